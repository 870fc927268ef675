/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.mwasearch.worker.internal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mwasearch.pipeline.SearchPipelineException;
import org.mwasearch.pipeline.model.Target;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class GsonSearchManifestReaderTest {

  @TempDir
  Path tempDir;

  private final GsonSearchManifestReader reader = new GsonSearchManifestReader();

  @Test
  @DisplayName("should read channels and targets with raw data resolved against the manifest")
  void should_read_channels_and_targets_with_raw_data_resolved_against_the_manifest() throws IOException {
    // Given
    var manifest = tempDir.resolve("manifest.json");
    Files.writeString(manifest, """
      {
        "channels": [109, 110, 111, 112],
        "targets": [
          {"name": "J0437-4715", "rawData": ["raw/ch109.fits", "/data/ch110.fits"]},
          {"name": "Blind_0410_0001", "rawData": []}
        ]
      }
      """);

    // When
    var result = reader.read(manifest);

    // Then
    assertThat(result.channelGroup().channelCount()).isEqualTo(4);
    assertThat(result.channelGroup().midpointFrequency()).isCloseTo(110.5 * 1.28, within(1e-9));
    assertThat(result.targets()).extracting(Target::name).containsExactly("J0437-4715", "Blind_0410_0001");
    assertThat(result.targets().get(0).rawDataGroup())
      .containsExactly(tempDir.toAbsolutePath().resolve("raw/ch109.fits"), Path.of("/data/ch110.fits"));
  }

  @Test
  @DisplayName("should reject a manifest without channels")
  void should_reject_a_manifest_without_channels() {
    // When / Then
    assertThatThrownBy(() -> reader.parse("{\"targets\": []}", tempDir))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("'channels'");
  }

  @Test
  @DisplayName("should reject a target without name")
  void should_reject_a_target_without_name() {
    // When / Then
    assertThatThrownBy(() -> reader.parse("{\"channels\": [109], \"targets\": [{\"rawData\": []}]}", tempDir))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("'name'");
  }

  @Test
  @DisplayName("should reject invalid JSON")
  void should_reject_invalid_json() {
    // When / Then
    assertThatThrownBy(() -> reader.parse("{\"channels\": [109", tempDir))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should report an unreadable manifest file")
  void should_report_an_unreadable_manifest_file() {
    // When / Then
    assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.json")))
      .isInstanceOf(SearchPipelineException.class)
      .hasMessageContaining("missing.json");
  }
}
