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
package org.mwasearch.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchPipelineLauncherTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("should report a usage error without arguments")
  void should_report_a_usage_error_without_arguments() {
    // When / Then
    assertThat(SearchPipelineLauncher.launch(new String[0])).isEqualTo(SearchPipelineLauncher.EXIT_USAGE);
  }

  @Test
  @DisplayName("should fail when the manifest cannot be read")
  void should_fail_when_the_manifest_cannot_be_read() throws Exception {
    // Given
    var catalogue = tempDir.resolve("catalogue.json");
    Files.writeString(catalogue, "{}");

    // When
    int status = SearchPipelineLauncher.launch(new String[]{tempDir.resolve("missing.json").toString(), catalogue.toString()});

    // Then
    assertThat(status).isEqualTo(SearchPipelineLauncher.EXIT_FAILED);
  }

  @Test
  @DisplayName("should finish without work when every target is missing from the catalogue")
  void should_finish_without_work_when_every_target_is_missing_from_the_catalogue() throws Exception {
    // Given
    var manifest = tempDir.resolve("manifest.json");
    Files.writeString(manifest, """
      {"channels": [109, 110], "targets": [{"name": "J9999+9999", "rawData": ["raw.fits"]}]}
      """);
    var catalogue = tempDir.resolve("catalogue.json");
    Files.writeString(catalogue, "{\"pulsar\": {}}");

    // When
    int status = SearchPipelineLauncher.launch(new String[]{manifest.toString(), catalogue.toString()});

    // Then
    assertThat(status).isEqualTo(SearchPipelineLauncher.EXIT_INCOMPLETE);
  }

  @Test
  @DisplayName("should size the worker pool from the configuration")
  void should_size_the_worker_pool_from_the_configuration() {
    // Given
    var properties = new Properties();

    // When / Then
    assertThat(SearchPipelineLauncher.threads(properties)).isEqualTo(Runtime.getRuntime().availableProcessors());
    properties.setProperty(SearchPipelineLauncher.THREADS, "6");
    assertThat(SearchPipelineLauncher.threads(properties)).isEqualTo(6);
    properties.setProperty(SearchPipelineLauncher.THREADS, "0");
    assertThatThrownBy(() -> SearchPipelineLauncher.threads(properties)).isInstanceOf(IllegalArgumentException.class);
  }
}
