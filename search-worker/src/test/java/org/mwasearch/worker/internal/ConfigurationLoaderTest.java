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
import org.mwasearch.pipeline.PipelineConfig;
import org.mwasearch.pipeline.SearchFailurePolicy;
import org.mwasearch.pipeline.SearchPipelineException;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.org.webcompere.systemstubs.SystemStubs.withEnvironmentVariables;

class ConfigurationLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  @DisplayName("should load the bundled defaults")
  void should_load_the_bundled_defaults() throws Exception {
    withEnvironmentVariables(ConfigurationLoader.ENV_CONFIG_FILE, "").execute(() -> {
      // When
      var config = PipelineConfig.fromProperties(ConfigurationLoader.load());

      // Then
      assertThat(config.blindDmMax()).isEqualTo(250.0);
      assertThat(config.searchFailurePolicy()).isEqualTo(SearchFailurePolicy.IGNORE);
    });
  }

  @Test
  @DisplayName("should layer the configuration file over the defaults")
  void should_layer_the_configuration_file_over_the_defaults() throws Exception {
    // Given
    var file = tempDir.resolve("site.properties");
    Files.writeString(file, "dm.blind.max=500\nworker.threads=4\n");

    withEnvironmentVariables(ConfigurationLoader.ENV_CONFIG_FILE, file.toString()).execute(() -> {
      // When
      var properties = ConfigurationLoader.load();

      // Then
      assertThat(properties.getProperty("dm.blind.max")).isEqualTo("500");
      assertThat(properties.getProperty("worker.threads")).isEqualTo("4");
      assertThat(properties.getProperty("dm.blind.min")).isEqualTo("1.0");
    });
  }

  @Test
  @DisplayName("should let environment variables override file keys")
  void should_let_environment_variables_override_file_keys() throws Exception {
    // Given
    var file = tempDir.resolve("site.properties");
    Files.writeString(file, "dm.blind.max=500\n");

    withEnvironmentVariables(ConfigurationLoader.ENV_CONFIG_FILE, file.toString())
      .and("MWA_SEARCH_DM_BLIND_MAX", "750")
      .and("MWA_SEARCH_SEARCH_FAILURE_POLICY", "ABORT")
      .and("MWA_SEARCH_MONITOR_STALL_TIMEOUT", "PT2H")
      .execute(() -> {
        // When
        var config = PipelineConfig.fromProperties(ConfigurationLoader.load());

        // Then
        assertThat(config.blindDmMax()).isEqualTo(750.0);
        assertThat(config.searchFailurePolicy()).isEqualTo(SearchFailurePolicy.ABORT);
        assertThat(config.stallTimeout()).hasHours(2);
      });
  }

  @Test
  @DisplayName("should fail when the configuration file is missing")
  void should_fail_when_the_configuration_file_is_missing() throws Exception {
    withEnvironmentVariables(ConfigurationLoader.ENV_CONFIG_FILE, tempDir.resolve("missing.properties").toString()).execute(() -> {
      // When / Then
      assertThatThrownBy(ConfigurationLoader::load)
        .isInstanceOf(SearchPipelineException.class)
        .hasMessageContaining("missing.properties");
    });
  }

  @Test
  @DisplayName("should derive environment variable names from keys")
  void should_derive_environment_variable_names_from_keys() {
    // When / Then
    assertThat(ConfigurationLoader.environmentVariable("observation.time-resolution-ms"))
      .isEqualTo("MWA_SEARCH_OBSERVATION_TIME_RESOLUTION_MS");
  }
}
