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
package org.mwasearch.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineConfigTest {

  @Test
  @DisplayName("defaults describe a 4800 s observation at 100 us")
  void defaults_describe_a_4800_s_observation_at_100_us() {
    // When
    var config = PipelineConfig.builder().build();

    // Then
    assertThat(config.blindDmMin()).isEqualTo(1.0);
    assertThat(config.blindDmMax()).isEqualTo(250.0);
    assertThat(config.catalogDmHalfWidth()).isEqualTo(2.0);
    assertThat(config.maxDmsPerTrial()).isEqualTo(1000);
    assertThat(config.totalSamples()).isEqualTo(48_000_000L);
    assertThat(config.searchFailurePolicy()).isEqualTo(SearchFailurePolicy.IGNORE);
  }

  @Test
  @DisplayName("fromProperties overrides only the keys present")
  void fromProperties_overrides_only_the_keys_present() {
    // Given
    var properties = new Properties();
    properties.setProperty(PipelineConfig.BLIND_DM_MAX, "500");
    properties.setProperty(PipelineConfig.SEARCH_FAILURE_POLICY, "abort");
    properties.setProperty(PipelineConfig.STALL_TIMEOUT, "PT30M");
    properties.setProperty(PipelineConfig.FOLD_PERIOD_THRESHOLD_SECONDS, "0.05");

    // When
    var config = PipelineConfig.fromProperties(properties);

    // Then
    assertThat(config.blindDmMin()).isEqualTo(1.0);
    assertThat(config.blindDmMax()).isEqualTo(500.0);
    assertThat(config.searchFailurePolicy()).isEqualTo(SearchFailurePolicy.ABORT);
    assertThat(config.stallTimeout()).isEqualTo(Duration.ofMinutes(30));
    assertThat(config.foldPolicy().periodThresholdSeconds()).isEqualTo(0.05);
    assertThat(config.monitorInterval()).isEqualTo(Duration.ofMinutes(1));
  }

  @Test
  @DisplayName("fromProperties rejects unparsable values with the offending key")
  void fromProperties_rejects_unparsable_values_with_the_offending_key() {
    // Given
    var properties = new Properties();
    properties.setProperty(PipelineConfig.MAX_DMS_PER_TRIAL, "many");

    // When / Then
    assertThatThrownBy(() -> PipelineConfig.fromProperties(properties))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining(PipelineConfig.MAX_DMS_PER_TRIAL);
  }

  @Test
  @DisplayName("build rejects an inverted blind range")
  void build_rejects_an_inverted_blind_range() {
    // Given
    var builder = PipelineConfig.builder().blindDmRange(100, 10);

    // When / Then
    assertThatThrownBy(builder::build)
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("blind DM range");
  }
}
