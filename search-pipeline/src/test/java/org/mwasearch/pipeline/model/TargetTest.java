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
package org.mwasearch.pipeline.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TargetTest {

  @ParameterizedTest
  @CsvSource({
    "Blind_0410_0001, BLIND, Blind",
    "FRB180916_burst2, FRB, FRB180916",
    "J0437-4715, CATALOG, J0437-4715",
    "J0835-4510_second, CATALOG, J0835-4510"
  })
  @DisplayName("type and source name come from the target name")
  void type_and_source_name_come_from_the_target_name(String name, TargetType type, String sourceName) {
    // Given
    var target = Target.of(name, Path.of("/data/obs.fits"));

    // When / Then
    assertThat(target.type()).isEqualTo(type);
    assertThat(target.sourceName()).isEqualTo(sourceName);
  }

  @Test
  @DisplayName("blank name is rejected")
  void blank_name_is_rejected() {
    // When / Then
    assertThatThrownBy(() -> Target.of(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("trial label shows the DM range with two decimals")
  void trial_label_shows_the_dm_range_with_two_decimals() {
    // Given
    var trial = new DmTrial(8.844, 17.7, 0.16, 55, 0.2, 2);

    // When / Then
    assertThat(trial.label()).isEqualTo("DM8.84-17.70");
  }

  @Test
  @DisplayName("channel group derives midpoint and bandwidth from coarse channel numbers")
  void channel_group_derives_midpoint_and_bandwidth_from_coarse_channel_numbers() {
    // Given
    var group = ChannelGroup.fromCoarseChannels(List.of(110, 109, 112, 111));

    // When / Then
    assertThat(group.channelCount()).isEqualTo(4);
    assertThat(group.midpointFrequency()).isCloseTo(110.5 * 1.28, within(1e-9));
    assertThat(group.bandwidth()).isCloseTo(5.12, within(1e-9));
  }
}
