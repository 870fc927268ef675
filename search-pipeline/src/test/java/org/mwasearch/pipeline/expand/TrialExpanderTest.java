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
package org.mwasearch.pipeline.expand;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mwasearch.pipeline.model.DmTrial;
import org.mwasearch.pipeline.model.SearchTask;
import org.mwasearch.pipeline.plan.ObservationGeometry;
import org.mwasearch.pipeline.plan.SubbandCalculator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mwasearch.pipeline.TestDataFactory.channelGroup;
import static org.mwasearch.pipeline.TestDataFactory.target;
import static org.mwasearch.pipeline.TestDataFactory.trial;
import static org.mwasearch.pipeline.TestDataFactory.trials;

class TrialExpanderTest {

  private final TrialExpander expander = new TrialExpander(
    new SubbandCalculator(ObservationGeometry.of(channelGroup(), 128, 0.1)), 48_000_000L);

  @Test
  @DisplayName("one task per trial with distinct keys")
  void one_task_per_trial_with_distinct_keys() {
    // Given
    var target = target("J0437-4715");

    // When
    var tasks = expander.expand(target, trials(6), channelGroup());

    // Then
    assertThat(tasks).hasSize(6);
    assertThat(tasks).extracting(SearchTask::key).doesNotHaveDuplicates();
    assertThat(tasks).extracting(SearchTask::trial).containsExactlyElementsOf(trials(6));
  }

  @Test
  @DisplayName("every task carries the target raw data and the shared channel layout")
  void every_task_carries_the_target_raw_data_and_the_shared_channel_layout() {
    // Given
    var target = target("J0437-4715");
    var channels = channelGroup();

    // When
    var tasks = expander.expand(target, trials(3), channels);

    // Then
    assertThat(tasks).allSatisfy(task -> {
      assertThat(task.rawDataGroup()).isEqualTo(target.rawDataGroup());
      assertThat(task.channelGroup()).isEqualTo(channels);
      assertThat(task.midpointFrequency()).isEqualTo(channels.midpointFrequency());
      assertThat(task.totalSamples()).isEqualTo(48_000_000L);
      assertThat(task.nsub()).isPositive();
    });
  }

  @Test
  @DisplayName("output samples follow the trial downsampling")
  void output_samples_follow_the_trial_downsampling() {
    // Given
    var downsampled = new DmTrial(100, 200, 1.0, 100, 0.8, 8);

    // When
    var task = expander.expand(target("Blind_0001"), List.of(downsampled), channelGroup()).get(0);

    // Then
    assertThat(task.outputSamples()).isEqualTo(6_000_000L);
  }

  @Test
  @DisplayName("no trial yields no task")
  void no_trial_yields_no_task() {
    // When
    var tasks = expander.expand(target("J0437-4715"), List.of(), channelGroup());

    // Then
    assertThat(tasks).isEmpty();
  }

  @Test
  @DisplayName("duplicate trial is rejected")
  void duplicate_trial_is_rejected() {
    // Given
    var trials = List.of(trial(0, 10), trial(10, 20), trial(0, 10));

    // When / Then
    assertThatThrownBy(() -> expander.expand(target("J0437-4715"), trials, channelGroup()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("DM0.00-10.00");
  }
}
