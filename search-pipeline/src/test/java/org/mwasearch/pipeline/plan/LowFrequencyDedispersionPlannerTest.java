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
package org.mwasearch.pipeline.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static java.lang.Math.pow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mwasearch.pipeline.TestDataFactory.channelGroup;

class LowFrequencyDedispersionPlannerTest {

  private final ObservationGeometry geometry = ObservationGeometry.of(channelGroup(), 128, 0.1);
  private final LowFrequencyDedispersionPlanner planner = new LowFrequencyDedispersionPlanner();

  @Test
  @DisplayName("segments cover the range without gap or overlap")
  void segments_cover_the_range_without_gap_or_overlap() {
    // When
    var trials = planner.plan(new DmRange(1, 250), geometry);

    // Then
    assertThat(trials).hasSizeGreaterThan(1);
    assertThat(trials.get(0).lowDm()).isEqualTo(1.0);
    assertThat(trials.get(trials.size() - 1).highDm()).isEqualTo(250.0);
    for (int i = 1; i < trials.size(); i++) {
      assertThat(trials.get(i).lowDm()).isEqualTo(trials.get(i - 1).highDm());
    }
  }

  @Test
  @DisplayName("each segment doubles time resolution and downsampling")
  void each_segment_doubles_time_resolution_and_downsampling() {
    // When
    var trials = planner.plan(new DmRange(1, 250), geometry);

    // Then
    for (int i = 1; i < trials.size(); i++) {
      assertThat(trials.get(i).downsampleFactor()).isGreaterThan(trials.get(i - 1).downsampleFactor());
      assertThat(trials.get(i).timeResolutionMs()).isGreaterThan(trials.get(i - 1).timeResolutionMs());
    }
    assertThat(trials).allSatisfy(trial -> assertThat(trial.dmStep()).isPositive());
  }

  @Test
  @DisplayName("narrow range fits in a single segment")
  void narrow_range_fits_in_a_single_segment() {
    // When
    var trials = planner.plan(new DmRange(2, 6), geometry);

    // Then
    assertThat(trials).hasSize(1);
    var trial = trials.get(0);
    assertThat(trial.lowDm()).isEqualTo(2.0);
    assertThat(trial.highDm()).isEqualTo(6.0);
    assertThat(trial.downsampleFactor()).isEqualTo(1);
    assertThat(trial.numDms() * trial.dmStep()).isGreaterThanOrEqualTo(4.0 - 1e-9).isLessThan(4.0 + trial.dmStep());
  }

  @Test
  @DisplayName("segment narrower than one step still searches one DM")
  void segment_narrower_than_one_step_still_searches_one_dm() {
    // When
    int count = LowFrequencyDedispersionPlanner.stepCount(282.81, 282.939, 0.13);

    // Then
    assertThat(count).isEqualTo(1);
  }

  @Test
  @DisplayName("step count covers a whole number of steps exactly")
  void step_count_covers_a_whole_number_of_steps_exactly() {
    // When
    int count = LowFrequencyDedispersionPlanner.stepCount(2.0, 6.0, 0.08);

    // Then
    assertThat(count).isEqualTo(50);
  }

  @Test
  @DisplayName("every segment searches at least one DM whatever the range edges")
  void every_segment_searches_at_least_one_dm_whatever_the_range_edges() {
    for (int centi = 300; centi <= 40_000; centi += 7) {
      // Given
      double dm = centi / 100.0;
      var range = new DmRange(dm - 2.0, dm + 2.0);

      // When
      var trials = planner.plan(range, geometry);

      // Then
      assertThat(trials)
        .as("plan around DM %.2f", dm)
        .isNotEmpty()
        .allSatisfy(trial -> assertThat(trial.numDms()).isPositive());
    }
  }

  @Test
  @DisplayName("dm step is rounded to a hundredth")
  void dm_step_is_rounded_to_a_hundredth() {
    // When
    double step = LowFrequencyDedispersionPlanner.dmStep(0.1, geometry.bandwidthMhz(), pow(geometry.centreFrequencyMhz(), 3));

    // Then
    assertThat(step).isEqualTo(0.08);
  }
}
