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
package org.mwasearch.pipeline.fold;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mwasearch.pipeline.correlate.SiftedLineFormat;
import org.mwasearch.pipeline.model.CorrelatedCandidate;
import org.mwasearch.pipeline.model.FoldJob;
import org.mwasearch.pipeline.model.FoldParameters;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mwasearch.pipeline.TestDataFactory.siftedLine;
import static org.mwasearch.pipeline.TestDataFactory.target;

class FoldPlannerTest {

  private final FoldPlanner planner = new FoldPlanner(FoldPolicy.DEFAULT);

  @Test
  @DisplayName("long period candidate gets fine bins and a single DM step")
  void long_period_candidate_gets_fine_bins_and_a_single_dm_step() {
    // Given
    var candidate = candidate("J1900-2600_DM20.00_ACCEL_0:1", "20.00", "15.0");

    // When
    var job = planner.plan(candidate);

    // Then
    assertThat(job.periodSeconds()).isCloseTo(0.015, within(1e-12));
    assertThat(job.dm()).isEqualTo(20.0);
    assertThat(job.parameters()).isEqualTo(new FoldParameters(100, 120, 1, 1));
    assertThat(job.rawDataGroup()).isEqualTo(target("J1900-2600").rawDataGroup());
    assertThat(job.targetName()).isEqualTo("J1900-2600");
  }

  @Test
  @DisplayName("short period candidate gets coarse bins and a wider search")
  void short_period_candidate_gets_coarse_bins_and_a_wider_search() {
    // Given
    var candidate = candidate("J0437-4715_DM2.64_ACCEL_0:3", "2.64", "5.0");

    // When
    var job = planner.plan(candidate);

    // Then
    assertThat(job.parameters()).isEqualTo(new FoldParameters(50, 40, 3, 2));
  }

  @Test
  @DisplayName("period equal to the threshold counts as short")
  void period_equal_to_the_threshold_counts_as_short() {
    // When / Then
    assertThat(FoldPolicy.DEFAULT.parametersFor(0.01)).isEqualTo(FoldPolicy.DEFAULT.shortPeriod());
    assertThat(FoldPolicy.DEFAULT.withPeriodThreshold(0.001).parametersFor(0.005)).isEqualTo(FoldPolicy.DEFAULT.longPeriod());
  }

  @Test
  @DisplayName("malformed candidate raises an error")
  void malformed_candidate_raises_an_error() {
    // Given
    var candidate = candidate("J0437-4715_DM2.64_ACCEL_0:3", "2.64", "n/a");

    // When / Then
    assertThatThrownBy(() -> planner.plan(candidate)).isInstanceOf(MalformedRecordException.class);
  }

  @Test
  @DisplayName("planAll drops malformed candidates and keeps the order of the others")
  void planAll_drops_malformed_candidates_and_keeps_the_order_of_the_others() {
    // Given
    var candidates = List.of(
      candidate("J1900-2600_DM20.00_ACCEL_0:1", "20.00", "15.0"),
      candidate("J1900-2600_DM21.00_ACCEL_0:2", "x", "15.0"),
      candidate("J1900-2600_DM19.00_ACCEL_0:3", "19.00", "3.2")
    );

    // When
    var jobs = planner.planAll(candidates);

    // Then
    assertThat(jobs).extracting(FoldJob::dm).containsExactly(20.0, 19.0);
  }

  private static CorrelatedCandidate candidate(String name, String dm, String periodMs) {
    var record = SiftedLineFormat.parse(siftedLine(name, dm, periodMs)).orElseThrow();
    return new CorrelatedCandidate(target(record.baseName()), record);
  }
}
