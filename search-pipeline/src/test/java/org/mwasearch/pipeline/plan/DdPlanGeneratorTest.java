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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mwasearch.pipeline.PipelineConfig;
import org.mwasearch.pipeline.model.DmTrial;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mwasearch.pipeline.TestDataFactory.channelGroup;
import static org.mwasearch.pipeline.TestDataFactory.target;

class DdPlanGeneratorTest {

  private PipelineConfig config;
  private ObservationGeometry geometry;
  private MapCatalogLookup catalog;

  @BeforeEach
  void setUp() {
    config = PipelineConfig.builder().blindDmRange(1, 250).build();
    geometry = ObservationGeometry.of(channelGroup(), 128, 0.1);
    catalog = new MapCatalogLookup(Map.of(
      CatalogCategory.TRANSIENT, Map.of("FRB180916", 349.2, "J0835-4510", 99.0),
      CatalogCategory.PULSAR, Map.of("J0835-4510", 67.97, "J0437-4715", 2.64, "J0034-0534", 1.5, "J1900-2600", 20.0)
    ));
  }

  @Test
  @DisplayName("blind target searches the configured range")
  void blind_target_searches_the_configured_range() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var range = generator.dmRange(target("Blind_0410_0001"));

    // Then
    assertThat(range).isEqualTo(new DmRange(1, 250));
  }

  @Test
  @DisplayName("catalogued target searches a window around its DM")
  void catalogued_target_searches_a_window_around_its_dm() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var range = generator.dmRange(target("J1900-2600"));

    // Then
    assertThat(range).isEqualTo(new DmRange(18, 22));
  }

  @Test
  @DisplayName("window is clamped to the minimum DM")
  void window_is_clamped_to_the_minimum_dm() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var range = generator.dmRange(target("J0034-0534"));

    // Then
    assertThat(range.low()).isEqualTo(1.0);
    assertThat(range.high()).isEqualTo(3.5);
  }

  @Test
  @DisplayName("transient catalogue wins over pulsar catalogue")
  void transient_catalogue_wins_over_pulsar_catalogue() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var range = generator.dmRange(target("J0835-4510"));

    // Then
    assertThat(range).isEqualTo(new DmRange(97, 101));
  }

  @Test
  @DisplayName("source name is the target name up to the first underscore")
  void source_name_is_the_target_name_up_to_the_first_underscore() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var range = generator.dmRange(target("FRB180916_burst2"));

    // Then
    assertThat(range.low()).isCloseTo(347.2, within(1e-9));
    assertThat(range.high()).isCloseTo(351.2, within(1e-9));
  }

  @Test
  @DisplayName("unknown source fails with a catalogue lookup error")
  void unknown_source_fails_with_a_catalogue_lookup_error() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When / Then
    assertThatThrownBy(() -> generator.plan(target("J9999+9999")))
      .isInstanceOf(CatalogLookupException.class)
      .satisfies(e -> assertThat(((CatalogLookupException) e).sourceName()).isEqualTo("J9999+9999"));
  }

  @Test
  @DisplayName("catalogue DM below the minimum window fails with an invalid range error")
  void catalogue_dm_below_the_minimum_window_fails_with_an_invalid_range_error() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, (source, category) -> OptionalDouble.of(-1.0));

    // When / Then
    assertThatThrownBy(() -> generator.plan(target("J2222-0000")))
      .isInstanceOf(InvalidDmRangeException.class)
      .satisfies(e -> {
        var error = (InvalidDmRangeException) e;
        assertThat(error.sourceName()).isEqualTo("J2222-0000");
        assertThat(error.catalogDm()).isEqualTo(-1.0);
      });
  }

  @Test
  @DisplayName("non numeric catalogue DM fails with an invalid range error")
  void non_numeric_catalogue_dm_fails_with_an_invalid_range_error() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, (source, category) -> OptionalDouble.of(Double.NaN));

    // When / Then
    assertThatThrownBy(() -> generator.dmRange(target("J2222-0000")))
      .isInstanceOf(InvalidDmRangeException.class);
  }

  @Test
  @DisplayName("every catalogue DM yields trials that each search at least one DM")
  void every_catalogue_dm_yields_trials_that_each_search_at_least_one_dm() {
    var defaults = PipelineConfig.builder().build();
    for (int centi = 100; centi <= 40_000; centi++) {
      // Given
      double dm = centi / 100.0;
      var generator = new DdPlanGenerator(defaults, geometry, (source, category) -> OptionalDouble.of(dm));

      // When
      var trials = generator.plan(target("J0437-4715"));

      // Then
      assertThat(trials)
        .as("plan around catalogue DM %.2f", dm)
        .isNotEmpty()
        .allSatisfy(trial -> assertThat(trial.numDms()).isPositive());
    }
  }

  @Test
  @DisplayName("plan hands the target range and geometry to the planner")
  void plan_hands_the_target_range_and_geometry_to_the_planner() {
    // Given
    var planner = mock(DedispersionPlanner.class);
    var segment = new DmTrial(18, 22, 0.01, 400, 0.1, 1);
    when(planner.plan(any(), any())).thenReturn(List.of(segment));
    var generator = new DdPlanGenerator(config, geometry, catalog, planner);

    // When
    var trials = generator.plan(target("J1900-2600"));

    // Then
    verify(planner).plan(eq(new DmRange(18, 22)), eq(geometry));
    assertThat(trials).containsExactly(segment);
  }

  @Test
  @DisplayName("segments above the per-trial limit are split into consecutive trials")
  void segments_above_the_per_trial_limit_are_split_into_consecutive_trials() {
    // Given
    var planner = mock(DedispersionPlanner.class);
    when(planner.plan(any(), any())).thenReturn(List.of(new DmTrial(0, 125, 0.5, 250, 0.4, 4)));
    var limited = PipelineConfig.builder().maxDmsPerTrial(100).build();
    var generator = new DdPlanGenerator(limited, geometry, catalog, planner);

    // When
    var trials = generator.plan(target("Blind_0410_0001"));

    // Then
    assertThat(trials).containsExactly(
      new DmTrial(0, 50, 0.5, 100, 0.4, 4),
      new DmTrial(50, 100, 0.5, 100, 0.4, 4),
      new DmTrial(100, 125, 0.5, 50, 0.4, 4)
    );
  }

  @Test
  @DisplayName("same target always yields the same plan")
  void same_target_always_yields_the_same_plan() {
    // Given
    var generator = new DdPlanGenerator(config, geometry, catalog);

    // When
    var first = generator.plan(target("Blind_0410_0001"));
    var second = generator.plan(target("Blind_0410_0001"));

    // Then
    assertThat(first).isNotEmpty().isEqualTo(second);
  }
}
