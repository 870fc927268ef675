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

import org.mwasearch.pipeline.model.DmTrial;

import java.util.List;

/**
 * Splits a DM range into dedispersion trials for a given instrument geometry.
 *
 * @see LowFrequencyDedispersionPlanner
 */
@FunctionalInterface
public interface DedispersionPlanner {

  /**
   * Computes the trials covering {@code range}.
   *
   * @param range    DM interval to cover
   * @param geometry instrument parameters
   * @return trials ordered by increasing DM; may be empty
   */
  List<DmTrial> plan(DmRange range, ObservationGeometry geometry);
}
