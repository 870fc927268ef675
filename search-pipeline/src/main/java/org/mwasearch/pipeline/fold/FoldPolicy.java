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

import org.mwasearch.pipeline.model.FoldParameters;

import static java.util.Objects.requireNonNull;

/**
 * Period-dependent choice of fold parameters.
 * <p>
 * Below the period threshold the sample time limits how finely a profile can be resolved, so
 * short-period candidates are folded with fewer bins and a wider DM and period search.
 * </p>
 *
 * @param periodThresholdSeconds periods strictly above this value use {@code longPeriod}
 * @param longPeriod             parameters for periods above the threshold
 * @param shortPeriod            parameters for periods at or below the threshold
 */
public record FoldPolicy(double periodThresholdSeconds, FoldParameters longPeriod, FoldParameters shortPeriod) {

  /**
   * Default policy: 10 ms threshold; 100 bins, 120 chunks, DM step 1, depth 1 above it;
   * 50 bins, 40 chunks, DM step 3, depth 2 at or below it.
   */
  public static final FoldPolicy DEFAULT = new FoldPolicy(
    0.01,
    new FoldParameters(100, 120, 1, 1),
    new FoldParameters(50, 40, 3, 2)
  );

  public FoldPolicy {
    if (periodThresholdSeconds <= 0) {
      throw new IllegalArgumentException("periodThresholdSeconds must be > 0, got: " + periodThresholdSeconds);
    }
    requireNonNull(longPeriod, "longPeriod must not be null");
    requireNonNull(shortPeriod, "shortPeriod must not be null");
  }

  public FoldPolicy withPeriodThreshold(double periodThresholdSeconds) {
    return new FoldPolicy(periodThresholdSeconds, longPeriod, shortPeriod);
  }

  /**
   * Selects the parameters for a candidate period.
   *
   * @param periodSeconds the candidate period in seconds
   * @return {@link #longPeriod()} when {@code periodSeconds > periodThresholdSeconds},
   * {@link #shortPeriod()} otherwise
   */
  public FoldParameters parametersFor(double periodSeconds) {
    return periodSeconds > periodThresholdSeconds ? longPeriod : shortPeriod;
  }
}
