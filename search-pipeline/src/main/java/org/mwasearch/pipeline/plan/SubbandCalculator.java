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

import static java.lang.Math.pow;
import static java.util.Objects.requireNonNull;

/**
 * Chooses the number of subbands used to dedisperse one trial.
 * <p>
 * The result is the smallest power of two dividing the fine channel count for which the
 * dispersion smearing inside one subband, at the highest DM of the trial, stays within the
 * trial's effective time resolution. When no such count exists, the largest power-of-two divisor
 * of the channel count is used.
 * </p>
 */
public final class SubbandCalculator {

  private final ObservationGeometry geometry;

  public SubbandCalculator(ObservationGeometry geometry) {
    this.geometry = requireNonNull(geometry, "geometry must not be null");
  }

  /**
   * Computes the subband count of a trial.
   *
   * @param trial             the dedispersion trial
   * @param midpointFrequency channel-group midpoint frequency in MHz
   * @return the number of subbands, a power of two dividing the fine channel count
   */
  public int nsub(DmTrial trial, double midpointFrequency) {
    requireNonNull(trial, "trial must not be null");
    if (midpointFrequency <= 0) {
      throw new IllegalArgumentException("midpointFrequency must be > 0, got: " + midpointFrequency);
    }

    int channels = geometry.fineChannelCount();
    double midpointCubed = pow(midpointFrequency, 3);
    int candidate = 1;
    int largestDivisor = 1;

    while (candidate <= channels) {
      if (channels % candidate == 0) {
        largestDivisor = candidate;
        double subbandWidth = geometry.bandwidthMhz() / candidate;
        double smearingMs = LowFrequencyDedispersionPlanner.DISPERSION_CONSTANT * trial.highDm() * subbandWidth / midpointCubed;
        if (smearingMs <= trial.timeResolutionMs()) {
          return candidate;
        }
      }
      candidate *= 2;
    }
    return largestDivisor;
  }
}
