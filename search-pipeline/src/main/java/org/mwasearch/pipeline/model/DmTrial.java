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

import java.util.Locale;

/**
 * One dedispersion trial: {@code numDms} DM values starting at {@code lowDm} and spaced by
 * {@code dmStep}, searched at an effective time resolution.
 *
 * @param lowDm            first DM of the trial (pc/cm³)
 * @param highDm           upper edge of the trial range (pc/cm³)
 * @param dmStep           spacing between consecutive DMs
 * @param numDms           number of DM values searched by this trial
 * @param timeResolutionMs effective sample time in milliseconds after downsampling
 * @param downsampleFactor factor applied to the native time resolution
 */
public record DmTrial(
  double lowDm,
  double highDm,
  double dmStep,
  int numDms,
  double timeResolutionMs,
  int downsampleFactor
) {

  public DmTrial {
    if (highDm < lowDm) {
      throw new IllegalArgumentException("highDm must be >= lowDm, got: [" + lowDm + ", " + highDm + "]");
    }
    if (dmStep <= 0) {
      throw new IllegalArgumentException("dmStep must be > 0, got: " + dmStep);
    }
    if (numDms <= 0) {
      throw new IllegalArgumentException("numDms must be > 0, got: " + numDms);
    }
    if (downsampleFactor <= 0) {
      throw new IllegalArgumentException("downsampleFactor must be > 0, got: " + downsampleFactor);
    }
  }

  /**
   * Returns a short label identifying the trial inside its target, e.g. {@code DM18.00-22.00}.
   *
   * @return the trial label
   */
  public String label() {
    return String.format(Locale.ROOT, "DM%.2f-%.2f", lowDm, highDm);
  }
}
