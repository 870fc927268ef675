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

/**
 * Inclusive DM interval searched for one target.
 *
 * @param low  lowest DM
 * @param high highest DM
 */
public record DmRange(double low, double high) {

  public DmRange {
    if (low < 0) {
      throw new IllegalArgumentException("low must be >= 0, got: " + low);
    }
    if (high <= low) {
      throw new IllegalArgumentException("high must be > low, got: [" + low + ", " + high + "]");
    }
  }

  /**
   * Builds the narrow window around a catalogued DM.
   *
   * @param catalogDm the catalogued DM
   * @param halfWidth distance searched on each side of the catalogued DM
   * @param floor     lowest DM allowed for the window
   * @return {@code [max(catalogDm - halfWidth, floor), catalogDm + halfWidth]}
   */
  public static DmRange around(double catalogDm, double halfWidth, double floor) {
    return new DmRange(Math.max(catalogDm - halfWidth, floor), catalogDm + halfWidth);
  }
}
