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

import org.mwasearch.pipeline.SearchPipelineException;

/**
 * Thrown when the catalogued DM of a source leaves no DM to search once the window is clamped
 * to the minimum DM, or when the catalogue holds a value that is not a number.
 * <p>
 * Like {@link CatalogLookupException}, the failure only affects the target being planned.
 * </p>
 */
public class InvalidDmRangeException extends SearchPipelineException {

  private final String sourceName;
  private final double catalogDm;

  public InvalidDmRangeException(String sourceName, double catalogDm, double halfWidth, double floor) {
    super("Catalogue DM " + catalogDm + " of source '" + sourceName + "' gives an empty search window (half-width "
      + halfWidth + ", minimum DM " + floor + ")");
    this.sourceName = sourceName;
    this.catalogDm = catalogDm;
  }

  public String sourceName() {
    return sourceName;
  }

  public double catalogDm() {
    return catalogDm;
  }
}
