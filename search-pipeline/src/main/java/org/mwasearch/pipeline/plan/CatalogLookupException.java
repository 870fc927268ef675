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

import java.util.Arrays;

/**
 * Thrown when a target needs a catalogue DM and none of the catalogues knows its source.
 * <p>
 * The failure is fatal for that target only: it gets no trial plan and no search task, the
 * other targets of the run continue.
 * </p>
 */
public class CatalogLookupException extends SearchPipelineException {

  private final String sourceName;

  public CatalogLookupException(String sourceName) {
    super("No catalogue DM found for source '" + sourceName + "' in any of " + Arrays.toString(CatalogCategory.values()));
    this.sourceName = sourceName;
  }

  public String sourceName() {
    return sourceName;
  }
}
