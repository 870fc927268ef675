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
package org.mwasearch.pipeline.correlate;

import org.mwasearch.pipeline.SearchPipelineException;

/**
 * Thrown when a sifted candidate cannot be attached to any target of the run.
 */
public class CorrelationException extends SearchPipelineException {

  private final String baseName;

  public CorrelationException(String baseName, String candidateName) {
    super("Candidate " + candidateName + " refers to unknown target '" + baseName + "'");
    this.baseName = baseName;
  }

  public String baseName() {
    return baseName;
  }
}
