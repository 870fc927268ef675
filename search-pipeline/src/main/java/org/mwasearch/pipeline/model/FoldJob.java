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

import java.nio.file.Path;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Fold request for one candidate over the raw data of its target.
 *
 * @param candidate     the sifted candidate
 * @param rawDataGroup  raw-data files of the origin target
 * @param periodSeconds candidate period in seconds
 * @param dm            candidate DM
 * @param parameters    fold parameters derived from the period
 */
public record FoldJob(
  CandidateRecord candidate,
  List<Path> rawDataGroup,
  double periodSeconds,
  double dm,
  FoldParameters parameters
) {

  public FoldJob {
    requireNonNull(candidate, "candidate must not be null");
    requireNonNull(parameters, "parameters must not be null");
    rawDataGroup = List.copyOf(rawDataGroup);
  }

  public String targetName() {
    return candidate.baseName();
  }
}
