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
 * Outputs produced by one {@link SearchTask}.
 *
 * @param targetName                name of the owning target
 * @param trial                     the trial that produced these outputs
 * @param periodicityCandidateFiles accelsearch candidate files
 * @param metadataFiles             one metadata file per dedispersed series
 * @param singlePulseFile           single-pulse detections of the trial
 */
public record TrialResult(
  String targetName,
  DmTrial trial,
  List<Path> periodicityCandidateFiles,
  List<Path> metadataFiles,
  Path singlePulseFile
) {

  public TrialResult {
    requireNonNull(targetName, "targetName must not be null");
    requireNonNull(trial, "trial must not be null");
    requireNonNull(singlePulseFile, "singlePulseFile must not be null");
    periodicityCandidateFiles = List.copyOf(periodicityCandidateFiles);
    metadataFiles = List.copyOf(metadataFiles);
  }

  public TrialKey key() {
    return new TrialKey(targetName, trial);
  }
}
