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
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * All trial results of one target, released by the aggregator once every expected trial
 * arrived. A bundle is never built from a partial set of results.
 *
 * @param targetName name of the target
 * @param members    trial results, one per trial
 */
public record ResultBundle(String targetName, List<TrialResult> members) {

  public ResultBundle {
    requireNonNull(targetName, "targetName must not be null");
    members = List.copyOf(members);
  }

  public int size() {
    return members.size();
  }

  public List<Path> periodicityCandidateFiles() {
    return members.stream().flatMap(m -> m.periodicityCandidateFiles().stream()).toList();
  }

  public List<Path> metadataFiles() {
    return members.stream().flatMap(m -> m.metadataFiles().stream()).toList();
  }

  public List<Path> singlePulseFiles() {
    return members.stream().map(TrialResult::singlePulseFile).toList();
  }

  /**
   * Returns every file of the bundle: candidates, metadata, then single-pulse files.
   *
   * @return the union of all member files
   */
  public List<Path> allFiles() {
    return Stream.of(periodicityCandidateFiles(), metadataFiles(), singlePulseFiles())
                 .flatMap(List::stream)
                 .toList();
  }
}
