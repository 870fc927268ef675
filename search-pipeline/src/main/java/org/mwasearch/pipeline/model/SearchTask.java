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
 * Unit of work handed to the search executor: one target searched over one dedispersion trial.
 *
 * @param target            the owning target, whose raw-data group is searched
 * @param trial             the dedispersion trial
 * @param channelGroup      the shared channel layout
 * @param nsub              number of subbands used for dedispersion
 * @param midpointFrequency channel-group midpoint frequency in MHz
 * @param totalSamples      number of native time samples of the observation
 */
public record SearchTask(
  Target target,
  DmTrial trial,
  ChannelGroup channelGroup,
  int nsub,
  double midpointFrequency,
  long totalSamples
) {

  public SearchTask {
    requireNonNull(target, "target must not be null");
    requireNonNull(trial, "trial must not be null");
    requireNonNull(channelGroup, "channelGroup must not be null");
    if (nsub <= 0) {
      throw new IllegalArgumentException("nsub must be > 0, got: " + nsub);
    }
  }

  public TrialKey key() {
    return new TrialKey(target.name(), trial);
  }

  public List<Path> rawDataGroup() {
    return target.rawDataGroup();
  }

  /**
   * Returns the number of output samples once the trial's downsampling is applied.
   *
   * @return the downsampled sample count
   */
  public long outputSamples() {
    return totalSamples / trial.downsampleFactor();
  }
}
