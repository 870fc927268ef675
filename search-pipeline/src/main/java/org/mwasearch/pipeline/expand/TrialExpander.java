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
package org.mwasearch.pipeline.expand;

import org.mwasearch.pipeline.model.ChannelGroup;
import org.mwasearch.pipeline.model.DmTrial;
import org.mwasearch.pipeline.model.SearchTask;
import org.mwasearch.pipeline.model.Target;
import org.mwasearch.pipeline.plan.SubbandCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Fans a target's trial plan out into search tasks.
 * <p>
 * The expansion is the product {target raw data} × trials × {channel group}: the raw-data group
 * and the channel group are the same for every trial of a target, so the result holds exactly one
 * {@link SearchTask} per trial, in trial order. The number of tasks is a property of the plan and
 * is only known at run time.
 * </p>
 * <p>
 * A target without trials yields no task at all. It is not an error; the caller simply never
 * registers the target with the result aggregator.
 * </p>
 */
public final class TrialExpander {

  private static final Logger logger = LoggerFactory.getLogger(TrialExpander.class);

  private final SubbandCalculator subbandCalculator;
  private final long totalSamples;

  /**
   * Creates an expander.
   *
   * @param subbandCalculator computes the subband count of each trial
   * @param totalSamples      native sample count of the observation, passed on to every task
   */
  public TrialExpander(SubbandCalculator subbandCalculator, long totalSamples) {
    this.subbandCalculator = requireNonNull(subbandCalculator, "subbandCalculator must not be null");
    if (totalSamples <= 0) {
      throw new IllegalArgumentException("totalSamples must be > 0, got: " + totalSamples);
    }
    this.totalSamples = totalSamples;
  }

  /**
   * Expands the trials of one target into search tasks.
   *
   * @param target       the target owning the trials
   * @param trials       the target's trial plan
   * @param channelGroup the shared channel layout
   * @return one task per trial, in the order of {@code trials}
   * @throws IllegalArgumentException if {@code trials} holds the same trial twice
   */
  public List<SearchTask> expand(Target target, List<DmTrial> trials, ChannelGroup channelGroup) {
    requireNonNull(target, "target must not be null");
    requireNonNull(trials, "trials must not be null");
    requireNonNull(channelGroup, "channelGroup must not be null");

    if (trials.isEmpty()) {
      logger.info("Target {} has no DM trial, no search task created", target.name());
      return List.of();
    }

    double midpoint = channelGroup.midpointFrequency();
    var seen = new HashSet<DmTrial>();
    var tasks = new ArrayList<SearchTask>(trials.size());

    for (var trial : trials) {
      if (!seen.add(trial)) {
        throw new IllegalArgumentException("Duplicate trial " + trial.label() + " for target " + target.name());
      }
      int nsub = subbandCalculator.nsub(trial, midpoint);
      tasks.add(new SearchTask(target, trial, channelGroup, nsub, midpoint, totalSamples));
    }

    logger.debug("Expanded target {} into {} search tasks", target.name(), tasks.size());
    return List.copyOf(tasks);
  }
}
