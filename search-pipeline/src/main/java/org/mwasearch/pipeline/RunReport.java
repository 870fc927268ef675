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
package org.mwasearch.pipeline;

import org.mwasearch.pipeline.aggregate.PendingBundle;
import org.mwasearch.pipeline.model.FoldJob;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a run.
 * <p>
 * A run always completes, even when some targets could not be searched to the end: those
 * targets appear in {@code failedTargets} or {@code incompleteBundles} and produce no fold job.
 * </p>
 *
 * @param statistics        job counters per stage
 * @param siftedTargets     targets whose complete bundle was sifted, in sift order
 * @param failedTargets     targets that failed at planning or sifting, with the reason
 * @param incompleteBundles bundles still missing trial results when the run ended
 * @param foldJobs          fold jobs planned during the run
 */
public record RunReport(
  Map<Stage, RunStatistics.StageSummary> statistics,
  List<String> siftedTargets,
  Map<String, String> failedTargets,
  List<PendingBundle> incompleteBundles,
  List<FoldJob> foldJobs
) {

  public RunReport {
    statistics = Map.copyOf(statistics);
    siftedTargets = List.copyOf(siftedTargets);
    failedTargets = Map.copyOf(failedTargets);
    incompleteBundles = List.copyOf(incompleteBundles);
    foldJobs = List.copyOf(foldJobs);
  }

  public boolean isComplete() {
    return failedTargets.isEmpty() && incompleteBundles.isEmpty();
  }
}
