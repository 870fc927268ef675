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
package org.mwasearch.pipeline.fold;

import org.mwasearch.pipeline.correlate.SiftedLineFormat;
import org.mwasearch.pipeline.model.CorrelatedCandidate;
import org.mwasearch.pipeline.model.FoldJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Derives fold jobs from correlated candidates.
 * <p>
 * The sifter reports periods in milliseconds; the planner converts them to seconds and picks the
 * fold parameters from the {@link FoldPolicy}.
 * </p>
 */
public final class FoldPlanner {

  private static final Logger logger = LoggerFactory.getLogger(FoldPlanner.class);

  private final FoldPolicy policy;

  public FoldPlanner(FoldPolicy policy) {
    this.policy = requireNonNull(policy, "policy must not be null");
  }

  /**
   * Plans the fold job of one candidate.
   *
   * @param candidate the candidate attached to its target
   * @return the fold job
   * @throws MalformedRecordException if the period or DM field is not a number
   */
  public FoldJob plan(CorrelatedCandidate candidate) {
    requireNonNull(candidate, "candidate must not be null");

    var record = candidate.candidate();
    double periodSeconds = SiftedLineFormat.periodMs(record) / 1000.0;
    double dm = SiftedLineFormat.dm(record);
    var parameters = policy.parametersFor(periodSeconds);

    logger.debug("Candidate {}: period={}s dm={} -> {}", record.name(), periodSeconds, dm, parameters);
    return new FoldJob(record, candidate.rawDataGroup(), periodSeconds, dm, parameters);
  }

  /**
   * Plans the fold jobs of several candidates, dropping the malformed ones.
   *
   * @param candidates the candidates
   * @return the fold jobs of the well-formed candidates, in input order
   */
  public List<FoldJob> planAll(List<CorrelatedCandidate> candidates) {
    var jobs = new ArrayList<FoldJob>(candidates.size());
    for (var candidate : candidates) {
      try {
        jobs.add(plan(candidate));
      } catch (MalformedRecordException e) {
        logger.warn("Dropping candidate {}: {}", candidate.candidate().name(), e.getMessage());
      }
    }
    return jobs;
  }
}
