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
import org.mwasearch.pipeline.model.CandidateRecord;
import org.mwasearch.pipeline.model.CorrelatedCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Re-attaches sifted candidate lines to the raw data of the target that produced them.
 * <p>
 * Each line is parsed with {@link SiftedLineFormat}; the base name recovered from the candidate
 * name is looked up in the {@link TargetIndex}. Lines that cannot be parsed or that name an
 * unknown target are logged and dropped, the remaining lines are still correlated.
 * </p>
 */
public final class CandidateCorrelator {

  private static final Logger logger = LoggerFactory.getLogger(CandidateCorrelator.class);

  /**
   * Correlates every line of a sifted candidate file.
   *
   * @param index       the run's targets, by name
   * @param siftedLines lines of the sifted candidate file
   * @return the correlated candidates, in line order
   */
  public List<CorrelatedCandidate> correlate(TargetIndex index, List<String> siftedLines) {
    requireNonNull(index, "index must not be null");
    requireNonNull(siftedLines, "siftedLines must not be null");

    var correlated = new ArrayList<CorrelatedCandidate>();
    int dropped = 0;

    for (var line : siftedLines) {
      try {
        var record = SiftedLineFormat.parse(line);
        if (record.isPresent()) {
          correlated.add(correlate(index, record.get()));
        }
      } catch (SearchPipelineException e) {
        dropped++;
        logger.warn("Dropping sifted candidate: {}", e.getMessage());
      }
    }

    logger.info("Correlated {} sifted candidates with their targets ({} dropped)", correlated.size(), dropped);
    return correlated;
  }

  /**
   * Correlates one parsed candidate.
   *
   * @param index  the run's targets, by name
   * @param record the candidate
   * @return the candidate attached to its target
   * @throws CorrelationException if no target carries the candidate's base name
   */
  public CorrelatedCandidate correlate(TargetIndex index, CandidateRecord record) {
    var target = index.find(record.baseName())
                      .orElseThrow(() -> new CorrelationException(record.baseName(), record.name()));
    return new CorrelatedCandidate(target, record);
  }
}
