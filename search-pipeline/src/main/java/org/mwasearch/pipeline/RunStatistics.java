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

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-safe job counters of a run: per {@link Stage}, the number of jobs expected, completed
 * and failed.
 */
public final class RunStatistics {

  private final Map<Stage, Counters> counters = new EnumMap<>(Stage.class);

  public RunStatistics() {
    for (var stage : Stage.values()) {
      counters.put(stage, new Counters());
    }
  }

  public void expected(Stage stage, int count) {
    counters.get(stage).expected.addAndGet(count);
  }

  public void completed(Stage stage) {
    counters.get(stage).completed.incrementAndGet();
  }

  public void failed(Stage stage) {
    counters.get(stage).errors.incrementAndGet();
  }

  public StageSummary summary(Stage stage) {
    var c = counters.get(stage);
    return new StageSummary(c.expected.get(), c.completed.get(), c.errors.get());
  }

  /**
   * Returns the summaries of all stages, in stage order.
   *
   * @return a snapshot of the counters
   */
  public Map<Stage, StageSummary> snapshot() {
    var snapshot = new EnumMap<Stage, StageSummary>(Stage.class);
    for (var stage : Stage.values()) {
      snapshot.put(stage, summary(stage));
    }
    return snapshot;
  }

  /**
   * Counters of one stage.
   *
   * @param expected  jobs the stage was expected to run
   * @param completed jobs that completed successfully
   * @param errors    jobs that failed
   */
  public record StageSummary(int expected, int completed, int errors) {

    /**
     * Returns the jobs that neither completed nor failed.
     *
     * @return {@code expected - completed - errors}
     */
    public int unfinished() {
      return expected - completed - errors;
    }
  }

  private static final class Counters {
    private final AtomicInteger expected = new AtomicInteger();
    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
  }
}
