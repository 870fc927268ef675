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
package org.mwasearch.pipeline.execution;

import org.mwasearch.pipeline.model.SearchTask;
import org.mwasearch.pipeline.model.TrialResult;

import java.util.concurrent.CompletionStage;

/**
 * Runs the dedispersion, periodicity and single-pulse search of one task.
 * <p>
 * Implementations own their worker pool: the pipeline submits every task of a run at once and
 * imposes no concurrency limit of its own. A failed task is reported by completing the returned
 * stage exceptionally.
 * </p>
 */
@FunctionalInterface
public interface SearchExecutor {

  /**
   * Starts the search of one task.
   *
   * @param task the task to run; never {@code null}
   * @return a stage completed with the task's outputs, or exceptionally if the task failed
   */
  CompletionStage<TrialResult> search(SearchTask task);
}
