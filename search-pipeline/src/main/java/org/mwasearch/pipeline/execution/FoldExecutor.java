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

import org.mwasearch.pipeline.model.FoldJob;

import java.util.concurrent.CompletionStage;

/**
 * Folds the raw data of a target at a candidate's period and DM.
 */
@FunctionalInterface
public interface FoldExecutor {

  /**
   * Starts one fold job. Fold outputs are not consumed by the pipeline.
   *
   * @param job the fold job; never {@code null}
   * @return a stage completed when the fold finished
   */
  CompletionStage<Void> fold(FoldJob job);
}
