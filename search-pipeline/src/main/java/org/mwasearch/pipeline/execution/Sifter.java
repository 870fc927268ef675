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

import org.mwasearch.pipeline.model.ResultBundle;
import org.mwasearch.pipeline.model.SiftOutput;

import java.util.concurrent.CompletionStage;

/**
 * Filters and merges the raw candidates of one complete result bundle.
 */
@FunctionalInterface
public interface Sifter {

  /**
   * Starts sifting a bundle. Called exactly once per target.
   *
   * @param bundle the complete result bundle of a target; never {@code null}
   * @return a stage completed with the sifter outputs
   */
  CompletionStage<SiftOutput> sift(ResultBundle bundle);
}
