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
package org.mwasearch.pipeline.aggregate;

import org.mwasearch.pipeline.model.ResultBundle;

/**
 * Receives result bundles as soon as the aggregator releases them.
 * <p>
 * Listeners are called on the thread that delivered the completing trial result; they should
 * hand heavy work over to an executor.
 * </p>
 */
@FunctionalInterface
public interface BundleListener {

  /**
   * Called exactly once per released bundle.
   *
   * @param bundle the complete bundle; never {@code null}
   */
  void onBundleComplete(ResultBundle bundle);
}
