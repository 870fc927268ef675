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

/**
 * What the pipeline does when a search task fails.
 */
public enum SearchFailurePolicy {
  /**
   * The failure is logged and counted. The target's result bundle never completes and is
   * reported as incomplete; every other target continues.
   */
  IGNORE,
  /**
   * The first failure fails the run. Tasks already submitted are not cancelled.
   */
  ABORT
}
