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
 * Base runtime exception for all search pipeline errors.
 * <p>
 * {@code SearchPipelineException} is thrown when a pipeline stage cannot proceed for one unit of
 * work, for example:
 * </p>
 * <ul>
 *   <li>no catalogue DM is known for a target</li>
 *   <li>a catalogue DM leaves no DM to search</li>
 *   <li>a sifted candidate line cannot be attached to any target</li>
 *   <li>a candidate record carries fields that are not numbers</li>
 *   <li>an external tool exits with a non-zero status</li>
 * </ul>
 *
 * <h2>Scope of a failure</h2>
 * <p>
 * Every subclass describes a failure scoped to a single target or a single record. The
 * {@link SearchPipeline} catches them at that scope, logs them and keeps processing the other
 * targets and records.
 * </p>
 *
 * @see org.mwasearch.pipeline.plan.CatalogLookupException
 * @see org.mwasearch.pipeline.plan.InvalidDmRangeException
 * @see org.mwasearch.pipeline.correlate.CorrelationException
 * @see org.mwasearch.pipeline.fold.MalformedRecordException
 */
public class SearchPipelineException extends RuntimeException {

  /**
   * Creates a new pipeline exception with the specified error message.
   *
   * @param message the detail message explaining the error; should not be {@code null}
   */
  public SearchPipelineException(String message) {
    super(message);
  }

  /**
   * Creates a new pipeline exception with the specified error message and cause.
   * <p>
   * This constructor is typically used to wrap lower-level exceptions (e.g., {@link java.io.IOException})
   * with the context of the stage that failed.
   * </p>
   *
   * @param message the detail message explaining the error; should not be {@code null}
   * @param cause   the underlying cause of this exception; may be {@code null}
   */
  public SearchPipelineException(String message, Throwable cause) {
    super(message, cause);
  }
}
