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
package org.mwasearch.pipeline.internal.concurrent;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

import static java.util.concurrent.CompletableFuture.completedFuture;

public final class Futures {
  private Futures() {
  }

  /**
   * Returns a {@link CompletionStage} that completes when all the given stages complete.
   *
   * <p>The returned stage:</p>
   * <ul>
   *   <li>Completes successfully with a {@link List} of results in the same order
   *       as the input stages, if all succeed.</li>
   *   <li>Completes exceptionally if <em>any</em> stage fails. The exception from one
   *       failed stage is propagated (others are suppressed by default).</li>
   * </ul>
   *
   * @param stages the stages to combine
   * @param <T>    the result type
   * @return a stage that yields a list of results or fails if any input stage fails
   * @throws NullPointerException if {@code stages} is null
   */
  public static <T> CompletionStage<List<T>> allOf(Collection<? extends CompletionStage<T>> stages) {
    if (stages.isEmpty()) return completedFuture(List.of());

    var futures = stages.stream().map(CompletionStage::toCompletableFuture).toList();

    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                            .thenApply(v -> futures.stream()
                                                   // allOf ensures all futures are completed, so join() will not block here.
                                                   .map(CompletableFuture::join)
                                                   .toList());
  }

  /**
   * Strips the {@link CompletionException} wrapper added by dependent stages.
   *
   * @param throwable the throwable observed by a completion callback
   * @return the underlying cause, or {@code throwable} itself when it is not a wrapper
   */
  public static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      return throwable.getCause();
    }
    return throwable;
  }
}
