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

import org.mwasearch.pipeline.model.DmTrial;
import org.mwasearch.pipeline.model.ResultBundle;
import org.mwasearch.pipeline.model.TrialResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Keyed barrier gathering the trial results of each target into a single {@link ResultBundle}.
 * <p>
 * Every target is registered with its expected trial count before its search tasks are
 * submitted. Each key then follows the state machine:
 * </p>
 * <pre>
 * expect(n) ──► PENDING(0) ──► PENDING(k) ──► COMPLETE (k == n) ──► released once, key retired
 * </pre>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>A bundle is released only when the number of distinct trials received equals the
 *       expected count; no partial bundle is ever released.</li>
 *   <li>A bundle is released at most once per target. Results arriving for a retired target,
 *       for an unregistered target, or a second time for the same trial are logged and ignored.</li>
 *   <li>Results may arrive in any order and interleaved across targets.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Each key is updated atomically through {@link ConcurrentHashMap#compute}; there is no lock
 * shared across keys, so results of different targets never contend. Listeners are invoked
 * outside the per-key update, on the thread that delivered the completing result.
 * </p>
 *
 * <h2>Incomplete bundles</h2>
 * <p>
 * When a search task fails and failures are ignored, its target never reaches the expected
 * count and stays pending forever. Such bundles are visible through {@link #pending()} and are
 * reported by the {@link StalledBundleMonitor}.
 * </p>
 *
 * @see BundleListener
 * @see StalledBundleMonitor
 */
public final class ResultAggregator {

  private static final Logger logger = LoggerFactory.getLogger(ResultAggregator.class);

  private final ConcurrentMap<String, Accumulator> accumulators = new ConcurrentHashMap<>();
  private final Set<String> retired = ConcurrentHashMap.newKeySet();
  private final List<BundleListener> listeners = new CopyOnWriteArrayList<>();
  private final Clock clock;

  public ResultAggregator() {
    this(Clock.systemUTC());
  }

  public ResultAggregator(Clock clock) {
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  /**
   * Registers a listener notified of every bundle released after this call.
   *
   * @param listener the listener; must not be {@code null}
   */
  public void addListener(BundleListener listener) {
    listeners.add(requireNonNull(listener, "listener must not be null"));
  }

  /**
   * Registers a target and the number of trial results its bundle waits for.
   *
   * @param targetName    name of the target
   * @param expectedCount number of trials planned for the target
   * @throws IllegalArgumentException if {@code expectedCount} is not positive
   * @throws IllegalStateException    if the target is already registered or was already released
   */
  public void expect(String targetName, int expectedCount) {
    requireNonNull(targetName, "targetName must not be null");
    if (expectedCount <= 0) {
      throw new IllegalArgumentException("expectedCount must be > 0, got: " + expectedCount);
    }
    if (retired.contains(targetName)) {
      throw new IllegalStateException("Bundle of target " + targetName + " was already released");
    }
    var previous = accumulators.putIfAbsent(targetName, Accumulator.empty(expectedCount, clock.instant()));
    if (previous != null) {
      throw new IllegalStateException("Target " + targetName + " is already registered");
    }
    logger.debug("Expecting {} trial results for target {}", expectedCount, targetName);
  }

  /**
   * Records one trial result.
   *
   * @param result the trial result; must not be {@code null}
   * @return the bundle of the target if this result completed it, an empty optional otherwise
   */
  public Optional<ResultBundle> accept(TrialResult result) {
    requireNonNull(result, "result must not be null");

    var targetName = result.targetName();
    var outcome = new Outcome[]{Outcome.UNKNOWN};
    var released = new ResultBundle[1];

    accumulators.computeIfPresent(targetName, (name, accumulator) -> {
      if (accumulator.received.containsKey(result.trial())) {
        outcome[0] = Outcome.DUPLICATE;
        return accumulator;
      }
      var updated = accumulator.with(result, clock.instant());
      if (updated.isComplete()) {
        outcome[0] = Outcome.COMPLETED;
        released[0] = new ResultBundle(name, List.copyOf(updated.received.values()));
        retired.add(name);
        return null;
      }
      outcome[0] = Outcome.PENDING;
      return updated;
    });

    switch (outcome[0]) {
      case COMPLETED -> {
        logger.info("All {} trial results received for target {}, releasing bundle", released[0].size(), targetName);
        listeners.forEach(listener -> notify(listener, released[0]));
        return Optional.of(released[0]);
      }
      case PENDING -> logger.debug("Received trial {} for target {}", result.trial().label(), targetName);
      case DUPLICATE -> logger.warn("Ignoring duplicate result for trial {} of target {}", result.trial().label(), targetName);
      case UNKNOWN -> {
        if (retired.contains(targetName)) {
          logger.warn("Ignoring result for trial {} of target {}: bundle already released", result.trial().label(), targetName);
        } else {
          logger.warn("Ignoring result for trial {} of unregistered target {}", result.trial().label(), targetName);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Feeds a stream of trial results through the barrier.
   *
   * @param results trial results in arrival order
   * @return the bundles released while consuming {@code results}, in release order
   */
  public Stream<ResultBundle> aggregate(Stream<TrialResult> results) {
    return results.map(this::accept).flatMap(Optional::stream);
  }

  /**
   * Returns a snapshot of the bundles still waiting for results, ordered by target name.
   *
   * @return the pending bundles
   */
  public List<PendingBundle> pending() {
    return accumulators.entrySet()
                       .stream()
                       .map(entry -> entry.getValue().snapshot(entry.getKey()))
                       .sorted(Comparator.comparing(PendingBundle::targetName))
                       .toList();
  }

  public boolean isPending(String targetName) {
    return accumulators.containsKey(targetName);
  }

  public boolean isReleased(String targetName) {
    return retired.contains(targetName);
  }

  private static void notify(BundleListener listener, ResultBundle bundle) {
    try {
      listener.onBundleComplete(bundle);
    } catch (RuntimeException e) {
      logger.error("Bundle listener failed for target {}", bundle.targetName(), e);
    }
  }

  private enum Outcome {UNKNOWN, DUPLICATE, PENDING, COMPLETED}

  /**
   * Immutable per-key state; replaced on every update so that {@link #pending()} never observes a
   * map being modified.
   */
  private record Accumulator(int expected, Map<DmTrial, TrialResult> received, Instant lastProgress) {

    static Accumulator empty(int expected, Instant now) {
      return new Accumulator(expected, Map.of(), now);
    }

    Accumulator with(TrialResult result, Instant now) {
      var copy = new LinkedHashMap<>(received);
      copy.put(result.trial(), result);
      return new Accumulator(expected, copy, now);
    }

    boolean isComplete() {
      return received.size() == expected;
    }

    PendingBundle snapshot(String targetName) {
      return new PendingBundle(targetName, expected, received.size(), lastProgress);
    }
  }
}
