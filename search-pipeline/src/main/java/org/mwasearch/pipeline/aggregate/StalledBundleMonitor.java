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

import org.mwasearch.pipeline.internal.concurrent.Schedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Periodically scans the pending bundles of a {@link ResultAggregator} and reports those that
 * made no progress for longer than the stall timeout.
 * <p>
 * A bundle whose search task failed under the ignore policy never completes. Instead of starving
 * silently, it is logged at WARN and handed to the {@link StalledBundleListener}. A stalled bundle
 * is reported once; if it later receives a result and stalls again it is reported again.
 * </p>
 */
public final class StalledBundleMonitor implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(StalledBundleMonitor.class);

  private final ResultAggregator aggregator;
  private final Duration stallTimeout;
  private final Duration interval;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;
  private final StalledBundleListener listener;
  private final Map<String, Integer> reported = new ConcurrentHashMap<>();
  private final Object lock = new Object();
  private ScheduledFuture<?> timer;

  public StalledBundleMonitor(ResultAggregator aggregator, Duration stallTimeout, Duration interval, StalledBundleListener listener) {
    this(aggregator, stallTimeout, interval, listener, Schedulers.shared(), Clock.systemUTC());
  }

  public StalledBundleMonitor(ResultAggregator aggregator,
                              Duration stallTimeout,
                              Duration interval,
                              StalledBundleListener listener,
                              ScheduledExecutorService scheduler,
                              Clock clock) {
    this.aggregator = requireNonNull(aggregator, "aggregator must not be null");
    this.stallTimeout = requireNonNull(stallTimeout, "stallTimeout must not be null");
    this.interval = requireNonNull(interval, "interval must not be null");
    this.listener = requireNonNull(listener, "listener must not be null");
    this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
    this.clock = requireNonNull(clock, "clock must not be null");
  }

  /**
   * Starts the periodic scan. Calling this method on a started monitor has no effect.
   */
  public void start() {
    synchronized (lock) {
      if (timer == null) {
        timer = scheduler.scheduleWithFixedDelay(this::check, interval.toNanos(), interval.toNanos(), NANOSECONDS);
        logger.debug("Stalled bundle monitor started (timeout={}, interval={})", stallTimeout, interval);
      }
    }
  }

  /**
   * Scans the pending bundles once.
   *
   * @return the bundles newly reported as stalled by this scan
   */
  public List<PendingBundle> check() {
    var now = clock.instant();
    var pending = aggregator.pending();
    reported.keySet().removeIf(name -> !aggregator.isPending(name));

    var stalled = pending.stream()
                         .filter(bundle -> !bundle.lastProgress().plus(stallTimeout).isAfter(now))
                         .filter(bundle -> !Integer.valueOf(bundle.received()).equals(reported.get(bundle.targetName())))
                         .toList();

    for (var bundle : stalled) {
      reported.put(bundle.targetName(), bundle.received());
      logger.warn("Result bundle of target {} stalled: {}/{} trial results received, no progress since {}",
        bundle.targetName(), bundle.received(), bundle.expected(), bundle.lastProgress());
      try {
        listener.onStalled(bundle);
      } catch (RuntimeException e) {
        logger.error("Stalled bundle listener failed for target {}", bundle.targetName(), e);
      }
    }
    return stalled;
  }

  @Override
  public void close() {
    synchronized (lock) {
      if (timer != null) {
        timer.cancel(false);
        timer = null;
        logger.debug("Stalled bundle monitor stopped");
      }
    }
  }
}
