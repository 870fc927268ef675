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

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Holder of the scheduler shared by the periodic jobs of the pipeline.
 */
public final class Schedulers {

  /**
   * Single-threaded daemon scheduler; periodic jobs are short scans of in-memory state.
   */
  private static final ScheduledThreadPoolExecutor SHARED;

  private Schedulers() {}

  static {
    SHARED = new ScheduledThreadPoolExecutor(
      1,
      r -> {
        Thread t = new Thread(r, "search-pipeline-scheduler");
        t.setDaemon(true);
        return t;
      }
    );
    SHARED.setRemoveOnCancelPolicy(true);
    SHARED.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);

    Runtime.getRuntime().addShutdownHook(new Thread(SHARED::shutdown, "search-pipeline-scheduler-shutdown"));
  }

  /**
   * Returns the shared scheduled executor service.
   * <p>
   * Do not call {@code shutdown()} on the returned executor; it is stopped when the JVM exits.
   * </p>
   *
   * @return the shared scheduled executor service
   */
  public static ScheduledExecutorService shared() {
    return SHARED;
  }
}
