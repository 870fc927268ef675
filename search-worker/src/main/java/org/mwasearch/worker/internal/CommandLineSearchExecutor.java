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
package org.mwasearch.worker.internal;

import org.mwasearch.pipeline.SearchPipelineException;
import org.mwasearch.pipeline.execution.SearchExecutor;
import org.mwasearch.pipeline.model.SearchTask;
import org.mwasearch.pipeline.model.TrialResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * {@link SearchExecutor} running the PRESTO tool chain on the local machine.
 * <p>
 * Each task gets its own directory {@code <workRoot>/<target>/<trial label>} in which:
 * </p>
 * <ol>
 *   <li>{@code prepsubband} dedisperses the raw data over the trial's DM steps,</li>
 *   <li>{@code realfft} and {@code accelsearch} run on every dedispersed time series,</li>
 *   <li>{@code single_pulse_search.py} runs over all time series at once,</li>
 *   <li>the per-DM {@code .singlepulse} files are concatenated into one file per trial.</li>
 * </ol>
 * <p>
 * Tasks run on the supplied executor, which bounds the number of concurrent searches.
 * </p>
 */
public final class CommandLineSearchExecutor implements SearchExecutor {
  private static final Logger logger = LoggerFactory.getLogger(CommandLineSearchExecutor.class);

  static final int ACCEL_NUM_HARMONICS = 16;
  static final int ACCEL_ZMAX = 0;

  private final CommandRunner runner;
  private final Path workRoot;
  private final Executor executor;

  public CommandLineSearchExecutor(Path workRoot, Executor executor) {
    this(new ProcessCommandRunner(), workRoot, executor);
  }

  CommandLineSearchExecutor(CommandRunner runner, Path workRoot, Executor executor) {
    this.runner = requireNonNull(runner, "runner must not be null");
    this.workRoot = requireNonNull(workRoot, "workRoot must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
  }

  @Override
  public CompletionStage<TrialResult> search(SearchTask task) {
    requireNonNull(task, "task must not be null");
    return CompletableFuture.supplyAsync(() -> {
      MDC.put("target", task.target().name());
      try {
        return runSearch(task);
      } finally {
        MDC.remove("target");
      }
    }, executor);
  }

  TrialResult runSearch(SearchTask task) {
    var targetName = task.target().name();
    var trial = task.trial();
    var directory = WorkDirectories.create(workRoot.resolve(WorkDirectories.safeName(targetName)).resolve(trial.label()));
    logger.info("Searching {} over {} ({} DMs, nsub={}, downsample={})",
      targetName, trial.label(), trial.numDms(), task.nsub(), trial.downsampleFactor());

    runner.run(ExternalCommand.in(directory, "prepsubband")
                              .flag("-lodm", trial.lowDm())
                              .flag("-dmstep", trial.dmStep())
                              .flag("-numdms", trial.numDms())
                              .flag("-nsub", task.nsub())
                              .flag("-downsamp", trial.downsampleFactor())
                              .flag("-numout", task.outputSamples())
                              .flag("-o", targetName)
                              .args(task.rawDataGroup())
                              .build());

    var timeSeries = WorkDirectories.list(directory, "*.dat");
    if (timeSeries.isEmpty()) {
      throw new SearchPipelineException("prepsubband produced no time series for " + task.key());
    }
    for (var series : timeSeries) {
      runner.run(ExternalCommand.in(directory, "realfft").arg(series.getFileName()).build());
      var spectrum = series.getFileName().toString().replaceFirst("\\.dat$", ".fft");
      runner.run(ExternalCommand.in(directory, "accelsearch")
                                .flag("-zmax", ACCEL_ZMAX)
                                .flag("-numharm", ACCEL_NUM_HARMONICS)
                                .arg(spectrum)
                                .build());
    }
    runner.run(ExternalCommand.in(directory, "single_pulse_search.py")
                              .arg("-p")
                              .args(timeSeries.stream().map(Path::getFileName).toList())
                              .build());

    var singlePulseFile = concatenate(
      WorkDirectories.list(directory, "*_DM*.singlepulse"),
      directory.resolve(WorkDirectories.safeName(targetName) + "_" + trial.label() + ".singlepulse"));

    return new TrialResult(
      targetName,
      trial,
      WorkDirectories.list(directory, "*_ACCEL_*"),
      WorkDirectories.list(directory, "*.inf"),
      singlePulseFile);
  }

  private static Path concatenate(List<Path> parts, Path destination) {
    try {
      Files.write(destination, new byte[0]);
      for (var part : parts) {
        if (part.equals(destination)) continue;
        Files.write(destination, Files.readAllBytes(part), StandardOpenOption.APPEND);
      }
      return destination;
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot write " + destination, e);
    }
  }
}
