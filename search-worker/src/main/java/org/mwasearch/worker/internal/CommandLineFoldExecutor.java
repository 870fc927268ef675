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

import org.mwasearch.pipeline.execution.FoldExecutor;
import org.mwasearch.pipeline.model.FoldJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * {@link FoldExecutor} running {@code prepfold} on the raw data of the candidate's target.
 * Outputs land in {@code <workRoot>/<target>/fold/<candidate>}.
 */
public final class CommandLineFoldExecutor implements FoldExecutor {
  private static final Logger logger = LoggerFactory.getLogger(CommandLineFoldExecutor.class);

  private final CommandRunner runner;
  private final Path workRoot;
  private final Executor executor;

  public CommandLineFoldExecutor(Path workRoot, Executor executor) {
    this(new ProcessCommandRunner(), workRoot, executor);
  }

  CommandLineFoldExecutor(CommandRunner runner, Path workRoot, Executor executor) {
    this.runner = requireNonNull(runner, "runner must not be null");
    this.workRoot = requireNonNull(workRoot, "workRoot must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
  }

  @Override
  public CompletionStage<Void> fold(FoldJob job) {
    requireNonNull(job, "job must not be null");
    return CompletableFuture.runAsync(() -> {
      MDC.put("target", job.targetName());
      try {
        runFold(job);
      } finally {
        MDC.remove("target");
      }
    }, executor);
  }

  void runFold(FoldJob job) {
    var candidateName = WorkDirectories.safeName(job.candidate().name());
    var directory = WorkDirectories.create(
      workRoot.resolve(WorkDirectories.safeName(job.targetName())).resolve("fold").resolve(candidateName));
    var parameters = job.parameters();
    logger.info("Folding {} at P={}s DM={} with {}", job.candidate().name(), job.periodSeconds(), job.dm(), parameters);

    runner.run(ExternalCommand.in(directory, "prepfold")
                              .flag("-n", parameters.nbins())
                              .flag("-npart", parameters.ntimechunks())
                              .flag("-dmstep", parameters.dmStep())
                              .flag("-npfact", parameters.periodSearchDepth())
                              .flag("-p", job.periodSeconds())
                              .flag("-dm", job.dm())
                              .arg("-noxwin")
                              .flag("-o", candidateName)
                              .args(job.rawDataGroup())
                              .build());
  }
}
