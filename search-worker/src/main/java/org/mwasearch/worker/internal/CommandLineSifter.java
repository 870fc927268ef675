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
import org.mwasearch.pipeline.execution.Sifter;
import org.mwasearch.pipeline.model.ResultBundle;
import org.mwasearch.pipeline.model.SiftOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import static java.util.Objects.requireNonNull;

/**
 * {@link Sifter} running {@code ACCEL_sift.py} over a complete result bundle.
 * <p>
 * Every file of the bundle is linked into {@code <workRoot>/<target>/sift}. The sifted candidate
 * list is written to {@code cands_<target>.txt}; the single-pulse files are plotted and archived
 * into {@code <target>_singlepulse.tar.gz}.
 * </p>
 */
public final class CommandLineSifter implements Sifter {
  private static final Logger logger = LoggerFactory.getLogger(CommandLineSifter.class);

  private final CommandRunner runner;
  private final Path workRoot;
  private final Executor executor;

  public CommandLineSifter(Path workRoot, Executor executor) {
    this(new ProcessCommandRunner(), workRoot, executor);
  }

  CommandLineSifter(CommandRunner runner, Path workRoot, Executor executor) {
    this.runner = requireNonNull(runner, "runner must not be null");
    this.workRoot = requireNonNull(workRoot, "workRoot must not be null");
    this.executor = requireNonNull(executor, "executor must not be null");
  }

  @Override
  public CompletionStage<SiftOutput> sift(ResultBundle bundle) {
    requireNonNull(bundle, "bundle must not be null");
    return CompletableFuture.supplyAsync(() -> {
      MDC.put("target", bundle.targetName());
      try {
        return runSift(bundle);
      } finally {
        MDC.remove("target");
      }
    }, executor);
  }

  SiftOutput runSift(ResultBundle bundle) {
    var targetName = WorkDirectories.safeName(bundle.targetName());
    var directory = WorkDirectories.create(workRoot.resolve(targetName).resolve("sift"));
    bundle.allFiles().forEach(file -> link(directory, file));
    logger.info("Sifting {} trial results of {}", bundle.size(), bundle.targetName());

    var candidateFile = directory.resolve("cands_" + targetName + ".txt");
    runner.run(ExternalCommand.in(directory, "ACCEL_sift.py").flag("--file_name", candidateFile.getFileName()).build());
    if (!Files.isRegularFile(candidateFile)) {
      throw new SearchPipelineException("ACCEL_sift.py did not write " + candidateFile);
    }

    var singlePulseFiles = bundle.singlePulseFiles().stream().map(Path::getFileName).toList();
    runner.run(ExternalCommand.in(directory, "single_pulse_search.py").args(singlePulseFiles).build());
    var plots = WorkDirectories.list(directory, "*_singlepulse.ps");
    if (plots.isEmpty()) {
      logger.warn("single_pulse_search.py produced no plot for {}", bundle.targetName());
    }

    var archive = directory.resolve(targetName + "_singlepulse.tar.gz");
    runner.run(ExternalCommand.in(directory, "tar").arg("-czf").arg(archive.getFileName()).args(singlePulseFiles).build());

    return new SiftOutput(bundle.targetName(), candidateFile, archive, plots.isEmpty() ? null : plots.get(0));
  }

  private static void link(Path directory, Path file) {
    var link = directory.resolve(file.getFileName());
    try {
      if (Files.notExists(link, LinkOption.NOFOLLOW_LINKS)) {
        Files.createSymbolicLink(link, file.toAbsolutePath());
      }
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot link " + file + " into " + directory, e);
    }
  }
}
