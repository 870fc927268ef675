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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * {@link CommandRunner} starting a child process per command.
 * <p>
 * Standard error is merged into standard output and every line is logged at DEBUG under the
 * program name. A non-zero exit status is reported as a {@link SearchPipelineException}.
 * </p>
 */
final class ProcessCommandRunner implements CommandRunner {
  private static final Logger logger = LoggerFactory.getLogger(ProcessCommandRunner.class);

  @Override
  public void run(ExternalCommand command) {
    logger.debug("Running '{}' in {}", command, command.workingDirectory());

    Process process;
    try {
      process = new ProcessBuilder(command.arguments())
        .directory(command.workingDirectory().toFile())
        .redirectErrorStream(true)
        .start();
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot start " + command.program(), e);
    }

    try (var output = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = output.readLine()) != null) {
        logger.debug("[{}] {}", command.program(), line);
      }
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        throw new SearchPipelineException(command.program() + " exited with " + exitCode);
      }
    } catch (IOException e) {
      process.destroy();
      throw new SearchPipelineException("Cannot read the output of " + command.program(), e);
    } catch (InterruptedException e) {
      process.destroy();
      Thread.currentThread().interrupt();
      throw new SearchPipelineException(command.program() + " was interrupted", e);
    }
  }
}
