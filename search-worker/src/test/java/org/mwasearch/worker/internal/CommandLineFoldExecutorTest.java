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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mwasearch.pipeline.SearchPipelineException;
import org.mwasearch.pipeline.model.CandidateRecord;
import org.mwasearch.pipeline.model.FoldJob;
import org.mwasearch.pipeline.model.FoldParameters;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineFoldExecutorTest {

  @TempDir
  Path workRoot;

  private final FoldJob job = new FoldJob(
    new CandidateRecord("J1900-2600_DM20.00_ACCEL_0:1", "J1900-2600", "20.00", "15.0",
      List.of("J1900-2600_DM20.00_ACCEL_0:1", "20.00", "11.2", "6.5", "4", "55.1", "60.2", "15.0")),
    List.of(Path.of("/data/J1900-2600_ch109.fits")),
    0.015,
    20.0,
    new FoldParameters(100, 120, 1, 1)
  );

  @Test
  @DisplayName("should fold the raw data at the candidate period and DM")
  void should_fold_the_raw_data_at_the_candidate_period_and_dm() {
    // Given
    var runner = new RecordingCommandRunner();
    var executor = new CommandLineFoldExecutor(runner, workRoot, Runnable::run);

    // When
    executor.fold(job).toCompletableFuture().join();

    // Then
    var command = runner.first("prepfold");
    assertThat(command.arguments()).containsExactly(
      "prepfold", "-n", "100", "-npart", "120", "-dmstep", "1", "-npfact", "1", "-p", "0.015", "-dm", "20.0",
      "-noxwin", "-o", "J1900-2600_DM20.00_ACCEL_0_1", "/data/J1900-2600_ch109.fits");
    assertThat(command.workingDirectory())
      .isEqualTo(workRoot.resolve("J1900-2600").resolve("fold").resolve("J1900-2600_DM20.00_ACCEL_0_1"))
      .isDirectory();
  }

  @Test
  @DisplayName("should complete exceptionally when prepfold fails")
  void should_complete_exceptionally_when_prepfold_fails() {
    // Given
    var runner = new RecordingCommandRunner().on("prepfold", command -> {
      throw new SearchPipelineException("prepfold exited with 1");
    });
    var executor = new CommandLineFoldExecutor(runner, workRoot, Runnable::run);

    // When / Then
    assertThatThrownBy(() -> executor.fold(job).toCompletableFuture().join())
      .hasCauseInstanceOf(SearchPipelineException.class);
  }
}
