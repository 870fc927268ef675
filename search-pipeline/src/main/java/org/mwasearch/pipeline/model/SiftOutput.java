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
package org.mwasearch.pipeline.model;

import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Files produced by the sifter for one target.
 *
 * @param targetName         name of the target
 * @param candidateFile      text file of sifted candidate lines
 * @param singlePulseArchive compressed archive of the single-pulse detections
 * @param singlePulsePlot    plot of the single-pulse detections
 */
public record SiftOutput(String targetName, Path candidateFile, Path singlePulseArchive, Path singlePulsePlot) {

  public SiftOutput {
    requireNonNull(targetName, "targetName must not be null");
    requireNonNull(candidateFile, "candidateFile must not be null");
  }
}
