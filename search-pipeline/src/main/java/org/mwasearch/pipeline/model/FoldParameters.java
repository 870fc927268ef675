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

/**
 * Folding resolution and search depth applied to one candidate.
 *
 * @param nbins             number of phase bins of the folded profile
 * @param ntimechunks       number of sub-integrations across the observation
 * @param dmStep            DM search step multiplier
 * @param periodSearchDepth period/period-derivative search depth multiplier
 */
public record FoldParameters(int nbins, int ntimechunks, int dmStep, int periodSearchDepth) {

  public FoldParameters {
    if (nbins <= 0) {
      throw new IllegalArgumentException("nbins must be > 0, got: " + nbins);
    }
    if (ntimechunks <= 0) {
      throw new IllegalArgumentException("ntimechunks must be > 0, got: " + ntimechunks);
    }
    if (dmStep <= 0) {
      throw new IllegalArgumentException("dmStep must be > 0, got: " + dmStep);
    }
    if (periodSearchDepth <= 0) {
      throw new IllegalArgumentException("periodSearchDepth must be > 0, got: " + periodSearchDepth);
    }
  }
}
