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

import static java.util.Objects.requireNonNull;

/**
 * Identity of one search task within a run: the owning target name and the trial.
 *
 * @param targetName name of the target
 * @param trial      the dedispersion trial
 */
public record TrialKey(String targetName, DmTrial trial) {

  public TrialKey {
    requireNonNull(targetName, "targetName must not be null");
    requireNonNull(trial, "trial must not be null");
  }

  @Override
  public String toString() {
    return targetName + "/" + trial.label();
  }
}
