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
package org.mwasearch.pipeline.correlate;

import org.mwasearch.pipeline.model.Target;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Lookup of the run's targets by name, used to re-attach derived results to their raw data.
 */
public final class TargetIndex {

  private final Map<String, Target> targetsByName;

  private TargetIndex(Map<String, Target> targetsByName) {
    this.targetsByName = targetsByName;
  }

  /**
   * Indexes a set of targets.
   *
   * @param targets the targets of the run
   * @return the index
   * @throws IllegalArgumentException if two targets share a name
   */
  public static TargetIndex of(Collection<Target> targets) {
    requireNonNull(targets, "targets must not be null");
    var index = new LinkedHashMap<String, Target>();
    for (var target : targets) {
      if (index.putIfAbsent(target.name(), target) != null) {
        throw new IllegalArgumentException("Duplicate target name: " + target.name());
      }
    }
    return new TargetIndex(index);
  }

  public Optional<Target> find(String targetName) {
    return Optional.ofNullable(targetsByName.get(targetName));
  }

  public int size() {
    return targetsByName.size();
  }
}
