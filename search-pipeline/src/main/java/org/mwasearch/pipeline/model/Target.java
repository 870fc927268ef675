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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One search unit: a pointing and the raw data recorded for it.
 * <p>
 * The {@code name} is the unique key of the target across a run. Its prefix encodes the
 * {@link TargetType}; an optional {@code _suffix} discriminates several pointings on the same
 * source (for example {@code J0835-4510_2}) and is ignored for catalogue lookups.
 * </p>
 *
 * @param name         unique target name; never blank
 * @param rawDataGroup raw-data files of the pointing, in observation order; owned by this target
 */
public record Target(String name, List<Path> rawDataGroup) {

  private static final char DISCRIMINATOR_SEPARATOR = '_';

  public Target {
    requireNonNull(name, "name must not be null");
    requireNonNull(rawDataGroup, "rawDataGroup must not be null");
    if (name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    rawDataGroup = List.copyOf(rawDataGroup);
  }

  public static Target of(String name, Path... rawData) {
    return new Target(name, List.of(rawData));
  }

  public TargetType type() {
    return TargetType.fromName(name);
  }

  /**
   * Returns the name without its trailing discriminator, as known by the catalogues.
   *
   * @return the source name used for catalogue lookups
   */
  public String sourceName() {
    int separator = name.indexOf(DISCRIMINATOR_SEPARATOR);
    return separator > 0 ? name.substring(0, separator) : name;
  }
}
