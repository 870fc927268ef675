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
 * Kind of search a {@link Target} requires, derived from the prefix of its name.
 */
public enum TargetType {
  /**
   * Blind search over the configured DM range. Names start with {@code Blind}.
   */
  BLIND("Blind"),
  /**
   * Known or candidate fast radio burst. Names start with {@code FRB}.
   */
  FRB("FRB"),
  /**
   * Any other catalogued source, usually a pulsar such as {@code J0835-4510}.
   */
  CATALOG("");

  private final String prefix;

  TargetType(String prefix) {
    this.prefix = prefix;
  }

  /**
   * Returns the name prefix identifying this type; empty for {@link #CATALOG}.
   *
   * @return the name prefix
   */
  public String prefix() {
    return prefix;
  }

  /**
   * Resolves the type of a target from its name.
   *
   * @param targetName the target name; must not be {@code null}
   * @return the matching type, {@link #CATALOG} when no prefix matches
   */
  public static TargetType fromName(String targetName) {
    if (targetName.startsWith(BLIND.prefix)) return BLIND;
    if (targetName.startsWith(FRB.prefix)) return FRB;
    return CATALOG;
  }
}
