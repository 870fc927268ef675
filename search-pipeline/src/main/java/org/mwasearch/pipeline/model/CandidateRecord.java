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

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One sifted candidate line after parsing.
 * <p>
 * The DM and period are kept as the text emitted by the sifter; they are converted to numbers
 * only when a fold job is planned, so that a malformed value drops this record alone.
 * All fields of the line are kept verbatim in {@code fields}.
 * </p>
 *
 * @param name        first field of the line: candidate name carrying the DM suffix
 * @param baseName    target name recovered from {@code name}
 * @param dmText      text of the DM field
 * @param periodMsText text of the period field, in milliseconds
 * @param fields      every whitespace-delimited field of the line
 */
public record CandidateRecord(
  String name,
  String baseName,
  String dmText,
  String periodMsText,
  List<String> fields
) {

  public CandidateRecord {
    requireNonNull(name, "name must not be null");
    requireNonNull(baseName, "baseName must not be null");
    requireNonNull(dmText, "dmText must not be null");
    requireNonNull(periodMsText, "periodMsText must not be null");
    fields = List.copyOf(fields);
  }

  /**
   * Returns the original line, fields joined by a single space.
   *
   * @return the candidate line
   */
  public String line() {
    return String.join(" ", fields);
  }
}
