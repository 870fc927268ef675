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

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import org.mwasearch.pipeline.fold.MalformedRecordException;
import org.mwasearch.pipeline.model.CandidateRecord;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Text format of the candidate lines written by the sifter.
 * <p>
 * This class is the only place that knows the layout of a sifted line. A line holds
 * whitespace-delimited fields:
 * </p>
 * <pre>
 * name-with-DM-suffix  DM  SNR  sigma  numharm  ipow  cpow  P(ms)  r  z  numhits
 * PSR0835-4510_DM12.30_ACCEL_0:1  12.30  ...  89.33  ...
 * </pre>
 * <p>
 * The target name is everything in the first field before the {@value #DM_MARKER} token. Lines
 * that are blank or start with {@code #} carry no candidate. Neither do the lines the sifter
 * writes under each candidate: one {@code DM= ... SNR= ... Sigma= ...} line per harmonic hit and
 * {@code -->} notes.
 * </p>
 */
public final class SiftedLineFormat {

  /**
   * Token separating the target name from the DM segment of a candidate name.
   */
  public static final String DM_MARKER = "_DM";
  public static final int NAME_FIELD = 0;
  public static final int DM_FIELD = 1;
  public static final int PERIOD_MS_FIELD = 7;

  private static final Splitter FIELD_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
  private static final String COMMENT_PREFIX = "#";
  private static final String HIT_PREFIX = "DM=";
  private static final String NOTE_PREFIX = "-->";

  private SiftedLineFormat() {
  }

  /**
   * Parses one sifted line.
   *
   * @param line the text line; must not be {@code null}
   * @return the candidate record, or an empty optional for blank, comment, hit and note lines
   * @throws MalformedRecordException if the line has too few fields to hold a period
   */
  public static Optional<CandidateRecord> parse(String line) {
    requireNonNull(line, "line must not be null");

    var trimmed = line.strip();
    if (trimmed.isEmpty() || isContinuation(trimmed)) {
      return Optional.empty();
    }

    var fields = FIELD_SPLITTER.splitToList(trimmed);
    if (fields.size() <= PERIOD_MS_FIELD) {
      throw new MalformedRecordException("Candidate line has " + fields.size() + " fields, expected at least "
        + (PERIOD_MS_FIELD + 1) + ": '" + trimmed + "'");
    }

    var name = fields.get(NAME_FIELD);
    return Optional.of(new CandidateRecord(
      name,
      baseName(name),
      fields.get(DM_FIELD),
      fields.get(PERIOD_MS_FIELD),
      fields
    ));
  }

  private static boolean isContinuation(String trimmed) {
    return trimmed.startsWith(COMMENT_PREFIX) || trimmed.startsWith(HIT_PREFIX) || trimmed.startsWith(NOTE_PREFIX);
  }

  /**
   * Strips the DM segment from a candidate name.
   *
   * @param candidateName first field of a sifted line
   * @return the part before {@value #DM_MARKER}, or the whole name when it has no DM segment
   */
  public static String baseName(String candidateName) {
    int marker = candidateName.indexOf(DM_MARKER);
    return marker >= 0 ? candidateName.substring(0, marker) : candidateName;
  }

  /**
   * Reads the DM of a candidate.
   *
   * @param record the parsed candidate
   * @return the DM
   * @throws MalformedRecordException if the DM field is not a number
   */
  public static double dm(CandidateRecord record) {
    return number(record.dmText(), "DM", record);
  }

  /**
   * Reads the period of a candidate.
   *
   * @param record the parsed candidate
   * @return the period in milliseconds
   * @throws MalformedRecordException if the period field is not a number
   */
  public static double periodMs(CandidateRecord record) {
    return number(record.periodMsText(), "period", record);
  }

  private static double number(String text, String fieldName, CandidateRecord record) {
    try {
      double value = Double.parseDouble(text);
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        throw new MalformedRecordException("Candidate " + record.name() + " has a non-finite " + fieldName + ": '" + text + "'");
      }
      return value;
    } catch (NumberFormatException e) {
      throw new MalformedRecordException("Candidate " + record.name() + " has a non-numeric " + fieldName + ": '" + text + "'", e);
    }
  }
}
