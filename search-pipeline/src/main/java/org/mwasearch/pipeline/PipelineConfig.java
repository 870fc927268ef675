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
package org.mwasearch.pipeline;

import org.mwasearch.pipeline.fold.FoldPolicy;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Properties;

import static java.util.Objects.requireNonNull;

/**
 * Immutable configuration of a search run.
 * <p>
 * This configuration gathers the DM ranges, the observation parameters, the failure policy of
 * search tasks, the stall monitoring settings and the fold policy. Create instances using the
 * builder pattern or {@link #fromProperties(Properties)}.
 * </p>
 *
 * <h2>Property keys</h2>
 * <table>
 *   <caption>Keys read by {@link #fromProperties(Properties)}</caption>
 *   <tr><th>Key</th><th>Default</th></tr>
 *   <tr><td>{@value #BLIND_DM_MIN}</td><td>1.0</td></tr>
 *   <tr><td>{@value #BLIND_DM_MAX}</td><td>250.0</td></tr>
 *   <tr><td>{@value #CATALOG_DM_HALF_WIDTH}</td><td>2.0</td></tr>
 *   <tr><td>{@value #MINIMUM_DM}</td><td>1.0</td></tr>
 *   <tr><td>{@value #MAX_DMS_PER_TRIAL}</td><td>1000</td></tr>
 *   <tr><td>{@value #FINE_CHANNELS_PER_COARSE}</td><td>128</td></tr>
 *   <tr><td>{@value #TIME_RESOLUTION_MS}</td><td>0.1</td></tr>
 *   <tr><td>{@value #OBSERVATION_DURATION_SECONDS}</td><td>4800</td></tr>
 *   <tr><td>{@value #SEARCH_FAILURE_POLICY}</td><td>IGNORE</td></tr>
 *   <tr><td>{@value #STALL_TIMEOUT}</td><td>PT6H</td></tr>
 *   <tr><td>{@value #MONITOR_INTERVAL}</td><td>PT1M</td></tr>
 *   <tr><td>{@value #FOLD_PERIOD_THRESHOLD_SECONDS}</td><td>0.01</td></tr>
 * </table>
 *
 * @see SearchPipeline
 */
public final class PipelineConfig {

  public static final String BLIND_DM_MIN = "dm.blind.min";
  public static final String BLIND_DM_MAX = "dm.blind.max";
  public static final String CATALOG_DM_HALF_WIDTH = "dm.catalog.half-width";
  public static final String MINIMUM_DM = "dm.minimum";
  public static final String MAX_DMS_PER_TRIAL = "dm.max-per-trial";
  public static final String FINE_CHANNELS_PER_COARSE = "observation.fine-channels-per-coarse";
  public static final String TIME_RESOLUTION_MS = "observation.time-resolution-ms";
  public static final String OBSERVATION_DURATION_SECONDS = "observation.duration-seconds";
  public static final String SEARCH_FAILURE_POLICY = "search.failure-policy";
  public static final String STALL_TIMEOUT = "monitor.stall-timeout";
  public static final String MONITOR_INTERVAL = "monitor.interval";
  public static final String FOLD_PERIOD_THRESHOLD_SECONDS = "fold.period-threshold-seconds";

  private final double blindDmMin;
  private final double blindDmMax;
  private final double catalogDmHalfWidth;
  private final double minimumDm;
  private final int maxDmsPerTrial;
  private final int fineChannelsPerCoarseChannel;
  private final double timeResolutionMs;
  private final double observationDurationSeconds;
  private final SearchFailurePolicy searchFailurePolicy;
  private final Duration stallTimeout;
  private final Duration monitorInterval;
  private final FoldPolicy foldPolicy;

  private PipelineConfig(Builder builder) {
    this.blindDmMin = builder.blindDmMin;
    this.blindDmMax = builder.blindDmMax;
    this.catalogDmHalfWidth = builder.catalogDmHalfWidth;
    this.minimumDm = builder.minimumDm;
    this.maxDmsPerTrial = builder.maxDmsPerTrial;
    this.fineChannelsPerCoarseChannel = builder.fineChannelsPerCoarseChannel;
    this.timeResolutionMs = builder.timeResolutionMs;
    this.observationDurationSeconds = builder.observationDurationSeconds;
    this.searchFailurePolicy = builder.searchFailurePolicy;
    this.stallTimeout = builder.stallTimeout;
    this.monitorInterval = builder.monitorInterval;
    this.foldPolicy = builder.foldPolicy;
  }

  /**
   * Returns the lowest DM of a blind search.
   *
   * @return the blind-search lower DM bound
   */
  public double blindDmMin() {
    return blindDmMin;
  }

  /**
   * Returns the highest DM of a blind search.
   *
   * @return the blind-search upper DM bound
   */
  public double blindDmMax() {
    return blindDmMax;
  }

  /**
   * Returns the distance searched on each side of a catalogued DM.
   *
   * @return the catalogue window half width
   */
  public double catalogDmHalfWidth() {
    return catalogDmHalfWidth;
  }

  /**
   * Returns the floor applied to the lower bound of catalogue windows.
   *
   * @return the minimum DM
   */
  public double minimumDm() {
    return minimumDm;
  }

  /**
   * Returns the largest number of DMs searched by one trial; larger plan segments are split.
   *
   * @return the maximum DM count per trial
   */
  public int maxDmsPerTrial() {
    return maxDmsPerTrial;
  }

  public int fineChannelsPerCoarseChannel() {
    return fineChannelsPerCoarseChannel;
  }

  public double timeResolutionMs() {
    return timeResolutionMs;
  }

  public double observationDurationSeconds() {
    return observationDurationSeconds;
  }

  /**
   * Returns the number of native samples of the observation.
   *
   * @return {@code observationDurationSeconds / timeResolution}, rounded
   */
  public long totalSamples() {
    return Math.round(observationDurationSeconds * 1000 / timeResolutionMs);
  }

  public SearchFailurePolicy searchFailurePolicy() {
    return searchFailurePolicy;
  }

  /**
   * Returns how long a result bundle may go without progress before it is reported as stalled.
   *
   * @return the stall timeout
   */
  public Duration stallTimeout() {
    return stallTimeout;
  }

  public Duration monitorInterval() {
    return monitorInterval;
  }

  public FoldPolicy foldPolicy() {
    return foldPolicy;
  }

  /**
   * Creates a new builder for constructing a {@link PipelineConfig}.
   *
   * @return a new builder instance
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from properties, using the defaults for missing keys.
   *
   * @param properties the properties to read; must not be {@code null}
   * @return the configuration
   * @throws IllegalArgumentException if a value cannot be parsed or the configuration is invalid
   */
  public static PipelineConfig fromProperties(Properties properties) {
    requireNonNull(properties, "properties must not be null");

    var builder = builder();
    var defaults = builder();
    builder.blindDmRange(
      doubleValue(properties, BLIND_DM_MIN, defaults.blindDmMin),
      doubleValue(properties, BLIND_DM_MAX, defaults.blindDmMax));
    builder.catalogDmHalfWidth(doubleValue(properties, CATALOG_DM_HALF_WIDTH, defaults.catalogDmHalfWidth));
    builder.minimumDm(doubleValue(properties, MINIMUM_DM, defaults.minimumDm));
    builder.maxDmsPerTrial(intValue(properties, MAX_DMS_PER_TRIAL, defaults.maxDmsPerTrial));
    builder.fineChannelsPerCoarseChannel(intValue(properties, FINE_CHANNELS_PER_COARSE, defaults.fineChannelsPerCoarseChannel));
    builder.timeResolutionMs(doubleValue(properties, TIME_RESOLUTION_MS, defaults.timeResolutionMs));
    builder.observationDurationSeconds(doubleValue(properties, OBSERVATION_DURATION_SECONDS, defaults.observationDurationSeconds));
    builder.searchFailurePolicy(policyValue(properties));
    builder.stallTimeout(durationValue(properties, STALL_TIMEOUT, defaults.stallTimeout));
    builder.monitorInterval(durationValue(properties, MONITOR_INTERVAL, defaults.monitorInterval));
    builder.foldPolicy(FoldPolicy.DEFAULT.withPeriodThreshold(
      doubleValue(properties, FOLD_PERIOD_THRESHOLD_SECONDS, FoldPolicy.DEFAULT.periodThresholdSeconds())));
    return builder.build();
  }

  @Override
  public String toString() {
    return "PipelineConfig{" +
      "blindDmRange=[" + blindDmMin + ", " + blindDmMax + "]" +
      ", catalogDmHalfWidth=" + catalogDmHalfWidth +
      ", minimumDm=" + minimumDm +
      ", maxDmsPerTrial=" + maxDmsPerTrial +
      ", fineChannelsPerCoarseChannel=" + fineChannelsPerCoarseChannel +
      ", timeResolutionMs=" + timeResolutionMs +
      ", observationDurationSeconds=" + observationDurationSeconds +
      ", searchFailurePolicy=" + searchFailurePolicy +
      ", stallTimeout=" + stallTimeout +
      ", monitorInterval=" + monitorInterval +
      ", foldPolicy=" + foldPolicy +
      '}';
  }

  private static double doubleValue(Properties properties, String key, double defaultValue) {
    var value = properties.getProperty(key);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property '" + key + "' must be a number, got: " + value, e);
    }
  }

  private static int intValue(Properties properties, String key, int defaultValue) {
    var value = properties.getProperty(key);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property '" + key + "' must be an integer, got: " + value, e);
    }
  }

  private static Duration durationValue(Properties properties, String key, Duration defaultValue) {
    var value = properties.getProperty(key);
    if (value == null || value.isBlank()) return defaultValue;
    try {
      return Duration.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Property '" + key + "' must be an ISO-8601 duration, got: " + value, e);
    }
  }

  private static SearchFailurePolicy policyValue(Properties properties) {
    var value = properties.getProperty(SEARCH_FAILURE_POLICY);
    if (value == null || value.isBlank()) return SearchFailurePolicy.IGNORE;
    try {
      return SearchFailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Property '" + SEARCH_FAILURE_POLICY + "' must be IGNORE or ABORT, got: " + value, e);
    }
  }

  /**
   * Builder for {@link PipelineConfig}.
   * <p>
   * Every setting has a default suitable for an MWA VCS observation searched with the
   * low-frequency DD plan; call {@link #build()} to validate and create the configuration.
   * </p>
   */
  public static final class Builder {
    private double blindDmMin = 1.0;
    private double blindDmMax = 250.0;
    private double catalogDmHalfWidth = 2.0;
    private double minimumDm = 1.0;
    private int maxDmsPerTrial = 1000;
    private int fineChannelsPerCoarseChannel = 128;
    private double timeResolutionMs = 0.1;
    private double observationDurationSeconds = 4800;
    private SearchFailurePolicy searchFailurePolicy = SearchFailurePolicy.IGNORE;
    private Duration stallTimeout = Duration.ofHours(6);
    private Duration monitorInterval = Duration.ofMinutes(1);
    private FoldPolicy foldPolicy = FoldPolicy.DEFAULT;

    private Builder() {
    }

    /**
     * Sets the DM range of blind searches.
     *
     * @param min lowest DM
     * @param max highest DM
     * @return this builder
     */
    public Builder blindDmRange(double min, double max) {
      this.blindDmMin = min;
      this.blindDmMax = max;
      return this;
    }

    public Builder catalogDmHalfWidth(double catalogDmHalfWidth) {
      this.catalogDmHalfWidth = catalogDmHalfWidth;
      return this;
    }

    public Builder minimumDm(double minimumDm) {
      this.minimumDm = minimumDm;
      return this;
    }

    public Builder maxDmsPerTrial(int maxDmsPerTrial) {
      this.maxDmsPerTrial = maxDmsPerTrial;
      return this;
    }

    public Builder fineChannelsPerCoarseChannel(int fineChannelsPerCoarseChannel) {
      this.fineChannelsPerCoarseChannel = fineChannelsPerCoarseChannel;
      return this;
    }

    public Builder timeResolutionMs(double timeResolutionMs) {
      this.timeResolutionMs = timeResolutionMs;
      return this;
    }

    public Builder observationDurationSeconds(double observationDurationSeconds) {
      this.observationDurationSeconds = observationDurationSeconds;
      return this;
    }

    public Builder searchFailurePolicy(SearchFailurePolicy searchFailurePolicy) {
      this.searchFailurePolicy = searchFailurePolicy;
      return this;
    }

    public Builder stallTimeout(Duration stallTimeout) {
      this.stallTimeout = stallTimeout;
      return this;
    }

    public Builder monitorInterval(Duration monitorInterval) {
      this.monitorInterval = monitorInterval;
      return this;
    }

    public Builder foldPolicy(FoldPolicy foldPolicy) {
      this.foldPolicy = foldPolicy;
      return this;
    }

    /**
     * Builds the immutable {@link PipelineConfig} instance.
     *
     * @return a new {@link PipelineConfig} instance
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public PipelineConfig build() {
      validate();
      return new PipelineConfig(this);
    }

    private void validate() {
      if (blindDmMin < 0 || blindDmMax <= blindDmMin)
        throw new IllegalArgumentException("blind DM range must satisfy 0 <= min < max, got: [" + blindDmMin + ", " + blindDmMax + "]");

      if (catalogDmHalfWidth <= 0)
        throw new IllegalArgumentException("catalogDmHalfWidth must be > 0, got: " + catalogDmHalfWidth);

      if (minimumDm < 0)
        throw new IllegalArgumentException("minimumDm must be >= 0, got: " + minimumDm);

      if (maxDmsPerTrial <= 0)
        throw new IllegalArgumentException("maxDmsPerTrial must be > 0, got: " + maxDmsPerTrial);

      if (fineChannelsPerCoarseChannel <= 0)
        throw new IllegalArgumentException("fineChannelsPerCoarseChannel must be > 0, got: " + fineChannelsPerCoarseChannel);

      if (timeResolutionMs <= 0)
        throw new IllegalArgumentException("timeResolutionMs must be > 0, got: " + timeResolutionMs);

      if (observationDurationSeconds <= 0)
        throw new IllegalArgumentException("observationDurationSeconds must be > 0, got: " + observationDurationSeconds);

      if (searchFailurePolicy == null)
        throw new IllegalArgumentException("searchFailurePolicy is required");

      if (stallTimeout == null || stallTimeout.isZero() || stallTimeout.isNegative())
        throw new IllegalArgumentException("stallTimeout must be > 0, got: " + stallTimeout);

      if (monitorInterval == null || monitorInterval.isZero() || monitorInterval.isNegative())
        throw new IllegalArgumentException("monitorInterval must be > 0, got: " + monitorInterval);

      if (foldPolicy == null)
        throw new IllegalArgumentException("foldPolicy is required");
    }
  }
}
