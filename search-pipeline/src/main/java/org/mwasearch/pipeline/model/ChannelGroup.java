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

import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Frequency layout of the observation, shared read-only by every target of a run.
 *
 * @param centreFrequenciesMhz centre frequency of each coarse channel, in MHz
 * @param channelWidthMhz      width of one coarse channel, in MHz
 */
public record ChannelGroup(List<Double> centreFrequenciesMhz, double channelWidthMhz) {

  /**
   * Width of an MWA coarse channel.
   */
  public static final double MWA_COARSE_CHANNEL_WIDTH_MHZ = 1.28;

  public ChannelGroup {
    requireNonNull(centreFrequenciesMhz, "centreFrequenciesMhz must not be null");
    if (centreFrequenciesMhz.isEmpty()) {
      throw new IllegalArgumentException("centreFrequenciesMhz must not be empty");
    }
    if (channelWidthMhz <= 0) {
      throw new IllegalArgumentException("channelWidthMhz must be > 0, got: " + channelWidthMhz);
    }
    centreFrequenciesMhz = List.copyOf(centreFrequenciesMhz);
  }

  /**
   * Builds a channel group from MWA coarse channel numbers (channel n is centred on n × 1.28 MHz).
   *
   * @param channelNumbers coarse channel numbers
   * @return the matching channel group
   */
  public static ChannelGroup fromCoarseChannels(List<Integer> channelNumbers) {
    return new ChannelGroup(
      channelNumbers.stream().map(n -> n * MWA_COARSE_CHANNEL_WIDTH_MHZ).toList(),
      MWA_COARSE_CHANNEL_WIDTH_MHZ
    );
  }

  public int channelCount() {
    return centreFrequenciesMhz.size();
  }

  /**
   * Returns the frequency halfway between the lowest and the highest channel centre.
   *
   * @return the midpoint frequency in MHz
   */
  public double midpointFrequency() {
    double min = Collections.min(centreFrequenciesMhz);
    double max = Collections.max(centreFrequenciesMhz);
    return min + (max - min) / 2;
  }

  /**
   * Returns the total bandwidth covered by the channels.
   *
   * @return the bandwidth in MHz
   */
  public double bandwidth() {
    return channelCount() * channelWidthMhz;
  }
}
