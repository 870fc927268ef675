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
package org.mwasearch.pipeline.plan;

import org.mwasearch.pipeline.model.ChannelGroup;

/**
 * Instrument parameters the dedispersion plan depends on.
 *
 * @param centreFrequencyMhz centre frequency of the band
 * @param bandwidthMhz       total bandwidth
 * @param fineChannelCount   number of fine frequency channels across the band
 * @param timeResolutionMs   native sample time
 */
public record ObservationGeometry(
  double centreFrequencyMhz,
  double bandwidthMhz,
  int fineChannelCount,
  double timeResolutionMs
) {

  public ObservationGeometry {
    if (centreFrequencyMhz <= 0) {
      throw new IllegalArgumentException("centreFrequencyMhz must be > 0, got: " + centreFrequencyMhz);
    }
    if (bandwidthMhz <= 0) {
      throw new IllegalArgumentException("bandwidthMhz must be > 0, got: " + bandwidthMhz);
    }
    if (fineChannelCount <= 0) {
      throw new IllegalArgumentException("fineChannelCount must be > 0, got: " + fineChannelCount);
    }
    if (timeResolutionMs <= 0) {
      throw new IllegalArgumentException("timeResolutionMs must be > 0, got: " + timeResolutionMs);
    }
  }

  /**
   * Derives the geometry of an observation from its coarse channel layout.
   *
   * @param channelGroup         coarse channels of the observation
   * @param fineChannelsPerCoarse fine channels in one coarse channel
   * @param timeResolutionMs     native sample time
   * @return the observation geometry
   */
  public static ObservationGeometry of(ChannelGroup channelGroup, int fineChannelsPerCoarse, double timeResolutionMs) {
    return new ObservationGeometry(
      channelGroup.midpointFrequency(),
      channelGroup.bandwidth(),
      channelGroup.channelCount() * fineChannelsPerCoarse,
      timeResolutionMs
    );
  }

  public double fineChannelWidthMhz() {
    return bandwidthMhz / fineChannelCount;
  }
}
