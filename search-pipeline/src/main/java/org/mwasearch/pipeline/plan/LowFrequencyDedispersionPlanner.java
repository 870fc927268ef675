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

import org.mwasearch.pipeline.model.DmTrial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.lang.Math.pow;
import static java.lang.Math.sqrt;
import static java.util.Objects.requireNonNull;

/**
 * Dedispersion planner for low-frequency telescopes, in the spirit of PRESTO's {@code DDplan.py}.
 * <p>
 * The DM step is chosen so that DM errors at most double the effective width of a pulsar with the
 * shortest period of interest. Each iteration covers the DMs up to the "diagonal" DM, where
 * dispersion smearing inside one fine channel equals twice the current time resolution; the time
 * resolution is then doubled (downsampling) for the next segment.
 * </p>
 *
 * <h2>Model constants</h2>
 * <ul>
 *   <li>minimum period of interest: 20 ms</li>
 *   <li>relative minimum S/N: 0.5</li>
 *   <li>assumed duty cycle: 10 %</li>
 * </ul>
 */
public final class LowFrequencyDedispersionPlanner implements DedispersionPlanner {

  private static final Logger logger = LoggerFactory.getLogger(LowFrequencyDedispersionPlanner.class);

  /**
   * Dispersion constant in ms·MHz³ per (pc/cm³)·MHz.
   */
  static final double DISPERSION_CONSTANT = 8.3e6;
  static final double MIN_PERIOD_MS = 20.0;
  static final double RELATIVE_MIN_SN = 0.5;
  static final double DUTY_CYCLE = 0.1;
  static final double SMALLEST_DM_STEP = 0.01;
  private static final double STEP_TOLERANCE = 1e-9;

  @Override
  public List<DmTrial> plan(DmRange range, ObservationGeometry geometry) {
    requireNonNull(range, "range must not be null");
    requireNonNull(geometry, "geometry must not be null");

    var trials = new ArrayList<DmTrial>();
    double centreCubed = pow(geometry.centreFrequencyMhz(), 3);
    double previousDm = range.low();
    double timeResolution = geometry.timeResolutionMs();
    double lastStep = SMALLEST_DM_STEP;
    int downsample = 1;
    double diagonalDm = 0;

    while (diagonalDm < range.high()) {
      diagonalDm = 2 * timeResolution * centreCubed / (DISPERSION_CONSTANT * geometry.fineChannelWidthMhz());

      double dmStep = dmStep(timeResolution, geometry.bandwidthMhz(), centreCubed);
      if (Double.isNaN(dmStep)) {
        // time resolution is now coarser than the pulse width model allows
        dmStep = lastStep;
      }
      lastStep = dmStep;

      if (diagonalDm >= range.high()) {
        trials.add(new DmTrial(previousDm, range.high(), dmStep, stepCount(previousDm, range.high(), dmStep), timeResolution, downsample));
      } else if (diagonalDm > previousDm) {
        trials.add(new DmTrial(previousDm, diagonalDm, dmStep, stepCount(previousDm, diagonalDm, dmStep), timeResolution, downsample));
        previousDm = diagonalDm;
      }

      timeResolution *= 2;
      downsample *= 2;
    }

    logger.debug("Planned {} dedispersion segments over [{}, {}] ({} DMs)",
      trials.size(), range.low(), range.high(), trials.stream().mapToInt(DmTrial::numDms).sum());
    return trials;
  }

  static double dmStep(double timeResolutionMs, double bandwidthMhz, double centreCubed) {
    double intrinsicWidth = sqrt(pow(MIN_PERIOD_MS * DUTY_CYCLE, 2) + pow(timeResolutionMs, 2));
    double widthRatio = intrinsicWidth / MIN_PERIOD_MS;
    double effectiveWidth = MIN_PERIOD_MS / (pow(RELATIVE_MIN_SN, 2) * ((1 - widthRatio) / widthRatio) + 1);

    double step = sqrt(pow(effectiveWidth, 2) - pow(intrinsicWidth, 2)) / (DISPERSION_CONSTANT * bandwidthMhz / centreCubed);
    if (Double.isNaN(step)) return step;

    double rounded = Math.round(step * 100) / 100.0;
    return rounded == 0.0 ? SMALLEST_DM_STEP : rounded;
  }

  /**
   * Number of DMs needed to cover {@code [low, high)}; a segment narrower than one step still
   * searches one DM.
   */
  static int stepCount(double low, double high, double dmStep) {
    return Math.max(1, (int) Math.ceil((high - low) / dmStep - STEP_TOLERANCE));
  }
}
