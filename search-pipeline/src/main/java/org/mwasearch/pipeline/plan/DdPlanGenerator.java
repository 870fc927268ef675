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

import org.mwasearch.pipeline.PipelineConfig;
import org.mwasearch.pipeline.model.DmTrial;
import org.mwasearch.pipeline.model.Target;
import org.mwasearch.pipeline.model.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Produces the ordered dedispersion trials of one target.
 * <p>
 * The DM range depends on the kind of target:
 * </p>
 * <ul>
 *   <li><strong>Blind</strong> targets search the configured blind range.</li>
 *   <li>Every other target searches a narrow window around its catalogued DM. Catalogues are
 *       consulted in {@link CatalogCategory} order and the first match wins.</li>
 * </ul>
 * <p>
 * The range is then handed to the {@link DedispersionPlanner}. Segments holding more DMs than
 * {@link PipelineConfig#maxDmsPerTrial()} are split into consecutive trials so that each search
 * task stays within the limits of the dedispersion tool. The output order is stable: the same
 * target and configuration always yield the same trials in the same order.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are stateless once built and can plan targets concurrently, provided the
 * {@link CatalogLookup} is thread-safe.
 * </p>
 */
public final class DdPlanGenerator {

  private static final Logger logger = LoggerFactory.getLogger(DdPlanGenerator.class);

  private final PipelineConfig config;
  private final ObservationGeometry geometry;
  private final CatalogLookup catalog;
  private final DedispersionPlanner planner;

  public DdPlanGenerator(PipelineConfig config, ObservationGeometry geometry, CatalogLookup catalog) {
    this(config, geometry, catalog, new LowFrequencyDedispersionPlanner());
  }

  public DdPlanGenerator(PipelineConfig config, ObservationGeometry geometry, CatalogLookup catalog, DedispersionPlanner planner) {
    this.config = requireNonNull(config, "config must not be null");
    this.geometry = requireNonNull(geometry, "geometry must not be null");
    this.catalog = requireNonNull(catalog, "catalog must not be null");
    this.planner = requireNonNull(planner, "planner must not be null");
  }

  /**
   * Plans the dedispersion trials of a target.
   *
   * @param target the target to plan; must not be {@code null}
   * @return the trials in search order; may be empty
   * @throws CatalogLookupException  if the target needs a catalogue DM and none is known
   * @throws InvalidDmRangeException if the catalogue window holds no DM above the minimum
   */
  public List<DmTrial> plan(Target target) {
    var range = dmRange(target);
    var segments = planner.plan(range, geometry);
    var trials = splitOversizedSegments(segments);

    logger.info("Planned {} DM trials for target {} over DM range [{}, {}]",
      trials.size(), target.name(), range.low(), range.high());
    return trials;
  }

  /**
   * Computes the DM range searched for a target.
   *
   * @param target the target; must not be {@code null}
   * @return the configured blind range for blind targets, the catalogue window otherwise
   * @throws CatalogLookupException  if the target needs a catalogue DM and none is known
   * @throws InvalidDmRangeException if the catalogue window holds no DM above the minimum
   */
  public DmRange dmRange(Target target) {
    requireNonNull(target, "target must not be null");

    if (target.type() == TargetType.BLIND) {
      return new DmRange(config.blindDmMin(), config.blindDmMax());
    }

    var sourceName = target.sourceName();
    for (var category : CatalogCategory.values()) {
      var dm = catalog.lookup(sourceName, category);
      if (dm.isPresent()) {
        logger.debug("Found DM {} for {} in {} catalogue", dm.getAsDouble(), sourceName, category);
        return catalogWindow(sourceName, dm.getAsDouble());
      }
    }
    throw new CatalogLookupException(sourceName);
  }

  private DmRange catalogWindow(String sourceName, double catalogDm) {
    double halfWidth = config.catalogDmHalfWidth();
    double floor = config.minimumDm();
    if (!Double.isFinite(catalogDm) || catalogDm + halfWidth <= floor) {
      throw new InvalidDmRangeException(sourceName, catalogDm, halfWidth, floor);
    }
    return DmRange.around(catalogDm, halfWidth, floor);
  }

  private List<DmTrial> splitOversizedSegments(List<DmTrial> segments) {
    int maxDms = config.maxDmsPerTrial();
    var trials = new ArrayList<DmTrial>(segments.size());

    for (var segment : segments) {
      if (segment.numDms() <= maxDms) {
        trials.add(segment);
        continue;
      }
      int remaining = segment.numDms();
      double low = segment.lowDm();
      while (remaining > 0) {
        int count = Math.min(maxDms, remaining);
        double high = Math.min(low + count * segment.dmStep(), segment.highDm());
        trials.add(new DmTrial(low, high, segment.dmStep(), count, segment.timeResolutionMs(), segment.downsampleFactor()));
        remaining -= count;
        low = high;
      }
    }
    return trials;
  }
}
