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

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

import static java.util.Objects.requireNonNull;

/**
 * {@link CatalogLookup} backed by in-memory maps, one per category.
 */
public final class MapCatalogLookup implements CatalogLookup {

  private final Map<CatalogCategory, Map<String, Double>> entries;

  public MapCatalogLookup(Map<CatalogCategory, Map<String, Double>> entries) {
    requireNonNull(entries, "entries must not be null");
    var copy = new EnumMap<CatalogCategory, Map<String, Double>>(CatalogCategory.class);
    entries.forEach((category, sources) -> copy.put(category, Map.copyOf(sources)));
    this.entries = copy;
  }

  @Override
  public OptionalDouble lookup(String sourceName, CatalogCategory category) {
    var dm = entries.getOrDefault(category, Map.of()).get(sourceName);
    return dm == null ? OptionalDouble.empty() : OptionalDouble.of(dm);
  }

  public int size(CatalogCategory category) {
    return entries.getOrDefault(category, Map.of()).size();
  }
}
