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
package org.mwasearch.worker.internal;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.mwasearch.pipeline.SearchPipelineException;
import org.mwasearch.pipeline.plan.CatalogCategory;
import org.mwasearch.pipeline.plan.CatalogLookup;
import org.mwasearch.pipeline.plan.MapCatalogLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

import static java.util.Objects.requireNonNull;

/**
 * {@link CatalogLookup} backed by a JSON file with one object per catalogue, mapping source names
 * to DMs:
 * <pre>{@code
 * {
 *   "transient": {"FRB180916": 349.2},
 *   "pulsar": {"J0437-4715": 2.64, "J0835-4510": 67.97}
 * }
 * }</pre>
 * A missing catalogue object is treated as an empty catalogue.
 */
public final class GsonCatalogLookup implements CatalogLookup {
  private static final Logger logger = LoggerFactory.getLogger(GsonCatalogLookup.class);

  private final MapCatalogLookup delegate;

  private GsonCatalogLookup(MapCatalogLookup delegate) {
    this.delegate = delegate;
  }

  public static GsonCatalogLookup read(Path file) {
    requireNonNull(file, "file must not be null");
    try {
      return parse(Files.readString(file, StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot read catalogue " + file, e);
    }
  }

  static GsonCatalogLookup parse(String json) {
    try {
      var root = JsonParser.parseString(json).getAsJsonObject();
      var entries = new EnumMap<CatalogCategory, Map<String, Double>>(CatalogCategory.class);
      for (var category : CatalogCategory.values()) {
        var field = category.name().toLowerCase(Locale.ROOT);
        if (root.has(field)) {
          entries.put(category, sources(root.getAsJsonObject(field), field));
        }
      }
      var lookup = new MapCatalogLookup(entries);
      logger.info("Loaded {} transient and {} pulsar DMs",
        lookup.size(CatalogCategory.TRANSIENT), lookup.size(CatalogCategory.PULSAR));
      return new GsonCatalogLookup(lookup);

    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON format for catalogue", e);
    } catch (IllegalStateException | ClassCastException e) {
      throw new IllegalArgumentException("Malformed JSON structure in catalogue", e);
    }
  }

  private static Map<String, Double> sources(JsonObject json, String catalogue) {
    var sources = new HashMap<String, Double>();
    json.entrySet().forEach(entry -> {
      var value = entry.getValue();
      if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
        throw new IllegalArgumentException("DM of '" + entry.getKey() + "' in " + catalogue + " catalogue must be a number, got: " + value);
      }
      sources.put(entry.getKey(), value.getAsDouble());
    });
    return sources;
  }

  @Override
  public OptionalDouble lookup(String sourceName, CatalogCategory category) {
    return delegate.lookup(sourceName, category);
  }
}
