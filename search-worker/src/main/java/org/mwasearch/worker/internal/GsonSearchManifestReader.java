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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.mwasearch.pipeline.SearchPipelineException;
import org.mwasearch.pipeline.model.ChannelGroup;
import org.mwasearch.pipeline.model.Target;
import org.mwasearch.worker.SearchManifest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Reads a {@link SearchManifest} from JSON.
 * <pre>{@code
 * {
 *   "channels": [109, 110, 111],
 *   "targets": [
 *     {"name": "J0437-4715", "rawData": ["raw/1255444104_ch109.fits", "raw/1255444104_ch110.fits"]},
 *     {"name": "Blind_0410_0001", "rawData": ["/data/blind/0001.fits"]}
 *   ]
 * }
 * }</pre>
 * <p>
 * {@code channels} holds MWA coarse channel numbers. Relative raw-data paths are resolved
 * against the directory of the manifest file.
 * </p>
 */
public final class GsonSearchManifestReader {

  /**
   * Reads a manifest file.
   *
   * @param file the manifest
   * @return the manifest
   * @throws SearchPipelineException  if the file cannot be read
   * @throws IllegalArgumentException if the JSON is malformed or misses a required field
   */
  public SearchManifest read(Path file) {
    requireNonNull(file, "file must not be null");
    try {
      var baseDirectory = file.toAbsolutePath().getParent();
      return parse(Files.readString(file, StandardCharsets.UTF_8), baseDirectory);
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot read search manifest " + file, e);
    }
  }

  SearchManifest parse(String json, Path baseDirectory) {
    try {
      var root = JsonParser.parseString(json).getAsJsonObject();
      var channels = requiredArray(root, "channels");
      var coarseChannels = new ArrayList<Integer>();
      channels.forEach(channel -> coarseChannels.add(channel.getAsInt()));
      if (coarseChannels.isEmpty()) {
        throw new IllegalArgumentException("Search manifest must list at least one channel");
      }

      var targets = new ArrayList<Target>();
      for (JsonElement element : requiredArray(root, "targets")) {
        targets.add(target(element.getAsJsonObject(), baseDirectory));
      }
      return new SearchManifest(ChannelGroup.fromCoarseChannels(coarseChannels), targets);

    } catch (JsonParseException e) {
      throw new IllegalArgumentException("Invalid JSON format for search manifest", e);
    } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw new IllegalArgumentException("Malformed JSON structure in search manifest", e);
    }
  }

  private static Target target(JsonObject json, Path baseDirectory) {
    if (!json.has("name") || !json.get("name").isJsonPrimitive()) {
      throw new IllegalArgumentException("Target must have a 'name' string, got: " + json);
    }
    var name = json.get("name").getAsString();
    List<Path> rawData = new ArrayList<>();
    for (JsonElement path : requiredArray(json, "rawData")) {
      rawData.add(baseDirectory.resolve(path.getAsString()));
    }
    return new Target(name, rawData);
  }

  private static JsonArray requiredArray(JsonObject json, String field) {
    if (!json.has(field) || !json.get(field).isJsonArray()) {
      throw new IllegalArgumentException("Search manifest must contain '" + field + "' array");
    }
    return json.getAsJsonArray(field);
  }
}
