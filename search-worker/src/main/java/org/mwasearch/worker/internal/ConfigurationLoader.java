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

import org.mwasearch.pipeline.SearchPipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Loads the launcher configuration.
 * <p>
 * Settings are layered, later layers overriding earlier ones:
 * </p>
 * <ol>
 *   <li>the bundled {@value #BUNDLED_CONFIG} defaults,</li>
 *   <li>the properties file named by {@value #ENV_CONFIG_FILE}, when set,</li>
 *   <li>one environment variable per key, named {@code MWA_SEARCH_} followed by the key in upper
 *       case with dots and dashes turned into underscores
 *       ({@code dm.blind.max} is overridden by {@code MWA_SEARCH_DM_BLIND_MAX}).</li>
 * </ol>
 * <p>
 * Only keys known to the bundled defaults or the configuration file can be overridden from the
 * environment.
 * </p>
 */
public final class ConfigurationLoader {
  private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);

  public static final String ENV_CONFIG_FILE = "MWA_SEARCH_CONFIG";
  public static final String ENV_PREFIX = "MWA_SEARCH_";
  static final String BUNDLED_CONFIG = "search-pipeline.properties";

  private ConfigurationLoader() {
  }

  public static Properties load() {
    var properties = new Properties();
    try (InputStream bundled = ConfigurationLoader.class.getClassLoader().getResourceAsStream(BUNDLED_CONFIG)) {
      if (bundled == null) {
        throw new SearchPipelineException("Bundled configuration " + BUNDLED_CONFIG + " is missing from the classpath");
      }
      properties.load(bundled);
    } catch (IOException e) {
      throw new SearchPipelineException("Cannot read bundled configuration " + BUNDLED_CONFIG, e);
    }

    var configFile = System.getenv(ENV_CONFIG_FILE);
    if (configFile != null && !configFile.isBlank()) {
      var path = Path.of(configFile.trim());
      try (InputStream in = Files.newInputStream(path)) {
        properties.load(in);
        logger.info("Loaded configuration from {}", path);
      } catch (IOException e) {
        throw new SearchPipelineException("Cannot read configuration file " + path + " named by " + ENV_CONFIG_FILE, e);
      }
    }

    for (var key : properties.stringPropertyNames()) {
      var value = System.getenv(environmentVariable(key));
      if (value != null && !value.isBlank()) {
        logger.debug("Overriding {} from environment variable {}", key, environmentVariable(key));
        properties.setProperty(key, value.trim());
      }
    }
    return properties;
  }

  static String environmentVariable(String key) {
    return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }
}
