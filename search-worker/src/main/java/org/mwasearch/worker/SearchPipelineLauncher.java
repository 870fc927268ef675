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
package org.mwasearch.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.mwasearch.pipeline.PipelineConfig;
import org.mwasearch.pipeline.RunReport;
import org.mwasearch.pipeline.SearchPipeline;
import org.mwasearch.pipeline.internal.concurrent.Futures;
import org.mwasearch.worker.internal.CommandLineFoldExecutor;
import org.mwasearch.worker.internal.CommandLineSearchExecutor;
import org.mwasearch.worker.internal.CommandLineSifter;
import org.mwasearch.worker.internal.ConfigurationLoader;
import org.mwasearch.worker.internal.GsonCatalogLookup;
import org.mwasearch.worker.internal.GsonSearchManifestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Command-line entry point running a search on the local machine.
 * <pre>
 * java -jar search-worker.jar &lt;manifest.json&gt; &lt;catalogue.json&gt;
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * Pipeline settings come from {@link ConfigurationLoader}. Two more keys drive the launcher:
 * </p>
 * <dl>
 *   <dt>{@value #WORK_DIRECTORY}</dt>
 *   <dd>root directory of the per-target outputs (default {@code work})</dd>
 *   <dt>{@value #THREADS}</dt>
 *   <dd>number of external programs run at once (default: available processors)</dd>
 * </dl>
 *
 * <h2>Exit status</h2>
 * <p>
 * {@code 0} when every target was searched, sifted and folded; {@code 2} when the run finished
 * with failed targets or incomplete bundles; {@code 1} when the run itself failed;
 * {@code 64} on a usage error.
 * </p>
 */
public final class SearchPipelineLauncher {
  private static final Logger logger = LoggerFactory.getLogger(SearchPipelineLauncher.class);

  public static final String WORK_DIRECTORY = "worker.directory";
  public static final String THREADS = "worker.threads";

  static final int EXIT_COMPLETE = 0;
  static final int EXIT_FAILED = 1;
  static final int EXIT_INCOMPLETE = 2;
  static final int EXIT_USAGE = 64;

  private SearchPipelineLauncher() {
  }

  public static void main(String[] args) {
    System.exit(launch(args));
  }

  static int launch(String[] args) {
    if (args.length != 2) {
      logger.error("Usage: search-worker <manifest.json> <catalogue.json>");
      return EXIT_USAGE;
    }

    ExecutorService executor = null;
    try {
      var properties = ConfigurationLoader.load();
      var config = PipelineConfig.fromProperties(properties);
      logger.info("Starting search with {}", config);

      var manifest = new GsonSearchManifestReader().read(Path.of(args[0]));
      var catalog = GsonCatalogLookup.read(Path.of(args[1]));
      var workRoot = Path.of(properties.getProperty(WORK_DIRECTORY, "work"));
      executor = Executors.newFixedThreadPool(threads(properties),
        new ThreadFactoryBuilder().setNameFormat("search-worker-%d").build());

      var pipeline = SearchPipeline.builder()
                                   .config(config)
                                   .channelGroup(manifest.channelGroup())
                                   .catalog(catalog)
                                   .searchExecutor(new CommandLineSearchExecutor(workRoot, executor))
                                   .sifter(new CommandLineSifter(workRoot, executor))
                                   .foldExecutor(new CommandLineFoldExecutor(workRoot, executor))
                                   .stalledBundleListener(bundle -> logger.warn("Target {} is waiting for {} trial results",
                                     bundle.targetName(), bundle.missing()))
                                   .build();

      RunReport report = pipeline.run(manifest.targets()).toCompletableFuture().join();
      logger.info("Search finished: {} targets sifted, {} fold jobs", report.siftedTargets().size(), report.foldJobs().size());
      report.failedTargets().forEach((target, reason) -> logger.warn("Target {} failed: {}", target, reason));
      return report.isComplete() ? EXIT_COMPLETE : EXIT_INCOMPLETE;

    } catch (CompletionException e) {
      logger.error("Search run failed", Futures.unwrap(e));
      return EXIT_FAILED;
    } catch (RuntimeException e) {
      logger.error("Search run could not start", e);
      return EXIT_FAILED;
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }
  }

  static int threads(Properties properties) {
    var value = properties.getProperty(THREADS);
    if (value == null || value.isBlank()) {
      return Runtime.getRuntime().availableProcessors();
    }
    try {
      int threads = Integer.parseInt(value.trim());
      if (threads <= 0) {
        throw new IllegalArgumentException("Property '" + THREADS + "' must be > 0, got: " + value);
      }
      return threads;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property '" + THREADS + "' must be an integer, got: " + value, e);
    }
  }
}
