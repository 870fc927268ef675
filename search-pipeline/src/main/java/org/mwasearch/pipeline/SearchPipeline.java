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

import org.mwasearch.pipeline.aggregate.ResultAggregator;
import org.mwasearch.pipeline.aggregate.StalledBundleListener;
import org.mwasearch.pipeline.aggregate.StalledBundleMonitor;
import org.mwasearch.pipeline.correlate.CandidateCorrelator;
import org.mwasearch.pipeline.correlate.TargetIndex;
import org.mwasearch.pipeline.execution.FoldExecutor;
import org.mwasearch.pipeline.execution.SearchExecutor;
import org.mwasearch.pipeline.execution.Sifter;
import org.mwasearch.pipeline.expand.TrialExpander;
import org.mwasearch.pipeline.fold.FoldPlanner;
import org.mwasearch.pipeline.internal.concurrent.Futures;
import org.mwasearch.pipeline.internal.concurrent.Schedulers;
import org.mwasearch.pipeline.model.ChannelGroup;
import org.mwasearch.pipeline.model.FoldJob;
import org.mwasearch.pipeline.model.ResultBundle;
import org.mwasearch.pipeline.model.SearchTask;
import org.mwasearch.pipeline.model.SiftOutput;
import org.mwasearch.pipeline.model.Target;
import org.mwasearch.pipeline.model.TrialResult;
import org.mwasearch.pipeline.plan.CatalogLookup;
import org.mwasearch.pipeline.plan.DdPlanGenerator;
import org.mwasearch.pipeline.plan.DedispersionPlanner;
import org.mwasearch.pipeline.plan.LowFrequencyDedispersionPlanner;
import org.mwasearch.pipeline.plan.ObservationGeometry;
import org.mwasearch.pipeline.plan.SubbandCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.CompletableFuture.completedFuture;

/**
 * Drives a search run from a list of targets to fold jobs.
 * <p>
 * A run has two phases. First every target is planned and expanded, and registered with a fresh
 * {@link ResultAggregator} with its trial count. Then every search task is submitted at once;
 * each task chains into the aggregator, and the result that completes a target's bundle triggers
 * the sift, correlate and fold steps of that target.
 * </p>
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>A target whose catalogue DM is unknown is reported in {@link RunReport#failedTargets()}
 *       and skipped; the other targets still run.</li>
 *   <li>A failed search task is counted. Under {@link SearchFailurePolicy#IGNORE} its target's
 *       bundle stays incomplete and is reported by the {@link StalledBundleMonitor} and in
 *       {@link RunReport#incompleteBundles()}. Under {@link SearchFailurePolicy#ABORT} the run
 *       completes exceptionally with a {@link SearchPipelineException}; tasks already submitted
 *       are not cancelled.</li>
 *   <li>Sift and fold failures are logged and counted, never fatal.</li>
 * </ul>
 *
 * <h2>Logging</h2>
 * <p>
 * Per-target work runs with the target name in the {@value #MDC_TARGET} MDC entry.
 * </p>
 */
public final class SearchPipeline {

  public static final String MDC_TARGET = "target";

  private static final Logger logger = LoggerFactory.getLogger(SearchPipeline.class);

  private final PipelineConfig config;
  private final ChannelGroup channelGroup;
  private final DdPlanGenerator planGenerator;
  private final TrialExpander expander;
  private final CandidateCorrelator correlator;
  private final FoldPlanner foldPlanner;
  private final SearchExecutor searchExecutor;
  private final Sifter sifter;
  private final FoldExecutor foldExecutor;
  private final StalledBundleListener stalledBundleListener;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;

  private SearchPipeline(Builder builder) {
    this.config = requireNonNull(builder.config, "config must not be null");
    this.channelGroup = requireNonNull(builder.channelGroup, "channelGroup must not be null");
    this.searchExecutor = requireNonNull(builder.searchExecutor, "searchExecutor must not be null");
    this.sifter = requireNonNull(builder.sifter, "sifter must not be null");
    this.foldExecutor = requireNonNull(builder.foldExecutor, "foldExecutor must not be null");
    this.stalledBundleListener = builder.stalledBundleListener;
    this.scheduler = builder.scheduler;
    this.clock = builder.clock;

    var geometry = ObservationGeometry.of(channelGroup, config.fineChannelsPerCoarseChannel(), config.timeResolutionMs());
    this.planGenerator = new DdPlanGenerator(config, geometry, requireNonNull(builder.catalog, "catalog must not be null"), builder.planner);
    this.expander = new TrialExpander(new SubbandCalculator(geometry), config.totalSamples());
    this.correlator = new CandidateCorrelator();
    this.foldPlanner = new FoldPlanner(config.foldPolicy());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs the search of a list of targets.
   *
   * @param targets the targets of the run; names must be unique
   * @return a stage completed with the run report once every submitted job has finished
   * @throws IllegalArgumentException if two targets share a name
   */
  public CompletionStage<RunReport> run(List<Target> targets) {
    requireNonNull(targets, "targets must not be null");
    var run = new Run(TargetIndex.of(targets));

    var tasks = new ArrayList<SearchTask>();
    for (var target : targets) {
      tasks.addAll(run.prepare(target));
    }
    logger.info("Submitting {} search tasks for {} targets", tasks.size(), targets.size());

    run.monitor.start();
    var chains = tasks.stream().map(run::submit).toList();

    return Futures.allOf(chains)
                  .toCompletableFuture()
                  .applyToEither(run.aborted, Function.identity())
                  .thenApply(ignored -> run.report())
                  .whenComplete((report, error) -> run.monitor.close());
  }

  /**
   * State of one run.
   */
  private final class Run {
    private final TargetIndex index;
    private final ResultAggregator aggregator = new ResultAggregator(clock);
    private final StalledBundleMonitor monitor;
    private final RunStatistics statistics = new RunStatistics();
    private final Map<String, String> failedTargets = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> siftedTargets = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<FoldJob> foldJobs = new ConcurrentLinkedQueue<>();
    private final CompletableFuture<List<Void>> aborted = new CompletableFuture<>();

    private Run(TargetIndex index) {
      this.index = index;
      this.monitor = new StalledBundleMonitor(aggregator, config.stallTimeout(), config.monitorInterval(),
        stalledBundleListener, scheduler, clock);
    }

    private List<SearchTask> prepare(Target target) {
      MDC.put(MDC_TARGET, target.name());
      try {
        var trials = planGenerator.plan(target);
        var tasks = expander.expand(target, trials, channelGroup);
        if (tasks.isEmpty()) {
          logger.warn("Target {} has no DM trial to search", target.name());
          return List.of();
        }
        aggregator.expect(target.name(), tasks.size());
        statistics.expected(Stage.SEARCH, tasks.size());
        return tasks;
      } catch (SearchPipelineException e) {
        logger.error("Skipping target {}: {}", target.name(), e.getMessage());
        failedTargets.put(target.name(), e.getMessage());
        return List.of();
      } finally {
        MDC.remove(MDC_TARGET);
      }
    }

    private CompletionStage<Void> submit(SearchTask task) {
      return invoke(() -> searchExecutor.search(task))
        .handle((result, error) -> onSearchDone(task, result, error))
        .thenCompose(result -> result.flatMap(aggregator::accept)
                                     .map(this::siftAndFold)
                                     .orElseGet(() -> completedFuture(null)));
    }

    private Optional<TrialResult> onSearchDone(SearchTask task, TrialResult result, Throwable error) {
      if (error == null) {
        statistics.completed(Stage.SEARCH);
        return Optional.of(result);
      }
      var cause = Futures.unwrap(error);
      statistics.failed(Stage.SEARCH);
      if (config.searchFailurePolicy() == SearchFailurePolicy.ABORT) {
        logger.error("Search task {} failed, aborting run", task.key(), cause);
        aborted.completeExceptionally(new SearchPipelineException("Search task " + task.key() + " failed", cause));
      } else {
        logger.warn("Search task {} failed, its bundle will stay incomplete", task.key(), cause);
      }
      return Optional.empty();
    }

    private CompletionStage<Void> siftAndFold(ResultBundle bundle) {
      var targetName = bundle.targetName();
      statistics.expected(Stage.SIFT, 1);
      return invoke(() -> sifter.sift(bundle))
        .thenApply(output -> {
          var jobs = planFolds(output);
          statistics.completed(Stage.SIFT);
          siftedTargets.add(targetName);
          return jobs;
        })
        .thenCompose(jobs -> Futures.allOf(jobs.stream().map(this::fold).toList()))
        .handle((ignored, error) -> {
          if (error != null) {
            var cause = Futures.unwrap(error);
            statistics.failed(Stage.SIFT);
            failedTargets.put(targetName, "sift failed: " + cause.getMessage());
            logger.error("Sifting of target {} failed", targetName, cause);
          }
          return null;
        });
    }

    private List<FoldJob> planFolds(SiftOutput output) {
      MDC.put(MDC_TARGET, output.targetName());
      try {
        List<String> lines;
        try {
          lines = Files.readAllLines(output.candidateFile());
        } catch (IOException e) {
          throw new SearchPipelineException("Cannot read sifted candidates " + output.candidateFile(), e);
        }
        var jobs = foldPlanner.planAll(correlator.correlate(index, lines));
        statistics.expected(Stage.FOLD, jobs.size());
        foldJobs.addAll(jobs);
        logger.info("Planned {} fold jobs from the candidates of target {}", jobs.size(), output.targetName());
        return jobs;
      } finally {
        MDC.remove(MDC_TARGET);
      }
    }

    private CompletionStage<Void> fold(FoldJob job) {
      return invoke(() -> foldExecutor.fold(job))
        .handle((ignored, error) -> {
          if (error == null) {
            statistics.completed(Stage.FOLD);
          } else {
            statistics.failed(Stage.FOLD);
            logger.error("Fold of candidate {} failed", job.candidate().name(), Futures.unwrap(error));
          }
          return null;
        });
    }

    private RunReport report() {
      var report = new RunReport(statistics.snapshot(), List.copyOf(siftedTargets), new LinkedHashMap<>(failedTargets),
        aggregator.pending(), List.copyOf(foldJobs));
      report.statistics().forEach((stage, summary) ->
        logger.info("{}: {} expected, {} completed, {} failed", stage, summary.expected(), summary.completed(), summary.errors()));
      report.incompleteBundles().forEach(bundle ->
        logger.warn("Target {} never completed: {} of {} trial results received",
          bundle.targetName(), bundle.received(), bundle.expected()));
      return report;
    }
  }

  /**
   * Calls an executor, turning a synchronous throw into a failed stage.
   */
  private static <T> CompletionStage<T> invoke(Supplier<CompletionStage<T>> call) {
    try {
      return requireNonNull(call.get(), "executor returned a null stage");
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Builder of {@link SearchPipeline}.
   */
  public static final class Builder {
    private PipelineConfig config = PipelineConfig.builder().build();
    private ChannelGroup channelGroup;
    private CatalogLookup catalog;
    private DedispersionPlanner planner = new LowFrequencyDedispersionPlanner();
    private SearchExecutor searchExecutor;
    private Sifter sifter;
    private FoldExecutor foldExecutor;
    private StalledBundleListener stalledBundleListener = bundle -> {
    };
    private ScheduledExecutorService scheduler = Schedulers.shared();
    private Clock clock = Clock.systemUTC();

    private Builder() {
    }

    public Builder config(PipelineConfig config) {
      this.config = config;
      return this;
    }

    public Builder channelGroup(ChannelGroup channelGroup) {
      this.channelGroup = channelGroup;
      return this;
    }

    public Builder catalog(CatalogLookup catalog) {
      this.catalog = catalog;
      return this;
    }

    public Builder dedispersionPlanner(DedispersionPlanner planner) {
      this.planner = requireNonNull(planner, "planner must not be null");
      return this;
    }

    public Builder searchExecutor(SearchExecutor searchExecutor) {
      this.searchExecutor = searchExecutor;
      return this;
    }

    public Builder sifter(Sifter sifter) {
      this.sifter = sifter;
      return this;
    }

    public Builder foldExecutor(FoldExecutor foldExecutor) {
      this.foldExecutor = foldExecutor;
      return this;
    }

    /**
     * Sets the listener told about stalled bundles. The monitor logs every stall regardless.
     */
    public Builder stalledBundleListener(StalledBundleListener listener) {
      this.stalledBundleListener = requireNonNull(listener, "listener must not be null");
      return this;
    }

    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = requireNonNull(scheduler, "scheduler must not be null");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = requireNonNull(clock, "clock must not be null");
      return this;
    }

    public SearchPipeline build() {
      return new SearchPipeline(this);
    }
  }
}
