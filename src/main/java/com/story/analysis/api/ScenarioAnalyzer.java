package com.story.analysis.api;

import com.story.analysis.cache.AnalysisCache;
import com.story.analysis.cache.CacheConfig;
import com.story.analysis.cache.NoOpAnalysisCache;
import com.story.analysis.consistency.ConsistencyIssue;
import com.story.analysis.consistency.DominatorPathSelector;
import com.story.analysis.consistency.EntityContinuityChecker;
import com.story.analysis.consistency.EntityState;
import com.story.analysis.consistency.NoOpPathConsistencyEvaluator;
import com.story.analysis.consistency.PathConsistencyEvaluator;
import com.story.analysis.consistency.PathEvaluationRequest;
import com.story.analysis.consistency.PathEvaluationResult;
import com.story.analysis.consistency.ScenarioConsistencyReport;
import com.story.analysis.consistency.ScenarioStateSpace;
import com.story.analysis.consistency.SelectedPath;
import com.story.analysis.dataflow.DataFlowAnalysis;
import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.Edge;
import com.story.analysis.graph.PathAlgorithms;
import com.story.analysis.logging.LogContext;
import com.story.analysis.metrics.MetricsService;
import com.story.analysis.metrics.NoOpMetricsService;
import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.ScenarioGraphBuilder;
import com.story.analysis.statespace.FrontierMergedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Main entry point for scenario analysis.
 *
 * <p>An analysis finds the start and ending scenes, computes must-introduced entity sets,
 * checks entity continuity, explores the frontier-merged state space and selects a bounded
 * set of representative paths. Selected paths can then be sent to a
 * {@link PathConsistencyEvaluator} for a narrative verdict.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ScenarioAnalyzer analyzer = ScenarioAnalyzer.builder()
 *     .options(AnalysisOptions.conservative())
 *     .evaluator(myEvaluator)
 *     .build();
 *
 * ScenarioAnalysisResult result = analyzer.analyze(scenario);
 * result.issues().forEach(System.out::println);
 *
 * ScenarioConsistencyReport report = analyzer.evaluateSelectedPaths(scenario).join();
 * </pre>
 *
 * <p>Analysis results are cached by scenario id. Invalidate the cache entry when a scenario
 * changes under the same id.</p>
 */
public class ScenarioAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(ScenarioAnalyzer.class);

    private final AnalysisOptions options;
    private final MetricsService metricsService;
    private final AnalysisCache cache;
    private final PathConsistencyEvaluator evaluator;
    private final ScenarioGraphBuilder graphBuilder;
    private final EntityContinuityChecker continuityChecker;
    private final ScenarioStateSpace stateSpace;
    private final DominatorPathSelector pathSelector;

    private ScenarioAnalyzer(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.cache = builder.cache != null
                ? builder.cache : new NoOpAnalysisCache();
        this.evaluator = builder.evaluator != null
                ? builder.evaluator : new NoOpPathConsistencyEvaluator();

        this.graphBuilder = new ScenarioGraphBuilder();
        this.continuityChecker = new EntityContinuityChecker(graphBuilder);
        this.stateSpace = new ScenarioStateSpace(graphBuilder);
        this.pathSelector = new DominatorPathSelector(graphBuilder);

        log.info("ScenarioAnalyzer initialized: options={}, evaluator={}",
                options, evaluator.getProviderName());
    }

    // ========== Analysis API ==========

    /**
     * Runs the full structural analysis of a scenario.
     */
    public ScenarioAnalysisResult analyze(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario is required");
        try (LogContext ctx = LogContext.forAnalysis(scenario.id(), "analyze")) {
            Optional<ScenarioAnalysisResult> cached = cache.get(scenario.id());
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                log.debug("analysis.cache.hit scenarioId={}", scenario.id());
                return cached.get();
            }
            metricsService.recordCacheMiss();

            long startNanos = System.nanoTime();
            ScenarioAnalysisResult result = doAnalyze(scenario);
            metricsService.recordAnalysisDuration("analyze", Duration.ofNanos(System.nanoTime() - startNanos));

            cache.put(scenario.id(), result);
            log.info("analysis.completed scenarioId={} start={} endings={} issues={} stateNodes={} paths={}",
                    scenario.id(), result.startSceneId(), result.endingSceneIds().size(),
                    result.issues().size(), result.stateNodeCount(), result.selectedPaths().size());
            return result;
        }
    }

    /**
     * Enumerates up to {@link AnalysisOptions#getMaxPaths()} simple paths from the start scene to endings.
     */
    public List<List<String>> enumeratePaths(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario is required");
        try (LogContext ctx = LogContext.forAnalysis(scenario.id(), "enumeratePaths")) {
            long startNanos = System.nanoTime();
            List<List<String>> paths = graphBuilder.enumerateAllPaths(scenario, options.getMaxPaths());
            metricsService.recordAnalysisDuration("enumeratePaths", Duration.ofNanos(System.nanoTime() - startNanos));
            metricsService.recordPathCount(paths.size());
            return paths;
        }
    }

    /**
     * Computes the must-introduced entity set of every scene from the start scene.
     * Empty for a scenario without scenes.
     */
    public Map<String, Set<String>> mustIntroducedSets(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario is required");
        try (LogContext ctx = LogContext.forAnalysis(scenario.id(), "mustIntroduced")) {
            long startNanos = System.nanoTime();
            Map<String, Set<String>> result = graphBuilder.findStartScene(scenario)
                    .map(start -> DataFlowAnalysis.computeMustIntroducedSets(
                            graphBuilder.toDataFlowNodes(scenario), start))
                    .orElse(Map.of());
            metricsService.recordAnalysisDuration("mustIntroduced", Duration.ofNanos(System.nanoTime() - startNanos));
            return result;
        }
    }

    /**
     * Sends every selected path of the scenario to the evaluator and aggregates the verdicts.
     * The returned future never completes exceptionally: an evaluator failure yields an
     * inconsistent report with score 0. When the evaluator is not available no path is sent
     * and the report is {@link ScenarioConsistencyReport#skipped skipped}.
     */
    public CompletableFuture<ScenarioConsistencyReport> evaluateSelectedPaths(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario is required");
        if (!evaluator.isAvailable()) {
            log.warn("evaluation.skipped scenarioId={} evaluator={} reason=unavailable",
                    scenario.id(), evaluator.getProviderName());
            return CompletableFuture.completedFuture(ScenarioConsistencyReport.skipped(scenario.id()));
        }

        ScenarioAnalysisResult analysis = analyze(scenario);
        String correlationId = LogContext.generateCorrelationId();

        List<CompletableFuture<PathEvaluationResult>> futures = new ArrayList<>();
        try (LogContext ctx = LogContext.forEvaluation(scenario.id(), correlationId)) {
            log.info("evaluation.started scenarioId={} paths={} evaluator={}",
                    scenario.id(), analysis.selectedPaths().size(), evaluator.getProviderName());
            for (SelectedPath path : analysis.selectedPaths()) {
                futures.add(evaluator.evaluateAsync(PathEvaluationRequest.of(scenario, path)));
            }
        } catch (RuntimeException e) {
            log.error("evaluation.failed scenarioId={} correlationId={} error={}",
                    scenario.id(), correlationId, e.getMessage(), e);
            return CompletableFuture.completedFuture(ScenarioConsistencyReport.failed(scenario.id()));
        }

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<PathEvaluationResult> results = new ArrayList<>(futures.size());
                    for (CompletableFuture<PathEvaluationResult> future : futures) {
                        PathEvaluationResult result = future.join();
                        metricsService.incrementPathEvaluation(result.consistent());
                        results.add(result);
                    }
                    ScenarioConsistencyReport report = ScenarioConsistencyReport.aggregate(scenario.id(), results);
                    log.info("evaluation.completed scenarioId={} correlationId={} consistent={} score={}",
                            scenario.id(), correlationId, report.consistent(), report.overallScore());
                    return report;
                })
                .exceptionally(e -> {
                    log.error("evaluation.failed scenarioId={} correlationId={} error={}",
                            scenario.id(), correlationId, e.getMessage(), e);
                    return ScenarioConsistencyReport.failed(scenario.id());
                });
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public AnalysisCache getCache() {
        return cache;
    }

    public PathConsistencyEvaluator getEvaluator() {
        return evaluator;
    }

    private ScenarioAnalysisResult doAnalyze(Scenario scenario) {
        Optional<String> startScene = graphBuilder.findStartScene(scenario);
        if (startScene.isEmpty()) {
            log.warn("analysis.empty scenarioId={}", scenario.id());
            return ScenarioAnalysisResult.empty(scenario.id());
        }
        String start = startScene.get();

        List<String> endings = graphBuilder.findEndingScenes(scenario);
        Map<String, Set<String>> must = DataFlowAnalysis.computeMustIntroducedSets(
                graphBuilder.toDataFlowNodes(scenario), start);

        List<ConsistencyIssue> issues = options.isContinuityCheckEnabled()
                ? continuityChecker.check(scenario, start, must)
                : List.of();
        for (ConsistencyIssue issue : issues) {
            metricsService.incrementIssue(issue.type());
        }

        int stateNodes = 0;
        int stateEdges = 0;
        List<SelectedPath> selected;
        if (options.isStateSpaceEnabled()) {
            FrontierMergedGraph<String, EntityState, EntityState.Signature, SceneTransition> stateGraph =
                    stateSpace.explore(scenario, options.getMaxDepth()).orElseThrow();
            stateNodes = stateGraph.nodeCount();
            stateEdges = stateGraph.edgeCount();
            metricsService.recordStateNodeCount(stateNodes);
            selected = pathSelector.selectPaths(stateGraph, options.getMaxPaths());
        } else {
            selected = scenePaths(scenario);
        }
        metricsService.recordPathCount(selected.size());

        return new ScenarioAnalysisResult(scenario.id(), start, endings, must, issues,
                stateNodes, stateEdges, selected);
    }

    private List<SelectedPath> scenePaths(Scenario scenario) {
        DirectedGraph<String, SceneTransition> graph = graphBuilder.build(scenario);
        List<SelectedPath> selected = new ArrayList<>();
        for (List<String> path : graphBuilder.enumerateAllPaths(scenario, options.getMaxPaths())) {
            List<SceneTransition> transitions = new ArrayList<>(path.size());
            for (Edge<String, SceneTransition> edge : PathAlgorithms.toEdgePath(graph, path)) {
                transitions.add(edge.label());
            }
            selected.add(new SelectedPath(path, transitions));
        }
        return selected;
    }

    // ========== Builder ==========

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link ScenarioAnalyzer}. Every component is optional.
     */
    public static class Builder {
        private AnalysisOptions options = AnalysisOptions.defaults();
        private MetricsService metricsService;
        private AnalysisCache cache;
        private PathConsistencyEvaluator evaluator;

        public Builder options(AnalysisOptions options) {
            this.options = Objects.requireNonNull(options, "options must not be null");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder cache(AnalysisCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Uses the cache described by {@code config}. A disabled configuration caches nothing.
         */
        public Builder cacheConfig(CacheConfig config) {
            this.cache = AnalysisCache.create(Objects.requireNonNull(config, "config must not be null"));
            return this;
        }

        public Builder evaluator(PathConsistencyEvaluator evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public ScenarioAnalyzer build() {
            return new ScenarioAnalyzer(this);
        }
    }
}
