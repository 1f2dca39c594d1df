package com.story.analysis.metrics;

import com.story.analysis.consistency.IssueType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code story.analysis.duration}: Timer (tag: operation)</li>
 *   <li>{@code story.analysis.paths}: DistributionSummary</li>
 *   <li>{@code story.analysis.state.nodes}: DistributionSummary</li>
 *   <li>{@code story.analysis.issues}: Counter (tag: type)</li>
 *   <li>{@code story.analysis.path.evaluations}: Counter (tag: consistent)</li>
 *   <li>{@code story.analysis.cache.hit}: Counter</li>
 *   <li>{@code story.analysis.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary pathCountSummary;
    private final DistributionSummary stateNodeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pathCountSummary = DistributionSummary.builder("story.analysis.paths")
                .description("Number of paths enumerated or selected per analysis")
                .register(registry);
        this.stateNodeSummary = DistributionSummary.builder("story.analysis.state.nodes")
                .description("Number of merged state nodes per exploration")
                .register(registry);
        this.cacheHitCounter = Counter.builder("story.analysis.cache.hit")
                .description("Number of analysis cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("story.analysis.cache.miss")
                .description("Number of analysis cache misses")
                .register(registry);
    }

    @Override
    public void recordAnalysisDuration(String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(operation, k ->
                Timer.builder("story.analysis.duration")
                        .description("Duration of scenario analysis operations")
                        .tag("operation", operation)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordPathCount(int count) {
        pathCountSummary.record(count);
    }

    @Override
    public void recordStateNodeCount(int count) {
        stateNodeSummary.record(count);
    }

    @Override
    public void incrementIssue(IssueType type) {
        String key = "issue:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("story.analysis.issues")
                        .description("Number of consistency issues found")
                        .tag("type", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementPathEvaluation(boolean consistent) {
        String key = "evaluation:" + consistent;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("story.analysis.path.evaluations")
                        .description("Number of path evaluations by verdict")
                        .tag("consistent", String.valueOf(consistent))
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
