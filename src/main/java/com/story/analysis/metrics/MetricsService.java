package com.story.analysis.metrics;

import com.story.analysis.consistency.IssueType;

import java.time.Duration;

/**
 * Interface for recording scenario analysis metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordAnalysisDuration(String operation, Duration duration);

    void recordPathCount(int count);

    void recordStateNodeCount(int count);

    void incrementIssue(IssueType type);

    void incrementPathEvaluation(boolean consistent);

    void recordCacheHit();

    void recordCacheMiss();
}
