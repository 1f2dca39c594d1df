package com.story.analysis.metrics;

import com.story.analysis.consistency.IssueType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAnalysisDuration(String operation, Duration duration) {
    }

    @Override
    public void recordPathCount(int count) {
    }

    @Override
    public void recordStateNodeCount(int count) {
    }

    @Override
    public void incrementIssue(IssueType type) {
    }

    @Override
    public void incrementPathEvaluation(boolean consistent) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
