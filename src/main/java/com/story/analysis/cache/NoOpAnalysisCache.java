package com.story.analysis.cache;

import com.story.analysis.api.ScenarioAnalysisResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpAnalysisCache implements AnalysisCache {

    @Override
    public Optional<ScenarioAnalysisResult> get(String scenarioId) {
        return Optional.empty();
    }

    @Override
    public void put(String scenarioId, ScenarioAnalysisResult result) {
    }

    @Override
    public void invalidate(String scenarioId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
