package com.story.analysis.cache;

import com.story.analysis.api.ScenarioAnalysisResult;

import java.util.Optional;

/**
 * Cache of scenario analysis results, keyed by scenario id.
 * Callers invalidate an entry when the scenario it was computed from changes.
 */
public interface AnalysisCache {

    /**
     * Gets a cached analysis.
     *
     * @param scenarioId the scenario id
     * @return the cached result, or empty if not cached
     */
    Optional<ScenarioAnalysisResult> get(String scenarioId);

    /**
     * Caches an analysis result under its scenario id.
     */
    void put(String scenarioId, ScenarioAnalysisResult result);

    /**
     * Invalidates the entry for the given scenario.
     */
    void invalidate(String scenarioId);

    void invalidateAll();

    CacheStats getStats();

    /**
     * Creates the cache described by {@code config}: a Caffeine cache when enabled,
     * otherwise a cache that stores nothing.
     */
    static AnalysisCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineAnalysisCache(config) : new NoOpAnalysisCache();
    }
}
