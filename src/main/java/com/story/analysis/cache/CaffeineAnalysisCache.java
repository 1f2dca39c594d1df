package com.story.analysis.cache;

import com.story.analysis.api.ScenarioAnalysisResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed analysis cache. A configuration with {@code enabled=false} stores nothing.
 */
public class CaffeineAnalysisCache implements AnalysisCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineAnalysisCache.class);

    private final Cache<String, ScenarioAnalysisResult> cache;
    private final boolean enabled;

    public CaffeineAnalysisCache(CacheConfig config) {
        this.enabled = config.enabled();
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineAnalysisCache initialized: maxSize={}, ttl={}s, enabled={}",
                config.maxSize(), config.ttlSeconds(), enabled);
    }

    @Override
    public Optional<ScenarioAnalysisResult> get(String scenarioId) {
        return Optional.ofNullable(cache.getIfPresent(scenarioId));
    }

    @Override
    public void put(String scenarioId, ScenarioAnalysisResult result) {
        if (!enabled) {
            return;
        }
        cache.put(scenarioId, result);
    }

    @Override
    public void invalidate(String scenarioId) {
        cache.invalidate(scenarioId);
        log.debug("Invalidated cached analysis for scenario {}", scenarioId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
