package com.story.analysis.cache;

import com.story.analysis.api.ScenarioAnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisCache Tests")
class AnalysisCacheTest {

    @Nested
    @DisplayName("CaffeineAnalysisCache")
    class Caffeine {

        private CaffeineAnalysisCache cache;

        @BeforeEach
        void setUp() {
            cache = new CaffeineAnalysisCache(CacheConfig.defaults());
        }

        @Test
        @DisplayName("Should return cached result after put")
        void putAndGet() {
            ScenarioAnalysisResult result = ScenarioAnalysisResult.empty("s1");
            cache.put("s1", result);

            assertEquals(Optional.of(result), cache.get("s1"));
            assertEquals(Optional.empty(), cache.get("s2"));
        }

        @Test
        @DisplayName("Should track hits and misses")
        void stats() {
            cache.put("s1", ScenarioAnalysisResult.empty("s1"));
            cache.get("s1");
            cache.get("s1");
            cache.get("other");

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
        }

        @Test
        @DisplayName("Should invalidate one scenario or everything")
        void invalidate() {
            cache.put("s1", ScenarioAnalysisResult.empty("s1"));
            cache.put("s2", ScenarioAnalysisResult.empty("s2"));

            cache.invalidate("s1");
            assertTrue(cache.get("s1").isEmpty());
            assertTrue(cache.get("s2").isPresent());

            cache.invalidateAll();
            assertTrue(cache.get("s2").isEmpty());
        }
    }

    @Nested
    @DisplayName("Disabled configuration")
    class Disabled {

        @Test
        @DisplayName("Caffeine cache built from a disabled configuration stores nothing")
        void caffeineDisabled() {
            CaffeineAnalysisCache cache = new CaffeineAnalysisCache(CacheConfig.disabled());
            cache.put("s1", ScenarioAnalysisResult.empty("s1"));

            assertFalse(cache.isEnabled());
            assertTrue(cache.get("s1").isEmpty());
            assertEquals(0, cache.getStats().size());
        }

        @Test
        @DisplayName("Factory picks the implementation from the enabled flag")
        void factory() {
            assertInstanceOf(NoOpAnalysisCache.class, AnalysisCache.create(CacheConfig.disabled()));
            assertInstanceOf(CaffeineAnalysisCache.class, AnalysisCache.create(CacheConfig.defaults()));
        }
    }

    @Nested
    @DisplayName("NoOpAnalysisCache")
    class NoOp {

        @Test
        @DisplayName("Should never return anything")
        void neverCaches() {
            NoOpAnalysisCache cache = new NoOpAnalysisCache();
            cache.put("s1", ScenarioAnalysisResult.empty("s1"));

            assertTrue(cache.get("s1").isEmpty());
            assertEquals(CacheStats.empty(), cache.getStats());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class Config {

        @Test
        @DisplayName("Should validate size and ttl")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }

        @Test
        @DisplayName("Should provide defaults and a disabled configuration")
        void presets() {
            CacheConfig defaults = CacheConfig.defaults();
            assertEquals(1_000, defaults.maxSize());
            assertEquals(600, defaults.ttlSeconds());
            assertTrue(defaults.enabled());
            assertFalse(CacheConfig.disabled().enabled());
        }

        @Test
        @DisplayName("Empty stats have a zero hit rate")
        void emptyStats() {
            assertEquals(0.0, CacheStats.empty().hitRate());
        }
    }
}
