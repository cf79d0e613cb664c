package com.linter.results.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link CacheMetrics}.
 */
public class NoOpCacheMetrics implements CacheMetrics {

    public static final NoOpCacheMetrics INSTANCE = new NoOpCacheMetrics();

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordFindingsCached(int count) {
    }

    @Override
    public void recordInvalidation(String reason) {
    }

    @Override
    public void recordSave(Duration duration) {
    }
}
