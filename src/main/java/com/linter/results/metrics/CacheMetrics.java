package com.linter.results.metrics;

import java.time.Duration;

/**
 * Interface for recording result cache metrics.
 * The default {@link NoOpCacheMetrics} does nothing, so the cache works
 * without a metrics registry.
 */
public interface CacheMetrics {

    void recordCacheHit();

    void recordCacheMiss();

    void recordFindingsCached(int count);

    void recordInvalidation(String reason);

    void recordSave(Duration duration);
}
