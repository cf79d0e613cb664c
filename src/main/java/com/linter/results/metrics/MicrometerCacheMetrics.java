package com.linter.results.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link CacheMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code linter.cache.hit} - Counter</li>
 *   <li>{@code linter.cache.miss} - Counter</li>
 *   <li>{@code linter.cache.findings} - DistributionSummary of findings per cached file</li>
 *   <li>{@code linter.cache.invalidated} - Counter (tag: reason)</li>
 *   <li>{@code linter.cache.save} - Timer</li>
 * </ul>
 */
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> invalidationCounters = new ConcurrentHashMap<>();
    private final Counter hitCounter;
    private final Counter missCounter;
    private final DistributionSummary findingsSummary;
    private final Timer saveTimer;

    public MicrometerCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.hitCounter = Counter.builder("linter.cache.hit")
                .description("Number of files whose findings were served from the cache")
                .register(registry);
        this.missCounter = Counter.builder("linter.cache.miss")
                .description("Number of files with no usable cached findings")
                .register(registry);
        this.findingsSummary = DistributionSummary.builder("linter.cache.findings")
                .description("Number of findings stored per cached file")
                .register(registry);
        this.saveTimer = Timer.builder("linter.cache.save")
                .description("Duration of cache serialization and write")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        hitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        missCounter.increment();
    }

    @Override
    public void recordFindingsCached(int count) {
        findingsSummary.record(count);
    }

    @Override
    public void recordInvalidation(String reason) {
        Counter counter = invalidationCounters.computeIfAbsent(reason, r ->
                Counter.builder("linter.cache.invalidated")
                        .description("Number of persisted caches discarded at load")
                        .tag("reason", r)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSave(Duration duration) {
        saveTimer.record(duration);
    }
}
