package com.linter.results.cache;

import com.linter.results.core.model.ToolVersion;
import com.linter.results.logging.LogContext;
import com.linter.results.metrics.CacheMetrics;
import com.linter.results.metrics.NoOpCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Loads and saves the {@link LinterCache} of one lint run at the configured location.
 * An unreadable or stale cache file is replaced by a fresh cache, so a run never
 * fails because of its cache.
 */
public class LinterCacheRepository {
    private static final Logger log = LoggerFactory.getLogger(LinterCacheRepository.class);

    private final CacheConfig config;
    private final ToolVersion currentVersion;
    private final Long configurationHash;
    private final CacheMetrics metrics;
    private final Clock clock;
    private final String runId = LogContext.generateRunId();

    public LinterCacheRepository(CacheConfig config, ToolVersion currentVersion, Long configurationHash) {
        this(config, currentVersion, configurationHash, NoOpCacheMetrics.INSTANCE, Clock.systemUTC());
    }

    public LinterCacheRepository(CacheConfig config, ToolVersion currentVersion, Long configurationHash,
                                 CacheMetrics metrics, Clock clock) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.currentVersion = Objects.requireNonNull(currentVersion, "currentVersion is required");
        this.configurationHash = configurationHash;
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    /**
     * Returns the persisted cache, or a fresh one if caching is disabled or the
     * persisted cache is missing, unreadable or invalid for this run.
     */
    public LinterCache load() {
        LinterCache.Builder builder = LinterCache.builder()
                .currentVersion(currentVersion)
                .configurationHash(configurationHash)
                .clock(clock)
                .metrics(metrics);
        if (!config.enabled()) {
            return builder.build();
        }

        Path path = config.path();
        try (LogContext ctx = LogContext.forCacheLoad(runId, path.toString())) {
            if (!Files.exists(path)) {
                log.debug("cache.missing path={}", path);
                return builder.build();
            }
            try {
                LinterCache cache = builder.load(path);
                log.info("cache.loaded path={} files={}", path, cache.cachedFiles().size());
                return cache;
            } catch (LinterCacheException e) {
                metrics.recordInvalidation(e.getReason().name());
                log.info("cache.invalid path={} reason={} detail={}", path, e.getReason(), e.getMessage());
                return builder.build();
            } catch (IOException e) {
                metrics.recordInvalidation("UNREADABLE");
                log.warn("cache.unreadable path={} error={}", path, e.getMessage());
                return builder.build();
            }
        }
    }

    /**
     * Persists {@code cache} at the configured location. Does nothing when caching is disabled.
     *
     * @throws IOException if the cache file cannot be written
     */
    public void save(LinterCache cache) throws IOException {
        Objects.requireNonNull(cache, "cache is required");
        if (!config.enabled()) {
            return;
        }
        Path path = config.path();
        try (LogContext ctx = LogContext.forCacheSave(runId, path.toString())) {
            cache.save(path);
            log.info("cache.saved path={} version={}", path, cache.getVersion());
        }
    }

    /**
     * Deletes the persisted cache file.
     *
     * @return true if a file was deleted
     * @throws IOException if the file exists but cannot be deleted
     */
    public boolean invalidate() throws IOException {
        boolean deleted = Files.deleteIfExists(config.path());
        if (deleted) {
            log.info("cache.deleted path={}", config.path());
        }
        return deleted;
    }
}
