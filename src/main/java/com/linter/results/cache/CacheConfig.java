package com.linter.results.cache;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Configuration for the on-disk result cache.
 *
 * @param path    the cache file
 * @param enabled whether caching is enabled
 */
public record CacheConfig(Path path, boolean enabled) {

    /** System property overriding the default cache file location. */
    public static final String PATH_PROPERTY = "linter.cache.path";

    public CacheConfig {
        Objects.requireNonNull(path, "path is required");
        if (path.getFileName() == null) {
            throw new IllegalArgumentException("path must name a file");
        }
    }

    /**
     * Default configuration: {@code ~/.cache/linter/cache.json}, enabled.
     * The location can be overridden with the {@code linter.cache.path} system property.
     */
    public static CacheConfig defaults() {
        String override = System.getProperty(PATH_PROPERTY);
        if (override != null && !override.isBlank()) {
            return new CacheConfig(Paths.get(override), true);
        }
        return new CacheConfig(
                Paths.get(System.getProperty("user.home"), ".cache", "linter", "cache.json"), true);
    }

    /**
     * Configuration with caching turned off.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(defaults().path(), false);
    }

    public static CacheConfig at(Path path) {
        return new CacheConfig(path, true);
    }
}
