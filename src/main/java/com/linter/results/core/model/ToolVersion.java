package com.linter.results.core.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Version of the lint tool that produced a cache.
 * Caches written by a different version are never reused.
 *
 * @param value the version string, compared exactly
 */
public record ToolVersion(String value) {

    static final String RESOURCE = "/linter-cache.properties";
    static final String PROPERTY = "tool.version";

    public ToolVersion {
        Objects.requireNonNull(value, "value is required");
        if (value.isBlank()) {
            throw new IllegalArgumentException("value must not be blank");
        }
    }

    public static ToolVersion of(String value) {
        return new ToolVersion(value);
    }

    /**
     * Returns the version this library was built as, read from {@code linter-cache.properties}.
     *
     * @throws IllegalStateException if the resource is missing or has no version
     */
    public static ToolVersion current() {
        return Holder.CURRENT;
    }

    private static ToolVersion loadCurrent() {
        try (InputStream in = ToolVersion.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            Properties props = new Properties();
            props.load(in);
            String value = props.getProperty(PROPERTY);
            if (value == null || value.isBlank()) {
                throw new IllegalStateException("No " + PROPERTY + " in " + RESOURCE);
            }
            return new ToolVersion(value.trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    @Override
    public String toString() {
        return value;
    }

    private static final class Holder {
        static final ToolVersion CURRENT = loadCurrent();
    }
}
