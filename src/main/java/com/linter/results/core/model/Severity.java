package com.linter.results.core.model;

import java.util.Optional;

/**
 * Severity of a finding as reported by a lint rule.
 */
public enum Severity {
    WARNING("warning"),
    ERROR("error");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    /**
     * Returns the lowercase value written to cache files.
     */
    public String value() {
        return value;
    }

    /**
     * Parses a persisted severity value.
     *
     * @param value the raw value, may be null
     * @return the matching severity, or empty if the value is unknown
     */
    public static Optional<Severity> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Severity severity : values()) {
            if (severity.value.equals(value)) {
                return Optional.of(severity);
            }
        }
        return Optional.empty();
    }
}
