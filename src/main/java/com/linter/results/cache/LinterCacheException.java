package com.linter.results.cache;

import java.util.Objects;

/**
 * Runtime exception thrown when a persisted cache cannot be used for the current run.
 * Callers should discard the cache and start from a fresh {@link LinterCache}.
 */
public class LinterCacheException extends RuntimeException {

    /**
     * Why a loaded cache was rejected. Checked in declaration order.
     */
    public enum Reason {
        /** The document's top level is not a JSON object. */
        INVALID_FORMAT,
        /** The cache was written by another tool version. */
        DIFFERENT_VERSION,
        /** The cache was written under another configuration. */
        DIFFERENT_CONFIGURATION,
        /** The recorded last run lies in the future. */
        INCONSISTENT_LAST_RUN_DATE
    }

    private final Reason reason;

    public LinterCacheException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason is required");
    }

    public Reason getReason() {
        return reason;
    }
}
