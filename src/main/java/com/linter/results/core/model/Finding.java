package com.linter.results.core.model;

import java.util.Objects;

/**
 * Immutable diagnostic produced by a lint rule for one file.
 *
 * @param ruleIdentifier the stable rule identifier, e.g. {@code line_length}
 * @param ruleName       the human-readable rule name
 * @param severity       the reported severity
 * @param location       where the finding applies
 * @param reason         the message shown to the user
 */
public record Finding(
        String ruleIdentifier,
        String ruleName,
        Severity severity,
        Location location,
        String reason
) {
    public Finding {
        Objects.requireNonNull(ruleIdentifier, "ruleIdentifier is required");
        Objects.requireNonNull(ruleName, "ruleName is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(reason, "reason is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String ruleIdentifier;
        private String ruleName;
        private Severity severity = Severity.WARNING;
        private Location location;
        private String reason;

        public Builder ruleIdentifier(String ruleIdentifier) {
            this.ruleIdentifier = ruleIdentifier;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Finding build() {
            return new Finding(ruleIdentifier, ruleName, severity, location, reason);
        }
    }
}
