package com.linter.results.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linter.results.core.model.Finding;
import com.linter.results.core.model.Location;
import com.linter.results.core.model.Severity;

import java.util.Optional;

/**
 * Converts findings to and from the per-finding records stored in a cache file.
 *
 * <pre>
 * {"line": 10, "character": null, "severity": "warning",
 *  "type": "Line Length", "rule_id": "line_length", "reason": "Line should be 120 characters or less"}
 * </pre>
 */
final class FindingCodec {

    static final String LINE = "line";
    static final String CHARACTER = "character";
    static final String SEVERITY = "severity";
    static final String TYPE = "type";
    static final String RULE_ID = "rule_id";
    static final String REASON = "reason";

    private FindingCodec() {
    }

    static ObjectNode encode(Finding finding) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        Location location = finding.location();
        if (location.line() != null) {
            node.put(LINE, location.line().intValue());
        } else {
            node.putNull(LINE);
        }
        if (location.character() != null) {
            node.put(CHARACTER, location.character().intValue());
        } else {
            node.putNull(CHARACTER);
        }
        node.put(SEVERITY, finding.severity().value());
        node.put(TYPE, finding.ruleName());
        node.put(RULE_ID, finding.ruleIdentifier());
        node.put(REASON, finding.reason());
        return node;
    }

    /**
     * Rebuilds a finding for {@code file}.
     * Returns empty when severity, type, rule id or reason is missing or malformed;
     * a malformed line or character reads as absent.
     */
    static Optional<Finding> decode(JsonNode record, String file) {
        Optional<Severity> severity = Severity.fromValue(text(record, SEVERITY));
        String name = text(record, TYPE);
        String ruleId = text(record, RULE_ID);
        String reason = text(record, REASON);
        if (severity.isEmpty() || name == null || ruleId == null || reason == null) {
            return Optional.empty();
        }
        Location location = new Location(file, integer(record, LINE), integer(record, CHARACTER));
        return Optional.of(new Finding(ruleId, name, severity.get(), location, reason));
    }

    private static String text(JsonNode record, String field) {
        JsonNode value = record.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }

    private static Integer integer(JsonNode record, String field) {
        JsonNode value = record.get(field);
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            return null;
        }
        return value.intValue();
    }
}
