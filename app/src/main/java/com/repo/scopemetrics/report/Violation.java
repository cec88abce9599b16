package com.repo.scopemetrics.report;

import com.repo.scopemetrics.ast.Node;
import com.repo.scopemetrics.ast.SourcePosition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single threshold violation reported by a rule.
 */
public record Violation(
        /** Rule identifier, e.g. "complexity" */
        String ruleId,

        /** Message identifier within the rule, e.g. "complex" */
        String messageId,

        /** The unit's defining node */
        Node node,

        /** Where the unit starts in the source */
        SourcePosition position,

        /** Message data: name, the metric value and max */
        Map<String, Object> data,

        /** Rendered, human-readable message */
        String message) {

    /**
     * Build a violation, rendering {@code template} with {@code data}.
     */
    public static Violation of(String ruleId, String messageId, Node node, String template,
            Map<String, Object> data) {
        Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        return new Violation(ruleId, messageId, node, node.position(), copy,
                MessageTemplate.render(template, copy));
    }

    public String name() {
        return String.valueOf(data.get("name"));
    }

    /**
     * Get a numeric data entry, or {@code defaultValue} when absent.
     */
    public int intData(String key, int defaultValue) {
        Object value = data.get(key);
        if (value instanceof Number)
            return ((Number) value).intValue();
        return defaultValue;
    }
}
