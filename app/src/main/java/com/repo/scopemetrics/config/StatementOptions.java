package com.repo.scopemetrics.config;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options of the {@code max-statements} rule.
 *
 * @param max                     statements allowed per function
 * @param ignoreTopLevelFunctions defer top-level functions and exempt a lone one
 */
public record StatementOptions(int max, boolean ignoreTopLevelFunctions) {

    public static final int DEFAULT_MAX = 10;

    private static final Set<String> THRESHOLD_KEYS = Set.of("maximum", "max");
    private static final Set<String> FLAG_KEYS = Set.of("ignoreTopLevelFunctions");
    private static final Set<String> COMBINED_KEYS = Set.of("maximum", "max", "ignoreTopLevelFunctions");

    public static StatementOptions defaults() {
        return new StatementOptions(DEFAULT_MAX, false);
    }

    /**
     * Parse the rule option. Accepted shapes:
     * <ul>
     * <li>an integer threshold</li>
     * <li>a map with {@code maximum}/{@code max} and {@code ignoreTopLevelFunctions}</li>
     * <li>a list {@code [threshold, {ignoreTopLevelFunctions: bool}]}, the threshold
     * being an integer or a {@code maximum}/{@code max} map</li>
     * </ul>
     */
    public static StatementOptions parse(Object option) {
        if (option instanceof List) {
            List<?> list = (List<?>) option;
            if (list.isEmpty() || list.size() > 2) {
                throw new ConfigurationException("max-statements expects one or two options, got: " + list.size());
            }
            Object threshold = list.get(0);
            if (threshold instanceof Map) {
                Thresholds.rejectUnknownKeys((Map<?, ?>) threshold, THRESHOLD_KEYS, "max-statements");
            }
            boolean ignore = list.size() == 2 && parseFlags(list.get(1));
            return new StatementOptions(Thresholds.parse(threshold, DEFAULT_MAX, "max-statements"), ignore);
        }
        if (option instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) option;
            Thresholds.rejectUnknownKeys(map, COMBINED_KEYS, "max-statements");
            return new StatementOptions(Thresholds.parse(map, DEFAULT_MAX, "max-statements"), ignoreFlag(map));
        }
        return new StatementOptions(Thresholds.parse(option, DEFAULT_MAX, "max-statements"), false);
    }

    private static boolean parseFlags(Object flags) {
        if (flags == null) {
            return false;
        }
        if (!(flags instanceof Map)) {
            throw new ConfigurationException("max-statements second option must be an object, got: " + flags);
        }
        Map<?, ?> map = (Map<?, ?>) flags;
        Thresholds.rejectUnknownKeys(map, FLAG_KEYS, "max-statements");
        return ignoreFlag(map);
    }

    private static boolean ignoreFlag(Map<?, ?> map) {
        Object value = map.get("ignoreTopLevelFunctions");
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean)) {
            throw new ConfigurationException("max-statements.ignoreTopLevelFunctions must be a boolean, got: " + value);
        }
        return (Boolean) value;
    }
}
