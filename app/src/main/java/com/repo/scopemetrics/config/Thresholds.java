package com.repo.scopemetrics.config;

import java.util.Map;
import java.util.Set;

/**
 * Shared parsing of the {@code integer | {maximum|max: integer}} threshold shape.
 */
final class Thresholds {

    private Thresholds() {
    }

    static int parse(Object option, int defaultValue, String rule) {
        if (option == null) {
            return defaultValue;
        }
        if (option instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) option;
            if (!map.containsKey("maximum") && !map.containsKey("max")) {
                return defaultValue;
            }
            int maximum = map.containsKey("maximum") ? nonNegative(map.get("maximum"), rule + ".maximum") : 0;
            // "maximum" wins unless it is 0, then "max" is consulted
            if (maximum != 0 || !map.containsKey("max")) {
                return maximum;
            }
            return nonNegative(map.get("max"), rule + ".max");
        }
        return nonNegative(option, rule);
    }

    static int nonNegative(Object value, String path) {
        if (!(value instanceof Integer) && !(value instanceof Long)) {
            throw new ConfigurationException(path + " must be an integer, got: " + value);
        }
        long number = ((Number) value).longValue();
        if (number < 0 || number > Integer.MAX_VALUE) {
            throw new ConfigurationException(path + " must be between 0 and " + Integer.MAX_VALUE + ", got: " + number);
        }
        return (int) number;
    }

    static void rejectUnknownKeys(Map<?, ?> map, Set<String> allowed, String rule) {
        for (Object key : map.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                throw new ConfigurationException(rule + " does not accept option '" + key + "'; allowed: " + allowed);
            }
        }
    }
}
