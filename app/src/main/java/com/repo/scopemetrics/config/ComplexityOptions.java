package com.repo.scopemetrics.config;

import java.util.Map;
import java.util.Set;

/**
 * Options of the {@code complexity} rule.
 *
 * @param max     reporting threshold; 0 reports every unit
 * @param variant counting variant, accepted but not yet used by the counter
 */
public record ComplexityOptions(int max, Variant variant) {

    public static final int DEFAULT_MAX = 20;

    private static final Set<String> KEYS = Set.of("maximum", "max", "variant");

    public enum Variant {
        CLASSIC,
        MODIFIED;

        static Variant parse(Object value) {
            if ("classic".equals(value)) {
                return CLASSIC;
            }
            if ("modified".equals(value)) {
                return MODIFIED;
            }
            throw new ConfigurationException("complexity.variant must be \"classic\" or \"modified\", got: " + value);
        }
    }

    public static ComplexityOptions defaults() {
        return new ComplexityOptions(DEFAULT_MAX, Variant.CLASSIC);
    }

    public static ComplexityOptions of(int max) {
        return new ComplexityOptions(max, Variant.CLASSIC);
    }

    /**
     * Parse the rule option: an integer, or a map with {@code maximum}/{@code max} and {@code variant}.
     */
    public static ComplexityOptions parse(Object option) {
        Variant variant = Variant.CLASSIC;
        if (option instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) option;
            Thresholds.rejectUnknownKeys(map, KEYS, "complexity");
            if (map.containsKey("variant")) {
                variant = Variant.parse(map.get("variant"));
            }
        }
        return new ComplexityOptions(Thresholds.parse(option, DEFAULT_MAX, "complexity"), variant);
    }
}
