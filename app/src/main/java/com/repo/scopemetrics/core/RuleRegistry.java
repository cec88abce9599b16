package com.repo.scopemetrics.core;

import com.repo.scopemetrics.config.MetricsConfig;
import com.repo.scopemetrics.report.ViolationSink;
import com.repo.scopemetrics.rules.ComplexityRule;
import com.repo.scopemetrics.rules.MaxStatementsRule;
import com.repo.scopemetrics.rules.MetricRule;

import java.util.*;

/**
 * Registry of metric rules by id.
 * Instantiates the enabled rules for each document.
 */
public class RuleRegistry {

    private final Map<String, RuleFactory> factories;

    public RuleRegistry(Map<String, RuleFactory> factories) {
        this.factories = new LinkedHashMap<>(factories);
    }

    /**
     * Registry with the built-in complexity and max-statements rules.
     */
    public static RuleRegistry defaults() {
        Map<String, RuleFactory> builtIn = new LinkedHashMap<>();
        builtIn.put(ComplexityRule.ID, (config, sink) -> config.complexity()
                .map(options -> new ComplexityRule(options, sink)));
        builtIn.put(MaxStatementsRule.ID, (config, sink) -> config.maxStatements()
                .map(options -> new MaxStatementsRule(options, sink)));
        return new RuleRegistry(builtIn);
    }

    /**
     * Create the rules enabled in {@code config}, all reporting to {@code sink}.
     */
    public List<MetricRule> createRules(MetricsConfig config, ViolationSink sink) {
        List<MetricRule> rules = new ArrayList<>();
        for (RuleFactory factory : factories.values()) {
            factory.create(config, sink).ifPresent(rules::add);
        }
        return rules;
    }

    public Set<String> getRuleIds() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public boolean hasRule(String ruleId) {
        return factories.containsKey(ruleId);
    }

    /**
     * Print summary of enabled rules.
     */
    public void printSummary(MetricsConfig config) {
        System.out.println("Enabled rules:");
        config.complexity().ifPresent(o -> System.out.printf("  [%s] max %d, variant %s%n",
                ComplexityRule.ID, o.max(), o.variant().name().toLowerCase(Locale.ROOT)));
        config.maxStatements().ifPresent(o -> System.out.printf("  [%s] max %d%s%n",
                MaxStatementsRule.ID, o.max(), o.ignoreTopLevelFunctions() ? ", ignoring top-level functions" : ""));
    }
}
