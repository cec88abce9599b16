package com.repo.scopemetrics.core;

import com.repo.scopemetrics.config.MetricsConfig;
import com.repo.scopemetrics.report.ViolationCollector;
import com.repo.scopemetrics.rules.ComplexityRule;
import com.repo.scopemetrics.rules.MaxStatementsRule;
import com.repo.scopemetrics.rules.MetricRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    @Test
    void testBuiltInRules() {
        RuleRegistry registry = RuleRegistry.defaults();

        assertTrue(registry.hasRule(ComplexityRule.ID));
        assertTrue(registry.hasRule(MaxStatementsRule.ID));

        List<MetricRule> rules = registry.createRules(MetricsConfig.defaults(), new ViolationCollector());
        assertEquals(List.of(ComplexityRule.ID, MaxStatementsRule.ID), rules.stream().map(MetricRule::id).toList());
    }

    @Test
    void testEachCallCreatesFreshInstances() {
        RuleRegistry registry = RuleRegistry.defaults();
        ViolationCollector sink = new ViolationCollector();

        MetricRule first = registry.createRules(MetricsConfig.defaults(), sink).get(0);
        MetricRule second = registry.createRules(MetricsConfig.defaults(), sink).get(0);

        assertNotSame(first, second);
    }

    @Test
    void testSwitchedOffRulesAreSkipped() {
        MetricsConfig config = MetricsConfig.fromMap(Map.of("rules", Map.of("max-statements", false)));

        List<MetricRule> rules = RuleRegistry.defaults().createRules(config, new ViolationCollector());

        assertEquals(1, rules.size());
        assertEquals(ComplexityRule.ID, rules.get(0).id());
    }

    @Test
    void testCustomFactories() {
        RuleRegistry registry = new RuleRegistry(Map.of("none", (config, sink) -> Optional.empty()));
        assertTrue(registry.createRules(MetricsConfig.defaults(), new ViolationCollector()).isEmpty());
        assertEquals(1, registry.getRuleIds().size());
    }
}
