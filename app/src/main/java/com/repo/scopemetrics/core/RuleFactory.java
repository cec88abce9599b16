package com.repo.scopemetrics.core;

import com.repo.scopemetrics.config.MetricsConfig;
import com.repo.scopemetrics.report.ViolationSink;
import com.repo.scopemetrics.rules.MetricRule;

import java.util.Optional;

/**
 * Creates a fresh rule instance for one document, or nothing when the rule is switched off.
 */
@FunctionalInterface
public interface RuleFactory {
    Optional<MetricRule> create(MetricsConfig config, ViolationSink sink);
}
