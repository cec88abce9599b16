package com.repo.scopemetrics.core;

import com.repo.scopemetrics.ast.Program;
import com.repo.scopemetrics.config.MetricsConfig;
import com.repo.scopemetrics.report.DocumentReport;
import com.repo.scopemetrics.report.ViolationCollector;
import com.repo.scopemetrics.rules.MetricRule;
import com.repo.scopemetrics.traverse.TreeWalker;

import java.util.List;

/**
 * Runs every enabled rule over one document. Rules are created anew for each
 * call, so analysing the same tree twice gives the same result.
 */
public class DocumentAnalyzer {

    private final MetricsConfig config;
    private final RuleRegistry registry;

    public DocumentAnalyzer(MetricsConfig config) {
        this(config, RuleRegistry.defaults());
    }

    public DocumentAnalyzer(MetricsConfig config, RuleRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    public DocumentReport analyze(Program program, String documentName) {
        ViolationCollector collector = new ViolationCollector();
        List<MetricRule> rules = registry.createRules(config, collector);
        new TreeWalker(rules).walk(program);
        return new DocumentReport(documentName, collector.violations());
    }
}
