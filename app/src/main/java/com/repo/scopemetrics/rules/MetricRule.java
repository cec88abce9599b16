package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.traverse.RuleListener;

/**
 * A metric rule. Instances hold per-document state and are created fresh for every document.
 */
public interface MetricRule extends RuleListener {

    /**
     * Rule identifier used in configuration and reports.
     */
    String id();
}
