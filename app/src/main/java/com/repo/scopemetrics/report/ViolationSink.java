package com.repo.scopemetrics.report;

/**
 * Receives violations as rules emit them.
 */
@FunctionalInterface
public interface ViolationSink {
    void report(Violation violation);
}
