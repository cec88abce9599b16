package com.repo.scopemetrics.report;

import java.util.Comparator;
import java.util.List;

/**
 * All violations found in one document, ordered by position.
 */
public record DocumentReport(String document, List<Violation> violations) {

    private static final Comparator<Violation> BY_POSITION = Comparator
            .comparingInt((Violation v) -> v.position().line())
            .thenComparingInt(v -> v.position().column());

    public DocumentReport {
        violations = violations.stream().sorted(BY_POSITION).toList();
    }

    public boolean isClean() {
        return violations.isEmpty();
    }
}
