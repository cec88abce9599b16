package com.repo.scopemetrics.report;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints violations in a compiler-like {@code file:line:column} layout.
 */
public class ConsoleReporter {

    private final PrintStream out;

    public ConsoleReporter() {
        this(System.out);
    }

    public ConsoleReporter(PrintStream out) {
        this.out = out;
    }

    public void print(DocumentReport report) {
        for (Violation v : report.violations()) {
            out.printf("%s:%s  %s  (%s)%n", report.document(), v.position(), v.message(), v.ruleId());
        }
    }

    public void printSummary(List<DocumentReport> reports) {
        long total = reports.stream().mapToLong(r -> r.violations().size()).sum();
        long dirty = reports.stream().filter(r -> !r.isClean()).count();
        out.printf("%n%d violation(s) in %d of %d document(s)%n", total, dirty, reports.size());
    }
}
