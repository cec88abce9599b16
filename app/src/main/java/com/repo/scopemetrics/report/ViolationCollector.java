package com.repo.scopemetrics.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ViolationCollector implements ViolationSink {

    private final List<Violation> violations = new ArrayList<>();

    @Override
    public void report(Violation violation) {
        violations.add(violation);
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }
}
