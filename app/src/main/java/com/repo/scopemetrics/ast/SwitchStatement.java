package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.List;

public final class SwitchStatement extends Node {

    private final Node discriminant;
    private final List<SwitchCase> cases;

    public SwitchStatement(Node discriminant, List<SwitchCase> cases) {
        super(NodeKind.SWITCH_STATEMENT);
        this.discriminant = adopt(discriminant);
        this.cases = adoptAll(List.copyOf(cases));
    }

    public Node discriminant() {
        return discriminant;
    }

    public List<SwitchCase> cases() {
        return cases;
    }

    public boolean hasDefaultCase() {
        return cases.stream().anyMatch(SwitchCase::isDefault);
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(cases.size() + 1);
        children.add(discriminant);
        children.addAll(cases);
        return children;
    }
}
