package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.List;

public final class SwitchCase extends Node {

    private final Node test;
    private final List<Node> consequent;

    public SwitchCase(Node test, List<? extends Node> consequent) {
        super(NodeKind.SWITCH_CASE);
        this.test = adopt(test);
        this.consequent = adoptAll(List.copyOf(consequent));
    }

    /**
     * The case test, or {@code null} for {@code default:}.
     */
    public Node test() {
        return test;
    }

    public List<Node> consequent() {
        return consequent;
    }

    public boolean isDefault() {
        return test == null;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(consequent.size() + 1);
        if (test != null) {
            children.add(test);
        }
        children.addAll(consequent);
        return children;
    }
}
