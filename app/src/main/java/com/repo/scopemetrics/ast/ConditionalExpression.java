package com.repo.scopemetrics.ast;

import java.util.List;

public final class ConditionalExpression extends Node {

    private final Node test;
    private final Node consequent;
    private final Node alternate;

    public ConditionalExpression(Node test, Node consequent, Node alternate) {
        super(NodeKind.CONDITIONAL_EXPRESSION);
        this.test = adopt(test);
        this.consequent = adopt(consequent);
        this.alternate = adopt(alternate);
    }

    public Node test() {
        return test;
    }

    public Node consequent() {
        return consequent;
    }

    public Node alternate() {
        return alternate;
    }

    @Override
    public List<Node> children() {
        return nonNull(test, consequent, alternate);
    }
}
