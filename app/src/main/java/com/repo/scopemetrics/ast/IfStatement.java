package com.repo.scopemetrics.ast;

import java.util.List;

public final class IfStatement extends Node {

    private final Node test;
    private final Node consequent;
    private final Node alternate;

    public IfStatement(Node test, Node consequent, Node alternate) {
        super(NodeKind.IF_STATEMENT);
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

    /**
     * The {@code else} branch, or {@code null}. Another {@link IfStatement} here is an else-if link.
     */
    public Node alternate() {
        return alternate;
    }

    public boolean hasFinalElse() {
        return alternate != null && alternate.kind() != NodeKind.IF_STATEMENT;
    }

    @Override
    public List<Node> children() {
        return nonNull(test, consequent, alternate);
    }
}
