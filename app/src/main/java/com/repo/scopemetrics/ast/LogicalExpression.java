package com.repo.scopemetrics.ast;

import java.util.List;

public final class LogicalExpression extends Node {

    private final LogicalOperator operator;
    private final Node left;
    private final Node right;

    public LogicalExpression(LogicalOperator operator, Node left, Node right) {
        super(NodeKind.LOGICAL_EXPRESSION);
        this.operator = operator;
        this.left = adopt(left);
        this.right = adopt(right);
    }

    public LogicalOperator operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    @Override
    public List<Node> children() {
        return nonNull(left, right);
    }
}
