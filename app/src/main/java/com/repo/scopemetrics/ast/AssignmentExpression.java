package com.repo.scopemetrics.ast;

import java.util.List;
import java.util.Set;

public final class AssignmentExpression extends Node {

    private static final Set<String> LOGICAL_ASSIGNMENT_OPERATORS = Set.of("&&=", "||=", "??=");

    private final String operator;
    private final Node left;
    private final Node right;

    public AssignmentExpression(String operator, Node left, Node right) {
        super(NodeKind.ASSIGNMENT_EXPRESSION);
        this.operator = operator;
        this.left = adopt(left);
        this.right = adopt(right);
    }

    public String operator() {
        return operator;
    }

    public Node left() {
        return left;
    }

    public Node right() {
        return right;
    }

    public boolean isPlainAssignment() {
        return "=".equals(operator);
    }

    /**
     * {@code &&=}, {@code ||=} and {@code ??=} short-circuit like their logical operators.
     */
    public boolean isLogicalAssignment() {
        return LOGICAL_ASSIGNMENT_OPERATORS.contains(operator);
    }

    @Override
    public List<Node> children() {
        return nonNull(left, right);
    }
}
