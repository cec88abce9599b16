package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.List;

public final class CallExpression extends Node {

    private final Node callee;
    private final List<Node> arguments;
    private final boolean optional;

    public CallExpression(Node callee, List<? extends Node> arguments, boolean optional) {
        super(NodeKind.CALL_EXPRESSION);
        this.callee = adopt(callee);
        this.arguments = adoptAll(List.copyOf(arguments));
        this.optional = optional;
    }

    public static CallExpression of(Node callee, Node... arguments) {
        return new CallExpression(callee, List.of(arguments), false);
    }

    public Node callee() {
        return callee;
    }

    public List<Node> arguments() {
        return arguments;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>(arguments.size() + 1);
        children.add(callee);
        children.addAll(arguments);
        return children;
    }
}
