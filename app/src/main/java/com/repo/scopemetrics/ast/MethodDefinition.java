package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * A class method. {@code kind} is one of {@code constructor}, {@code method}, {@code get}, {@code set}.
 */
public final class MethodDefinition extends Node {

    private final Node key;
    private final FunctionNode value;
    private final String methodKind;
    private final boolean computed;
    private final boolean isStatic;

    public MethodDefinition(Node key, FunctionNode value, String methodKind, boolean computed, boolean isStatic) {
        super(NodeKind.METHOD_DEFINITION);
        this.key = adopt(key);
        this.value = adopt(value);
        this.methodKind = methodKind == null ? "method" : methodKind;
        this.computed = computed;
        this.isStatic = isStatic;
    }

    public Node key() {
        return key;
    }

    public FunctionNode value() {
        return value;
    }

    public String methodKind() {
        return methodKind;
    }

    public boolean isComputed() {
        return computed;
    }

    public boolean isStatic() {
        return isStatic;
    }

    @Override
    public List<Node> children() {
        return nonNull(key, value);
    }
}
