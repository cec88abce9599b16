package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * An object literal property. {@code kind} is {@code init}, {@code get} or {@code set};
 * {@code method} marks the {@code foo() {}} shorthand.
 */
public final class Property extends Node {

    private final Node key;
    private final Node value;
    private final String propertyKind;
    private final boolean method;
    private final boolean shorthand;
    private final boolean computed;

    public Property(Node key, Node value, String propertyKind, boolean method, boolean shorthand, boolean computed) {
        super(NodeKind.PROPERTY);
        this.key = adopt(key);
        this.value = adopt(value);
        this.propertyKind = propertyKind == null ? "init" : propertyKind;
        this.method = method;
        this.shorthand = shorthand;
        this.computed = computed;
    }

    public static Property method(String name, FunctionNode value) {
        return new Property(new Identifier(name), value, "init", true, false, false);
    }

    public Node key() {
        return key;
    }

    public Node value() {
        return value;
    }

    public String propertyKind() {
        return propertyKind;
    }

    public boolean isMethod() {
        return method;
    }

    public boolean isShorthand() {
        return shorthand;
    }

    public boolean isComputed() {
        return computed;
    }

    @Override
    public List<Node> children() {
        // shorthand properties share one node between key and value
        if (shorthand && key == value) {
            return nonNull(value);
        }
        return nonNull(key, value);
    }
}
