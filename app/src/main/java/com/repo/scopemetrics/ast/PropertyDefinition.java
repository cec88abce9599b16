package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * A class field. The optional {@link #value()} is the field initializer.
 */
public final class PropertyDefinition extends Node {

    private final Node key;
    private final Node value;
    private final boolean computed;
    private final boolean isStatic;

    public PropertyDefinition(Node key, Node value, boolean computed, boolean isStatic) {
        super(NodeKind.PROPERTY_DEFINITION);
        this.key = adopt(key);
        this.value = adopt(value);
        this.computed = computed;
        this.isStatic = isStatic;
    }

    public Node key() {
        return key;
    }

    public Node value() {
        return value;
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
