package com.repo.scopemetrics.ast;

import java.util.List;

public final class MemberExpression extends Node {

    private final Node object;
    private final Node property;
    private final boolean computed;
    private final boolean optional;

    public MemberExpression(Node object, Node property, boolean computed, boolean optional) {
        super(NodeKind.MEMBER_EXPRESSION);
        this.object = adopt(object);
        this.property = adopt(property);
        this.computed = computed;
        this.optional = optional;
    }

    public static MemberExpression dot(Node object, String property) {
        return new MemberExpression(object, new Identifier(property), false, false);
    }

    public Node object() {
        return object;
    }

    public Node property() {
        return property;
    }

    public boolean isComputed() {
        return computed;
    }

    public boolean isOptional() {
        return optional;
    }

    /**
     * The name after the dot for {@code a.b}, or {@code null} for computed access.
     */
    public String propertyName() {
        if (!computed && property.kind() == NodeKind.IDENTIFIER) {
            return ((Identifier) property).name();
        }
        return null;
    }

    @Override
    public List<Node> children() {
        return nonNull(object, property);
    }
}
