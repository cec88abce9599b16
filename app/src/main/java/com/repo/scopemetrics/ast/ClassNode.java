package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * A class declaration or class expression.
 */
public final class ClassNode extends Node {

    private final Identifier id;
    private final Node superClass;
    private final ClassBody body;

    public ClassNode(NodeKind kind, Identifier id, Node superClass, ClassBody body) {
        super(kind);
        if (kind != NodeKind.CLASS_DECLARATION && kind != NodeKind.CLASS_EXPRESSION) {
            throw new IllegalArgumentException("Not a class kind: " + kind);
        }
        this.id = adopt(id);
        this.superClass = adopt(superClass);
        this.body = adopt(body);
    }

    public Identifier id() {
        return id;
    }

    public Node superClass() {
        return superClass;
    }

    public ClassBody body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return nonNull(id, superClass, body);
    }
}
