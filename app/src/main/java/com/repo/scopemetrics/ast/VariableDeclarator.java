package com.repo.scopemetrics.ast;

import java.util.List;

public final class VariableDeclarator extends Node {

    private final Node id;
    private final Node init;

    public VariableDeclarator(Node id, Node init) {
        super(NodeKind.VARIABLE_DECLARATOR);
        this.id = adopt(id);
        this.init = adopt(init);
    }

    /**
     * The binding target: an {@link Identifier} or a destructuring pattern.
     */
    public Node id() {
        return id;
    }

    public Node init() {
        return init;
    }

    @Override
    public List<Node> children() {
        return nonNull(id, init);
    }
}
