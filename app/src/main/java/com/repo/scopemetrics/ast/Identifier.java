package com.repo.scopemetrics.ast;

import java.util.List;

public final class Identifier extends Node {

    private final String name;

    public Identifier(String name) {
        super(NodeKind.IDENTIFIER);
        this.name = name;
    }

    public String name() {
        return name;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
