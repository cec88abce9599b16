package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * A {@code #name} class member key. {@link #name()} excludes the hash.
 */
public final class PrivateIdentifier extends Node {

    private final String name;

    public PrivateIdentifier(String name) {
        super(NodeKind.PRIVATE_IDENTIFIER);
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
