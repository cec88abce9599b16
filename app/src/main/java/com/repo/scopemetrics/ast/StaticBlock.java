package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * A {@code static { ... }} class initializer. Not a {@link BlockStatement}.
 */
public final class StaticBlock extends Node {

    private final List<Node> body;

    public StaticBlock(List<? extends Node> body) {
        super(NodeKind.STATIC_BLOCK);
        this.body = adoptAll(List.copyOf(body));
    }

    public List<Node> body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
