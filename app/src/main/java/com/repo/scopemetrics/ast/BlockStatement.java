package com.repo.scopemetrics.ast;

import java.util.List;

public final class BlockStatement extends Node {

    private final List<Node> body;

    public BlockStatement(List<? extends Node> body) {
        super(NodeKind.BLOCK_STATEMENT);
        this.body = adoptAll(List.copyOf(body));
    }

    public static BlockStatement of(Node... statements) {
        return new BlockStatement(List.of(statements));
    }

    public List<Node> body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return body;
    }
}
