package com.repo.scopemetrics.ast;

import java.util.List;

public final class Program extends Node {

    private final List<Node> body;

    public Program(List<? extends Node> body) {
        super(NodeKind.PROGRAM);
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
