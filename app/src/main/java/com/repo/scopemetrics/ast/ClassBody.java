package com.repo.scopemetrics.ast;

import java.util.List;

public final class ClassBody extends Node {

    private final List<Node> members;

    public ClassBody(List<? extends Node> members) {
        super(NodeKind.CLASS_BODY);
        this.members = adoptAll(List.copyOf(members));
    }

    public List<Node> members() {
        return members;
    }

    @Override
    public List<Node> children() {
        return members;
    }
}
