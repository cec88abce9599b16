package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * Any of the five loop forms. The head parts differ per form, so they are kept
 * as an ordered list alongside the loop body.
 */
public final class LoopStatement extends Node {

    private final List<Node> children;
    private final Node body;

    private LoopStatement(NodeKind kind, Node body, Node... parts) {
        super(kind);
        if (!kind.isLoop()) {
            throw new IllegalArgumentException("Not a loop kind: " + kind);
        }
        for (Node part : parts) {
            adopt(part);
        }
        this.body = body;
        this.children = List.copyOf(nonNull(parts));
    }

    public static LoopStatement forStatement(Node init, Node test, Node update, Node body) {
        return new LoopStatement(NodeKind.FOR_STATEMENT, body, init, test, update, body);
    }

    public static LoopStatement forIn(Node left, Node right, Node body) {
        return new LoopStatement(NodeKind.FOR_IN_STATEMENT, body, left, right, body);
    }

    public static LoopStatement forOf(Node left, Node right, Node body) {
        return new LoopStatement(NodeKind.FOR_OF_STATEMENT, body, left, right, body);
    }

    public static LoopStatement whileStatement(Node test, Node body) {
        return new LoopStatement(NodeKind.WHILE_STATEMENT, body, test, body);
    }

    public static LoopStatement doWhile(Node body, Node test) {
        return new LoopStatement(NodeKind.DO_WHILE_STATEMENT, body, body, test);
    }

    public Node body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return children;
    }
}
