package com.repo.scopemetrics.ast;

import java.util.List;

/**
 * Any ESTree node the metrics do not inspect directly: statements such as
 * {@code ReturnStatement}, expressions such as {@code BinaryExpression}, patterns.
 * Its children are still walked.
 */
public final class GenericNode extends Node {

    private final String type;
    private final List<Node> children;

    public GenericNode(String type, List<? extends Node> children) {
        super(NodeKind.OTHER);
        this.type = type;
        this.children = adoptAll(List.copyOf(children));
    }

    public static GenericNode of(String type, Node... children) {
        return new GenericNode(type, List.of(children));
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public List<Node> children() {
        return children;
    }
}
