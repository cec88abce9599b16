package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A function declaration, function expression or arrow function.
 * Arrow functions may have an expression body instead of a block.
 */
public final class FunctionNode extends Node {

    private final Identifier id;
    private final List<Node> params;
    private final Node body;
    private final boolean async;
    private final boolean generator;

    public FunctionNode(NodeKind kind, Identifier id, List<? extends Node> params, Node body,
            boolean async, boolean generator) {
        super(kind);
        if (!kind.isFunction()) {
            throw new IllegalArgumentException("Not a function kind: " + kind);
        }
        this.id = adopt(id);
        this.params = adoptAll(List.copyOf(params));
        this.body = adopt(body);
        this.async = async;
        this.generator = generator;
    }

    public static FunctionNode declaration(String name, BlockStatement body) {
        return new FunctionNode(NodeKind.FUNCTION_DECLARATION, new Identifier(name), List.of(), body, false, false);
    }

    public static FunctionNode expression(BlockStatement body) {
        return new FunctionNode(NodeKind.FUNCTION_EXPRESSION, null, List.of(), body, false, false);
    }

    public static FunctionNode arrow(Node body) {
        return new FunctionNode(NodeKind.ARROW_FUNCTION_EXPRESSION, null, List.of(), body, false, false);
    }

    /**
     * The declared name, or {@code null} for anonymous functions.
     */
    public Identifier id() {
        return id;
    }

    public List<Node> params() {
        return params;
    }

    public Node body() {
        return body;
    }

    public boolean isAsync() {
        return async;
    }

    public boolean isGenerator() {
        return generator;
    }

    public boolean isArrow() {
        return kind() == NodeKind.ARROW_FUNCTION_EXPRESSION;
    }

    @Override
    public List<Node> children() {
        List<Node> children = new ArrayList<>();
        if (id != null) {
            children.add(id);
        }
        children.addAll(params);
        children.add(body);
        return children;
    }
}
