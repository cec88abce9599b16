package com.repo.scopemetrics.ast;

import java.util.List;

public final class Literal extends Node {

    private final Object value;
    private final String raw;

    public Literal(Object value, String raw) {
        super(NodeKind.LITERAL);
        this.value = value;
        this.raw = raw;
    }

    public static Literal of(Object value) {
        return new Literal(value, value instanceof String ? "'" + value + "'" : String.valueOf(value));
    }

    /**
     * The literal value; {@code null} for the {@code null} literal and for regular expressions.
     */
    public Object value() {
        return value;
    }

    public String raw() {
        return raw;
    }

    @Override
    public List<Node> children() {
        return List.of();
    }
}
