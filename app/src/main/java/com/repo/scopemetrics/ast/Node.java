package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class of every syntax node.
 * Children adopt their parent when the parent is constructed, so a finished
 * tree always has working parent links.
 */
public abstract class Node {

    private final NodeKind kind;
    private Node parent;
    private SourcePosition position = SourcePosition.UNKNOWN;

    protected Node(NodeKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * The ESTree type string. Generic nodes override this with their raw type.
     */
    public String type() {
        return kind.estreeType();
    }

    public Node parent() {
        return parent;
    }

    public SourcePosition position() {
        return position;
    }

    public void setPosition(SourcePosition position) {
        this.position = position == null ? SourcePosition.UNKNOWN : position;
    }

    /**
     * Direct child nodes in document order.
     */
    public abstract List<Node> children();

    protected final <T extends Node> T adopt(T child) {
        if (child != null) {
            ((Node) child).parent = this;
        }
        return child;
    }

    protected final <T extends Node> List<T> adoptAll(List<T> nodes) {
        List<T> adopted = new ArrayList<>(nodes.size());
        for (T node : nodes) {
            adopted.add(adopt(node));
        }
        return Collections.unmodifiableList(adopted);
    }

    /**
     * Collects the non-null nodes given, in order. Used by subclasses to build {@link #children()}.
     */
    protected static List<Node> nonNull(Node... nodes) {
        List<Node> result = new ArrayList<>(nodes.length);
        for (Node node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return type() + (position.isKnown() ? "@" + position : "");
    }
}
