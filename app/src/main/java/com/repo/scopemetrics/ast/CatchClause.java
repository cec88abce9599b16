package com.repo.scopemetrics.ast;

import java.util.List;

public final class CatchClause extends Node {

    private final Node param;
    private final BlockStatement body;

    public CatchClause(Node param, BlockStatement body) {
        super(NodeKind.CATCH_CLAUSE);
        this.param = adopt(param);
        this.body = adopt(body);
    }

    /**
     * The bound exception, or {@code null} for an optional catch binding.
     */
    public Node param() {
        return param;
    }

    public BlockStatement body() {
        return body;
    }

    @Override
    public List<Node> children() {
        return nonNull(param, body);
    }
}
