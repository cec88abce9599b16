package com.repo.scopemetrics.ast;

import java.util.Arrays;

public enum LogicalOperator {
    AND("&&"),
    OR("||"),
    NULLISH("??");

    private final String token;

    LogicalOperator(String token) {
        this.token = token;
    }

    public String token() {
        return token;
    }

    public static LogicalOperator fromToken(String token) {
        return Arrays.stream(values())
                .filter(op -> op.token.equals(token))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown logical operator: " + token));
    }
}
