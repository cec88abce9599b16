package com.repo.scopemetrics.ast;

/**
 * 1-based line, 0-based column, as ESTree {@code loc.start} reports them.
 */
public record SourcePosition(int line, int column) {

    public static final SourcePosition UNKNOWN = new SourcePosition(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
