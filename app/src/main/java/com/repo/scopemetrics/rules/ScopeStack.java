package com.repo.scopemetrics.rules;

import java.util.Arrays;

/**
 * One integer accumulator per open scope. Opens and closes must pair up in
 * LIFO order with the traversal's nesting; a missed close shifts every later
 * count onto the wrong scope.
 */
public final class ScopeStack {

    private int[] counters = new int[8];
    private int depth;

    /**
     * Push a zero-valued accumulator.
     */
    public void open() {
        if (depth == counters.length) {
            counters = Arrays.copyOf(counters, depth * 2);
        }
        counters[depth++] = 0;
    }

    /**
     * Pop the innermost accumulator and return its final value.
     *
     * @throws IllegalStateException if no scope is open
     */
    public int close() {
        if (depth == 0) {
            throw new IllegalStateException("close() without a matching open()");
        }
        return counters[--depth];
    }

    public void increment() {
        add(1);
    }

    /**
     * Add to the innermost accumulator. Ignored when no scope is open.
     */
    public void add(int amount) {
        if (depth > 0) {
            counters[depth - 1] += amount;
        }
    }

    public int depth() {
        return depth;
    }

    public boolean isEmpty() {
        return depth == 0;
    }
}
