package com.repo.scopemetrics.traverse;

import com.repo.scopemetrics.ast.Node;

/**
 * Callbacks fired by {@link TreeWalker}. A unit is opened before its node is
 * entered and closed after its node is exited.
 */
public interface RuleListener {

    default void onUnitOpen(LogicalUnit unit) {
    }

    default void onUnitClose(LogicalUnit unit) {
    }

    default void enter(Node node) {
    }

    default void exit(Node node) {
    }
}
