package com.repo.scopemetrics.traverse;

import com.repo.scopemetrics.ast.Node;

/**
 * One function body, static initializer, class field initializer or the whole program,
 * as delimited by {@link TreeWalker}.
 *
 * @param origin what kind of code the unit covers
 * @param node   the syntax node the unit is defined by, used for naming and position
 */
public record LogicalUnit(UnitOrigin origin, Node node) {
}
