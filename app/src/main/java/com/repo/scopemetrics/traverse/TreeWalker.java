package com.repo.scopemetrics.traverse;

import com.repo.scopemetrics.ast.Node;
import com.repo.scopemetrics.ast.NodeKind;
import com.repo.scopemetrics.ast.Program;
import com.repo.scopemetrics.ast.PropertyDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first, document-order traversal that dispatches node events and
 * logical-unit events to a fixed set of listeners.
 * <p>
 * Units: the program, every function, every class field initializer and
 * every static block. A field initializer that is itself a function opens
 * two nested units, the initializer first.
 */
public class TreeWalker {

    private final List<RuleListener> listeners;

    public TreeWalker(List<? extends RuleListener> listeners) {
        this.listeners = List.copyOf(listeners);
    }

    public void walk(Program program) {
        visit(program);
    }

    private void visit(Node node) {
        List<LogicalUnit> units = unitsStartingAt(node);

        for (LogicalUnit unit : units) {
            listeners.forEach(listener -> listener.onUnitOpen(unit));
        }
        listeners.forEach(listener -> listener.enter(node));

        for (Node child : node.children()) {
            visit(child);
        }

        listeners.forEach(listener -> listener.exit(node));
        for (int i = units.size() - 1; i >= 0; i--) {
            LogicalUnit unit = units.get(i);
            listeners.forEach(listener -> listener.onUnitClose(unit));
        }
    }

    static List<LogicalUnit> unitsStartingAt(Node node) {
        List<LogicalUnit> units = new ArrayList<>(2);
        if (isFieldInitializer(node)) {
            units.add(new LogicalUnit(UnitOrigin.CLASS_FIELD_INITIALIZER, node));
        }
        if (node.kind() == NodeKind.PROGRAM) {
            units.add(new LogicalUnit(UnitOrigin.PROGRAM, node));
        } else if (node.kind().isFunction()) {
            units.add(new LogicalUnit(UnitOrigin.FUNCTION, node));
        } else if (node.kind() == NodeKind.STATIC_BLOCK) {
            units.add(new LogicalUnit(UnitOrigin.CLASS_STATIC_BLOCK, node));
        }
        return units;
    }

    private static boolean isFieldInitializer(Node node) {
        Node parent = node.parent();
        return parent != null
                && parent.kind() == NodeKind.PROPERTY_DEFINITION
                && ((PropertyDefinition) parent).value() == node;
    }
}
