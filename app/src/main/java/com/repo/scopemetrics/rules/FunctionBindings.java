package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.*;

import java.util.Optional;

/**
 * Finds the name a function can call itself by, judged purely from where the
 * function appears in the source. No scope analysis: shadowing and
 * reassignment are not considered.
 */
public final class FunctionBindings {

    private FunctionBindings() {
    }

    /**
     * Checked in order: the function's own name; the variable it initializes;
     * the identifier it is assigned to; the property it is assigned to; the key
     * of the object-literal shorthand method it defines.
     */
    public static Optional<String> bindingOf(FunctionNode function) {
        if (function.id() != null) {
            return Optional.of(function.id().name());
        }
        Node parent = function.parent();
        if (parent == null) {
            return Optional.empty();
        }
        switch (parent.kind()) {
            case VARIABLE_DECLARATOR -> {
                VariableDeclarator declarator = (VariableDeclarator) parent;
                if (declarator.init() == function) {
                    return identifierName(declarator.id());
                }
            }
            case ASSIGNMENT_EXPRESSION -> {
                AssignmentExpression assignment = (AssignmentExpression) parent;
                if (assignment.isPlainAssignment() && assignment.right() == function) {
                    Node target = assignment.left();
                    if (target.kind() == NodeKind.MEMBER_EXPRESSION) {
                        return Optional.ofNullable(((MemberExpression) target).propertyName());
                    }
                    return identifierName(target);
                }
            }
            case PROPERTY -> {
                Property property = (Property) parent;
                if (property.isMethod() && !property.isComputed() && property.value() == function) {
                    return identifierName(property.key());
                }
            }
            default -> {
            }
        }
        return Optional.empty();
    }

    /**
     * The name a call goes to: {@code foo()} gives {@code foo}, {@code a.b.foo()} gives {@code foo}.
     */
    public static Optional<String> calleeName(CallExpression call) {
        Node callee = call.callee();
        if (callee.kind() == NodeKind.IDENTIFIER) {
            return Optional.of(((Identifier) callee).name());
        }
        if (callee.kind() == NodeKind.MEMBER_EXPRESSION) {
            return Optional.ofNullable(((MemberExpression) callee).propertyName());
        }
        return Optional.empty();
    }

    private static Optional<String> identifierName(Node node) {
        if (node != null && node.kind() == NodeKind.IDENTIFIER) {
            return Optional.of(((Identifier) node).name());
        }
        return Optional.empty();
    }
}
