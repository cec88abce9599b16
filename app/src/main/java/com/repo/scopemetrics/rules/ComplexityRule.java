package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.*;
import com.repo.scopemetrics.config.ComplexityOptions;
import com.repo.scopemetrics.report.Violation;
import com.repo.scopemetrics.report.ViolationSink;
import com.repo.scopemetrics.traverse.LogicalUnit;
import com.repo.scopemetrics.traverse.UnitOrigin;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;

/**
 * Cyclomatic complexity per function, class field initializer and class static block.
 * <p>
 * Every unit starts at 1. Decision points add 1 each: catch clauses,
 * conditional expressions, loops, {@code if} (plus 1 for a final
 * {@code else}), {@code switch} (plus 1 with a {@code default} arm),
 * each same-operator run of a {@code &&}/{@code ||} chain, {@code ??},
 * logical assignments, and calls of the enclosing function by its own name.
 */
public class ComplexityRule implements MetricRule {

    public static final String ID = "complexity";
    public static final String MESSAGE_ID = "complex";
    public static final String MESSAGE = "{{name}} has a complexity of {{complexity}}. Maximum allowed is {{max}}.";

    private static final int BASE_COMPLEXITY = 1;

    private final ComplexityOptions options;
    private final ViolationSink sink;

    private final ScopeStack complexities = new ScopeStack();
    private final Deque<Optional<String>> bindings = new ArrayDeque<>();

    public ComplexityRule(ComplexityOptions options, ViolationSink sink) {
        this.options = options;
        this.sink = sink;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void onUnitOpen(LogicalUnit unit) {
        complexities.open();
        // non-function units push an empty binding so both stacks stay aligned
        bindings.push(unit.origin() == UnitOrigin.FUNCTION
                ? FunctionBindings.bindingOf((FunctionNode) unit.node())
                : Optional.empty());
    }

    @Override
    public void enter(Node node) {
        switch (node.kind()) {
            case CATCH_CLAUSE, CONDITIONAL_EXPRESSION,
                    FOR_STATEMENT, FOR_IN_STATEMENT, FOR_OF_STATEMENT,
                    WHILE_STATEMENT, DO_WHILE_STATEMENT -> complexities.increment();
            case IF_STATEMENT -> {
                complexities.increment();
                if (((IfStatement) node).hasFinalElse()) {
                    complexities.increment();
                }
            }
            case SWITCH_STATEMENT -> {
                complexities.increment();
                if (((SwitchStatement) node).hasDefaultCase()) {
                    complexities.increment();
                }
            }
            case LOGICAL_EXPRESSION -> onLogicalExpression((LogicalExpression) node);
            case ASSIGNMENT_EXPRESSION -> {
                if (((AssignmentExpression) node).isLogicalAssignment()) {
                    complexities.increment();
                }
            }
            case CALL_EXPRESSION -> {
                if (isSelfCall((CallExpression) node)) {
                    complexities.increment();
                }
            }
            default -> {
            }
        }
    }

    @Override
    public void onUnitClose(LogicalUnit unit) {
        bindings.pop();
        int complexity = BASE_COMPLEXITY + complexities.close();

        // program-level code is never reported
        if (!unit.origin().isReportable()) {
            return;
        }

        int threshold = options.max();
        if (threshold == 0 || complexity > threshold) {
            sink.report(Violation.of(ID, MESSAGE_ID, unit.node(), MESSAGE, Map.of(
                    "name", FunctionNames.upperCaseFirst(unitName(unit)),
                    "complexity", complexity,
                    "max", threshold)));
        }
    }

    private void onLogicalExpression(LogicalExpression node) {
        if (node.operator() == LogicalOperator.NULLISH) {
            complexities.increment();
            return;
        }
        // inner links of a chain are counted from the outermost node
        if (isShortCircuitChainLink(node.parent())) {
            return;
        }
        complexities.add(countOperatorRuns(node, null));
    }

    /**
     * Counts maximal same-operator runs below {@code node}. A node opens a new
     * run when its operator differs from the one its parent carried down.
     */
    static int countOperatorRuns(LogicalExpression node, LogicalOperator current) {
        int runs = node.operator() == current ? 0 : 1;
        if (isShortCircuitChainLink(node.left())) {
            runs += countOperatorRuns((LogicalExpression) node.left(), node.operator());
        }
        if (isShortCircuitChainLink(node.right())) {
            runs += countOperatorRuns((LogicalExpression) node.right(), node.operator());
        }
        return runs;
    }

    private static boolean isShortCircuitChainLink(Node node) {
        return node != null
                && node.kind() == NodeKind.LOGICAL_EXPRESSION
                && ((LogicalExpression) node).operator() != LogicalOperator.NULLISH;
    }

    private boolean isSelfCall(CallExpression call) {
        Optional<String> binding = bindings.isEmpty() ? Optional.empty() : bindings.peek();
        return binding.isPresent() && binding.equals(FunctionBindings.calleeName(call));
    }

    private static String unitName(LogicalUnit unit) {
        return switch (unit.origin()) {
            case CLASS_FIELD_INITIALIZER -> "class field initializer";
            case CLASS_STATIC_BLOCK -> "class static block";
            case FUNCTION -> FunctionNames.nameWithKind((FunctionNode) unit.node());
            case PROGRAM -> "program";
        };
    }
}
