package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.BlockStatement;
import com.repo.scopemetrics.ast.FunctionNode;
import com.repo.scopemetrics.ast.Node;
import com.repo.scopemetrics.config.StatementOptions;
import com.repo.scopemetrics.report.Violation;
import com.repo.scopemetrics.report.ViolationSink;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Statements per function. Each function owns one counter that sums the
 * direct statements of every block lexically inside it, up to the next
 * nested function.
 * <p>
 * Static blocks get a counter of their own so their statements stay out of
 * the enclosing function, but are never reported.
 */
public class MaxStatementsRule implements MetricRule {

    public static final String ID = "max-statements";
    public static final String MESSAGE_ID = "exceed";
    public static final String MESSAGE = "{{name}} has too many statements ({{count}}). Maximum allowed is {{max}}.";

    private record TopLevelFunction(FunctionNode node, int count) {
    }

    private final StatementOptions options;
    private final ViolationSink sink;

    private final ScopeStack functionStack = new ScopeStack();
    private final List<TopLevelFunction> topLevelFunctions = new ArrayList<>();

    public MaxStatementsRule(StatementOptions options, ViolationSink sink) {
        this.options = options;
        this.sink = sink;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public void enter(Node node) {
        switch (node.kind()) {
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION, STATIC_BLOCK -> functionStack.open();
            case BLOCK_STATEMENT -> functionStack.add(((BlockStatement) node).body().size());
            default -> {
            }
        }
    }

    @Override
    public void exit(Node node) {
        switch (node.kind()) {
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> endFunction((FunctionNode) node);
            case STATIC_BLOCK -> functionStack.close();
            case PROGRAM -> reportTopLevelFunctions();
            default -> {
            }
        }
    }

    private void endFunction(FunctionNode node) {
        int count = functionStack.close();

        if (options.ignoreTopLevelFunctions() && functionStack.isEmpty()) {
            topLevelFunctions.add(new TopLevelFunction(node, count));
        } else {
            reportIfTooManyStatements(node, count);
        }
    }

    private void reportTopLevelFunctions() {
        // a lone top-level function is taken to be a module wrapper
        if (topLevelFunctions.size() == 1) {
            return;
        }
        for (TopLevelFunction function : topLevelFunctions) {
            reportIfTooManyStatements(function.node(), function.count());
        }
    }

    private void reportIfTooManyStatements(FunctionNode node, int count) {
        int max = options.max();
        if (count > max) {
            sink.report(Violation.of(ID, MESSAGE_ID, node, MESSAGE, Map.of(
                    "name", FunctionNames.upperCaseFirst(FunctionNames.nameWithKind(node)),
                    "count", count,
                    "max", max)));
        }
    }
}
