package com.repo.scopemetrics.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of ESTree node kinds the traversal can report.
 * Anything the metrics never look at is folded into {@link #OTHER}.
 */
public enum NodeKind {
    PROGRAM("Program"),
    FUNCTION_DECLARATION("FunctionDeclaration"),
    FUNCTION_EXPRESSION("FunctionExpression"),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression"),
    CLASS_DECLARATION("ClassDeclaration"),
    CLASS_EXPRESSION("ClassExpression"),
    CLASS_BODY("ClassBody"),
    METHOD_DEFINITION("MethodDefinition"),
    PROPERTY_DEFINITION("PropertyDefinition"),
    STATIC_BLOCK("StaticBlock"),
    BLOCK_STATEMENT("BlockStatement"),
    IF_STATEMENT("IfStatement"),
    FOR_STATEMENT("ForStatement"),
    FOR_IN_STATEMENT("ForInStatement"),
    FOR_OF_STATEMENT("ForOfStatement"),
    WHILE_STATEMENT("WhileStatement"),
    DO_WHILE_STATEMENT("DoWhileStatement"),
    SWITCH_STATEMENT("SwitchStatement"),
    SWITCH_CASE("SwitchCase"),
    CATCH_CLAUSE("CatchClause"),
    CONDITIONAL_EXPRESSION("ConditionalExpression"),
    LOGICAL_EXPRESSION("LogicalExpression"),
    ASSIGNMENT_EXPRESSION("AssignmentExpression"),
    CALL_EXPRESSION("CallExpression"),
    MEMBER_EXPRESSION("MemberExpression"),
    IDENTIFIER("Identifier"),
    PRIVATE_IDENTIFIER("PrivateIdentifier"),
    LITERAL("Literal"),
    TEMPLATE_LITERAL("TemplateLiteral"),
    VARIABLE_DECLARATOR("VariableDeclarator"),
    PROPERTY("Property"),
    OTHER("*");

    private static final Map<String, NodeKind> BY_TYPE = Arrays.stream(values())
            .filter(kind -> kind != OTHER)
            .collect(Collectors.toMap(NodeKind::estreeType, Function.identity()));

    private final String estreeType;

    NodeKind(String estreeType) {
        this.estreeType = estreeType;
    }

    /**
     * The ESTree {@code type} string for this kind.
     */
    public String estreeType() {
        return estreeType;
    }

    public boolean isFunction() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION || this == ARROW_FUNCTION_EXPRESSION;
    }

    public boolean isLoop() {
        return this == FOR_STATEMENT || this == FOR_IN_STATEMENT || this == FOR_OF_STATEMENT
                || this == WHILE_STATEMENT || this == DO_WHILE_STATEMENT;
    }

    /**
     * Look up the kind for an ESTree type string; unknown types map to {@link #OTHER}.
     */
    public static NodeKind fromEstreeType(String type) {
        return BY_TYPE.getOrDefault(type, OTHER);
    }
}
