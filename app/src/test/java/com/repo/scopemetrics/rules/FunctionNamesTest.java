package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repo.scopemetrics.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

class FunctionNamesTest {

    @Test
    void testPlainFunctions() {
        FunctionNode declaration = fn("foo");
        program(declaration);
        assertEquals("function 'foo'", FunctionNames.nameWithKind(declaration));

        FunctionNode anonymous = fnExpr();
        program(let("bar", anonymous));
        assertEquals("function", FunctionNames.nameWithKind(anonymous));

        FunctionNode arrow = arrow();
        program(stmt(call("run", arrow)));
        assertEquals("arrow function", FunctionNames.nameWithKind(arrow));
    }

    @Test
    void testAsyncAndGeneratorModifiers() {
        FunctionNode function = new FunctionNode(NodeKind.FUNCTION_DECLARATION, id("load"), List.of(),
                block(), true, true);
        program(function);
        assertEquals("async generator function 'load'", FunctionNames.nameWithKind(function));
    }

    @Test
    void testClassMembers() {
        FunctionNode ctor = fnExpr();
        FunctionNode getter = fnExpr();
        FunctionNode staticAsync = new FunctionNode(NodeKind.FUNCTION_EXPRESSION, null, List.of(), block(), true,
                false);
        FunctionNode privateMethod = fnExpr();
        FunctionNode fieldArrow = arrowExpr(lit(1));

        program(classDecl("A",
                new MethodDefinition(id("constructor"), ctor, "constructor", false, false),
                new MethodDefinition(id("size"), getter, "get", false, false),
                new MethodDefinition(id("fetch"), staticAsync, "method", false, true),
                new MethodDefinition(new PrivateIdentifier("reset"), privateMethod, "method", false, false),
                field("handler", fieldArrow)));

        assertEquals("constructor", FunctionNames.nameWithKind(ctor));
        assertEquals("getter 'size'", FunctionNames.nameWithKind(getter));
        assertEquals("static async method 'fetch'", FunctionNames.nameWithKind(staticAsync));
        assertEquals("private method #reset", FunctionNames.nameWithKind(privateMethod));
        assertEquals("method 'handler'", FunctionNames.nameWithKind(fieldArrow));
    }

    @Test
    void testObjectProperties() {
        FunctionNode shorthand = fnExpr();
        FunctionNode keyed = fnExpr();
        FunctionNode setter = fnExpr();
        FunctionNode literalKey = fnExpr();

        program(stmt(object(
                Property.method("run", shorthand),
                prop("stop", keyed),
                new Property(id("value"), setter, "set", false, false, false),
                new Property(lit("my-key"), literalKey, "init", false, false, false))));

        assertEquals("method 'run'", FunctionNames.nameWithKind(shorthand));
        assertEquals("method 'stop'", FunctionNames.nameWithKind(keyed));
        assertEquals("setter 'value'", FunctionNames.nameWithKind(setter));
        assertEquals("method 'my-key'", FunctionNames.nameWithKind(literalKey));
    }

    @Test
    void testComputedKeyFallsBackToFunctionName() {
        FunctionNode named = namedFnExpr("impl");
        program(stmt(object(new Property(id("key"), named, "init", false, false, true))));
        assertEquals("method 'impl'", FunctionNames.nameWithKind(named));
    }

    @Test
    void testTemplateLiteralKeys() {
        FunctionNode plainTemplate = fnExpr();
        FunctionNode withExpression = fnExpr();
        program(classDecl("A",
                new MethodDefinition(TemplateLiteral.of("foo"), plainTemplate, "method", true, false),
                new MethodDefinition(new TemplateLiteral(List.of("on", ""), List.of(id("event"))), withExpression,
                        "method", true, false)));

        assertEquals("method 'foo'", FunctionNames.nameWithKind(plainTemplate));
        // `on${event}` has no static name
        assertEquals("method", FunctionNames.nameWithKind(withExpression));
    }

    @Test
    void testUpperCaseFirst() {
        assertEquals("Function 'foo'", FunctionNames.upperCaseFirst("function 'foo'"));
        assertEquals("", FunctionNames.upperCaseFirst(""));
    }
}
