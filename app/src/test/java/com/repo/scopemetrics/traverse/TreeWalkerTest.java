package com.repo.scopemetrics.traverse;

import com.repo.scopemetrics.ast.ClassNode;
import com.repo.scopemetrics.ast.Node;
import com.repo.scopemetrics.ast.Program;
import com.repo.scopemetrics.ast.PropertyDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.repo.scopemetrics.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeWalkerTest {

    private static class Recorder implements RuleListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onUnitOpen(LogicalUnit unit) {
            events.add("open " + unit.origin().id());
        }

        @Override
        public void onUnitClose(LogicalUnit unit) {
            events.add("close " + unit.origin().id());
        }

        @Override
        public void enter(Node node) {
            events.add("enter " + node.type());
        }

        @Override
        public void exit(Node node) {
            events.add("exit " + node.type());
        }
    }

    @Test
    void testVisitsInDocumentOrderWithUnitsAroundTheirNodes() {
        Recorder recorder = new Recorder();
        new TreeWalker(List.of(recorder)).walk(program(fn("f", ret(id("x")))));

        assertEquals(List.of(
                "open program",
                "enter Program",
                "open function",
                "enter FunctionDeclaration",
                "enter Identifier",
                "exit Identifier",
                "enter BlockStatement",
                "enter ReturnStatement",
                "enter Identifier",
                "exit Identifier",
                "exit ReturnStatement",
                "exit BlockStatement",
                "exit FunctionDeclaration",
                "close function",
                "exit Program",
                "close program"), recorder.events);
    }

    @Test
    void testFunctionFieldInitializerOpensInitializerFirst() {
        Recorder recorder = new Recorder();
        new TreeWalker(List.of(recorder)).walk(program(classDecl("A", field("x", arrowExpr(lit(1))))));

        List<String> events = recorder.events;
        int initializerOpen = events.indexOf("open class-field-initializer");
        assertTrue(initializerOpen > events.indexOf("exit Identifier"), "Key is not part of the initializer");
        assertEquals("open function", events.get(initializerOpen + 1));
        assertEquals("enter ArrowFunctionExpression", events.get(initializerOpen + 2));

        int functionClose = events.indexOf("close function");
        assertEquals("exit ArrowFunctionExpression", events.get(functionClose - 1));
        assertEquals("close class-field-initializer", events.get(functionClose + 1));
    }

    @Test
    void testUnitOrigins() {
        Program program = program(classDecl("A",
                staticBlock(),
                field("y", id("z")),
                field("empty", null)));

        assertEquals(List.of(new LogicalUnit(UnitOrigin.PROGRAM, program)), TreeWalker.unitsStartingAt(program));

        Node staticBlock = ((ClassNode) program.body().get(0)).body().members().get(0);
        assertEquals(UnitOrigin.CLASS_STATIC_BLOCK, TreeWalker.unitsStartingAt(staticBlock).get(0).origin());

        Node fieldValue = ((PropertyDefinition)
                ((ClassNode) program.body().get(0)).body().members().get(1)).value();
        assertEquals(UnitOrigin.CLASS_FIELD_INITIALIZER, TreeWalker.unitsStartingAt(fieldValue).get(0).origin());
    }

    @Test
    void testEveryListenerSeesEveryEvent() {
        Recorder first = new Recorder();
        Recorder second = new Recorder();
        new TreeWalker(List.of(first, second)).walk(program(arrowExpr(id("a"))));

        assertFalse(first.events.isEmpty());
        assertEquals(first.events, second.events);
    }

    @Test
    void testUnitReportsOriginIds() {
        assertEquals("class-static-block", UnitOrigin.CLASS_STATIC_BLOCK.id());
        assertFalse(UnitOrigin.PROGRAM.isReportable());
        assertTrue(UnitOrigin.CLASS_FIELD_INITIALIZER.isReportable());
    }
}
