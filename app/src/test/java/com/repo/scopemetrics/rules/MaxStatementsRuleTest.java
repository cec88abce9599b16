package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.Node;
import com.repo.scopemetrics.ast.Program;
import com.repo.scopemetrics.config.StatementOptions;
import com.repo.scopemetrics.report.Violation;
import com.repo.scopemetrics.report.ViolationCollector;
import com.repo.scopemetrics.traverse.TreeWalker;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.repo.scopemetrics.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class MaxStatementsRuleTest {

    @Test
    void testCountsDirectStatementsOfTheBody() {
        List<Violation> violations = analyze(2, false, program(fn("foo", statements(3))));

        assertEquals(1, violations.size());
        assertEquals("Function 'foo' has too many statements (3). Maximum allowed is 2.", violations.get(0).message());
        assertEquals(3, violations.get(0).intData("count", -1));
        assertEquals(MaxStatementsRule.ID, violations.get(0).ruleId());
        assertEquals(MaxStatementsRule.MESSAGE_ID, violations.get(0).messageId());
    }

    @Test
    void testNestedBlocksAddToTheEnclosingFunction() {
        // function f() { if (a) { x; y; } z; }
        Program program = program(fn("f",
                ifStmt(id("a"), block(stmt(id("x")), stmt(id("y")))),
                stmt(id("z"))));

        assertEquals(4, countOf(program));
    }

    @Test
    void testNestedFunctionsKeepTheirOwnCount() {
        // function outer() { a; function inner() { b; c; d; } }
        Program program = program(fn("outer",
                stmt(id("a")),
                fn("inner", stmt(id("b")), stmt(id("c")), stmt(id("d")))));

        List<Violation> violations = analyze(0, false, program);

        assertEquals(2, violations.size());
        assertEquals("Function 'inner'", violations.get(0).name());
        assertEquals(3, violations.get(0).intData("count", -1));
        assertEquals("Function 'outer'", violations.get(1).name());
        assertEquals(2, violations.get(1).intData("count", -1));
    }

    @Test
    void testArrowWithExpressionBodyHasNoStatements() {
        Program program = program(let("double", arrowExpr(id("x"))));

        assertTrue(analyze(0, false, program).isEmpty());
    }

    @Test
    void testStaticBlocksAreIsolatedAndNeverReported() {
        // function f() { class A { static { if (x) { a; b; c; } d; } } }
        Program program = program(fn("f",
                classDecl("A", staticBlock(
                        ifStmt(id("x"), block(stmt(id("a")), stmt(id("b")), stmt(id("c")))),
                        stmt(id("d"))))));

        List<Violation> violations = analyze(0, false, program);

        assertEquals(1, violations.size());
        assertEquals("Function 'f'", violations.get(0).name());
        assertEquals(1, violations.get(0).intData("count", -1));
    }

    @Test
    void testBlocksOutsideFunctionsAreIgnored() {
        Program program = program(ifStmt(id("a"), block(statements(20))));

        assertTrue(analyze(0, false, program).isEmpty());
    }

    @Test
    void testThresholdBoundary() {
        assertTrue(analyze(3, false, program(fn("foo", statements(3)))).isEmpty());
        assertEquals(1, analyze(3, false, program(fn("foo", statements(4)))).size());
    }

    @Test
    void testDefaultMaximumIsTen() {
        StatementOptions defaults = StatementOptions.defaults();
        assertTrue(analyzeWith(defaults, program(fn("foo", statements(10)))).isEmpty());
        assertEquals(1, analyzeWith(defaults, program(fn("foo", statements(11)))).size());
    }

    @Test
    void testLoneTopLevelFunctionIsExemptWhenIgnoringTopLevel() {
        Program program = program(fn("wrapper", statements(5)));

        assertTrue(analyze(2, true, program).isEmpty());
        assertEquals(1, analyze(2, false, program).size());
    }

    @Test
    void testSeveralTopLevelFunctionsAreAllCheckedWhenIgnoringTopLevel() {
        Program program = program(
                fn("first", statements(5)),
                fn("second", statements(5)),
                fn("third", statements(1)));

        List<Violation> violations = analyze(2, true, program);

        assertEquals(2, violations.size());
        assertEquals("Function 'first'", violations.get(0).name());
        assertEquals("Function 'second'", violations.get(1).name());
    }

    @Test
    void testNestedFunctionsAreReportedRightAwayWhenIgnoringTopLevel() {
        // (function () { function helper() { 5 statements } })()
        Program program = program(stmt(call(fnExpr(fn("helper", statements(5))))));

        List<Violation> violations = analyze(2, true, program);

        assertEquals(1, violations.size());
        assertEquals("Function 'helper'", violations.get(0).name());
    }

    @Test
    void testAnalysingTheSameTreeTwiceGivesTheSameCounts() {
        Program program = program(fn("a", statements(4)), fn("b", statements(6)));

        List<Violation> first = analyze(3, true, program);
        List<Violation> second = analyze(3, true, program);

        assertEquals(2, first.size());
        assertEquals(first.get(0).data(), second.get(0).data());
        assertEquals(first.get(1).data(), second.get(1).data());
    }

    private static Node[] statements(int count) {
        Node[] statements = new Node[count];
        for (int i = 0; i < count; i++) {
            statements[i] = stmt(call("step" + i));
        }
        return statements;
    }

    private static int countOf(Program program) {
        List<Violation> violations = analyze(0, false, program);
        assertEquals(1, violations.size());
        return violations.get(0).intData("count", -1);
    }

    private static List<Violation> analyze(int max, boolean ignoreTopLevelFunctions, Program program) {
        return analyzeWith(new StatementOptions(max, ignoreTopLevelFunctions), program);
    }

    private static List<Violation> analyzeWith(StatementOptions options, Program program) {
        ViolationCollector collector = new ViolationCollector();
        new TreeWalker(List.of(new MaxStatementsRule(options, collector))).walk(program);
        return collector.violations();
    }
}
