package com.repo.scopemetrics.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleOptionsTest {

    @Test
    void testComplexityAcceptsIntegerAndRecordShapes() {
        assertEquals(20, ComplexityOptions.parse(null).max());
        assertEquals(5, ComplexityOptions.parse(5).max());
        assertEquals(0, ComplexityOptions.parse(0).max());
        assertEquals(7, ComplexityOptions.parse(Map.of("maximum", 7)).max());
        assertEquals(9, ComplexityOptions.parse(Map.of("max", 9)).max());
        assertEquals(20, ComplexityOptions.parse(Map.of("variant", "classic")).max());
    }

    @Test
    void testMaximumWinsUnlessZero() {
        assertEquals(4, ComplexityOptions.parse(Map.of("maximum", 4, "max", 6)).max());
        assertEquals(6, ComplexityOptions.parse(Map.of("maximum", 0, "max", 6)).max());
        assertEquals(0, ComplexityOptions.parse(Map.of("maximum", 0)).max());
    }

    @Test
    void testComplexityRejectsMalformedOptions() {
        assertThrows(ConfigurationException.class, () -> ComplexityOptions.parse(-1));
        assertThrows(ConfigurationException.class, () -> ComplexityOptions.parse("ten"));
        assertThrows(ConfigurationException.class, () -> ComplexityOptions.parse(2.5));
        assertThrows(ConfigurationException.class, () -> ComplexityOptions.parse(Map.of("limit", 3)));
        assertThrows(ConfigurationException.class, () -> ComplexityOptions.parse(Map.of("max", -3)));
    }

    @Test
    void testStatementShapes() {
        assertEquals(StatementOptions.defaults(), StatementOptions.parse(null));
        assertEquals(new StatementOptions(3, false), StatementOptions.parse(3));
        assertEquals(new StatementOptions(3, true),
                StatementOptions.parse(Map.of("max", 3, "ignoreTopLevelFunctions", true)));
        assertEquals(new StatementOptions(10, true),
                StatementOptions.parse(Map.of("ignoreTopLevelFunctions", true)));
        assertEquals(new StatementOptions(4, true),
                StatementOptions.parse(List.of(Map.of("maximum", 4), Map.of("ignoreTopLevelFunctions", true))));
        assertEquals(new StatementOptions(6, false), StatementOptions.parse(List.of(6)));
    }

    @Test
    void testStatementRejectsMalformedOptions() {
        assertThrows(ConfigurationException.class, () -> StatementOptions.parse(List.of()));
        assertThrows(ConfigurationException.class, () -> StatementOptions.parse(List.of(1, Map.of(), 3)));
        assertThrows(ConfigurationException.class,
                () -> StatementOptions.parse(List.of(1, Map.of("ignoreTopLevelFunctions", "yes"))));
        assertThrows(ConfigurationException.class,
                () -> StatementOptions.parse(List.of(Map.of("max", 1, "ignoreTopLevelFunctions", true))));
        assertThrows(ConfigurationException.class, () -> StatementOptions.parse(Map.of("variant", "classic")));
    }
}
