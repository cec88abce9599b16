package com.repo.scopemetrics.traverse;

/**
 * Where a logical unit (code path) comes from.
 */
public enum UnitOrigin {
    PROGRAM("program"),
    FUNCTION("function"),
    CLASS_FIELD_INITIALIZER("class-field-initializer"),
    CLASS_STATIC_BLOCK("class-static-block");

    private final String id;

    UnitOrigin(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Whether metrics of a unit with this origin are reported. Program-level code never is.
     */
    public boolean isReportable() {
        return this != PROGRAM;
    }
}
