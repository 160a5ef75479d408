package com.metarwatch.core.model;

import java.util.Objects;

/**
 * Prevailing visibility in statute miles. The qualifier carries the "less than" and
 * "greater than" forms of the report so the caller decides how to render them.
 */
public record Visibility(VisibilityQualifier qualifier, double value, String unit) {
    public static final String MILES = "mi";

    public Visibility {
        Objects.requireNonNull(qualifier, "qualifier is required");
        Objects.requireNonNull(unit, "unit is required");
    }

    public static Visibility miles(VisibilityQualifier qualifier, double value) {
        return new Visibility(qualifier, value, MILES);
    }
}
