package com.metarwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Surface wind. {@code direction} is a 16-point compass label, {@code "varies"} or
 * {@code "calm"}; speeds are whole miles per hour and are absent for calm wind.
 */
public record Wind(String direction, Integer speedMph, Integer gustMph) {
    public static final String CALM = "calm";
    public static final String VARIES = "varies";

    public static Wind calm() {
        return new Wind(CALM, null, null);
    }

    @JsonIgnore
    public boolean isCalm() {
        return CALM.equals(direction);
    }
}
