package com.metarwatch.core.model;

/**
 * The most recently reported sky layer. {@code altitudeFeet} is only known for a vertical
 * visibility ({@code VV}) layer.
 */
public record CloudLayer(String code, String description, Integer altitudeFeet) {
    public static final String VERTICAL_VISIBILITY = "VV";

    public static CloudLayer clearSkies() {
        return new CloudLayer("CAVOK", "clear skies", null);
    }
}
