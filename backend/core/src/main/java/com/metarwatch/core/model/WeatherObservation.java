package com.metarwatch.core.model;

/**
 * Decoded surface observation. Every component is optional; {@code null} means the group
 * was not reported, never that decoding failed.
 */
public record WeatherObservation(
        Wind wind,
        Visibility visibility,
        String presentConditions,
        CloudLayer cloudLayer,
        Integer temperatureC,
        Integer temperatureF,
        Integer dewPointC,
        Integer dewPointF,
        Integer relativeHumidityPercent,
        Integer heatIndexF,
        Integer windChillF,
        Double pressureInHg,
        Integer pressureHPa,
        String remarks
) {
}
