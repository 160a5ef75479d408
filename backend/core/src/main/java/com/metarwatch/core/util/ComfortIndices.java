package com.metarwatch.core.util;

import java.util.OptionalInt;

/**
 * Apparent-temperature indices derived from an already decoded temperature group.
 */
public final class ComfortIndices {
    private ComfortIndices() {
    }

    public static int relativeHumidity(int temperatureC, int dewPointC) {
        double ratio = (112 - 0.1 * temperatureC + dewPointC) / (112 + 0.9 * temperatureC);
        return UnitConversions.round(100 * Math.pow(ratio, 8));
    }

    /**
     * Rothfusz regression; only meaningful above 79°F and 39% humidity.
     */
    public static OptionalInt heatIndex(int temperatureF, int humidityPercent) {
        if (temperatureF <= 79 || humidityPercent <= 39) {
            return OptionalInt.empty();
        }
        double t = temperatureF;
        double rh = humidityPercent;
        double index = -42.379 + 2.04901523 * t + 10.14333127 * rh - 0.22475541 * t * rh
                - 0.00683783 * t * t - 0.05481717 * rh * rh
                + 0.00122874 * t * t * rh + 0.00085282 * t * rh * rh
                - 0.00000199 * t * t * rh * rh;
        return OptionalInt.of(UnitConversions.round(index));
    }

    /**
     * NWS wind chill; requires a temperature below 51°F and more than 3 mph of wind.
     */
    public static OptionalInt windChill(int temperatureF, int windSpeedMph) {
        if (temperatureF >= 51 || windSpeedMph <= 3) {
            return OptionalInt.empty();
        }
        double v = Math.pow(windSpeedMph, 0.16);
        double chill = 35.74 + 0.6215 * temperatureF - 35.75 * v + 0.4275 * temperatureF * v;
        return OptionalInt.of(UnitConversions.round(chill));
    }
}
