package com.metarwatch.core.util;

import java.util.Locale;

/**
 * Conversions between the units a METAR reports in and the US customary units the
 * observation carries. All rounding is half away from zero.
 */
public final class UnitConversions {
    public static final double MPH_PER_KNOT = 1.1508;
    public static final double MPH_PER_METER_PER_SECOND = 2.23694;
    public static final double MPH_PER_KILOMETER_PER_HOUR = 0.621371;
    public static final double METERS_PER_MILE = 621.4;
    public static final double INHG_PER_HPA = 0.02953;

    private UnitConversions() {
    }

    public enum SpeedUnit {
        KT(MPH_PER_KNOT),
        MPS(MPH_PER_METER_PER_SECOND),
        KMH(MPH_PER_KILOMETER_PER_HOUR);

        private final double mphFactor;

        SpeedUnit(double mphFactor) {
            this.mphFactor = mphFactor;
        }

        public static SpeedUnit fromCode(String code) {
            return valueOf(code.toUpperCase(Locale.ROOT));
        }
    }

    public static int toMph(int speed, SpeedUnit unit) {
        return round(unit.mphFactor * speed);
    }

    public static int celsiusToFahrenheit(int celsius) {
        return round(1.8 * celsius + 32);
    }

    /**
     * Meters to statute miles: one decimal place up to five miles, whole miles beyond.
     */
    public static double metersToMiles(int meters) {
        double miles = roundTo(meters / METERS_PER_MILE, 1);
        return miles > 5 ? round(miles) : miles;
    }

    public static int inHgToHPa(double inHg) {
        return round(inHg / INHG_PER_HPA);
    }

    public static double hPaToInHg(int hPa) {
        return roundTo(INHG_PER_HPA * hPa, 2);
    }

    public static int round(double value) {
        return (int) (Math.signum(value) * Math.floor(Math.abs(value) + 0.5));
    }

    public static double roundTo(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.signum(value) * Math.floor(Math.abs(value) * scale + 0.5) / scale;
    }
}
