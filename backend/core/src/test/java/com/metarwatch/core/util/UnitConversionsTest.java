package com.metarwatch.core.util;

import com.metarwatch.core.util.UnitConversions.SpeedUnit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UnitConversionsTest {
    @Test
    void roundsHalfAwayFromZero() {
        assertEquals(3, UnitConversions.round(2.5));
        assertEquals(-3, UnitConversions.round(-2.5));
        assertEquals(-2, UnitConversions.round(-2.4));
        assertEquals(0, UnitConversions.round(0.0));
        assertEquals(-0.1, UnitConversions.roundTo(-0.05, 1), 1e-9);
    }

    @Test
    void speedsConvertToMilesPerHour() {
        assertEquals(17, UnitConversions.toMph(15, SpeedUnit.KT));
        assertEquals(22, UnitConversions.toMph(10, SpeedUnit.MPS));
        assertEquals(12, UnitConversions.toMph(20, SpeedUnit.KMH));
        assertEquals(SpeedUnit.MPS, SpeedUnit.fromCode("mps"));
        assertThrows(IllegalArgumentException.class, () -> SpeedUnit.fromCode("MPH"));
    }

    @Test
    void celsiusConvertsToWholeFahrenheit() {
        assertEquals(32, UnitConversions.celsiusToFahrenheit(0));
        assertEquals(34, UnitConversions.celsiusToFahrenheit(1));
        assertEquals(25, UnitConversions.celsiusToFahrenheit(-4));
        assertEquals(-40, UnitConversions.celsiusToFahrenheit(-40));
    }

    @Test
    void metersKeepOneDecimalOnlyUpToFiveMiles() {
        assertEquals(2.6, UnitConversions.metersToMiles(1600), 1e-9);
        assertEquals(4.8, UnitConversions.metersToMiles(3000), 1e-9);
        assertEquals(8.0, UnitConversions.metersToMiles(5000), 1e-9);
        assertEquals(0.0, UnitConversions.metersToMiles(0), 1e-9);
    }

    @Test
    void pressureConvertsBothWays() {
        assertEquals(1013, UnitConversions.inHgToHPa(29.92));
        assertEquals(1019, UnitConversions.inHgToHPa(30.10));
        assertEquals(29.91, UnitConversions.hPaToInHg(1013), 1e-9);
        assertEquals(29.47, UnitConversions.hPaToInHg(998), 1e-9);
    }
}
