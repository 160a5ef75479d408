package com.metarwatch.core.decoder;

import com.metarwatch.core.model.Wind;
import com.metarwatch.core.util.ComfortIndices;
import com.metarwatch.core.util.UnitConversions;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code tt/dd} in whole degrees Celsius, {@code M} marking below zero. The dew point may be
 * missing or {@code XX}. Humidity, heat index and wind chill are derived here because this
 * is the first point at which temperature and the already decoded wind are both known.
 */
final class TemperatureDecoder implements GroupDecoder {
    private static final Pattern TEMPERATURE = Pattern.compile("(M?\\d{2})/(M?\\d{2}|XX)?");
    private static final String NOT_REPORTED = "XX";

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        Matcher matcher = TEMPERATURE.matcher(token);
        if (!matcher.matches()) {
            return GroupOutcome.NO_MATCH;
        }

        int temperatureC = celsius(matcher.group(1));
        int temperatureF = UnitConversions.celsiusToFahrenheit(temperatureC);
        draft.temperature(temperatureC, temperatureF);

        Wind wind = draft.wind();
        if (wind != null && !wind.isCalm() && wind.speedMph() != null) {
            ComfortIndices.windChill(temperatureF, wind.speedMph()).ifPresent(draft::windChillF);
        }

        String dew = matcher.group(2);
        if (dew != null && !NOT_REPORTED.equals(dew)) {
            int dewPointC = celsius(dew);
            draft.dewPoint(dewPointC, UnitConversions.celsiusToFahrenheit(dewPointC));
            int humidity = ComfortIndices.relativeHumidity(temperatureC, dewPointC);
            draft.relativeHumidityPercent(humidity);
            ComfortIndices.heatIndex(temperatureF, humidity).ifPresent(draft::heatIndexF);
        }
        return GroupOutcome.CONSUMED;
    }

    private static int celsius(String value) {
        return Integer.parseInt(value.replace('M', '-'));
    }
}
