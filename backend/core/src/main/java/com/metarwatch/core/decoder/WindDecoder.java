package com.metarwatch.core.decoder;

import com.metarwatch.core.model.Wind;
import com.metarwatch.core.util.UnitConversions;
import com.metarwatch.core.util.UnitConversions.SpeedUnit;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code dddssKT}, {@code dddssGggKT} or {@code VRBssKT}; speed and gust may be three digits
 * and the unit may also be {@code MPS} or {@code KMH}. {@code 00000} is calm.
 */
final class WindDecoder implements GroupDecoder {
    private static final Pattern CALM = Pattern.compile("00000(KT|MPS|KMH)");
    private static final Pattern WIND = Pattern.compile("(\\d{3}|VRB)(\\d{2,3})(?:G(\\d{2,3}))?(KT|MPS|KMH)");
    private static final List<String> COMPASS = List.of(
            "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
            "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"
    );

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        if (CALM.matcher(token).matches()) {
            draft.wind(Wind.calm());
            return GroupOutcome.CONSUMED;
        }
        Matcher matcher = WIND.matcher(token);
        if (!matcher.matches()) {
            return GroupOutcome.NO_MATCH;
        }

        SpeedUnit unit = SpeedUnit.fromCode(matcher.group(4));
        int speed = UnitConversions.toMph(Integer.parseInt(matcher.group(2)), unit);
        Integer gust = matcher.group(3) == null
                ? null
                : UnitConversions.toMph(Integer.parseInt(matcher.group(3)), unit);
        draft.wind(new Wind(direction(matcher.group(1)), speed, gust));
        return GroupOutcome.CONSUMED;
    }

    static String direction(String code) {
        if ("VRB".equals(code)) {
            return Wind.VARIES;
        }
        int degrees = Integer.parseInt(code);
        return COMPASS.get(UnitConversions.round(degrees / 22.5) % COMPASS.size());
    }
}
