package com.metarwatch.core.decoder;

import com.metarwatch.core.util.UnitConversions;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code Annnn} (hundredths of an inch of mercury) or {@code Qnnnn} (hectopascals). Both
 * units are stored whichever was reported.
 */
final class AltimeterDecoder implements GroupDecoder {
    private static final Pattern ALTIMETER = Pattern.compile("([AQ])(\\d{4})\\S*");

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        Matcher matcher = ALTIMETER.matcher(token);
        if (!matcher.matches()) {
            return GroupOutcome.NO_MATCH;
        }

        String digits = matcher.group(2);
        if ("A".equals(matcher.group(1))) {
            double inHg = Double.parseDouble(digits.substring(0, 2) + "." + digits.substring(2));
            draft.pressure(inHg, UnitConversions.inHgToHPa(inHg));
        } else {
            int hPa = Integer.parseInt(digits);
            draft.pressure(UnitConversions.hPaToInHg(hPa), hPa);
        }
        return GroupOutcome.CONSUMED;
    }
}
