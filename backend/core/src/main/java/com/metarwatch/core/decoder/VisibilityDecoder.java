package com.metarwatch.core.decoder;

import com.metarwatch.core.model.CloudLayer;
import com.metarwatch.core.model.Visibility;
import com.metarwatch.core.model.VisibilityQualifier;
import com.metarwatch.core.util.UnitConversions;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prevailing visibility in one of its forms: {@code 10SM}, {@code M1/4SM}, {@code P6SM}, a
 * mixed number split over two tokens ({@code 1 1/2SM}), four-digit meters, or {@code CAVOK}.
 */
final class VisibilityDecoder implements GroupDecoder {
    private static final String STATUTE_MILES = "SM";
    private static final String KILOMETERS = "KM";
    private static final String CAVOK = "CAVOK";
    private static final Pattern METERS = Pattern.compile("\\d{4}");
    private static final Pattern FRACTION = Pattern.compile("(\\d{1,2})/(\\d{1,2})");
    private static final Pattern DECIMAL = Pattern.compile("\\d{1,3}(\\.\\d+)?");
    private static final double CAVOK_MILES = 7;
    // CAVOK stands in for visibility, runway, present weather and cloud groups.
    private static final int CAVOK_GROUP_SKIP = 4;

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        if (token.length() == 1 && Character.isDigit(token.charAt(0))) {
            session.holdWholeMile(token);
            return GroupOutcome.CONSUMED_REPEAT;
        }
        if (token.endsWith(STATUTE_MILES)) {
            decodeMiles(token.substring(0, token.length() - STATUTE_MILES.length()), session, draft);
            return GroupOutcome.CONSUMED;
        }
        if (token.endsWith(KILOMETERS)) {
            // kilometre visibility is not converted
            return GroupOutcome.CONSUMED;
        }
        if (METERS.matcher(token).matches()) {
            double miles = UnitConversions.metersToMiles(Integer.parseInt(token));
            draft.visibility(Visibility.miles(VisibilityQualifier.EXACT, miles));
            return GroupOutcome.CONSUMED;
        }
        if (CAVOK.equals(token)) {
            draft.visibility(Visibility.miles(VisibilityQualifier.AT_LEAST, CAVOK_MILES));
            session.clearConditions();
            draft.presentConditions("");
            draft.cloudLayer(CloudLayer.clearSkies());
            return GroupOutcome.consumedSkipping(CAVOK_GROUP_SKIP);
        }
        return GroupOutcome.NO_MATCH;
    }

    private static void decodeMiles(String value, ParseSession session, ObservationDraft draft) {
        VisibilityQualifier qualifier = VisibilityQualifier.EXACT;
        String amount = value;
        if (amount.startsWith("M")) {
            qualifier = VisibilityQualifier.AT_MOST;
            amount = amount.substring(1);
        } else if (amount.startsWith("P")) {
            qualifier = VisibilityQualifier.AT_LEAST;
            amount = amount.substring(1);
        }

        String wholeMile = session.takePendingWholeMile();
        OptionalDouble miles = parseMiles(amount);
        if (miles.isEmpty()) {
            return;
        }
        double total = miles.getAsDouble() + (wholeMile == null ? 0 : Integer.parseInt(wholeMile));
        draft.visibility(Visibility.miles(qualifier, total));
    }

    /**
     * Whole, fractional ({@code 3/4}) or decimal miles; empty when the amount is unreadable.
     */
    static OptionalDouble parseMiles(String amount) {
        Matcher fraction = FRACTION.matcher(amount);
        if (fraction.matches()) {
            int denominator = Integer.parseInt(fraction.group(2));
            return denominator == 0
                    ? OptionalDouble.empty()
                    : OptionalDouble.of((double) Integer.parseInt(fraction.group(1)) / denominator);
        }
        if (DECIMAL.matcher(amount).matches()) {
            return OptionalDouble.of(Double.parseDouble(amount));
        }
        return OptionalDouble.empty();
    }
}
