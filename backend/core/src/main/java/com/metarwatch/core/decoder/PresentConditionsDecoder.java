package com.metarwatch.core.decoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Present weather, e.g. {@code -RA}, {@code +TSRAGR}, {@code VCSH}. Codes follow FMH-1
 * section 12.6.8; consecutive weather groups are joined into one description.
 */
final class PresentConditionsDecoder implements GroupDecoder {
    private static final Pattern CONDITIONS = Pattern.compile(
            "(-|\\+|VC)?((?:TS|SH|FZ|BL|DR|MI|BC|PR|RA|DZ|SN|SG|GR|GS|PE|PL|IC|UP"
                    + "|BR|FG|FU|VA|DU|SA|HZ|PY|PO|SQ|FC|SS|DS)+)"
    );
    private static final String SHOWERS = "SH";
    private static final int CODE_LENGTH = 2;

    private static final Map<String, String> QUALIFIERS = Map.of(
            "-", "light",
            "+", "heavy",
            "VC", "nearby"
    );

    private static final Map<String, String> PHENOMENA = Map.ofEntries(
            entry("MI", "shallow"),
            entry("PR", "partial"),
            entry("BC", "patches of"),
            entry("DR", "low drifting"),
            entry("BL", "blowing"),
            entry("SH", "showers"),
            entry("TS", "thunderstorm"),
            entry("FZ", "freezing"),
            entry("DZ", "drizzle"),
            entry("RA", "rain"),
            entry("SN", "snow"),
            entry("SG", "snow grains"),
            entry("IC", "ice crystals"),
            entry("PE", "ice pellets"),
            entry("PL", "ice pellets"),
            entry("GR", "hail"),
            entry("GS", "small hail"),
            entry("UP", "unknown"),
            entry("BR", "mist"),
            entry("FG", "fog"),
            entry("FU", "smoke"),
            entry("VA", "volcanic ash"),
            entry("DU", "widespread dust"),
            entry("SA", "sand"),
            entry("HZ", "haze"),
            entry("PY", "spray"),
            entry("PO", "dust whirls"),
            entry("SQ", "squalls"),
            entry("FC", "tornado"),
            entry("SS", "duststorm"),
            entry("DS", "duststorm")
    );

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        Matcher matcher = CONDITIONS.matcher(token);
        if (!matcher.matches()) {
            return GroupOutcome.NO_MATCH;
        }
        draft.presentConditions(session.appendConditions(describe(matcher.group(1), matcher.group(2))));
        return GroupOutcome.CONSUMED_REPEAT;
    }

    static String describe(String qualifier, String codes) {
        List<String> words = new ArrayList<>();
        if (qualifier != null) {
            words.add(QUALIFIERS.get(qualifier));
        }
        String ordered = showersLast(codes);
        for (int i = 0; i < ordered.length(); i += CODE_LENGTH) {
            words.add(PHENOMENA.get(ordered.substring(i, i + CODE_LENGTH)));
        }
        return String.join(" ", words);
    }

    // "SHRA" reads as "rain showers"
    private static String showersLast(String codes) {
        if (!codes.startsWith(SHOWERS) || codes.length() < 2 * CODE_LENGTH) {
            return codes;
        }
        return codes.substring(CODE_LENGTH, 2 * CODE_LENGTH) + SHOWERS + codes.substring(2 * CODE_LENGTH);
    }
}
