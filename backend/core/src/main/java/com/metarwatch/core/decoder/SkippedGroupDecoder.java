package com.metarwatch.core.decoder;

import java.util.regex.Pattern;

/**
 * Recognizes a group the observation does not carry (report time, station type, variable
 * wind sector, runway visual range) so that it is consumed in position and not mistaken
 * for a later group.
 */
final class SkippedGroupDecoder implements GroupDecoder {
    private final Pattern pattern;
    private final boolean repeatable;

    private SkippedGroupDecoder(Pattern pattern, boolean repeatable) {
        this.pattern = pattern;
        this.repeatable = repeatable;
    }

    static SkippedGroupDecoder once(String regex) {
        return new SkippedGroupDecoder(Pattern.compile(regex), false);
    }

    static SkippedGroupDecoder repeating(String regex) {
        return new SkippedGroupDecoder(Pattern.compile(regex), true);
    }

    @Override
    public GroupOutcome attempt(String token, ParseSession session, ObservationDraft draft) {
        if (!pattern.matcher(token).matches()) {
            return GroupOutcome.NO_MATCH;
        }
        return repeatable ? GroupOutcome.CONSUMED_REPEAT : GroupOutcome.CONSUMED;
    }
}
