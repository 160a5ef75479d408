package com.metarwatch.core.decoder;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decodes the body of a METAR into a {@link com.metarwatch.core.model.WeatherObservation}.
 *
 * <p>Groups are optional but strictly ordered, so decoding is a single forward scan: each
 * {@link GroupKind} in turn looks at the current token and either consumes it or lets the
 * next kind try. Repeatable kinds keep the cursor on themselves until a token no longer
 * matches. Nothing is ever re-read, and tokens left over when the kinds run out (or
 * anything after {@code RMK}) are ignored.
 *
 * <p>Instances hold no state and may be shared between threads.
 */
public final class ReportDecoder {
    private static final Logger LOGGER = Logger.getLogger(ReportDecoder.class.getName());
    private static final List<GroupKind> ORDER = List.of(GroupKind.values());

    public DecodeResult decode(String rawReport) {
        if (rawReport == null || rawReport.isBlank()) {
            return DecodeResult.noData();
        }

        RawReport report = RawReport.tokenize(rawReport);
        ParseSession session = new ParseSession(report);
        ObservationDraft draft = new ObservationDraft();

        while (session.groupCursor() < ORDER.size() && session.hasToken()) {
            GroupKind kind = ORDER.get(session.groupCursor());
            GroupOutcome outcome = kind.decoder().attempt(session.currentToken(), session, draft);
            if (outcome.consumed()) {
                session.consumeToken();
            }
            session.advanceGroups(outcome.groupAdvance());
        }

        if (session.hasToken() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Ignored trailing groups for " + report.stationId() + ": "
                    + String.join(" ", report.tokens().subList(session.tokenCursor(), report.size())));
        }
        return DecodeResult.decoded(draft.toObservation(report.remarks()));
    }
}
