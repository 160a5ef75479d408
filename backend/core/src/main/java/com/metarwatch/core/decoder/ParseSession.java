package com.metarwatch.core.decoder;

/**
 * Cursor and carry-over state for a single decode call. A new session is created for every
 * report, so nothing decoded from one report can leak into the next.
 */
final class ParseSession {
    private static final String CONDITIONS_JOIN = " & ";

    private final RawReport report;
    private int tokenCursor = 1;
    private int groupCursor;
    private String pendingWholeMile;
    private final StringBuilder conditionsAccumulator = new StringBuilder();

    ParseSession(RawReport report) {
        this.report = report;
    }

    boolean hasToken() {
        return tokenCursor < report.size();
    }

    String currentToken() {
        return report.tokens().get(tokenCursor);
    }

    int tokenCursor() {
        return tokenCursor;
    }

    int groupCursor() {
        return groupCursor;
    }

    void consumeToken() {
        tokenCursor++;
    }

    void advanceGroups(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("group cursor cannot move backwards");
        }
        groupCursor += count;
    }

    String pendingWholeMile() {
        return pendingWholeMile;
    }

    void holdWholeMile(String wholeMile) {
        pendingWholeMile = wholeMile;
    }

    String takePendingWholeMile() {
        String held = pendingWholeMile;
        pendingWholeMile = null;
        return held;
    }

    String appendConditions(String phrase) {
        if (conditionsAccumulator.length() > 0) {
            conditionsAccumulator.append(CONDITIONS_JOIN);
        }
        conditionsAccumulator.append(phrase);
        return conditionsAccumulator.toString();
    }

    void clearConditions() {
        conditionsAccumulator.setLength(0);
    }
}
