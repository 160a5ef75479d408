package com.metarwatch.core.decoder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * A report split into whitespace-delimited groups. Token 0 is always the station
 * identifier; a leading report-type word is dropped and everything after {@code RMK} is
 * kept as undecoded remarks.
 */
public record RawReport(String stationId, List<String> tokens, String remarks) {
    private static final Set<String> REPORT_TYPES = Set.of("METAR", "SPECI");
    private static final String REMARKS_MARKER = "RMK";

    public RawReport {
        tokens = List.copyOf(tokens);
    }

    public static RawReport tokenize(String raw) {
        String trimmed = raw == null ? "" : raw.trim();
        List<String> groups = trimmed.isEmpty()
                ? new ArrayList<>()
                : new ArrayList<>(Arrays.asList(trimmed.split("\\s+")));
        if (!groups.isEmpty() && REPORT_TYPES.contains(groups.get(0))) {
            groups.remove(0);
        }

        String remarks = null;
        int marker = groups.indexOf(REMARKS_MARKER);
        if (marker >= 0) {
            List<String> trailing = groups.subList(marker + 1, groups.size());
            remarks = trailing.isEmpty() ? null : String.join(" ", trailing);
            groups = new ArrayList<>(groups.subList(0, marker));
        }

        String station = groups.isEmpty() ? null : groups.get(0);
        return new RawReport(station, groups, remarks);
    }

    public int size() {
        return tokens.size();
    }
}
