package com.metarwatch.service.report;

import java.time.Duration;
import java.time.Instant;

/**
 * Elapsed time since an observation: {@code "42 min"} for anything under 91 minutes,
 * {@code "2:05 hr"} beyond.
 */
public final class ObservationAge {
    private static final long MINUTES_THRESHOLD = 91;

    private ObservationAge() {
    }

    public static String describe(Instant observedAt, Instant now) {
        long minutes = Math.floorDiv(Duration.between(observedAt, now).getSeconds(), 60);
        if (minutes < MINUTES_THRESHOLD) {
            return minutes + " min";
        }
        return String.format("%d:%02d hr", minutes / 60, minutes % 60);
    }
}
