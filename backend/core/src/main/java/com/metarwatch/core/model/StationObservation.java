package com.metarwatch.core.model;

import java.time.Instant;

public record StationObservation(
        String station,
        Instant observedAt,
        String rawReport,
        WeatherObservation observation
) {
}
