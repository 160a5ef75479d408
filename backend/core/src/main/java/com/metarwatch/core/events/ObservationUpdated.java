package com.metarwatch.core.events;

import java.time.Instant;

public record ObservationUpdated(
        Instant timestamp,
        String station,
        Instant observedAt,
        Integer temperatureF,
        String presentConditions
) implements Event {
    @Override
    public String type() {
        return "ObservationUpdated";
    }
}
