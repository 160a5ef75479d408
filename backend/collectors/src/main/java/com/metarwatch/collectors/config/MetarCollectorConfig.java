package com.metarwatch.collectors.config;

import java.time.Duration;
import java.util.List;

public record MetarCollectorConfig(Duration interval, List<String> stations) {
    public MetarCollectorConfig {
        stations = stations == null ? List.of() : List.copyOf(stations);
    }
}
