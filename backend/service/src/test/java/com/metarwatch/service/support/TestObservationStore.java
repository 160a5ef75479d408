package com.metarwatch.service.support;

import com.metarwatch.collectors.api.ObservationStore;
import com.metarwatch.core.model.StationObservation;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class TestObservationStore implements ObservationStore {
    private final Map<String, StationObservation> observations = new ConcurrentHashMap<>();

    @Override
    public Optional<StationObservation> getObservation(String station) {
        return Optional.ofNullable(observations.get(station));
    }

    @Override
    public void putObservation(StationObservation observation) {
        observations.put(observation.station(), observation);
    }
}
