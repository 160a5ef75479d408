package com.metarwatch.collectors.api;

import com.metarwatch.core.model.StationObservation;

import java.util.Optional;

/**
 * Latest decoded observation per station.
 */
public interface ObservationStore {
    Optional<StationObservation> getObservation(String station);

    void putObservation(StationObservation observation);
}
