package com.metarwatch.core.decoder;

import com.metarwatch.core.model.WeatherObservation;

/**
 * Either a (possibly sparse) observation or {@link DecodeError#NO_DATA} for an empty report.
 */
public record DecodeResult(WeatherObservation observation, DecodeError error) {
    public static DecodeResult decoded(WeatherObservation observation) {
        return new DecodeResult(observation, null);
    }

    public static DecodeResult noData() {
        return new DecodeResult(null, DecodeError.NO_DATA);
    }

    public boolean isNoData() {
        return error == DecodeError.NO_DATA;
    }
}
