package com.metarwatch.core.decoder;

import com.metarwatch.core.model.CloudLayer;
import com.metarwatch.core.model.Visibility;
import com.metarwatch.core.model.WeatherObservation;
import com.metarwatch.core.model.Wind;

/**
 * Mutable accumulator filled in by the group decoders, frozen into a
 * {@link WeatherObservation} once the dispatcher stops.
 */
final class ObservationDraft {
    private Wind wind;
    private Visibility visibility;
    private String presentConditions;
    private CloudLayer cloudLayer;
    private Integer temperatureC;
    private Integer temperatureF;
    private Integer dewPointC;
    private Integer dewPointF;
    private Integer relativeHumidityPercent;
    private Integer heatIndexF;
    private Integer windChillF;
    private Double pressureInHg;
    private Integer pressureHPa;

    Wind wind() {
        return wind;
    }

    void wind(Wind wind) {
        this.wind = wind;
    }

    Visibility visibility() {
        return visibility;
    }

    void visibility(Visibility visibility) {
        this.visibility = visibility;
    }

    String presentConditions() {
        return presentConditions;
    }

    void presentConditions(String presentConditions) {
        this.presentConditions = presentConditions;
    }

    CloudLayer cloudLayer() {
        return cloudLayer;
    }

    void cloudLayer(CloudLayer cloudLayer) {
        this.cloudLayer = cloudLayer;
    }

    void temperature(int celsius, int fahrenheit) {
        this.temperatureC = celsius;
        this.temperatureF = fahrenheit;
    }

    void dewPoint(int celsius, int fahrenheit) {
        this.dewPointC = celsius;
        this.dewPointF = fahrenheit;
    }

    void relativeHumidityPercent(int percent) {
        this.relativeHumidityPercent = percent;
    }

    void heatIndexF(int heatIndexF) {
        this.heatIndexF = heatIndexF;
    }

    void windChillF(int windChillF) {
        this.windChillF = windChillF;
    }

    void pressure(double inHg, int hPa) {
        this.pressureInHg = inHg;
        this.pressureHPa = hPa;
    }

    WeatherObservation toObservation(String remarks) {
        return new WeatherObservation(
                wind,
                visibility,
                presentConditions,
                cloudLayer,
                temperatureC,
                temperatureF,
                dewPointC,
                dewPointF,
                relativeHumidityPercent,
                heatIndexF,
                windChillF,
                pressureInHg,
                pressureHPa,
                remarks
        );
    }
}
