package com.metarwatch.core.decoder;

/**
 * METAR body groups in the order they must appear. Each kind is tried at most once in this
 * order; repeatable kinds may consume several consecutive tokens.
 */
enum GroupKind {
    TIME(SkippedGroupDecoder.once("\\d{6}Z")),
    STATION_TYPE(SkippedGroupDecoder.once("AUTO|COR")),
    WIND(new WindDecoder()),
    VARIABLE_WIND(SkippedGroupDecoder.once("\\d{3}V\\d{3}")),
    VISIBILITY(new VisibilityDecoder()),
    RUNWAY(SkippedGroupDecoder.repeating("R\\d{1,3}\\S*")),
    PRESENT_CONDITIONS(new PresentConditionsDecoder()),
    CLOUD_LAYER(new CloudLayerDecoder()),
    TEMPERATURE(new TemperatureDecoder()),
    ALTIMETER(new AltimeterDecoder());

    private final GroupDecoder decoder;

    GroupKind(GroupDecoder decoder) {
        this.decoder = decoder;
    }

    GroupDecoder decoder() {
        return decoder;
    }
}
