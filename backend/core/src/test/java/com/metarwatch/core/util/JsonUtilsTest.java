package com.metarwatch.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metarwatch.core.model.CloudLayer;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.core.model.Visibility;
import com.metarwatch.core.model.VisibilityQualifier;
import com.metarwatch.core.model.WeatherObservation;
import com.metarwatch.core.model.Wind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void observationSerializesWithoutAbsentGroups() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        StationObservation stored = new StationObservation(
                "KTIK",
                Instant.parse("2026-02-01T18:53:00Z"),
                "KTIK 011853Z 00000KT 10SM CLR 01/M04 A3010",
                new WeatherObservation(Wind.calm(), Visibility.miles(VisibilityQualifier.AT_LEAST, 7),
                        null, new CloudLayer("CLR", "clear", null),
                        1, 34, -4, 25, 70, null, null, 30.10, 1019, null)
        );

        JsonNode tree = mapper.readTree(mapper.writeValueAsString(stored));

        assertEquals("2026-02-01T18:53:00Z", tree.get("observedAt").asText());
        assertEquals("calm", tree.at("/observation/wind/direction").asText());
        assertFalse(tree.at("/observation/wind").has("calm"));
        assertFalse(tree.get("observation").has("presentConditions"));
        assertEquals("AT_LEAST", tree.at("/observation/visibility/qualifier").asText());

        StationObservation parsed = mapper.readValue(mapper.writeValueAsString(stored), StationObservation.class);
        assertEquals(stored, parsed);
    }

    @Test
    void unknownPropertiesAreIgnored() throws Exception {
        Wind wind = JsonUtils.objectMapper().readValue(
                "{\"direction\":\"NE\",\"speedMph\":10,\"unknown\":1}", Wind.class);

        assertEquals(new Wind("NE", 10, null), wind);
    }

    @Test
    void prettyJsonIsIndented() {
        String json = JsonUtils.toPrettyJson(new Wind("S", 14, 25));

        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"gustMph\" : 25"));
    }
}
