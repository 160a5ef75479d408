package com.metarwatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.metarwatch.collectors.metar.FetchedReport;
import com.metarwatch.collectors.metar.MetarSource;
import com.metarwatch.collectors.metar.ReportUnavailableException;
import com.metarwatch.core.decoder.ReportDecoder;
import com.metarwatch.core.util.JsonUtils;
import com.metarwatch.service.report.ReportFormatter;
import com.metarwatch.service.support.Observations;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private final MetarSource source = station -> switch (station) {
        case "KTIK" -> new FetchedReport("KTIK", Observations.WINTER_REPORT, Observations.WINTER_OBSERVED_AT);
        case "KEMP" -> new FetchedReport("KEMP", "", Observations.WINTER_OBSERVED_AT);
        default -> throw new ReportUnavailableException(station, ReportUnavailableException.Reason.STATION_NOT_FOUND);
    };
    private final ReportFormatter formatter = new ReportFormatter(
            Clock.fixed(Observations.WINTER_OBSERVED_AT.plus(Duration.ofMinutes(7)), ZoneOffset.UTC),
            ZoneOffset.UTC
    );

    @Test
    void printsFormattedReportsAndCountsFailures() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int failures = Main.printReports(
                Main.CliOptions.parse(new String[]{"ktik", "KZZZ", "KEMP"}),
                source,
                new ReportDecoder(),
                formatter,
                new PrintStream(buffer, true, StandardCharsets.UTF_8)
        );

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertEquals(2, failures);
        assertTrue(output.contains("Weather @ KTIK"));
        assertTrue(output.contains("Wind Chill................26°F"));
        assertTrue(output.contains("KZZZ: Station not found"));
        assertTrue(output.contains("KEMP: Data not available"));
    }

    @Test
    void jsonModePrintsTheDecodedObservation() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        int failures = Main.printReports(
                Main.CliOptions.parse(new String[]{"--json", "KTIK"}),
                source,
                new ReportDecoder(),
                formatter,
                new PrintStream(buffer, true, StandardCharsets.UTF_8)
        );

        JsonNode json = JsonUtils.objectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));
        assertEquals(0, failures);
        assertEquals("KTIK", json.get("station").asText());
        assertEquals(34, json.at("/observation/temperatureF").asInt());
        assertEquals(1019, json.at("/observation/pressureHPa").asInt());
        assertEquals("EXACT", json.at("/observation/visibility/qualifier").asText());
    }

    @Test
    void optionsParseStationsAndJsonFlag() {
        Main.CliOptions options = Main.CliOptions.parse(new String[]{"--json", " ktik", "kokc"});

        assertTrue(options.json());
        assertEquals(List.of("KTIK", "KOKC"), options.stations());
        assertFalse(Main.CliOptions.parse(new String[0]).json());
        assertThrows(IllegalArgumentException.class, () -> Main.CliOptions.parse(new String[]{"--verbose"}));
    }

    @Test
    void zoneComesFromEnvironmentWithWarningOnUnknownIds() {
        List<String> warnings = new ArrayList<>();

        assertEquals(ZoneId.of("America/Chicago"),
                Main.resolveZone(Map.of("METAR_ZONE", "America/Chicago"), warnings::add));
        assertEquals(ZoneId.systemDefault(), Main.resolveZone(Map.of(), warnings::add));
        assertTrue(warnings.isEmpty());

        assertEquals(ZoneId.systemDefault(), Main.resolveZone(Map.of("METAR_ZONE", "Mars/Olympus"), warnings::add));
        assertEquals(1, warnings.size());
    }
}
