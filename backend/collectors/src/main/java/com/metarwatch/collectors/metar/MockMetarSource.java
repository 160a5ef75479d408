package com.metarwatch.collectors.metar;

import com.metarwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves canned reports from a JSON fixture, for offline runs and tests.
 */
public class MockMetarSource implements MetarSource {
    private final Map<String, FetchedReport> reports = new ConcurrentHashMap<>();

    public MockMetarSource(Path jsonFile) {
        try (InputStream in = Files.newInputStream(jsonFile)) {
            MetarFixture fixture = JsonUtils.objectMapper().readValue(in, MetarFixture.class);
            fixture.reports().forEach(entry -> reports.put(
                    normalize(entry.station()),
                    new FetchedReport(normalize(entry.station()), entry.rawText(), entry.observedAt())
            ));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading METAR fixture: " + jsonFile, e);
        }
    }

    @Override
    public FetchedReport fetch(String station) {
        FetchedReport report = reports.get(normalize(station));
        if (report == null) {
            throw new ReportUnavailableException(station, ReportUnavailableException.Reason.STATION_NOT_FOUND);
        }
        return report;
    }

    private static String normalize(String station) {
        return station.trim().toUpperCase(Locale.ROOT);
    }

    private record MetarFixture(List<MetarEntry> reports) {
    }

    private record MetarEntry(String station, String rawText, Instant observedAt) {
    }
}
