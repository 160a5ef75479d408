package com.metarwatch.service.runtime;

import com.metarwatch.collectors.api.CollectorContext;
import com.metarwatch.collectors.api.CollectorResult;
import com.metarwatch.collectors.config.MetarCollectorConfig;
import com.metarwatch.collectors.metar.MetarCollector;
import com.metarwatch.collectors.metar.MetarSource;
import com.metarwatch.collectors.metar.MockMetarSource;
import com.metarwatch.core.bus.EventBus;
import com.metarwatch.core.events.AlertRaised;
import com.metarwatch.core.events.ObservationUpdated;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.service.support.Observations;
import com.metarwatch.service.support.TestObservationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerServiceTest {
    @TempDir
    Path tempDir;

    private MockMetarSource source;

    @BeforeEach
    void writeFixture() throws Exception {
        Path fixture = tempDir.resolve("metars.json");
        Files.writeString(fixture, """
                {"reports":[
                  {"station":"KTIK","rawText":"%s","observedAt":"2026-01-19T18:53:00Z"},
                  {"station":"KOKC","rawText":"KOKC 191852Z 18012KT 2SM -RA BR OVC030 12/11 A2992","observedAt":"2026-01-19T18:52:00Z"},
                  {"station":"KEMP","rawText":" ","observedAt":"2026-01-19T18:50:00Z"}
                ]}
                """.formatted(Observations.WINTER_REPORT));
        source = new MockMetarSource(fixture);
    }

    @Test
    void runOnceAllCollectorsPollsOnlyEnabledMetarCollectors() {
        AtomicInteger disabledFetches = new AtomicInteger();
        MetarSource disabledSource = station -> {
            disabledFetches.incrementAndGet();
            return source.fetch(station);
        };
        TestObservationStore store = new TestObservationStore();
        EventBus bus = new EventBus();
        List<ObservationUpdated> updates = new CopyOnWriteArrayList<>();
        bus.subscribe(ObservationUpdated.class, updates::add);

        SchedulerService scheduler = new SchedulerService(
                List.of(
                        scheduled(new MetarCollector(source), true),
                        scheduled(new MetarCollector(disabledSource), false)
                ),
                context(bus, store, List.of("KTIK", "KOKC"))
        );

        try {
            List<CollectorResult> results = scheduler.runOnceAllCollectors();

            assertEquals(1, results.size());
            assertTrue(results.get(0).success());
            assertEquals(2L, results.get(0).stats().get("successes"));
            assertEquals(0, disabledFetches.get());
            assertEquals(2, updates.size());

            StationObservation ktik = store.getObservation("KTIK").orElseThrow();
            assertEquals(34, ktik.observation().temperatureF());
            assertEquals(Observations.WINTER_OBSERVED_AT, ktik.observedAt());
            assertEquals("light rain & mist", store.getObservation("KOKC").orElseThrow().observation().presentConditions());
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void stationFailuresAreAlertedWithoutLosingTheOtherStations() {
        TestObservationStore store = new TestObservationStore();
        EventBus bus = new EventBus();
        List<AlertRaised> alerts = new CopyOnWriteArrayList<>();
        bus.subscribe(AlertRaised.class, alerts::add);

        SchedulerService scheduler = new SchedulerService(
                List.of(scheduled(new MetarCollector(source), true)),
                context(bus, store, List.of("KTIK", "KZZZ", "KEMP"))
        );

        try {
            CollectorResult result = scheduler.runOnceAllCollectors().get(0);

            assertFalse(result.success());
            assertEquals(List.of("KZZZ", "KEMP"), result.stats().get("failed"));
            assertTrue(store.getObservation("KTIK").isPresent());
            assertTrue(store.getObservation("KEMP").isEmpty());
            assertTrue(alerts.stream().anyMatch(alert ->
                    alert.message().equals("METAR unavailable for KZZZ: Station not found")));
            assertTrue(alerts.stream().anyMatch(alert ->
                    alert.message().equals("METAR unavailable for KEMP: Data not available")));
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void collectorThatCrashesBecomesSchedulerAlert() {
        EventBus bus = new EventBus();
        List<AlertRaised> alerts = new CopyOnWriteArrayList<>();
        bus.subscribe(AlertRaised.class, alerts::add);
        CollectorContext unconfigured = new CollectorContext(
                HttpClient.newHttpClient(),
                bus,
                new TestObservationStore(),
                Clock.fixed(Instant.parse("2026-01-19T19:00:00Z"), ZoneOffset.UTC),
                Duration.ofSeconds(2),
                Map.of()
        );

        SchedulerService scheduler = new SchedulerService(
                List.of(scheduled(new MetarCollector(source), true)),
                unconfigured
        );

        try {
            CollectorResult result = scheduler.runOnceAllCollectors().get(0);

            assertFalse(result.success());
            assertEquals("Collector run failed: metarCollector", result.message());
            assertEquals(1, alerts.size());
            assertEquals("metarCollector", alerts.get(0).details().get("collector"));
            assertTrue(alerts.get(0).message().endsWith("Missing required config key: metarCollector"));
        } finally {
            scheduler.shutdown();
        }
    }

    @Test
    void startedSchedulerKeepsPollingUntilShutdown() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        MetarSource counting = station -> {
            fetches.incrementAndGet();
            return source.fetch(station);
        };
        List<String> stations = List.of("KTIK", "KOKC");

        SchedulerService scheduler = new SchedulerService(
                List.of(new SchedulerService.ScheduledCollector(
                        new MetarCollector(counting), Duration.ofMillis(5), true)),
                context(new EventBus(), new TestObservationStore(), stations),
                5
        );

        scheduler.start();
        Thread.sleep(80);
        scheduler.shutdown();
        int shortlyAfterShutdown = fetches.get();
        Thread.sleep(40);
        int settledAfterShutdown = fetches.get();

        assertTrue(shortlyAfterShutdown >= stations.size());
        // a tick already in flight may still fetch its stations
        assertTrue(settledAfterShutdown <= shortlyAfterShutdown + stations.size());
    }

    private static SchedulerService.ScheduledCollector scheduled(MetarCollector collector, boolean enabled) {
        return new SchedulerService.ScheduledCollector(collector, Duration.ofMinutes(10), enabled);
    }

    private static CollectorContext context(EventBus bus, TestObservationStore store, List<String> stations) {
        return new CollectorContext(
                HttpClient.newHttpClient(),
                bus,
                store,
                Clock.fixed(Instant.parse("2026-01-19T19:00:00Z"), ZoneOffset.UTC),
                Duration.ofSeconds(2),
                Map.of(MetarCollector.CONFIG_KEY, new MetarCollectorConfig(Duration.ofMinutes(10), stations))
        );
    }
}
