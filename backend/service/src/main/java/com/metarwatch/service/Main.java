package com.metarwatch.service;

import com.metarwatch.collectors.api.CollectorContext;
import com.metarwatch.collectors.config.MetarCollectorConfig;
import com.metarwatch.collectors.metar.FetchedReport;
import com.metarwatch.collectors.metar.MetarCollector;
import com.metarwatch.collectors.metar.MetarSource;
import com.metarwatch.collectors.metar.ReportUnavailableException;
import com.metarwatch.core.bus.EventBus;
import com.metarwatch.core.decoder.DecodeResult;
import com.metarwatch.core.decoder.ReportDecoder;
import com.metarwatch.core.events.AlertRaised;
import com.metarwatch.core.events.ObservationUpdated;
import com.metarwatch.core.model.CollectorConfig;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.core.util.JsonUtils;
import com.metarwatch.service.awc.AviationWeatherClient;
import com.metarwatch.service.config.ConfigLoader;
import com.metarwatch.service.http.HttpClientFactory;
import com.metarwatch.service.report.ReportFormatter;
import com.metarwatch.service.runtime.SchedulerService;
import com.metarwatch.service.store.JsonFileObservationStore;

import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final String JSON_FLAG = "--json";

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Map<String, String> env = System.getenv();
        CliOptions options = CliOptions.parse(args);
        Clock clock = Clock.systemUTC();
        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        AviationWeatherClient source = new AviationWeatherClient(
                httpClient,
                AviationWeatherClient.DEFAULT_ENDPOINT,
                Duration.ofSeconds(6),
                env.getOrDefault("AWC_USER_AGENT", AviationWeatherClient.DEFAULT_USER_AGENT)
        );

        if (!options.stations().isEmpty()) {
            ReportFormatter formatter = new ReportFormatter(clock, resolveZone(env, LOGGER::warning));
            int failures = printReports(options, source, new ReportDecoder(), formatter, System.out);
            if (failures > 0) {
                System.exit(1);
            }
            return;
        }
        runDaemon(httpClient, source, clock);
    }

    static int printReports(
            CliOptions options,
            MetarSource source,
            ReportDecoder decoder,
            ReportFormatter formatter,
            PrintStream out
    ) {
        int failures = 0;
        for (String station : options.stations()) {
            try {
                FetchedReport report = source.fetch(station);
                DecodeResult decoded = decoder.decode(report.rawText());
                if (decoded.isNoData()) {
                    out.println(station + ": " + decoded.error().label());
                    failures++;
                    continue;
                }
                StationObservation observation = new StationObservation(
                        report.station(),
                        report.observedAt(),
                        report.rawText(),
                        decoded.observation()
                );
                out.println(options.json() ? JsonUtils.toPrettyJson(observation) : formatter.format(observation));
            } catch (ReportUnavailableException e) {
                out.println(station + ": " + e.reason().label());
                failures++;
            }
        }
        return failures;
    }

    private static void runDaemon(HttpClient httpClient, MetarSource source, Clock clock) throws InterruptedException {
        Path configDir = Path.of("config");
        Path stateFile = Path.of("state/observations.json");

        EventBus eventBus = new EventBus();
        eventBus.subscribe(ObservationUpdated.class, event -> LOGGER.info(() -> event.station()
                + " observed " + event.observedAt() + ": " + event.temperatureF() + "F"
                + (event.presentConditions() == null ? "" : ", " + event.presentConditions())));
        eventBus.subscribe(AlertRaised.class, event -> LOGGER.warning(event.category() + ": " + event.message()));

        JsonFileObservationStore store = new JsonFileObservationStore(stateFile);
        MetarCollectorConfig metarConfig = ConfigLoader.loadMetar(configDir);
        List<CollectorConfig> collectorConfigs = ConfigLoader.loadCollectors(configDir);
        Map<String, CollectorConfig> collectorConfigByName = new HashMap<>();
        for (CollectorConfig cfg : collectorConfigs) {
            collectorConfigByName.put(cfg.name(), cfg);
        }

        MetarCollector metarCollector = new MetarCollector(
                source,
                new ReportDecoder(),
                intervalFor(collectorConfigByName, "metarCollector", metarConfig.interval())
        );
        CollectorContext context = new CollectorContext(
                httpClient,
                eventBus,
                store,
                clock,
                Duration.ofSeconds(15),
                Map.of(MetarCollector.CONFIG_KEY, metarConfig)
        );

        SchedulerService scheduler = new SchedulerService(List.of(new SchedulerService.ScheduledCollector(
                metarCollector,
                metarCollector.interval(),
                isEnabled(collectorConfigByName, "metarCollector", true)
        )), context);

        LOGGER.info(() -> "Watching " + metarConfig.stations() + " every " + metarCollector.interval());
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            scheduler.shutdown();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static ZoneId resolveZone(Map<String, String> env, Consumer<String> warn) {
        String raw = env.get("METAR_ZONE");
        if (raw == null || raw.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(raw.trim());
        } catch (DateTimeException e) {
            warn.accept("Unknown METAR_ZONE=" + raw + ", using " + ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    private static Duration intervalFor(Map<String, CollectorConfig> map, String name, Duration fallback) {
        CollectorConfig config = map.get(name);
        if (config == null) {
            return fallback;
        }
        return Duration.ofSeconds(Math.max(1, config.intervalSeconds()));
    }

    private static boolean isEnabled(Map<String, CollectorConfig> map, String name, boolean fallback) {
        CollectorConfig config = map.get(name);
        return config == null ? fallback : config.enabled();
    }

    record CliOptions(List<String> stations, boolean json) {
        static CliOptions parse(String[] args) {
            List<String> stations = new ArrayList<>();
            boolean json = false;
            for (String arg : args) {
                if (JSON_FLAG.equals(arg)) {
                    json = true;
                } else if (arg.startsWith("-")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (!arg.isBlank()) {
                    stations.add(arg.trim().toUpperCase(Locale.ROOT));
                }
            }
            return new CliOptions(List.copyOf(stations), json);
        }
    }
}
