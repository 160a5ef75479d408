package com.metarwatch.collectors.metar;

import com.metarwatch.collectors.api.Collector;
import com.metarwatch.collectors.api.CollectorContext;
import com.metarwatch.collectors.api.CollectorResult;
import com.metarwatch.collectors.config.MetarCollectorConfig;
import com.metarwatch.core.decoder.DecodeResult;
import com.metarwatch.core.decoder.ReportDecoder;
import com.metarwatch.core.events.AlertRaised;
import com.metarwatch.core.events.CollectorTickCompleted;
import com.metarwatch.core.events.CollectorTickStarted;
import com.metarwatch.core.events.ObservationUpdated;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.core.model.WeatherObservation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls every configured station, decodes its latest report and keeps the result in the
 * observation store. One station failing never stops the others.
 */
public class MetarCollector implements Collector {
    public static final String CONFIG_KEY = "metarCollector";
    private static final Logger LOGGER = Logger.getLogger(MetarCollector.class.getName());

    private final MetarSource source;
    private final ReportDecoder decoder;
    private final Duration interval;

    public MetarCollector(MetarSource source) {
        this(source, new ReportDecoder(), Duration.ofMinutes(10));
    }

    public MetarCollector(MetarSource source, ReportDecoder decoder, Duration interval) {
        this.source = source;
        this.decoder = decoder;
        this.interval = interval;
    }

    @Override
    public String name() {
        return "metarCollector";
    }

    @Override
    public Duration interval() {
        return interval;
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        Instant tickStartedAt = ctx.clock().instant();
        ctx.eventBus().publish(new CollectorTickStarted(tickStartedAt, name()));

        MetarCollectorConfig cfg = ctx.requiredConfig(CONFIG_KEY, MetarCollectorConfig.class);
        List<CompletableFuture<StationPollOutcome>> tasks = cfg.stations().stream()
                .map(station -> CompletableFuture.supplyAsync(() -> pollStation(station, ctx))
                        .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(error -> failedOutcome(station, ctx, error)))
                .toList();

        CompletableFuture<CollectorResult> pipeline = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> summarize(tasks.stream().map(CompletableFuture::join).toList()));

        return pipeline.handle((result, error) -> {
            long durationMillis = Duration.between(tickStartedAt, ctx.clock().instant()).toMillis();
            if (error != null) {
                ctx.eventBus().publish(new CollectorTickCompleted(ctx.clock().instant(), name(), false, durationMillis));
                return CollectorResult.failure("METAR collector failed: " + rootMessage(error), Map.of());
            }
            ctx.eventBus().publish(new CollectorTickCompleted(
                    ctx.clock().instant(),
                    name(),
                    result.success(),
                    durationMillis
            ));
            return result;
        });
    }

    private StationPollOutcome pollStation(String station, CollectorContext ctx) {
        FetchedReport report = source.fetch(station);
        DecodeResult decoded = decoder.decode(report.rawText());
        if (decoded.isNoData()) {
            publishAlert(ctx, station, decoded.error().label());
            return new StationPollOutcome(station, false);
        }

        WeatherObservation observation = decoded.observation();
        ctx.observationStore().putObservation(new StationObservation(
                report.station(),
                report.observedAt(),
                report.rawText(),
                observation
        ));
        ctx.eventBus().publish(new ObservationUpdated(
                ctx.clock().instant(),
                report.station(),
                report.observedAt(),
                observation.temperatureF(),
                observation.presentConditions()
        ));
        return new StationPollOutcome(station, true);
    }

    private StationPollOutcome failedOutcome(String station, CollectorContext ctx, Throwable error) {
        String message = rootMessage(error);
        LOGGER.log(Level.WARNING, "METAR fetch failed for " + station + ": " + message);
        publishAlert(ctx, station, message);
        return new StationPollOutcome(station, false);
    }

    private void publishAlert(CollectorContext ctx, String station, String message) {
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "collector",
                "METAR unavailable for " + station + ": " + message,
                Map.of("collector", name(), "station", station)
        ));
    }

    private CollectorResult summarize(List<StationPollOutcome> outcomes) {
        List<String> failed = new ArrayList<>();
        long successes = 0;
        for (StationPollOutcome outcome : outcomes) {
            if (outcome.success()) {
                successes++;
            } else {
                failed.add(outcome.station());
            }
        }

        Map<String, Object> stats = new HashMap<>();
        stats.put("stations", outcomes.size());
        stats.put("successes", successes);
        stats.put("failed", failed);

        if (failed.isEmpty()) {
            return CollectorResult.success("METAR polling completed", stats);
        }
        return CollectorResult.failure("METAR polling had failures", stats);
    }

    private record StationPollOutcome(String station, boolean success) {
    }

    private String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof ReportUnavailableException unavailable) {
            return unavailable.reason().label();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
