package com.metarwatch.service.runtime;

import com.metarwatch.collectors.api.Collector;
import com.metarwatch.collectors.api.CollectorContext;
import com.metarwatch.collectors.api.CollectorResult;
import com.metarwatch.core.events.AlertRaised;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Polls each enabled collector at its own fixed rate. A collector that throws is reported
 * as an alert and keeps its schedule.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledCollector> collectors;
    private final CollectorContext context;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService collectorExecutor;

    public SchedulerService(List<ScheduledCollector> collectors, CollectorContext context) {
        this(collectors, context, 100);
    }

    SchedulerService(List<ScheduledCollector> collectors, CollectorContext context, long minIntervalMillis) {
        this.collectors = List.copyOf(collectors);
        this.context = context;
        this.minIntervalMillis = minIntervalMillis;
        this.collectorExecutor = Executors.newFixedThreadPool(Math.max(1, this.collectors.size()));
    }

    public void start() {
        for (ScheduledCollector scheduled : collectors) {
            if (!scheduled.enabled()) {
                LOGGER.info(() -> "Collector disabled: " + scheduled.collector().name());
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> collectorExecutor.submit(() -> runCollectorSafely(scheduled.collector())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
        }
    }

    public List<CollectorResult> runOnceAllCollectors() {
        List<Callable<CollectorResult>> tasks = new ArrayList<>();
        for (ScheduledCollector scheduled : collectors) {
            if (scheduled.enabled()) {
                tasks.add(() -> runCollectorSafely(scheduled.collector()));
            }
        }

        List<CollectorResult> results = new ArrayList<>();
        try {
            for (Future<CollectorResult> future : collectorExecutor.invokeAll(tasks)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Collector task failed outside its error handling", e);
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        collectorExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            collectorExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledCollector> scheduledCollectors() {
        return collectors;
    }

    private CollectorResult runCollectorSafely(Collector collector) {
        try {
            return collector.poll(context).join();
        } catch (Exception ex) {
            context.eventBus().publish(new AlertRaised(
                    context.clock().instant(),
                    "collector",
                    "Collector run failed: " + collector.name() + " - " + ex.getMessage(),
                    Map.of("collector", collector.name())
            ));
            return CollectorResult.failure(
                    "Collector run failed: " + collector.name(),
                    Map.of("collector", collector.name())
            );
        }
    }

    public record ScheduledCollector(Collector collector, Duration interval, boolean enabled) {
        public ScheduledCollector {
            Objects.requireNonNull(collector, "collector is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
