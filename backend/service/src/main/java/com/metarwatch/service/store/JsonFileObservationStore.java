package com.metarwatch.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metarwatch.collectors.api.ObservationStore;
import com.metarwatch.core.model.StationObservation;
import com.metarwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Latest observation per station, rewritten as a whole to a JSON file on every update so a
 * restart picks up where the last run stopped.
 */
public class JsonFileObservationStore implements ObservationStore {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StationObservation> observations = new ConcurrentHashMap<>();

    public JsonFileObservationStore(Path file) {
        this.file = file;
        loadIfPresent();
    }

    @Override
    public Optional<StationObservation> getObservation(String station) {
        return Optional.ofNullable(observations.get(station));
    }

    @Override
    public void putObservation(StationObservation observation) {
        lock.lock();
        try {
            observations.put(observation.station(), observation);
            persist();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, StationObservation> all() {
        return new TreeMap<>(observations);
    }

    private void loadIfPresent() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return;
            }
            try (InputStream in = Files.newInputStream(file)) {
                ObservationSnapshotFile loaded = MAPPER.readValue(in, ObservationSnapshotFile.class);
                if (loaded.observations() != null) {
                    observations.putAll(loaded.observations());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading observations from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, new ObservationSnapshotFile(all()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing observations to " + file, e);
        }
    }

    private record ObservationSnapshotFile(Map<String, StationObservation> observations) {
    }
}
