package com.metarwatch.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.metarwatch.collectors.config.MetarCollectorConfig;
import com.metarwatch.core.model.CollectorConfig;
import com.metarwatch.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static List<CollectorConfig> loadCollectors(Path configDir) {
        return read(configDir.resolve("collectors.json"), new TypeReference<>() {
        });
    }

    public static MetarCollectorConfig loadMetar(Path configDir) {
        MetarCollectorConfig config = read(configDir.resolve("metar.json"), new TypeReference<>() {
        });
        if (config.stations().isEmpty()) {
            throw new IllegalStateException("No stations configured in " + configDir.resolve("metar.json"));
        }
        return config;
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
