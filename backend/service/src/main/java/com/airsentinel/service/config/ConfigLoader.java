package com.airsentinel.service.config;

import com.airsentinel.core.model.CitySource;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.ingest.config.IngestionConfig;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Reads the JSON files under the config directory. {@code cities.json} is required; the other
 * files fall back to built-in defaults when absent. A city listed without {@code sensorIds} has
 * its sensors discovered at ingestion time.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static List<CitySource> loadCities(Path configDir) {
        List<CitySource> cities = read(configDir.resolve("cities.json"), new TypeReference<>() {
        });
        if (cities == null || cities.isEmpty()) {
            throw new IllegalStateException("No cities configured in " + configDir.resolve("cities.json"));
        }
        for (CitySource city : cities) {
            if (city.name().isBlank()) {
                throw new IllegalStateException("City without a name in " + configDir.resolve("cities.json"));
            }
            if (city.sensorIds().isEmpty()) {
                LOGGER.info(() -> "No sensorIds for " + city.name() + "; its PM2.5 sensors will be looked up");
            }
        }
        return cities;
    }

    public static IngestionConfig loadIngestion(Path configDir) {
        return readOrDefault(configDir.resolve("ingestion.json"), new TypeReference<>() {
        }, IngestionConfig::defaults);
    }

    public static ForecastConfig loadForecast(Path configDir) {
        return readOrDefault(configDir.resolve("forecast.json"), new TypeReference<>() {
        }, ForecastConfig::defaults);
    }

    private static <T> T readOrDefault(Path path, TypeReference<T> ref, Supplier<T> fallback) {
        if (!Files.exists(path)) {
            LOGGER.warning(() -> "Config file " + path + " not found; using defaults");
            return fallback.get();
        }
        return read(path, ref);
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
