package com.airsentinel.service.api;

import com.airsentinel.core.error.AirSentinelException;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.service.error.InvalidQueryParamsException;
import com.airsentinel.service.error.ModelNotTrainedException;
import com.airsentinel.service.forecast.ModelArtifact;
import com.airsentinel.service.forecast.ModelRegistry;
import com.airsentinel.service.query.CurrentReadingService;
import com.airsentinel.service.query.ForecastService;
import com.airsentinel.service.store.EventStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON over the JDK HTTP server. Typed failures map to fixed status codes and an
 * {@code {"error": ..., "code": ...}} body; anything untyped is a 500 {@code internal_error}.
 */
public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    private static final Set<String> NOT_FOUND_CODES = Set.of("unknown_city", "no_data", "model_not_trained");
    private static final String BAD_REQUEST_CODE = "invalid_query_params";
    private static final int DEFAULT_HISTORY_HOURS = 168;
    private static final int DEFAULT_HISTORY_LIMIT = 1000;
    private static final int DEFAULT_EVENT_LIMIT = 200;

    private final int port;
    private final int threads;
    private final CurrentReadingService readings;
    private final ForecastService forecasts;
    private final ModelRegistry registry;
    private final EventStore eventStore;
    private final PipelineStatusTracker statusTracker;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(
            int port,
            int threads,
            CurrentReadingService readings,
            ForecastService forecasts,
            ModelRegistry registry,
            EventStore eventStore,
            PipelineStatusTracker statusTracker
    ) {
        this.port = port;
        this.threads = Math.max(1, threads);
        this.readings = readings;
        this.forecasts = forecasts;
        this.registry = registry;
        this.eventStore = eventStore;
        this.statusTracker = statusTracker;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newFixedThreadPool(threads);
            server.setExecutor(executor);
            server.createContext("/api/health", exchange -> respond(exchange, ignored -> health()));
            server.createContext("/api/cities", exchange -> respond(exchange, ignored -> Map.of("cities", readings.cities())));
            server.createContext("/api/current", exchange -> respond(exchange, this::current));
            server.createContext("/api/all-current", exchange -> respond(exchange, ignored -> Map.of("cities", readings.allCurrent())));
            server.createContext("/api/history", exchange -> respond(exchange, this::history));
            server.createContext("/api/stats", exchange -> respond(exchange, this::stats));
            server.createContext("/api/forecast", exchange -> respond(exchange, this::forecast));
            server.createContext("/api/models", exchange -> respond(exchange, this::model));
            server.createContext("/api/status", exchange -> respond(exchange, ignored -> statusTracker.snapshot()));
            server.createContext("/api/events", exchange -> respond(exchange, this::events));
            server.start();
            LOGGER.info(() -> "API server listening on port " + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("cities", readings.cities().size());
        body.put("data_loaded", !readings.allCurrent().isEmpty());
        body.put("models_available", registry.cities().size());
        return body;
    }

    private Object current(HttpExchange exchange) {
        return readings.current(citySegment(exchange, "/api/current"));
    }

    private Object history(HttpExchange exchange) {
        String city = citySegment(exchange, "/api/history");
        Map<String, String> query = queryParams(exchange.getRequestURI());
        int hours = intParam(query, "hours", DEFAULT_HISTORY_HOURS);
        int limit = intParam(query, "limit", DEFAULT_HISTORY_LIMIT);
        return readings.history(city, hours, limit);
    }

    private Object stats(HttpExchange exchange) {
        return readings.stats(citySegment(exchange, "/api/stats"));
    }

    private Object forecast(HttpExchange exchange) {
        String city = citySegment(exchange, "/api/forecast");
        int days = intParam(queryParams(exchange.getRequestURI()), "days", forecasts.defaultDays());
        return forecasts.forecast(city, days);
    }

    private Object model(HttpExchange exchange) {
        String city = citySegment(exchange, "/api/models");
        ModelArtifact artifact = forecasts.model(city).orElseThrow(() -> new ModelNotTrainedException(city));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("city", artifact.city());
        body.put("trained_at", artifact.trainedAt());
        body.put("window_start", artifact.windowStart());
        body.put("window_end", artifact.windowEnd());
        body.put("observations", artifact.observationCount());
        body.put("feature_spec", artifact.featureSpec());
        return body;
    }

    private Object events(HttpExchange exchange) {
        Instant since;
        Optional<String> type;
        int limit;
        try {
            Map<String, String> query = queryParams(exchange.getRequestURI());
            since = query.containsKey("since") ? Instant.parse(query.get("since")) : Instant.EPOCH;
            type = Optional.ofNullable(query.get("type")).filter(value -> !value.isBlank());
            limit = query.containsKey("limit") ? Integer.parseInt(query.get("limit")) : DEFAULT_EVENT_LIMIT;
        } catch (RuntimeException invalidParamError) {
            throw new InvalidQueryParamsException("Invalid event query: " + invalidParamError.getMessage(), invalidParamError);
        }
        return eventStore.query(since, type, Math.max(1, limit));
    }

    private void respond(HttpExchange exchange, Endpoint endpoint) throws IOException {
        if (!ensureGet(exchange, true)) {
            return;
        }
        Object body;
        try {
            body = endpoint.handle(exchange);
        } catch (NotFound notFound) {
            writeError(exchange, 404, "not_found", notFound.getMessage());
            return;
        } catch (AirSentinelException e) {
            if (NOT_FOUND_CODES.contains(e.code())) {
                writeError(exchange, 404, e.code(), e.getMessage());
            } else if (BAD_REQUEST_CODE.equals(e.code())) {
                writeError(exchange, 400, e.code(), e.getMessage());
            } else {
                LOGGER.log(Level.SEVERE, "Request failed: " + exchange.getRequestURI(), e);
                writeError(exchange, 500, "internal_error", "Internal server error");
            }
            return;
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Request failed: " + exchange.getRequestURI(), e);
            writeError(exchange, 500, "internal_error", "Internal server error");
            return;
        }
        writeJson(exchange, 200, body);
    }

    private boolean ensureGet(HttpExchange exchange, boolean corsEnabled) throws IOException {
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            if (corsEnabled) {
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET,OPTIONS");
                exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "Content-Type");
            }
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeError(HttpExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message == null ? code : message);
        body.put("code", code);
        writeJson(exchange, status, body);
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    /**
     * The single path segment after {@code prefix}, URL-decoded.
     */
    private static String citySegment(HttpExchange exchange, String prefix) {
        String path = exchange.getRequestURI().getPath();
        if (!path.startsWith(prefix + "/")) {
            throw new NotFound("No such resource: " + path);
        }
        String rest = path.substring(prefix.length() + 1);
        if (rest.endsWith("/")) {
            rest = rest.substring(0, rest.length() - 1);
        }
        if (rest.isBlank() || rest.contains("/")) {
            throw new NotFound("No such resource: " + path);
        }
        return rest;
    }

    private static int intParam(Map<String, String> query, String name, int fallback) {
        String raw = query.get(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryParamsException("Query parameter '" + name + "' must be an integer", e);
        }
    }

    private static Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            query.put(key, value);
        }
        return query;
    }

    @FunctionalInterface
    private interface Endpoint {
        Object handle(HttpExchange exchange);
    }

    private static final class NotFound extends RuntimeException {
        private NotFound(String message) {
            super(message);
        }
    }
}
