package com.brandsentinel.app;

import com.brandsentinel.core.stats.Statistics;
import com.brandsentinel.core.stats.StatisticsSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and pipeline statistics.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: liveness, with timestamp and uptime</li>
 * <li>{@code GET /api/v1/status}: current statistics snapshot</li>
 * </ul>
 * <p>
 * Any other path answers {@code 404} with a JSON error body. Uses the JDK
 * built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);

    private final Statistics statistics;
    private final ObjectMapper mapper;
    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StatusServer(Statistics statistics) {
        this.statistics = Objects.requireNonNull(statistics, "Statistics must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Start the server.
     *
     * @param port TCP port; {@code 0} binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/", this::handle);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Status server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or {@code -1} if not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            respond(exchange, 405, error("Method not allowed: " + exchange.getRequestMethod()));
            return;
        }
        switch (path) {
            case "/health" -> respond(exchange, 200, health());
            case "/api/v1/status" -> respond(exchange, 200, status());
            default -> respond(exchange, 404, error("Not found: " + path));
        }
    }

    private Map<String, Object> health() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", Instant.now());
        data.put("uptime", statistics.snapshot().formattedUptime());
        return envelope("ok", "Brand Sentinel is running", data);
    }

    private Map<String, Object> status() {
        StatisticsSnapshot snapshot = statistics.snapshot();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("start_time", snapshot.getStartTime());
        data.put("uptime", snapshot.formattedUptime());
        data.put("uptime_seconds", snapshot.getUptime().getSeconds());
        data.put("events_processed", snapshot.getEventsProcessed());
        data.put("threats_found", snapshot.getThreatsFound());
        data.put("actions_live", snapshot.getActionsLive());
        data.put("actions_dry_run", snapshot.getActionsDryRun());
        return envelope("ok", "Statistics", data);
    }

    private static Map<String, Object> error(String message) {
        return envelope("error", message, null);
    }

    private static Map<String, Object> envelope(String status, String message, Object data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("message", message);
        if (data != null) {
            body.put("data", data);
        }
        return body;
    }

    private void respond(HttpExchange exchange, int status, Map<String, Object> body) throws IOException {
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize status response: {}", e.getMessage(), e);
            status = 500;
            bytes = "{\"status\":\"error\",\"message\":\"serialization failed\"}".getBytes(StandardCharsets.UTF_8);
        }
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
