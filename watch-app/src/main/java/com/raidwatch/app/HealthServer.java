package com.raidwatch.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.raidwatch.core.actor.AggregatorDriver;
import com.raidwatch.core.actor.LoopMetrics;
import com.raidwatch.core.actor.LoopState;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server that exposes health and readiness endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – loop state and counters as JSON, e.g.
 * {@code {"status":"UP","state":"RUNNING","sightingsApplied":12,...}}</li>
 * <li>{@code GET /readiness} – Same; readiness check target</li>
 * </ul>
 *
 * <p>
 * Both return {@code 200} while the aggregator loop is {@code NEW} or
 * {@code RUNNING} and {@code 503} with {@code "status":"DOWN"} once it has
 * terminated. Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class HealthServer {

    private static final Logger LOG = LoggerFactory.getLogger(HealthServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AggregatorDriver driver;
    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthServer(AggregatorDriver driver) {
        this.driver = Objects.requireNonNull(driver, "AggregatorDriver must not be null");
    }

    /**
     * Start the health server on the given port.
     *
     * @param port TCP port to bind to; {@code 0} picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IllegalStateException    if the server cannot bind
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Health port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", this::handleHealthCheck);
            server.createContext("/readiness", this::handleHealthCheck);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "health-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Health server started on port {}", getPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start health server on port " + port, e);
        }
    }

    /**
     * Stop the health server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Health server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Health server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handler (shared between /health and /readiness)
    // ---------------------------------------------------------------

    private void handleHealthCheck(HttpExchange exchange) throws IOException {
        LoopState state = driver.state();
        boolean up = state != LoopState.TERMINATED;
        byte[] body = MAPPER.writeValueAsBytes(healthDocument(state, up, driver.metrics()));

        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(up ? 200 : 503, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private static Map<String, Object> healthDocument(LoopState state, boolean up, LoopMetrics metrics) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("status", up ? "UP" : "DOWN");
        doc.put("state", state.name());
        doc.put("sightingsApplied", metrics.getSightingsApplied());
        doc.put("bossesDiscovered", metrics.getBossesDiscovered());
        doc.put("queriesAnswered", metrics.getQueriesAnswered());
        doc.put("repliesDropped", metrics.getRepliesDropped());
        doc.put("readFailures", metrics.getReadFailures());
        return doc;
    }
}
