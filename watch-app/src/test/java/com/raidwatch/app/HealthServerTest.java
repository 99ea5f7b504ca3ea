package com.raidwatch.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raidwatch.core.actor.Aggregator;
import com.raidwatch.core.source.BlockingSightingSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link HealthServer}.
 */
class HealthServerTest {

    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private final ObjectMapper mapper = new ObjectMapper();

    private Aggregator aggregator;
    private HealthServer server;

    @BeforeEach
    void setUp() {
        aggregator = Aggregator.fromSource(new BlockingSightingSource(), 5);
        server = new HealthServer(aggregator.driver());
        server.start(0);
    }

    @AfterEach
    void tearDown() {
        server.stop();
        aggregator.driver().shutdown();
    }

    @Test
    @DisplayName("Should report UP with loop counters while the loop is alive")
    void shouldReportUp() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).contains("application/json");
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("UP");
        assertThat(body.get("state").asText()).isEqualTo("NEW");
        assertThat(body.get("sightingsApplied").asLong()).isZero();
        assertThat(body.has("readFailures")).isTrue();
    }

    @Test
    @DisplayName("Should report DOWN with 503 once the loop has terminated")
    void shouldReportDownAfterTermination() throws Exception {
        aggregator.driver().shutdown();

        HttpResponse<String> response = get("/readiness");

        assertThat(response.statusCode()).isEqualTo(503);
        JsonNode body = mapper.readTree(response.body());
        assertThat(body.get("status").asText()).isEqualTo("DOWN");
        assertThat(body.get("state").asText()).isEqualTo("TERMINATED");
    }

    @Test
    @DisplayName("Should stop serving after stop")
    void shouldStop() {
        assertThat(server.isRunning()).isTrue();

        server.stop();

        assertThat(server.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should reject ports outside the TCP range")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> new HealthServer(aggregator.driver()).start(65_536))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
