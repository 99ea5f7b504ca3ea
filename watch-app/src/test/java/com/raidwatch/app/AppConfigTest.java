package com.raidwatch.app;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AppConfig}.
 */
class AppConfigTest {

    @Test
    @DisplayName("Should apply defaults when no variable is set")
    void shouldApplyDefaults() {
        AppConfig config = AppConfig.fromVariables(Map.of());

        assertThat(config.getSourceKind()).isEqualTo(AppConfig.SourceKind.STDIN);
        assertThat(config.getKafkaSightingsTopic()).isEqualTo("raid-sightings");
        assertThat(config.getBoardInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getHealthPort()).isEqualTo(8080);
        assertThat(config.getTrackerConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should resolve Kafka settings from variables")
    void shouldResolveKafkaSettings() {
        AppConfig config = AppConfig.fromVariables(Map.of(
                "SIGHTING_SOURCE", "Kafka",
                "KAFKA_BOOTSTRAP_SERVERS", "broker:29092",
                "KAFKA_SIGHTINGS_TOPIC", "tweets",
                "KAFKA_GROUP_ID", "watchers",
                "KAFKA_POLL_MILLIS", "250"));

        assertThat(config.getSourceKind()).isEqualTo(AppConfig.SourceKind.KAFKA);
        assertThat(config.getKafkaPollTimeout()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.kafkaConsumerProperties())
                .containsEntry(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, "broker:29092")
                .containsEntry(ConsumerConfig.GROUP_ID_CONFIG, "watchers");
    }

    @Test
    @DisplayName("Should treat blank variables as unset")
    void shouldIgnoreBlankVariables() {
        AppConfig config = AppConfig.fromVariables(Map.of("BOARD_INTERVAL_SECONDS", "  "));

        assertThat(config.getBoardInterval()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should allow port 0 to disable the health server")
    void shouldAllowDisabledHealthPort() {
        AppConfig config = AppConfig.fromVariables(Map.of("HEALTH_PORT", "0"));

        assertThat(config.getHealthPort()).isZero();
    }

    @Test
    @DisplayName("Should fail on non-numeric values")
    void shouldRejectNonNumericValues() {
        assertThatThrownBy(() -> AppConfig.fromVariables(Map.of("HEALTH_PORT", "eighty")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("eighty");
    }

    @Test
    @DisplayName("Should reject an unknown source kind")
    void shouldRejectUnknownSource() {
        assertThatThrownBy(() -> AppConfig.fromVariables(Map.of("SIGHTING_SOURCE", "twitter")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("twitter");
    }

    @Test
    @DisplayName("Should require a file path for the file source")
    void shouldRequireSightingFile() {
        assertThatThrownBy(() -> new AppConfig.Builder().sourceKind(AppConfig.SourceKind.FILE).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sightingFile");
    }

    @Test
    @DisplayName("Should reject out-of-range values")
    void shouldRejectOutOfRangeValues() {
        assertThatThrownBy(() -> new AppConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("healthPort");
        assertThatThrownBy(() -> new AppConfig.Builder().boardIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("boardIntervalSeconds");
        assertThatThrownBy(() -> new AppConfig.Builder().kafkaSightingsTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaSightingsTopic");
    }
}
