package com.raidwatch.app;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Typed, immutable configuration object for the Raid Watch application.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the application is configurable from a container manifest, Docker {@code -e}
 * flags or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    /** Where sightings are read from. */
    public enum SourceKind {
        KAFKA,
        FILE,
        STDIN;

        static SourceKind parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unknown sighting source '" + value + "'. Supported: kafka, file, stdin", e);
            }
        }
    }

    // ---------------------------------------------------------------
    // Source
    // ---------------------------------------------------------------
    private final SourceKind sourceKind;
    private final String sightingFile;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaSightingsTopic;
    private final String kafkaGroupId;
    private final long kafkaPollMillis;

    // ---------------------------------------------------------------
    // Tracker / output
    // ---------------------------------------------------------------
    private final String trackerConfigPath;
    private final long boardIntervalSeconds;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private AppConfig(Builder b) {
        this.sourceKind = b.sourceKind;
        this.sightingFile = b.sightingFile;
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaSightingsTopic = b.kafkaSightingsTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.kafkaPollMillis = b.kafkaPollMillis;
        this.trackerConfigPath = b.trackerConfigPath;
        this.boardIntervalSeconds = b.boardIntervalSeconds;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build an {@link AppConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromVariables(System.getenv());
    }

    /**
     * Build an {@link AppConfig} from an explicit variable map, using the
     * same names and defaults as {@link #fromEnvironment()}.
     */
    static AppConfig fromVariables(Map<String, String> variables) {
        Function<String, String> lookup = variables::get;
        try {
            return new Builder()
                    .sourceKind(SourceKind.parse(value(lookup, "SIGHTING_SOURCE", "stdin")))
                    .sightingFile(value(lookup, "SIGHTING_FILE", ""))
                    .kafkaBootstrapServers(value(lookup, "KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaSightingsTopic(value(lookup, "KAFKA_SIGHTINGS_TOPIC", "raid-sightings"))
                    .kafkaGroupId(value(lookup, "KAFKA_GROUP_ID", "raidwatch"))
                    .kafkaPollMillis(Long.parseLong(value(lookup, "KAFKA_POLL_MILLIS", "500")))
                    .trackerConfigPath(value(lookup, "TRACKER_CONFIG_PATH", ""))
                    .boardIntervalSeconds(Long.parseLong(value(lookup, "BOARD_INTERVAL_SECONDS", "5")))
                    .healthPort(Integer.parseInt(value(lookup, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Kafka properties helpers
    // ---------------------------------------------------------------

    /**
     * Build Kafka consumer {@link Properties} for the sightings topic.
     *
     * @return new Properties instance configured for consumption
     */
    public Properties kafkaConsumerProperties() {
        Properties props = new Properties();
        props.setProperty(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaBootstrapServers);
        props.setProperty(ConsumerConfig.GROUP_ID_CONFIG, kafkaGroupId);
        props.setProperty(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        props.setProperty(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        props.setProperty(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.setProperty(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        return props;
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public String getSightingFile() {
        return sightingFile;
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaSightingsTopic() {
        return kafkaSightingsTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public Duration getKafkaPollTimeout() {
        return Duration.ofMillis(kafkaPollMillis);
    }

    public String getTrackerConfigPath() {
        return trackerConfigPath;
    }

    public Duration getBoardInterval() {
        return Duration.ofSeconds(boardIntervalSeconds);
    }

    /**
     * @return health server port; {@code 0} means the server is disabled
     */
    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AppConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (poll timeout &gt; 0, board interval &gt; 0, port in
     * [0, 65535], non-blank Kafka names, a file path when the source is
     * {@code file}).
     * </p>
     */
    public static class Builder {
        private SourceKind sourceKind = SourceKind.STDIN;
        private String sightingFile = "";
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaSightingsTopic = "raid-sightings";
        private String kafkaGroupId = "raidwatch";
        private long kafkaPollMillis = 500;
        private String trackerConfigPath = "";
        private long boardIntervalSeconds = 5;
        private int healthPort = 8080;

        public Builder sourceKind(SourceKind v) {
            this.sourceKind = v;
            return this;
        }

        public Builder sightingFile(String v) {
            this.sightingFile = v;
            return this;
        }

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaSightingsTopic(String v) {
            this.kafkaSightingsTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder kafkaPollMillis(long v) {
            this.kafkaPollMillis = v;
            return this;
        }

        public Builder trackerConfigPath(String v) {
            this.trackerConfigPath = v;
            return this;
        }

        public Builder boardIntervalSeconds(long v) {
            this.boardIntervalSeconds = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link AppConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public AppConfig build() {
            Objects.requireNonNull(sourceKind, "sourceKind required");
            Objects.requireNonNull(sightingFile, "sightingFile required");
            Objects.requireNonNull(trackerConfigPath, "trackerConfigPath required");
            requireNonBlank(kafkaBootstrapServers, "kafkaBootstrapServers");
            requireNonBlank(kafkaSightingsTopic, "kafkaSightingsTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (sourceKind == SourceKind.FILE && sightingFile.isBlank()) {
                throw new IllegalArgumentException("sightingFile must be set when the source is 'file'");
            }
            if (kafkaPollMillis < 1) {
                throw new IllegalArgumentException("kafkaPollMillis must be >= 1, got: " + kafkaPollMillis);
            }
            if (boardIntervalSeconds < 1) {
                throw new IllegalArgumentException(
                        "boardIntervalSeconds must be >= 1, got: " + boardIntervalSeconds);
            }
            if (healthPort < 0 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [0, 65535], got: " + healthPort);
            }

            return new AppConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Function<String, String> lookup, String name, String defaultValue) {
        String value = lookup.apply(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "sourceKind=" + sourceKind +
                ", sightingFile='" + sightingFile + '\'' +
                ", kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaSightingsTopic='" + kafkaSightingsTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", kafkaPollMillis=" + kafkaPollMillis +
                ", trackerConfigPath='" + trackerConfigPath + '\'' +
                ", boardIntervalSeconds=" + boardIntervalSeconds +
                ", healthPort=" + healthPort +
                '}';
    }
}
