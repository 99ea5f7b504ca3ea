package com.raidwatch.app;

import com.raidwatch.core.actor.Aggregator;
import com.raidwatch.core.config.TrackerSettings;
import com.raidwatch.core.config.TrackerSettingsLoader;
import com.raidwatch.core.source.SightingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main entry point for the Raid Watch application.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka topic / JSON-lines file / stdin
 *     → Deserialize JSON → Sighting
 *     → Aggregator loop (boss table + recent history)
 *     → Boss board printed every BOARD_INTERVAL_SECONDS
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link AppConfig}; tracker tuning comes from {@link TrackerSettingsLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class RaidWatchApp {

        private static final Logger LOG = LoggerFactory.getLogger(RaidWatchApp.class);
        private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

        private RaidWatchApp() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                AppConfig config = AppConfig.fromEnvironment();
                LOG.info("Starting Raid Watch with config: {}", config);

                // 2. Load tracker settings
                TrackerSettings settings = loadSettings(config);

                // 3. Build the aggregator over the configured source
                Aggregator aggregator = Aggregator.builder()
                                .source(createSource(config))
                                .settings(settings)
                                .build();

                // 4. Start health server (liveness / readiness checks)
                HealthServer healthServer = null;
                if (config.getHealthPort() > 0) {
                        healthServer = new HealthServer(aggregator.driver());
                        healthServer.start(config.getHealthPort());
                } else {
                        LOG.info("Health server disabled");
                }

                // 5. Run the loop and the board
                Thread loop = new Thread(aggregator.driver(), "raidwatch-aggregator");
                loop.start();

                BossBoard board = new BossBoard(aggregator.handle(), System.out);
                board.start(config.getBoardInterval());

                Runtime.getRuntime().addShutdownHook(
                                new Thread(shutdownTask(aggregator, board, healthServer), "raidwatch-shutdown"));

                // 6. Block until the loop terminates
                aggregator.driver().termination().join();
                LOG.info("Raid Watch stopped");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        static TrackerSettings loadSettings(AppConfig config) {
                return TrackerSettingsLoader.resolve(config.getTrackerConfigPath());
        }

        static SightingSource createSource(AppConfig config) throws IOException {
                switch (config.getSourceKind()) {
                        case KAFKA:
                                return new KafkaSightingSource(config);
                        case FILE:
                                LOG.info("Reading sightings from file {}", config.getSightingFile());
                                return new JsonLinesSightingSource(
                                                Files.newBufferedReader(Path.of(config.getSightingFile()),
                                                                StandardCharsets.UTF_8),
                                                new SightingDeserializer());
                        case STDIN:
                        default:
                                LOG.info("Reading sightings from standard input");
                                return new JsonLinesSightingSource(
                                                new InputStreamReader(System.in, StandardCharsets.UTF_8),
                                                new SightingDeserializer());
                }
        }

        private static Runnable shutdownTask(Aggregator aggregator, BossBoard board, HealthServer healthServer) {
                return () -> {
                        board.close();
                        aggregator.driver().shutdown();
                        try {
                                aggregator.driver().termination().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                        } catch (TimeoutException | ExecutionException e) {
                                LOG.warn("Aggregator loop did not stop cleanly: {}", e.toString());
                        }
                        if (healthServer != null) {
                                healthServer.stop();
                        }
                };
        }
}
