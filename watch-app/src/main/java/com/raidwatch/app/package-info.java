/**
 * Standalone Raid Watch process.
 *
 * <p>
 * This package feeds the core aggregator from Kafka, a JSON-lines file or
 * standard input, prints the boss board and serves health endpoints.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.raidwatch.app.RaidWatchApp} - main entry point</li>
 * <li>{@link com.raidwatch.app.AppConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.raidwatch.app.KafkaSightingSource} - Kafka topic
 * source</li>
 * <li>{@link com.raidwatch.app.HealthServer} - HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.raidwatch.app;
