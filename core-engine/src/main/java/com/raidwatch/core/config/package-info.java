/**
 * Configuration loading and validation for the aggregator.
 *
 * <p>
 * Settings are defined in YAML and loaded by
 * {@link com.raidwatch.core.config.TrackerSettingsLoader} into a
 * {@link com.raidwatch.core.config.TrackerSettings} instance. Validation runs
 * right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.raidwatch.core.config;
