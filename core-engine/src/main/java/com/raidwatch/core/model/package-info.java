/**
 * Domain model classes for Raid Watch.
 *
 * <p>
 * This package contains the values exchanged between the upstream source,
 * the aggregator and its callers:
 * </p>
 * <ul>
 * <li>{@link com.raidwatch.core.model.Sighting} - one raid tweet</li>
 * <li>{@link com.raidwatch.core.model.RaidBoss} - boss summary returned by
 * queries</li>
 * <li>{@link com.raidwatch.core.model.Language} - language of a tweet</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.raidwatch.core.model;
