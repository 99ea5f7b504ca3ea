/**
 * Per-boss aggregation state.
 *
 * <p>
 * {@link com.raidwatch.core.aggregation.AggregationTable} folds sightings
 * into one entry per boss name, each holding the boss summary, the time it
 * was last seen and a bounded history of recent sightings. Boss levels come
 * from a pluggable
 * {@link com.raidwatch.core.aggregation.BossLevelParser}; the default
 * {@link com.raidwatch.core.aggregation.PrefixBossLevelParser} reads the
 * {@code Lvl}/{@code Lv} prefix of the name.
 * </p>
 *
 * @since 1.0.0
 */
package com.raidwatch.core.aggregation;
