/**
 * Upstream sighting sources.
 *
 * <p>
 * {@link com.raidwatch.core.source.SightingSource} is the narrow interface the
 * aggregator pulls from. Network-backed implementations live in the
 * application module; {@link com.raidwatch.core.source.BlockingSightingSource}
 * is an in-process feed for embedders and tests.
 * </p>
 *
 * @since 1.0.0
 */
package com.raidwatch.core.source;
