package com.raidwatch.core.aggregation;

import java.util.OptionalInt;

/**
 * Derives a boss level from a boss identifier.
 *
 * <p>
 * Implementations must be side-effect free; the aggregator calls them on its
 * loop thread once per newly seen boss.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface BossLevelParser {

    /**
     * @param bossName the boss identifier, e.g. {@code "Lvl 60 Ozorotter"}
     * @return the level, or empty if the name carries none
     */
    OptionalInt parseLevel(String bossName);
}
