package com.raidwatch.core.aggregation;

import com.raidwatch.core.model.RaidBoss;
import com.raidwatch.core.model.Sighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Boss name to {@link BossEntry} mapping: the authoritative aggregation state.
 *
 * <p>
 * Every sighting either creates an entry (first sighting of a boss) or
 * updates one. Entries are never removed; a boss stays known for the lifetime
 * of the table.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. It is owned by the
 * aggregator loop, which is the only thread that reads or writes it; other
 * threads see its contents only through query replies.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregationTable {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationTable.class);

    private final Map<String, BossEntry> bosses = new HashMap<>();
    private final int historySize;
    private final BossLevelParser levelParser;

    /**
     * @param historySize number of recent sightings kept per boss; must be
     *                    {@code >= 0}
     * @param levelParser derives a level for newly seen bosses; must not be
     *                    {@code null}
     * @throws IllegalArgumentException if {@code historySize} is negative
     */
    public AggregationTable(int historySize, BossLevelParser levelParser) {
        if (historySize < 0) {
            throw new IllegalArgumentException("historySize must be >= 0, got: " + historySize);
        }
        this.historySize = historySize;
        this.levelParser = Objects.requireNonNull(levelParser, "BossLevelParser must not be null");
    }

    /**
     * Fold one sighting into the table.
     *
     * <p>
     * Not idempotent: applying the same sighting twice records it twice.
     * </p>
     *
     * @param sighting the sighting; must not be {@code null}
     * @return {@code true} if the sighting introduced a new boss
     */
    public boolean apply(Sighting sighting) {
        Objects.requireNonNull(sighting, "Sighting must not be null");

        BossEntry entry = bosses.get(sighting.getBossName());
        if (entry != null) {
            entry.record(sighting);
            return false;
        }

        String name = sighting.getBossName();
        RaidBoss boss = new RaidBoss(name, levelOf(name), null, sighting.getLanguage());
        bosses.put(name, new BossEntry(boss, sighting, historySize));
        LOG.debug("New boss [{}] at level {}", name, boss.getLevel());
        return true;
    }

    /**
     * @return a new list holding every known boss, in no particular order
     */
    public List<RaidBoss> bosses() {
        List<RaidBoss> result = new ArrayList<>(bosses.size());
        for (BossEntry entry : bosses.values()) {
            result.add(entry.boss());
        }
        return result;
    }

    /**
     * Recent sightings of one boss.
     *
     * @param bossName boss identifier
     * @return unordered snapshot of the boss history; empty if the boss is
     *         unknown
     */
    public List<Sighting> recentHistory(String bossName) {
        BossEntry entry = bosses.get(bossName);
        return entry == null ? Collections.emptyList() : entry.recentSightings();
    }

    public int size() {
        return bosses.size();
    }

    public int historySize() {
        return historySize;
    }

    Optional<BossEntry> entry(String bossName) {
        return Optional.ofNullable(bosses.get(bossName));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private int levelOf(String bossName) {
        try {
            OptionalInt level = levelParser.parseLevel(bossName);
            return level.orElse(RaidBoss.UNKNOWN_LEVEL);
        } catch (RuntimeException e) {
            LOG.warn("Level parser failed for boss [{}]; using level {}: {}",
                    bossName, RaidBoss.UNKNOWN_LEVEL, e.getMessage());
            return RaidBoss.UNKNOWN_LEVEL;
        }
    }
}
