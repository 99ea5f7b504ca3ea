package com.raidwatch.core.aggregation;

import com.raidwatch.core.history.RingHistory;
import com.raidwatch.core.model.RaidBoss;
import com.raidwatch.core.model.Sighting;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Mutable per-boss aggregate: boss metadata, last-seen time and the bounded
 * history of recent sightings.
 *
 * <p>
 * Owned by {@link AggregationTable}; only the aggregator loop thread mutates
 * it.
 * </p>
 */
final class BossEntry {

    private RaidBoss boss;
    private Instant lastSeen;
    private final RingHistory<Sighting> history;

    BossEntry(RaidBoss boss, Sighting first, int historySize) {
        this.boss = Objects.requireNonNull(boss, "Boss must not be null");
        this.history = new RingHistory<>(historySize);
        record(first);
    }

    /**
     * Record a further sighting of this boss.
     *
     * <p>
     * The first image ever seen sticks: once the boss has one, later images
     * are ignored.
     * </p>
     */
    void record(Sighting sighting) {
        lastSeen = sighting.getCreatedAt();
        history.push(sighting);
        if (boss.getImage().isEmpty() && sighting.getImage().isPresent()) {
            boss = boss.withImage(sighting.getImage().get());
        }
    }

    RaidBoss boss() {
        return boss;
    }

    Instant lastSeen() {
        return lastSeen;
    }

    List<Sighting> recentSightings() {
        return history.snapshot();
    }
}
