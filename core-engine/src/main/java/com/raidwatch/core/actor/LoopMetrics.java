package com.raidwatch.core.actor;

import java.util.concurrent.atomic.LongAdder;

/**
 * Counters maintained by the aggregator loop.
 *
 * <p>
 * Written only by the loop thread, readable from any thread.
 * </p>
 *
 * <h3>Exposed Counters</h3>
 * <ul>
 * <li>{@code sightingsApplied} – sightings folded into the table</li>
 * <li>{@code bossesDiscovered} – sightings that introduced a new boss</li>
 * <li>{@code queriesAnswered} – queries whose result reached the caller</li>
 * <li>{@code repliesDropped} – queries answered after the caller gave up</li>
 * <li>{@code readFailures} – upstream read failures skipped</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class LoopMetrics {

    private final LongAdder sightingsApplied = new LongAdder();
    private final LongAdder bossesDiscovered = new LongAdder();
    private final LongAdder queriesAnswered = new LongAdder();
    private final LongAdder repliesDropped = new LongAdder();
    private final LongAdder readFailures = new LongAdder();

    void recordSighting(boolean newBoss) {
        sightingsApplied.increment();
        if (newBoss) {
            bossesDiscovered.increment();
        }
    }

    void recordReply(boolean delivered) {
        if (delivered) {
            queriesAnswered.increment();
        } else {
            repliesDropped.increment();
        }
    }

    void recordReadFailure() {
        readFailures.increment();
    }

    public long getSightingsApplied() {
        return sightingsApplied.sum();
    }

    public long getBossesDiscovered() {
        return bossesDiscovered.sum();
    }

    public long getQueriesAnswered() {
        return queriesAnswered.sum();
    }

    public long getRepliesDropped() {
        return repliesDropped.sum();
    }

    public long getReadFailures() {
        return readFailures.sum();
    }

    @Override
    public String toString() {
        return "LoopMetrics{" +
                "sightingsApplied=" + getSightingsApplied() +
                ", bossesDiscovered=" + getBossesDiscovered() +
                ", queriesAnswered=" + getQueriesAnswered() +
                ", repliesDropped=" + getRepliesDropped() +
                ", readFailures=" + getReadFailures() +
                '}';
    }
}
