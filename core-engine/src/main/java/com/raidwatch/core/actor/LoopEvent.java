package com.raidwatch.core.actor;

import com.raidwatch.core.aggregation.AggregationTable;
import com.raidwatch.core.model.RaidBoss;
import com.raidwatch.core.model.Sighting;

import java.util.List;
import java.util.Objects;

/**
 * One item of the aggregator's merged input: a sighting from the source, a
 * query from a handle, or a control signal.
 */
interface LoopEvent {

    /**
     * Called for events still queued when the loop terminates.
     */
    default void abandon() {
    }

    /** Control signals. */
    enum Signal implements LoopEvent {
        /** The upstream source is permanently exhausted. */
        SOURCE_EXHAUSTED,
        /** Every handle was closed; no further commands can arrive. */
        MAILBOX_CLOSED,
        /** Wakes the loop after {@link AggregatorDriver#shutdown()}. */
        STOP
    }

    final class SightingReceived implements LoopEvent {
        private final Sighting sighting;

        SightingReceived(Sighting sighting) {
            this.sighting = Objects.requireNonNull(sighting, "Sighting must not be null");
        }

        Sighting sighting() {
            return sighting;
        }

        @Override
        public String toString() {
            return "SightingReceived{" + sighting + '}';
        }
    }

    final class ReadFailed implements LoopEvent {
        private final Exception cause;

        ReadFailed(Exception cause) {
            this.cause = cause;
        }

        Exception cause() {
            return cause;
        }

        @Override
        public String toString() {
            return "ReadFailed{" + cause + '}';
        }
    }

    /**
     * A request answered from the table, paired with its reply slot.
     *
     * @param <T> result type
     */
    abstract class Query<T> implements LoopEvent {
        private final Reply<T> reply = new Reply<>();

        abstract T answer(AggregationTable table);

        Reply<T> reply() {
            return reply;
        }

        @Override
        public void abandon() {
            reply.close();
        }
    }

    final class ListBosses extends Query<List<RaidBoss>> {
        @Override
        List<RaidBoss> answer(AggregationTable table) {
            return table.bosses();
        }

        @Override
        public String toString() {
            return "ListBosses";
        }
    }

    final class RecentHistory extends Query<List<Sighting>> {
        private final String bossName;

        RecentHistory(String bossName) {
            this.bossName = Objects.requireNonNull(bossName, "Boss name must not be null");
        }

        @Override
        List<Sighting> answer(AggregationTable table) {
            return table.recentHistory(bossName);
        }

        @Override
        public String toString() {
            return "RecentHistory{" + bossName + '}';
        }
    }
}
