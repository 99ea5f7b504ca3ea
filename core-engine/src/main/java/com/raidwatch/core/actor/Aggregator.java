package com.raidwatch.core.actor;

import com.raidwatch.core.aggregation.AggregationTable;
import com.raidwatch.core.aggregation.BossLevelParser;
import com.raidwatch.core.aggregation.PrefixBossLevelParser;
import com.raidwatch.core.config.TrackerSettings;
import com.raidwatch.core.source.SightingSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;

/**
 * Construction entry point for an aggregator.
 *
 * <p>
 * Building an aggregator yields a {@link AggregatorHandle} for queries and an
 * {@link AggregatorDriver} that the caller must run to completion:
 * </p>
 *
 * <pre>
 * Aggregator aggregator = Aggregator.fromSource(source, 20);
 * executor.execute(aggregator.driver());
 * List&lt;RaidBoss&gt; bosses = aggregator.handle().listBosses().get();
 * </pre>
 *
 * @since 1.0.0
 */
public final class Aggregator {

    private final AggregatorHandle handle;
    private final AggregatorDriver driver;

    private Aggregator(Builder b) {
        Mailbox mailbox = new Mailbox();
        AggregationTable table = new AggregationTable(b.historySize, b.levelParser);
        SourcePump pump = new SourcePump(b.source, mailbox, b.readErrorBackoff);
        this.driver = new AggregatorDriver(mailbox, pump, table, b.pumpThreadFactory);
        this.handle = new AggregatorHandle(mailbox);
    }

    /**
     * Build an aggregator with default collaborators.
     *
     * @param source      upstream sighting source; must not be {@code null}
     * @param historySize recent sightings kept per boss; must be {@code >= 0}
     * @return the aggregator
     */
    public static Aggregator fromSource(SightingSource source, int historySize) {
        return builder().source(source).historySize(historySize).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the handle created with the aggregator; duplicate it for further
     *         call sites
     */
    public AggregatorHandle handle() {
        return handle;
    }

    public AggregatorDriver driver() {
        return driver;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link Aggregator}.
     *
     * <p>
     * {@link #build()} requires a source and validates the history size and
     * backoff.
     * </p>
     */
    public static class Builder {
        private SightingSource source;
        private int historySize = TrackerSettings.DEFAULT_HISTORY_SIZE;
        private BossLevelParser levelParser = new PrefixBossLevelParser();
        private Duration readErrorBackoff = Duration.ofMillis(TrackerSettings.DEFAULT_READ_ERROR_BACKOFF_MILLIS);
        private ThreadFactory pumpThreadFactory = r -> {
            Thread t = new Thread(r, "raidwatch-source-pump");
            t.setDaemon(true);
            return t;
        };

        public Builder source(SightingSource v) {
            this.source = v;
            return this;
        }

        public Builder historySize(int v) {
            this.historySize = v;
            return this;
        }

        public Builder levelParser(BossLevelParser v) {
            this.levelParser = v;
            return this;
        }

        public Builder readErrorBackoff(Duration v) {
            this.readErrorBackoff = v;
            return this;
        }

        public Builder pumpThreadFactory(ThreadFactory v) {
            this.pumpThreadFactory = v;
            return this;
        }

        /**
         * Apply history size and read-error backoff from loaded settings.
         */
        public Builder settings(TrackerSettings settings) {
            Objects.requireNonNull(settings, "TrackerSettings must not be null");
            this.historySize = settings.getHistorySize();
            this.readErrorBackoff = settings.readErrorBackoff();
            return this;
        }

        /**
         * Build and validate the aggregator.
         *
         * @return a new {@link Aggregator}, not yet running
         * @throws NullPointerException     if a collaborator is {@code null}
         * @throws IllegalArgumentException if a value is out of range
         */
        public Aggregator build() {
            Objects.requireNonNull(source, "SightingSource must not be null");
            Objects.requireNonNull(levelParser, "BossLevelParser must not be null");
            Objects.requireNonNull(readErrorBackoff, "readErrorBackoff must not be null");
            Objects.requireNonNull(pumpThreadFactory, "pumpThreadFactory must not be null");
            if (historySize < 0) {
                throw new IllegalArgumentException("historySize must be >= 0, got: " + historySize);
            }
            if (readErrorBackoff.isNegative()) {
                throw new IllegalArgumentException("readErrorBackoff must not be negative, got: " + readErrorBackoff);
            }
            return new Aggregator(this);
        }
    }
}
