package com.raidwatch.core.actor;

import com.raidwatch.core.model.RaidBoss;
import com.raidwatch.core.model.Sighting;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client-side entry point to a running aggregator.
 *
 * <p>
 * Every query is a non-blocking enqueue into the aggregator's mailbox; the
 * returned future completes when the loop dequeues and answers it. Handles
 * are safe to use from any thread, and {@link #duplicate()} yields further
 * handles on the same mailbox so independent call sites need no locking of
 * their own.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * A future fails with {@link AggregatorClosedException} if the loop
 * terminates before answering. An unknown boss is not a failure. No timeout
 * is applied; use {@link CompletableFuture#get(long, java.util.concurrent.TimeUnit)}
 * or {@link CompletableFuture#orTimeout(long, java.util.concurrent.TimeUnit)}.
 * Cancelling a future does not withdraw the query; its result is discarded.
 * </p>
 *
 * <h3>Closing</h3>
 * <p>
 * Once every handle of an aggregator is {@linkplain #close() closed}, the
 * command side of its input is exhausted and the loop terminates as soon as
 * the source is exhausted too.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregatorHandle implements AutoCloseable {

    private final Mailbox mailbox;
    private final AtomicBoolean closed = new AtomicBoolean();

    AggregatorHandle(Mailbox mailbox) {
        this.mailbox = Objects.requireNonNull(mailbox, "Mailbox must not be null");
    }

    /**
     * Ask for every known boss.
     *
     * @return future of a list with one entry per boss, in no particular order
     * @throws IllegalStateException if this handle is closed
     */
    public CompletableFuture<List<RaidBoss>> listBosses() {
        return request(new LoopEvent.ListBosses());
    }

    /**
     * Ask for the recent sightings of one boss.
     *
     * @param bossName boss identifier; must not be {@code null}
     * @return future of the boss history in no particular order; an empty list
     *         if the boss is unknown
     * @throws IllegalStateException if this handle is closed
     */
    public CompletableFuture<List<Sighting>> recentHistory(String bossName) {
        Objects.requireNonNull(bossName, "Boss name must not be null");
        return request(new LoopEvent.RecentHistory(bossName));
    }

    /**
     * Create another handle on the same mailbox.
     *
     * @return new, independently closable handle
     * @throws IllegalStateException if this handle is closed
     */
    public AggregatorHandle duplicate() {
        ensureOpen();
        if (!mailbox.retainHandle()) {
            throw new IllegalStateException("Aggregator mailbox is closed");
        }
        return new AggregatorHandle(mailbox);
    }

    /**
     * Release this handle. Idempotent.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            mailbox.releaseHandle();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private <T> CompletableFuture<T> request(LoopEvent.Query<T> query) {
        ensureOpen();
        if (!mailbox.submit(query)) {
            query.abandon();
        }
        return query.reply().future();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Aggregator handle is closed");
        }
    }
}
