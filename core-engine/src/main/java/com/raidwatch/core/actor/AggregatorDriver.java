package com.raidwatch.core.actor;

import com.raidwatch.core.aggregation.AggregationTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The aggregator loop: sole owner and mutator of the {@link AggregationTable}.
 *
 * <p>
 * {@link #run()} drains the merged input one event at a time, applying each
 * one completely before taking the next, so every query observes the effect
 * of every sighting queued ahead of it and never a partial one. The embedding
 * process runs the driver to completion on a thread of its choosing.
 * </p>
 *
 * <h3>Termination</h3>
 * <p>
 * The loop completes normally once the upstream source is exhausted
 * <em>and</em> every {@link AggregatorHandle} has been closed, or as soon as
 * {@link #shutdown()} is called. Queries still queued at that point, and any
 * submitted later, fail with {@link AggregatorClosedException}.
 * </p>
 *
 * <h3>Failure policy</h3>
 * <p>
 * Upstream read failures arrive as no-op events and never stop the loop. A
 * runtime exception while handling one event is logged and the loop moves on
 * to the next event.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregatorDriver implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(AggregatorDriver.class);

    private final Mailbox mailbox;
    private final SourcePump pump;
    private final AggregationTable table;
    private final ThreadFactory pumpThreads;
    private final LoopMetrics metrics = new LoopMetrics();
    private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.NEW);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private volatile boolean stopRequested;

    // Loop-thread only.
    private boolean sourceOpen = true;
    private boolean mailboxOpen = true;

    AggregatorDriver(Mailbox mailbox, SourcePump pump, AggregationTable table, ThreadFactory pumpThreads) {
        this.mailbox = Objects.requireNonNull(mailbox, "Mailbox must not be null");
        this.pump = Objects.requireNonNull(pump, "SourcePump must not be null");
        this.table = Objects.requireNonNull(table, "AggregationTable must not be null");
        this.pumpThreads = Objects.requireNonNull(pumpThreads, "ThreadFactory must not be null");
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Run the loop until both inputs are exhausted or {@link #shutdown()} is
     * called. Blocks the calling thread.
     *
     * @throws IllegalStateException if the loop was already started or shut
     *                               down
     */
    @Override
    public void run() {
        if (!state.compareAndSet(LoopState.NEW, LoopState.RUNNING)) {
            throw new IllegalStateException("Aggregator loop cannot start: state is " + state.get());
        }
        LOG.info("Aggregator loop started (historySize={})", table.historySize());
        pump.start(pumpThreads);

        try {
            while (!stopRequested && (sourceOpen || mailboxOpen)) {
                handle(mailbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("Aggregator loop interrupted");
        } finally {
            finish();
        }
    }

    /**
     * Stop the loop after the event it is currently handling. Idempotent; if
     * the loop was never started it terminates immediately.
     */
    public void shutdown() {
        stopRequested = true;
        if (state.compareAndSet(LoopState.NEW, LoopState.RUNNING)) {
            finish();
        } else {
            mailbox.deliver(LoopEvent.Signal.STOP);
        }
    }

    public LoopState state() {
        return state.get();
    }

    /**
     * @return future completed once the loop has terminated
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    public LoopMetrics metrics() {
        return metrics;
    }

    // ---------------------------------------------------------------
    // Event handling
    // ---------------------------------------------------------------

    private void handle(LoopEvent event) {
        try {
            if (event instanceof LoopEvent.SightingReceived received) {
                try {
                    metrics.recordSighting(table.apply(received.sighting()));
                } finally {
                    pump.acknowledge();
                }
            } else if (event instanceof LoopEvent.Query<?> query) {
                answer(query);
            } else if (event instanceof LoopEvent.ReadFailed failed) {
                metrics.recordReadFailure();
                LOG.debug("Skipping failed source read: {}", failed.cause().toString());
                pump.acknowledge();
            } else if (event == LoopEvent.Signal.SOURCE_EXHAUSTED) {
                sourceOpen = false;
                LOG.info("Source exhausted; {} boss(es) known", table.size());
            } else if (event == LoopEvent.Signal.MAILBOX_CLOSED) {
                mailboxOpen = false;
                LOG.info("All handles closed");
            }
        } catch (RuntimeException e) {
            LOG.error("Failed to handle {}; continuing with next event", event, e);
            event.abandon();
        }
    }

    private <T> void answer(LoopEvent.Query<T> query) {
        T result = query.answer(table);
        boolean delivered = query.reply().send(result);
        if (!delivered) {
            LOG.trace("Caller abandoned {}; reply dropped", query);
        }
        metrics.recordReply(delivered);
    }

    /**
     * Terminate before touching the source: closing a source may block (a
     * reader blocked in {@code readLine()} holds its lock), and callers must
     * see the closed condition regardless.
     */
    private void finish() {
        int unanswered = 0;
        for (LoopEvent event : mailbox.close()) {
            if (event instanceof LoopEvent.Query<?>) {
                unanswered++;
            }
            event.abandon();
        }
        state.set(LoopState.TERMINATED);
        LOG.info("Aggregator loop terminated: {} boss(es), {}; {} pending request(s) closed",
                table.size(), metrics, unanswered);
        termination.complete(null);
        pump.stop();
    }
}
