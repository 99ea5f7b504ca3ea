package com.raidwatch.core.actor;

import com.raidwatch.core.model.Sighting;
import com.raidwatch.core.source.SightingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls the upstream {@link SightingSource} into the mailbox.
 *
 * <p>
 * The pump holds a single credit: it reads one sighting, delivers it, and
 * waits until the loop has {@linkplain #acknowledge() acknowledged} it before
 * reading the next. The source therefore never runs ahead of the aggregator.
 * </p>
 *
 * <p>
 * Read failures are delivered as {@link LoopEvent.ReadFailed} and followed by
 * a pause of {@code readErrorBackoff}; the pump then keeps reading.
 * </p>
 */
final class SourcePump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SourcePump.class);

    private final SightingSource source;
    private final Mailbox mailbox;
    private final Duration readErrorBackoff;
    private final Semaphore credit = new Semaphore(1);

    private final AtomicBoolean closeRequested = new AtomicBoolean(false);

    private volatile boolean stopped;
    private volatile Thread thread;

    SourcePump(SightingSource source, Mailbox mailbox, Duration readErrorBackoff) {
        this.source = Objects.requireNonNull(source, "SightingSource must not be null");
        this.mailbox = Objects.requireNonNull(mailbox, "Mailbox must not be null");
        this.readErrorBackoff = Objects.requireNonNull(readErrorBackoff, "Read error backoff must not be null");
    }

    void start(ThreadFactory threadFactory) {
        Thread t = threadFactory.newThread(this);
        thread = t;
        t.start();
    }

    @Override
    public void run() {
        try {
            while (!stopped) {
                credit.acquire();
                if (stopped) {
                    return;
                }
                try {
                    Optional<Sighting> next = source.next();
                    if (next.isEmpty()) {
                        LOG.info("Sighting source exhausted");
                        mailbox.deliver(LoopEvent.Signal.SOURCE_EXHAUSTED);
                        return;
                    }
                    mailbox.deliver(new LoopEvent.SightingReceived(next.get()));
                } catch (IOException | RuntimeException e) {
                    if (stopped) {
                        return;
                    }
                    LOG.warn("Sighting source read failed; continuing: {}", e.toString());
                    mailbox.deliver(new LoopEvent.ReadFailed(e));
                    pause();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Source pump interrupted");
        }
    }

    /**
     * Called by the loop once it has handled a sighting or read failure.
     */
    void acknowledge() {
        credit.release();
    }

    /**
     * Stop pulling and close the source. Safe to call more than once; the
     * source is closed once.
     *
     * <p>
     * Never blocks the caller once the pump is running: a source blocked in
     * {@code next()} may hold the lock its {@code close()} needs, and may
     * ignore interrupts, so the close runs on its own daemon thread.
     * </p>
     */
    void stop() {
        stopped = true;
        if (!closeRequested.compareAndSet(false, true)) {
            return;
        }
        Thread t = thread;
        if (t == null) {
            closeSource();
            return;
        }
        t.interrupt();
        Thread closer = new Thread(this::closeSource, "raidwatch-source-close");
        closer.setDaemon(true);
        closer.start();
    }

    private void closeSource() {
        try {
            source.close();
            LOG.debug("Sighting source closed");
        } catch (RuntimeException e) {
            LOG.warn("Failed to close sighting source: {}", e.getMessage(), e);
        }
    }

    private void pause() throws InterruptedException {
        if (!readErrorBackoff.isZero()) {
            Thread.sleep(readErrorBackoff.toMillis());
        }
    }
}
