package com.raidwatch.core.actor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The aggregator's merged input queue.
 *
 * <p>
 * Handles {@linkplain #submit(LoopEvent) submit} commands and the source pump
 * {@linkplain #deliver(LoopEvent) delivers} sightings into the same unbounded
 * FIFO queue, which the loop drains one event at a time. Submission never
 * blocks.
 * </p>
 *
 * <h3>Handle accounting</h3>
 * <p>
 * The mailbox counts open handles, starting at one for the handle created
 * with the aggregator. When the count drops to zero the command side is
 * exhausted and {@link LoopEvent.Signal#MAILBOX_CLOSED} is queued.
 * </p>
 */
final class Mailbox {

    private final BlockingQueue<LoopEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicInteger openHandles = new AtomicInteger(1);
    private volatile boolean closed;

    /**
     * Enqueue a command from a handle.
     *
     * @return {@code false} if the loop has terminated; the caller owns the
     *         event and must abandon it
     */
    boolean submit(LoopEvent event) {
        if (closed) {
            return false;
        }
        queue.add(event);
        // close() may have drained before our add landed
        return !(closed && queue.remove(event));
    }

    /**
     * Enqueue an event from inside the aggregator (source pump, shutdown).
     */
    void deliver(LoopEvent event) {
        queue.add(event);
    }

    LoopEvent take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Register one more handle.
     *
     * @return {@code false} if every handle was already closed
     */
    boolean retainHandle() {
        while (true) {
            int open = openHandles.get();
            if (open == 0) {
                return false;
            }
            if (openHandles.compareAndSet(open, open + 1)) {
                return true;
            }
        }
    }

    void releaseHandle() {
        if (openHandles.decrementAndGet() == 0) {
            queue.add(LoopEvent.Signal.MAILBOX_CLOSED);
        }
    }

    /**
     * Refuse further submissions and hand back everything still queued.
     */
    List<LoopEvent> close() {
        closed = true;
        List<LoopEvent> leftover = new ArrayList<>();
        queue.drainTo(leftover);
        return leftover;
    }
}
