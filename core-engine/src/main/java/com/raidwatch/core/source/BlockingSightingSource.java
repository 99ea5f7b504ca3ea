package com.raidwatch.core.source;

import com.raidwatch.core.model.Sighting;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process {@link SightingSource} fed by {@link #publish(Sighting)}.
 *
 * <p>
 * Publishers never block. Failures and end-of-stream are queued behind the
 * sightings already published, so a consumer sees them in the order they
 * were signalled.
 * </p>
 *
 * @since 1.0.0
 */
public final class BlockingSightingSource implements SightingSource {

    private static final Signal END = new Signal(null, null);

    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    /**
     * @param sighting sighting to hand to the consumer; must not be
     *                 {@code null}
     */
    public void publish(Sighting sighting) {
        signals.add(new Signal(Objects.requireNonNull(sighting, "Sighting must not be null"), null));
    }

    /**
     * Make a later {@link #next()} call throw {@code failure}.
     *
     * @param failure the read failure to report; must not be {@code null}
     */
    public void fail(IOException failure) {
        signals.add(new Signal(null, Objects.requireNonNull(failure, "Failure must not be null")));
    }

    /**
     * Signal end-of-stream after everything already published.
     */
    public void complete() {
        signals.add(END);
    }

    @Override
    public Optional<Sighting> next() throws IOException, InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        Signal signal = signals.take();
        if (signal.failure != null) {
            throw signal.failure;
        }
        if (signal == END) {
            // keep reporting exhaustion to any later caller
            signals.add(END);
            return Optional.empty();
        }
        return Optional.of(signal.sighting);
    }

    @Override
    public void close() {
        closed = true;
        signals.add(END);
    }

    private static final class Signal {
        private final Sighting sighting;
        private final IOException failure;

        private Signal(Sighting sighting, IOException failure) {
            this.sighting = sighting;
            this.failure = failure;
        }
    }
}
