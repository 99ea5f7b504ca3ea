package com.raidwatch.core.actor;

/**
 * Raised to a query caller when the aggregator can no longer deliver a
 * reply, because its loop has terminated or was shut down.
 *
 * <p>
 * An unknown boss is <strong>not</strong> reported this way; it yields an
 * empty result.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregatorClosedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AggregatorClosedException(String message) {
        super(message);
    }
}
