package com.raidwatch.core.actor;

import java.util.concurrent.CompletableFuture;

/**
 * Single-use reply slot carried by a query.
 *
 * <p>
 * The aggregator loop deposits exactly one result with {@link #send(Object)},
 * or the slot is {@linkplain #close() closed} when the loop terminates first.
 * A caller that cancels or abandons the future simply makes the later
 * {@code send} a no-op.
 * </p>
 *
 * @param <T> result type
 */
final class Reply<T> {

    private final CompletableFuture<T> future = new CompletableFuture<>();

    /**
     * @return {@code true} if the value reached the caller, {@code false} if
     *         the slot was already completed, closed or cancelled
     */
    boolean send(T value) {
        return future.complete(value);
    }

    /**
     * Fail the caller with {@link AggregatorClosedException} unless a result
     * was already delivered.
     */
    boolean close() {
        return future.completeExceptionally(
                new AggregatorClosedException("Aggregator is closed; no reply will be delivered"));
    }

    CompletableFuture<T> future() {
        return future;
    }
}
