package com.raidwatch.core.actor;

/**
 * Lifecycle of an {@link AggregatorDriver}.
 *
 * @since 1.0.0
 */
public enum LoopState {
    /** Created, {@link AggregatorDriver#run()} not yet called. */
    NEW,
    /** Draining the merged input. */
    RUNNING,
    /** Both inputs exhausted or shut down; no further replies. */
    TERMINATED
}
