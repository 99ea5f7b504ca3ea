package com.raidwatch.core.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-capacity history that keeps the most recent items pushed into it.
 *
 * <p>
 * Backed by a pre-sized list and a wrap-around write index: once {@code capacity}
 * items are stored, each push overwrites the oldest one. Pushing is O(1) and
 * never reallocates. A capacity of zero is legal and discards every push.
 * </p>
 *
 * <h3>Ordering</h3>
 * <p>
 * {@link #snapshot()} returns the stored items in physical slot order, which
 * is <strong>not</strong> chronological once the buffer has wrapped. Callers
 * that need chronology sort by the items' own timestamps.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. Instances are confined to
 * the aggregator loop thread.
 * </p>
 *
 * @param <T> item type
 * @since 1.0.0
 */
public final class RingHistory<T> {

    private final List<T> slots;

    /** Next slot to write. */
    private int writeIndex;

    private int size;

    /**
     * @param capacity maximum number of items retained; must be {@code >= 0}
     * @throws IllegalArgumentException if {@code capacity} is negative
     */
    public RingHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0, got: " + capacity);
        }
        this.slots = new ArrayList<>(Collections.nCopies(capacity, null));
    }

    /**
     * Store an item, evicting the oldest one when full.
     *
     * @param item item to store; must not be {@code null}
     * @throws NullPointerException if {@code item} is {@code null}
     */
    public void push(T item) {
        Objects.requireNonNull(item, "History item must not be null");
        if (slots.isEmpty()) {
            return;
        }
        slots.set(writeIndex, item);
        writeIndex = (writeIndex + 1) % slots.size();
        if (size < slots.size()) {
            size++;
        }
    }

    /**
     * Copy out every stored item.
     *
     * @return unmodifiable list of the stored items, in unspecified order
     */
    public List<T> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(slots.subList(0, size)));
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return slots.size();
    }

    @Override
    public String toString() {
        return "RingHistory{size=" + size + ", capacity=" + slots.size() + '}';
    }
}
