package com.raidwatch.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the tracker YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * historySize: 20
 * readErrorBackoffMillis: 1000
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every value is legal.
 * </p>
 *
 * @since 1.0.0
 */
public class TrackerSettings {

    public static final int DEFAULT_HISTORY_SIZE = 20;
    public static final long DEFAULT_READ_ERROR_BACKOFF_MILLIS = 1_000;

    /** Number of recent sightings retained per boss. */
    private int historySize = DEFAULT_HISTORY_SIZE;

    /** Pause before pulling the source again after a read failure. */
    private long readErrorBackoffMillis = DEFAULT_READ_ERROR_BACKOFF_MILLIS;

    /**
     * Validate every setting.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (historySize < 0) {
            errors.add("'historySize' must be >= 0, got: " + historySize);
        }
        if (readErrorBackoffMillis < 0) {
            errors.add("'readErrorBackoffMillis' must be >= 0, got: " + readErrorBackoffMillis);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid TrackerSettings: " + String.join("; ", errors));
        }
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public long getReadErrorBackoffMillis() {
        return readErrorBackoffMillis;
    }

    public void setReadErrorBackoffMillis(long readErrorBackoffMillis) {
        this.readErrorBackoffMillis = readErrorBackoffMillis;
    }

    public Duration readErrorBackoff() {
        return Duration.ofMillis(readErrorBackoffMillis);
    }

    @Override
    public String toString() {
        return "TrackerSettings{" +
                "historySize=" + historySize +
                ", readErrorBackoffMillis=" + readErrorBackoffMillis +
                '}';
    }
}
