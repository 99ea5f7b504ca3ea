package com.raidwatch.core.source;

import com.raidwatch.core.model.Sighting;

import java.io.IOException;
import java.util.Optional;

/**
 * Upstream supplier of sightings.
 *
 * <p>
 * The aggregator pulls from a source one sighting at a time and only asks for
 * the next one after it has applied the previous one, so a slow aggregator
 * slows the source down instead of buffering without limit.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * An {@link IOException} from {@link #next()} is a transient read failure:
 * the aggregator logs it and keeps pulling. Permanent exhaustion is signalled
 * by an empty result.
 * </p>
 *
 * @since 1.0.0
 */
public interface SightingSource extends AutoCloseable {

    /**
     * Block until the next sighting is available.
     *
     * @return the next sighting, or empty once the source is permanently
     *         exhausted
     * @throws IOException          if reading failed; the source may be polled
     *                              again
     * @throws InterruptedException if the calling thread was interrupted
     */
    Optional<Sighting> next() throws IOException, InterruptedException;

    /**
     * Release the source. A thread blocked in {@link #next()} must return
     * promptly, either empty or with an exception.
     */
    @Override
    void close();
}
