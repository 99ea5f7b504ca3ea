package com.raidwatch.app;

import com.raidwatch.core.model.Sighting;
import com.raidwatch.core.source.SightingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SightingSource} reading one JSON sighting per line, e.g. from a
 * recorded feed file or standard input.
 *
 * <p>
 * Blank and malformed lines are skipped. End of input exhausts the source.
 * </p>
 *
 * @since 1.0.0
 */
public final class JsonLinesSightingSource implements SightingSource {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesSightingSource.class);

    private final BufferedReader reader;
    private final SightingDeserializer deserializer;
    private long lineNumber;

    public JsonLinesSightingSource(Reader reader, SightingDeserializer deserializer) {
        Objects.requireNonNull(reader, "Reader must not be null");
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        this.deserializer = Objects.requireNonNull(deserializer, "SightingDeserializer must not be null");
    }

    @Override
    public Optional<Sighting> next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Optional<Sighting> sighting = deserializer.deserialize(line);
            if (sighting.isPresent()) {
                return sighting;
            }
            LOG.debug("Skipped line {}", lineNumber);
        }
        LOG.info("End of sighting input after {} line(s)", lineNumber);
        return Optional.empty();
    }

    @Override
    public void close() {
        try {
            reader.close();
        } catch (IOException e) {
            LOG.warn("Failed to close sighting input: {}", e.getMessage(), e);
        }
    }
}
