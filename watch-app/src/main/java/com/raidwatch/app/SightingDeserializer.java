package com.raidwatch.app;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raidwatch.core.model.Sighting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Converts raw JSON into {@link Sighting} instances.
 * <p>
 * Malformed messages are logged and dropped (returns empty), so a single bad
 * record never reaches the aggregator.
 * </p>
 */
public class SightingDeserializer {

    private static final Logger LOG = LoggerFactory.getLogger(SightingDeserializer.class);

    private final ObjectMapper mapper;

    public SightingDeserializer() {
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Optional<Sighting> deserialize(byte[] message) {
        if (message == null || message.length == 0) {
            return Optional.empty();
        }
        return deserialize(new String(message, StandardCharsets.UTF_8));
    }

    public Optional<Sighting> deserialize(String message) {
        if (message == null || message.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(message, Sighting.class));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to deserialize sighting, skipping: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
