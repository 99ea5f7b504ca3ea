package com.raidwatch.app;

import com.raidwatch.core.model.Language;
import com.raidwatch.core.model.Sighting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SightingDeserializer}.
 */
class SightingDeserializerTest {

    static final String OZOROTTER_JSON = "{"
            + "\"raidId\":\"ABCD1234\","
            + "\"bossName\":\"Lvl 60 Ozorotter\","
            + "\"user\":\"raider\","
            + "\"userImage\":\"http://example.com/raider.png\","
            + "\"text\":\"help please\","
            + "\"image\":\"http://example.com/ozorotter.png\","
            + "\"createdAt\":\"2017-06-01T12:00:00Z\","
            + "\"language\":\"English\","
            + "\"retweets\":3}";

    private final SightingDeserializer deserializer = new SightingDeserializer();

    @Test
    @DisplayName("Should decode every sighting field and ignore unknown ones")
    void shouldDecodeSighting() {
        Optional<Sighting> result = deserializer.deserialize(OZOROTTER_JSON.getBytes(StandardCharsets.UTF_8));

        assertThat(result).isPresent();
        Sighting sighting = result.get();
        assertThat(sighting.getRaidId()).contains("ABCD1234");
        assertThat(sighting.getBossName()).isEqualTo("Lvl 60 Ozorotter");
        assertThat(sighting.getUser()).isEqualTo("raider");
        assertThat(sighting.getText()).contains("help please");
        assertThat(sighting.getImage()).contains("http://example.com/ozorotter.png");
        assertThat(sighting.getCreatedAt()).isEqualTo(Instant.parse("2017-06-01T12:00:00Z"));
        assertThat(sighting.getLanguage()).isEqualTo(Language.ENGLISH);
    }

    @Test
    @DisplayName("Should accept a language in any case and omit optional fields")
    void shouldDecodeMinimalSighting() {
        String json = "{\"bossName\":\"Lv60 オオゾラッコ\",\"user\":\"u\","
                + "\"createdAt\":\"2017-06-01T12:00:00Z\",\"language\":\"JAPANESE\"}";

        Optional<Sighting> result = deserializer.deserialize(json);

        assertThat(result).isPresent();
        assertThat(result.get().getLanguage()).isEqualTo(Language.JAPANESE);
        assertThat(result.get().getRaidId()).isEmpty();
        assertThat(result.get().getImage()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "not json",
            "{\"bossName\":\"Lvl 60 Ozorotter\"}",
            "{\"bossName\":\"Lvl 60 Ozorotter\",\"user\":\"u\",\"createdAt\":\"yesterday\",\"language\":\"English\"}",
            "{\"bossName\":\"Lvl 60 Ozorotter\",\"user\":\"u\",\"createdAt\":\"2017-06-01T12:00:00Z\",\"language\":\"Klingon\"}"
    })
    @DisplayName("Should drop blank, malformed and incomplete messages")
    void shouldDropInvalidMessages(String message) {
        assertThat(deserializer.deserialize(message)).isEmpty();
    }

    @Test
    @DisplayName("Should drop null and empty payloads")
    void shouldDropEmptyPayloads() {
        assertThat(deserializer.deserialize((byte[]) null)).isEmpty();
        assertThat(deserializer.deserialize(new byte[0])).isEmpty();
    }
}
