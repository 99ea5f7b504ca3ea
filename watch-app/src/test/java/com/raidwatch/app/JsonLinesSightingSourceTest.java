package com.raidwatch.app;

import com.raidwatch.core.model.Sighting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonLinesSightingSource}.
 */
class JsonLinesSightingSourceTest {

    @Test
    @DisplayName("Should read one sighting per line and skip blank and malformed lines")
    void shouldReadLines() throws Exception {
        String input = SightingDeserializerTest.OZOROTTER_JSON + "\n"
                + "\n"
                + "garbage\n"
                + SightingDeserializerTest.OZOROTTER_JSON.replace("raider", "second") + "\n";
        JsonLinesSightingSource source = new JsonLinesSightingSource(new StringReader(input),
                new SightingDeserializer());

        assertThat(source.next()).map(Sighting::getUser).contains("raider");
        assertThat(source.next()).map(Sighting::getUser).contains("second");
        assertThat(source.next()).isEmpty();
        assertThat(source.next()).isEmpty();
    }

    @Test
    @DisplayName("Should propagate read errors")
    void shouldPropagateReadErrors() {
        Reader failing = new Reader() {
            @Override
            public int read(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk gone");
            }

            @Override
            public void close() {
            }
        };
        JsonLinesSightingSource source = new JsonLinesSightingSource(failing, new SightingDeserializer());

        assertThatThrownBy(source::next).isInstanceOf(IOException.class).hasMessage("disk gone");
    }

    @Test
    @DisplayName("Should fail reads once closed")
    void shouldCloseReader() {
        JsonLinesSightingSource source = new JsonLinesSightingSource(
                new StringReader(SightingDeserializerTest.OZOROTTER_JSON), new SightingDeserializer());

        source.close();

        assertThatThrownBy(source::next).isInstanceOf(IOException.class);
    }
}
