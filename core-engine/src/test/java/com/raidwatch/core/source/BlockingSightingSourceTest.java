package com.raidwatch.core.source;

import com.raidwatch.core.model.Sighting;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static com.raidwatch.core.TestSightings.sighting;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BlockingSightingSource}.
 */
class BlockingSightingSourceTest {

    private final BlockingSightingSource source = new BlockingSightingSource();

    @Test
    @DisplayName("Should hand out sightings in publish order")
    void shouldPreserveOrder() throws Exception {
        Sighting first = sighting("Lvl 60 Ozorotter", 1);
        Sighting second = sighting("Lvl 60 Ozorotter", 2);
        source.publish(first);
        source.publish(second);

        assertThat(source.next()).containsSame(first);
        assertThat(source.next()).containsSame(second);
    }

    @Test
    @DisplayName("Should report a failure in its queued position and keep going")
    void shouldThrowQueuedFailure() throws Exception {
        Sighting after = sighting("Lvl 60 Ozorotter", 2);
        source.fail(new IOException("boom"));
        source.publish(after);

        assertThatThrownBy(source::next).isInstanceOf(IOException.class).hasMessage("boom");
        assertThat(source.next()).containsSame(after);
    }

    @Test
    @DisplayName("Should keep reporting exhaustion after completion")
    void shouldStayExhausted() throws Exception {
        source.publish(sighting("Lvl 60 Ozorotter", 1));
        source.complete();

        assertThat(source.next()).isPresent();
        assertThat(source.next()).isEmpty();
        assertThat(source.next()).isEmpty();
    }

    @Test
    @DisplayName("Should report exhaustion once closed")
    void shouldBeExhaustedWhenClosed() throws Exception {
        source.publish(sighting("Lvl 60 Ozorotter", 1));
        source.close();

        assertThat(source.next()).isEmpty();
    }

    @Test
    @DisplayName("Should reject null sightings and failures")
    void shouldRejectNulls() {
        assertThatThrownBy(() -> source.publish(null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> source.fail(null)).isInstanceOf(NullPointerException.class);
    }
}
