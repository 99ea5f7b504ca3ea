package com.raidwatch.core;

import com.raidwatch.core.model.Language;
import com.raidwatch.core.model.Sighting;

import java.time.Instant;

/**
 * Sighting fixtures shared by the core tests.
 */
public final class TestSightings {

    public static final Instant BASE = Instant.parse("2017-06-01T12:00:00Z");

    private TestSightings() {
    }

    public static Sighting sighting(String bossName, int secondsAfterBase) {
        return sighting(bossName, secondsAfterBase, null);
    }

    public static Sighting sighting(String bossName, int secondsAfterBase, String image) {
        return Sighting.builder()
                .raidId(Integer.toHexString(bossName.hashCode() ^ secondsAfterBase).toUpperCase())
                .bossName(bossName)
                .user("reporter_" + secondsAfterBase)
                .text("help pls")
                .image(image)
                .createdAt(BASE.plusSeconds(secondsAfterBase))
                .language(bossName.startsWith("Lvl") ? Language.ENGLISH : Language.JAPANESE)
                .build();
    }
}
