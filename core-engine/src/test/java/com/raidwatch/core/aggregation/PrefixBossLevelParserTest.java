package com.raidwatch.core.aggregation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PrefixBossLevelParser}.
 */
class PrefixBossLevelParserTest {

    private final PrefixBossLevelParser parser = new PrefixBossLevelParser();

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Lvl 60 Ozorotter, 60",
            "Lvl 100 Leviathan Omega, 100",
            "Lv60 オオゾラッコ, 60",
            "Lv75 シュヴァリエ・マグナ, 75",
            "Lv 120 Huanglong, 120"
    })
    @DisplayName("Should read the level from English and Japanese prefixes")
    void shouldParseLevelPrefix(String bossName, int expected) {
        assertThat(parser.parseLevel(bossName)).hasValue(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ozorotter", "Lvl Ozorotter", "Level 60 Ozorotter", "Lvl60x Boss", ""})
    @DisplayName("Should return empty when the name carries no level")
    void shouldReturnEmptyWithoutPrefix(String bossName) {
        assertThat(parser.parseLevel(bossName)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a null name")
    void shouldRejectNull() {
        assertThatThrownBy(() -> parser.parseLevel(null)).isInstanceOf(NullPointerException.class);
    }
}
