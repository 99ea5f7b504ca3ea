package com.raidwatch.core.aggregation;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the level from the {@code Lvl}/{@code Lv} prefix of a boss name.
 *
 * <p>
 * English feeds write {@code "Lvl 60 Ozorotter"}, Japanese feeds write
 * {@code "Lv60 オオゾラッコ"}; both forms, with or without the space, are
 * recognised.
 * </p>
 *
 * @since 1.0.0
 */
public final class PrefixBossLevelParser implements BossLevelParser {

    private static final Pattern LEVEL_PREFIX = Pattern.compile("^Lvl?\\s*(\\d{1,9})(?:\\s|$)");

    @Override
    public OptionalInt parseLevel(String bossName) {
        Objects.requireNonNull(bossName, "Boss name must not be null");
        Matcher matcher = LEVEL_PREFIX.matcher(bossName.trim());
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(matcher.group(1)));
    }
}
