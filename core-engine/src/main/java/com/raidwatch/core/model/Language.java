package com.raidwatch.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Language a sighting was posted in.
 *
 * @since 1.0.0
 */
public enum Language {

    ENGLISH,
    JAPANESE;

    /**
     * Resolve a language from its name, ignoring case.
     *
     * @param value language name, e.g. {@code "English"} or {@code "JAPANESE"}
     * @return the matching language
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if no language matches
     */
    @JsonCreator
    public static Language fromString(String value) {
        if (value == null) {
            throw new NullPointerException("Language value must not be null");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.name().equals(normalised)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unknown language: '" + value
                + "'. Supported: English, Japanese");
    }

    /**
     * @return display name, e.g. {@code English}
     */
    public String displayName() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
