package com.raidwatch.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Summary of a raid boss derived from the sightings that name it.
 *
 * <p>
 * Instances are immutable. The aggregation table swaps its reference when it
 * attaches an image, so every {@code RaidBoss} handed to a caller is an
 * independent snapshot that later sightings cannot change.
 * </p>
 *
 * @since 1.0.0
 */
public final class RaidBoss {

    /** Level reported when the boss name carries no level prefix. */
    public static final int UNKNOWN_LEVEL = 0;

    private final String name;
    private final int level;
    private final String image;
    private final Language language;

    /**
     * @param name     boss identifier; must not be {@code null}
     * @param level    numeric level, {@link #UNKNOWN_LEVEL} if not known
     * @param image    boss image URL, may be {@code null}
     * @param language language of the first sighting; must not be
     *                 {@code null}
     */
    public RaidBoss(String name, int level, String image, Language language) {
        this.name = Objects.requireNonNull(name, "Boss name must not be null");
        this.level = level;
        this.image = image;
        this.language = Objects.requireNonNull(language, "Language must not be null");
    }

    /**
     * Return a copy of this boss with the given image attached.
     *
     * @param image image URL; must not be {@code null}
     * @return new boss instance
     */
    public RaidBoss withImage(String image) {
        return new RaidBoss(name, level, Objects.requireNonNull(image, "Image must not be null"), language);
    }

    public String getName() {
        return name;
    }

    public int getLevel() {
        return level;
    }

    public Optional<String> getImage() {
        return Optional.ofNullable(image);
    }

    public Language getLanguage() {
        return language;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RaidBoss that))
            return false;
        return level == that.level
                && name.equals(that.name)
                && Objects.equals(image, that.image)
                && language == that.language;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, level, image, language);
    }

    @Override
    public String toString() {
        return "RaidBoss{" +
                "name='" + name + '\'' +
                ", level=" + level +
                ", image='" + image + '\'' +
                ", language=" + language +
                '}';
    }
}
