package com.raidwatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One observed raid report: a tweet announcing a raid against a boss.
 *
 * <p>
 * Sightings are produced by the upstream source and consumed by the
 * aggregator, which stores them by reference in per-boss history buffers. The
 * same instance may therefore be held by the history and by any number of
 * query results at once; it is immutable so that sharing is safe across
 * threads.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code bossName}, {@code user}, {@code createdAt}
 * and {@code language} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. The builder doubles as the
 * Jackson deserialization entry point.
 * </p>
 *
 * @since 1.0.0
 */
@JsonDeserialize(builder = Sighting.Builder.class)
public final class Sighting {

    /** Raid code players type in-game to join, when the tweet carries one. */
    private final String raidId;

    /** Boss identifier, e.g. {@code "Lvl 60 Ozorotter"}. */
    private final String bossName;

    /** Screen name of the reporter. */
    private final String user;

    /** Reporter avatar URL. */
    private final String userImage;

    /** Free-text note the reporter added to the tweet. */
    private final String text;

    /** Boss image URL attached to the tweet. */
    private final String image;

    private final Instant createdAt;

    private final Language language;

    private Sighting(Builder builder) {
        this.raidId = builder.raidId;
        this.bossName = Objects.requireNonNull(builder.bossName, "bossName must not be null");
        this.user = Objects.requireNonNull(builder.user, "user must not be null");
        this.userImage = builder.userImage;
        this.text = builder.text;
        this.image = builder.image;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.language = Objects.requireNonNull(builder.language, "language must not be null");
    }

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Sighting} instances.
     */
    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String raidId;
        private String bossName;
        private String user;
        private String userImage;
        private String text;
        private String image;
        private Instant createdAt;
        private Language language;

        public Builder raidId(String raidId) {
            this.raidId = raidId;
            return this;
        }

        public Builder bossName(String bossName) {
            this.bossName = bossName;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder userImage(String userImage) {
            this.userImage = userImage;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder language(Language language) {
            this.language = language;
            return this;
        }

        /**
         * Build the sighting.
         *
         * @return a new {@link Sighting}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Sighting build() {
            return new Sighting(this);
        }
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Optional<String> getRaidId() {
        return Optional.ofNullable(raidId);
    }

    public String getBossName() {
        return bossName;
    }

    public String getUser() {
        return user;
    }

    public Optional<String> getUserImage() {
        return Optional.ofNullable(userImage);
    }

    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }

    public Optional<String> getImage() {
        return Optional.ofNullable(image);
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Language getLanguage() {
        return language;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sighting that))
            return false;
        return Objects.equals(raidId, that.raidId)
                && bossName.equals(that.bossName)
                && user.equals(that.user)
                && Objects.equals(userImage, that.userImage)
                && Objects.equals(text, that.text)
                && Objects.equals(image, that.image)
                && createdAt.equals(that.createdAt)
                && language == that.language;
    }

    @Override
    public int hashCode() {
        return Objects.hash(raidId, bossName, user, createdAt);
    }

    @Override
    public String toString() {
        return "Sighting{" +
                "raidId='" + raidId + '\'' +
                ", bossName='" + bossName + '\'' +
                ", user='" + user + '\'' +
                ", createdAt=" + createdAt +
                ", language=" + language +
                '}';
    }
}
