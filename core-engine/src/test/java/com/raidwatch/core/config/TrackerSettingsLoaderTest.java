package com.raidwatch.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TrackerSettingsLoader}.
 */
class TrackerSettingsLoaderTest {

    @Test
    @DisplayName("Should load test settings from classpath")
    void shouldLoadFromClasspath() {
        TrackerSettings settings = TrackerSettingsLoader.fromClasspath("test-tracker.yml");

        assertThat(settings.getHistorySize()).isEqualTo(5);
        assertThat(settings.getReadErrorBackoffMillis()).isEqualTo(250);
        assertThat(settings.readErrorBackoff()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("Should load the bundled default settings")
    void shouldLoadDefaultResource() {
        TrackerSettings settings = TrackerSettingsLoader.fromClasspath(TrackerSettingsLoader.DEFAULT_RESOURCE);

        assertThat(settings.getHistorySize()).isEqualTo(TrackerSettings.DEFAULT_HISTORY_SIZE);
        assertThat(settings.getReadErrorBackoffMillis())
                .isEqualTo(TrackerSettings.DEFAULT_READ_ERROR_BACKOFF_MILLIS);
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        TrackerSettings settings = TrackerSettingsLoader.fromClasspath("empty-tracker.yml");

        assertThat(settings.getHistorySize()).isEqualTo(TrackerSettings.DEFAULT_HISTORY_SIZE);
    }

    @Test
    @DisplayName("Should report every invalid value at once")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> TrackerSettingsLoader.fromClasspath("invalid-tracker.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("historySize")
                .hasMessageContaining("readErrorBackoffMillis");
    }

    @Test
    @DisplayName("Should load settings from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tracker.yml");
        Files.writeString(file, "historySize: 0\n");

        TrackerSettings settings = TrackerSettingsLoader.fromFile(file.toString());

        assertThat(settings.getHistorySize()).isZero();
        assertThat(settings.getReadErrorBackoffMillis())
                .isEqualTo(TrackerSettings.DEFAULT_READ_ERROR_BACKOFF_MILLIS);
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> TrackerSettingsLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the settings file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> TrackerSettingsLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should resolve the bundled settings when no path is configured")
    void shouldResolveDefaultWithoutPath() {
        assertThat(TrackerSettingsLoader.resolve("").getHistorySize())
                .isEqualTo(TrackerSettings.DEFAULT_HISTORY_SIZE);
        assertThat(TrackerSettingsLoader.resolve(null).getHistorySize())
                .isEqualTo(TrackerSettings.DEFAULT_HISTORY_SIZE);
    }

    @Test
    @DisplayName("Should resolve a configured path from the file system")
    void shouldResolveConfiguredPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tracker.yml");
        Files.writeString(file, "historySize: 7\n");

        assertThat(TrackerSettingsLoader.resolve(file.toString()).getHistorySize()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should fail instead of falling back when a configured path does not exist")
    void shouldNotFallBackForMissingConfiguredPath(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();

        assertThatThrownBy(() -> TrackerSettingsLoader.resolve(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(missing);
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "historySize: 3\nhistorySize: 4\n");

        assertThatThrownBy(() -> TrackerSettingsLoader.fromFile(file.toString()))
                .isInstanceOf(RuntimeException.class);
    }
}
