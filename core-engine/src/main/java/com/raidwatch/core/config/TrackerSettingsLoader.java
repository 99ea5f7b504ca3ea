package com.raidwatch.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link TrackerSettings} from a YAML document.
 *
 * <p>
 * The loader does not read the environment. The caller decides where the
 * settings live and hands the path to {@link #resolve(String)}: a configured
 * path must exist, while an unset path means the bundled
 * {@value #DEFAULT_RESOURCE}.
 * </p>
 *
 * <p>
 * Every entry point calls {@link TrackerSettings#validate()} after parsing,
 * so a bad value stops the process at startup.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrackerSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(TrackerSettingsLoader.class);

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "tracker.yml";

    private TrackerSettingsLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load settings from {@code path}, or from {@value #DEFAULT_RESOURCE} on
     * the classpath when no path is configured.
     *
     * @param path settings file; {@code null} or blank selects the default
     * @return parsed and validated settings
     * @throws IllegalArgumentException if a configured file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrackerSettings resolve(String path) {
        if (path == null || path.isBlank()) {
            LOG.info("Loading tracker settings from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("Loading tracker settings from file: {}", path);
        return fromFile(path);
    }

    /**
     * Load settings from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated settings
     * @throws NullPointerException     if {@code path} is {@code null}
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrackerSettings fromFile(String path) {
        Objects.requireNonNull(path, "Settings file path must not be null");
        try (InputStream is = Files.newInputStream(Path.of(path))) {
            return parseAndValidate(is);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Settings file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + path, e);
        }
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated settings
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static TrackerSettings fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = TrackerSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static TrackerSettings parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(TrackerSettings.class, options));
        TrackerSettings settings = yaml.load(is);

        if (settings == null) {
            LOG.warn("Tracker settings document is empty; using defaults");
            settings = new TrackerSettings();
        }
        settings.validate();

        LOG.info("Loaded {}", settings);
        return settings;
    }
}
