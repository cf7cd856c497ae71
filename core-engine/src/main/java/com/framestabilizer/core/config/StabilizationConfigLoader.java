package com.framestabilizer.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link StabilizationConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code load*}/{@code from*} method validates after parsing, so the
 * application <strong>fails fast</strong> on an invalid configuration.
 * An empty document yields the defaults.
 * </p>
 *
 * @since 1.0.0
 */
public final class StabilizationConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(StabilizationConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "STABILIZATION_CONFIG_PATH";

    /** Classpath resource used when nothing else is configured. */
    public static final String DEFAULT_RESOURCE = "stabilization.yml";

    private StabilizationConfigLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the configuration using automatic resolution: the file named by
     * {@code STABILIZATION_CONFIG_PATH} when it exists, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws InvalidConfigException if validation fails
     */
    public static StabilizationConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading stabilization config from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading stabilization config from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws InvalidConfigException   if parsing or validation fails
     */
    public static StabilizationConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Stabilization config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read stabilization config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails
     * @throws InvalidConfigException   if parsing or validation fails
     */
    public static StabilizationConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = StabilizationConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static StabilizationConfig parseAndValidate(InputStream is, String origin) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(StabilizationSettings.class, options));

        StabilizationSettings settings;
        try {
            settings = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidConfigException("Malformed stabilization config '" + origin + "': "
                    + e.getMessage(), e);
        }

        if (settings == null) {
            LOG.warn("Stabilization config '{}' is empty, using defaults", origin);
            settings = new StabilizationSettings();
        }

        StabilizationConfig config = settings.toConfig();
        LOG.info("Loaded stabilization config: {}", config);
        return config;
    }
}
