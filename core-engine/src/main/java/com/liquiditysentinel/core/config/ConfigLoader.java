package com.liquiditysentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Loads and validates {@link EngineConfig} from a YAML source.
 *
 * <h3>Sources</h3>
 * <ol>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE} via {@link #load()},
 * falling back to defaults when it is absent</li>
 * <li>Any classpath resource via {@link #fromClasspath(String)}</li>
 * <li>A caller-supplied stream via {@link #fromStream(InputStream, String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Every method calls {@link EngineConfig#validate()} after parsing so that the
 * application <strong>fails fast</strong> on an invalid configuration.
 * Duplicate keys and unknown properties are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Classpath resource read by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "liquidity-sentinel.yml";

    private ConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when
     * no such resource exists.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static EngineConfig load() {
        if (ConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on classpath - using default configuration", DEFAULT_RESOURCE);
            return new EngineConfig();
        }
        LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws NullPointerException     if {@code resource} is {@code null}
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static EngineConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Load configuration from a stream. The stream is not closed.
     *
     * @param is         YAML source; must not be {@code null}
     * @param sourceName name used in log and error messages
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static EngineConfig fromStream(InputStream is, String sourceName) {
        Objects.requireNonNull(is, "InputStream must not be null");
        return parseAndValidate(is, sourceName != null ? sourceName : "<stream>");
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static EngineConfig parseAndValidate(InputStream is, String sourceName) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EngineConfig.class, options));

        EngineConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse configuration " + sourceName + ": "
                    + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Configuration {} is empty - using defaults", sourceName);
            config = new EngineConfig();
        }
        // Fail fast if any section is misconfigured
        config.validate();

        LOG.info("Loaded configuration from {}", sourceName);
        return config;
    }
}
