package com.brandsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and validates {@link SentinelConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #fromFile(Path)}</li>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * <h3>Environment expansion</h3>
 * <p>
 * {@code ${NAME}} and {@code $NAME} placeholders are replaced with the value
 * of the environment variable before parsing; unset variables expand to an
 * empty string.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Every {@code from*} method applies defaults and calls
 * {@link SentinelConfig#validate()}, so an invalid file fails fast before the
 * engine is built.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";

    /** Classpath fallback. */
    public static final String DEFAULT_RESOURCE = "brand-sentinel.yml";

    /** Classpath resource copied by {@link #writeSample(Path)}. */
    static final String SAMPLE_RESOURCE = "sample-config.yml";

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private ConfigLoader() {
        // utility class, not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution: the
     * {@value #ENV_CONFIG_PATH} file if set and present, otherwise
     * {@value #DEFAULT_RESOURCE} on the classpath.
     *
     * @return parsed and validated configuration
     */
    public static SentinelConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading configuration from environment path: {}", envPath);
            return fromFile(Path.of(envPath));
        }
        LOG.info("Loading configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load configuration from a file system path.
     *
     * @param path YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromFile(Path path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try {
            String yaml = Files.readString(path, StandardCharsets.UTF_8);
            LOG.info("Loading configuration from {}", path);
            return fromString(yaml, System::getenv);
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration file: " + path, e);
        }
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading, parsing or validation fails
     */
    public static SentinelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        return fromString(readResource(resource), System::getenv);
    }

    /**
     * Parse configuration text.
     *
     * @param yaml YAML document
     * @param env  environment lookup used for placeholder expansion
     * @return parsed and validated configuration
     * @throws IllegalStateException if parsing or validation fails
     */
    public static SentinelConfig fromString(String yaml, Function<String, String> env) {
        Objects.requireNonNull(yaml, "YAML text must not be null");
        Objects.requireNonNull(env, "Environment lookup must not be null");

        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml parser = new Yaml(new Constructor(SentinelConfig.class, options));

        SentinelConfig config;
        try {
            config = parser.load(expandEnvironment(yaml, env));
        } catch (YAMLException e) {
            throw new IllegalStateException("Failed to parse configuration: " + e.getMessage(), e);
        }
        if (config == null) {
            LOG.warn("Configuration document is empty, using defaults");
            config = new SentinelConfig();
        }

        config.applyDefaults();
        // Fail fast if anything is misconfigured
        config.validate();
        LOG.debug("Loaded {}", config);
        return config;
    }

    /**
     * Write a commented sample configuration file.
     *
     * @param target destination; must not exist yet
     * @throws IllegalStateException if the file exists or cannot be written
     */
    public static void writeSample(Path target) {
        Objects.requireNonNull(target, "Target path must not be null");
        try {
            Files.writeString(target, readResource(SAMPLE_RESOURCE), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW);
            LOG.info("Sample configuration written to {}", target);
        } catch (FileAlreadyExistsException e) {
            throw new IllegalStateException("Configuration file already exists: " + target, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write configuration file: " + target, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static String expandEnvironment(String text, Function<String, String> env) {
        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String value = env.apply(name);
            m.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : ""));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String readResource(String resource) {
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }
}
