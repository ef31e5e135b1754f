package com.brandsentinel.app;

import java.util.Objects;
import java.util.function.Function;

/**
 * Process-level settings resolved from environment variables.
 *
 * <p>
 * Pipeline behaviour lives in the YAML configuration; this object only
 * carries what the launcher needs before that file is read.
 * </p>
 *
 * <h3>Variables</h3>
 * <ul>
 * <li>{@code SENTINEL_CONFIG_PATH}: YAML configuration file (optional)</li>
 * <li>{@code STATUS_PORT}: port of the status server, {@code 0} disables it
 * (default {@value #DEFAULT_STATUS_PORT})</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class AppConfig {

    public static final String ENV_CONFIG_PATH = "SENTINEL_CONFIG_PATH";
    public static final String ENV_STATUS_PORT = "STATUS_PORT";
    public static final int DEFAULT_STATUS_PORT = 8080;

    private final String configPath;
    private final int statusPort;

    private AppConfig(Builder b) {
        this.configPath = b.configPath;
        this.statusPort = b.statusPort;
    }

    /**
     * Build an {@link AppConfig} from the process environment.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static AppConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static AppConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "Environment lookup must not be null");
        try {
            return new Builder()
                    .configPath(value(env, ENV_CONFIG_PATH, ""))
                    .statusPort(Integer.parseInt(value(env, ENV_STATUS_PORT, String.valueOf(DEFAULT_STATUS_PORT))))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getConfigPath() {
        return configPath;
    }

    public boolean hasConfigPath() {
        return !configPath.isBlank();
    }

    public int getStatusPort() {
        return statusPort;
    }

    public boolean isStatusServerEnabled() {
        return statusPort > 0;
    }

    /**
     * Fluent builder for {@link AppConfig}; {@link #build()} validates.
     */
    public static class Builder {
        private String configPath = "";
        private int statusPort = DEFAULT_STATUS_PORT;

        public Builder configPath(String v) {
            this.configPath = v;
            return this;
        }

        public Builder statusPort(int v) {
            this.statusPort = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the port is outside [0, 65535]
         */
        public AppConfig build() {
            if (configPath == null) {
                configPath = "";
            }
            if (statusPort < 0 || statusPort > 65_535) {
                throw new IllegalArgumentException(
                        "statusPort must be in [0, 65535], got: " + statusPort);
            }
            return new AppConfig(this);
        }
    }

    private static String value(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "configPath='" + configPath + '\'' +
                ", statusPort=" + statusPort +
                '}';
    }
}
