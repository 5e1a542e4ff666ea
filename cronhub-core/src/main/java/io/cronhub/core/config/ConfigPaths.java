package io.cronhub.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    static final String CONFIG_ENV = "CRONHUB_CONFIG";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv(CONFIG_ENV);
        if (override != null && !override.isBlank()) {
            return resolve(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".cronhub", "config.json");
    }

    /**
     * Expands a leading {@code ~/} to the user's home directory.
     */
    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new IllegalArgumentException("path must not be blank");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }

    public static Path resolveOrNull(String rawPath) {
        return rawPath == null || rawPath.isBlank() ? null : resolve(rawPath);
    }
}
