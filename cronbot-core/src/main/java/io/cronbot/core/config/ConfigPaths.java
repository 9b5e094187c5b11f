package io.cronbot.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".cronbot");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    /**
     * Expands a leading {@code ~/}; blank values fall back to {@code ~/.cronbot/cronbot.db}.
     */
    public static Path resolveDatabase(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return home().resolve("cronbot.db");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
