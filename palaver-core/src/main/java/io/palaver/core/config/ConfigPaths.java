package io.palaver.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".palaver", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".palaver", "sessions.db");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
