package io.threadkeep.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path homeDirectory() {
        return Path.of(System.getProperty("user.home"), ".threadkeep");
    }

    public static Path defaultConfigPath() {
        return homeDirectory().resolve("config.json");
    }

    /**
     * Expands {@code ~/} and falls back to {@code fallback} under the home directory when blank.
     */
    public static Path resolve(String rawPath, String fallback) {
        if (rawPath == null || rawPath.isBlank()) {
            return homeDirectory().resolve(fallback);
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
