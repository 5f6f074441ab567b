package io.parley.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("PARLEY_CONFIG");
        if (override != null && !override.isBlank()) {
            return expandHome(override);
        }
        return Path.of(System.getProperty("user.home"), ".parley", "config.json");
    }

    public static Path expandHome(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
