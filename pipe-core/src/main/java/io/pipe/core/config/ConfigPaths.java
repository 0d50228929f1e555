package io.pipe.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".pipe", "config.json");
    }

    /** Relative paths resolve against {@code projectRoot}; {@code ~/} expands to the user's home. */
    public static Path resolve(Path projectRoot, String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return projectRoot;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        Path path = Path.of(rawPath);
        return path.isAbsolute() ? path : projectRoot.resolve(path);
    }
}
