package com.sattline.lint.config;

import java.nio.file.Path;

/** The configuration file is missing, not a {@code .toml} file, or does not hold valid settings. */
public class ConfigurationException extends Exception {
    private final Path path;

    public ConfigurationException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public ConfigurationException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
