package com.sattline.lint.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.sattline.lint.loader.resolve.CodeMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/** Reads {@link LintConfig} from a TOML file. Unknown keys are an error. */
public final class LintConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(LintConfigLoader.class.getName());

    private static final TomlMapper MAPPER = createMapper();

    private LintConfigLoader() {}

    public static LintConfig load(Path path) throws ConfigurationException {
        if (path == null) {
            throw new IllegalArgumentException("path is null");
        }
        if (!path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".toml")) {
            throw new ConfigurationException("Configuration file must have a .toml extension: " + path, path);
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path, path);
        }
        LintConfig config;
        try (InputStream in = Files.newInputStream(path)) {
            config = MAPPER.readValue(in, LintConfig.class);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException(
                    "Invalid configuration in " + path + ": " + ex.getOriginalMessage(), path, ex);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read configuration " + path, path, ex);
        }
        if (config == null) {
            config = LintConfig.empty();
        }
        validate(config, path);
        LOGGER.fine("Loaded configuration from " + path);
        return config;
    }

    private static void validate(LintConfig config, Path path) throws ConfigurationException {
        if (config.mode != null) {
            try {
                CodeMode.fromName(config.mode);
            } catch (IllegalArgumentException ex) {
                throw new ConfigurationException(ex.getMessage() + " in " + path, path, ex);
            }
        }
        if (config.root != null && config.root.isBlank()) {
            throw new ConfigurationException("'root' must not be blank in " + path, path);
        }
    }

    private static TomlMapper createMapper() {
        return TomlMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }
}
