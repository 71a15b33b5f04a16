package com.sattline.lint.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class LintConfigLoaderTest {

    @Test
    void readsEveryKnownKey() throws Exception {
        Path config =
                write(
                        "full.toml",
                        "root = 'Plant'",
                        "mode = 'official'",
                        "ignore_vendor = true",
                        "scan_root_only = false",
                        "programs_dir = 'programs'",
                        "libs_dirs = ['libs/core', 'libs/vendor']",
                        "vendor_dir = 'libs/vendor'",
                        "strict = true",
                        "debug = false");

        LintConfig loaded = LintConfigLoader.load(config);

        assertEquals("Plant", loaded.root);
        assertEquals("official", loaded.mode);
        assertEquals(Boolean.TRUE, loaded.ignoreVendor);
        assertEquals(Boolean.FALSE, loaded.scanRootOnly);
        assertEquals("programs", loaded.programsDir);
        assertEquals(List.of("libs/core", "libs/vendor"), loaded.libsDirs);
        assertEquals("libs/vendor", loaded.vendorDir);
        assertEquals(Boolean.TRUE, loaded.strict);
        assertEquals(Boolean.FALSE, loaded.debug);
    }

    @Test
    void leavesAbsentKeysUnset() throws Exception {
        LintConfig loaded = LintConfigLoader.load(write("partial.toml", "root = 'Plant'"));

        assertEquals("Plant", loaded.root);
        assertNull(loaded.mode);
        assertNull(loaded.strict);
        assertNull(loaded.libsDirs);
    }

    @Test
    void rejectsUnknownKeys() throws Exception {
        Path config = write("unknown.toml", "root = 'Plant'", "colour = 'blue'");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> LintConfigLoader.load(config));

        assertEquals(config, ex.getPath());
        assertTrue(ex.getMessage().contains("colour"), ex.getMessage());
    }

    @Test
    void rejectsUnknownMode() throws Exception {
        Path config = write("mode.toml", "mode = 'release'");

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> LintConfigLoader.load(config));

        assertTrue(ex.getMessage().contains("release"), ex.getMessage());
    }

    @Test
    void rejectsMissingAndNonTomlFiles() throws Exception {
        Path dir = Files.createTempDirectory("sattlint-config");

        assertThrows(ConfigurationException.class, () -> LintConfigLoader.load(dir.resolve("absent.toml")));
        Path json = Files.writeString(dir.resolve("config.json"), "{}");
        assertThrows(ConfigurationException.class, () -> LintConfigLoader.load(json));
    }

    @Test
    void rejectsMalformedToml() throws Exception {
        Path config = write("broken.toml", "root = ");

        assertThrows(ConfigurationException.class, () -> LintConfigLoader.load(config));
    }

    private static Path write(String name, String... lines) throws Exception {
        Path dir = Files.createTempDirectory("sattlint-config");
        return Files.writeString(dir.resolve(name), String.join("\n", lines) + "\n");
    }
}
