package com.sattline.lint.loader.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResolverOptionsTest {

    @Test
    void searchPathPutsProgramDirectoryFirstAndDropsDuplicates() {
        Path programs = Path.of("work", "programs");
        Path libA = Path.of("work", "libA");
        Path libB = Path.of("work", "libB");

        ResolverOptions options =
                ResolverOptions.builder()
                        .programDir(programs)
                        .libDirs(List.of(libA, libB, Path.of("work", ".", "libA"), programs))
                        .build();

        assertEquals(
                List.of(absolute(programs), absolute(libA), absolute(libB)), options.searchPath());
        assertEquals(CodeMode.DRAFT, options.getMode());
    }

    @Test
    void vendorDirectoryIsDroppedOnlyWhenIgnored() {
        Path vendor = Path.of("work", "vendor");
        ResolverOptions.Builder builder =
                ResolverOptions.builder().programDir(Path.of("work")).addLibDir(vendor).vendorDir(vendor);

        assertEquals(2, builder.build().searchPath().size());
        assertEquals(List.of(absolute(Path.of("work"))), builder.ignoreVendor(true).build().searchPath());
    }

    @Test
    void codeModeNamesAndExtensions() {
        assertEquals(CodeMode.OFFICIAL, CodeMode.fromName(" Official "));
        assertEquals("Pump.x", CodeMode.OFFICIAL.fileName("Pump"));
        assertEquals("Pump.s", CodeMode.fromName("draft").fileName("Pump"));
        assertThrows(IllegalArgumentException.class, () -> CodeMode.fromName("release"));
    }

    private static Path absolute(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
