package com.sattline.lint.loader.resolve;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Search path and policy for one {@link DependencyResolver} run. */
public final class ResolverOptions {
    private final Path programDir;
    private final List<Path> libDirs;
    private final CodeMode mode;
    private final boolean ignoreVendor;
    private final Path vendorDir;
    private final boolean scanRootOnly;
    private final boolean strict;

    private ResolverOptions(Builder builder) {
        this.programDir = normalize(Objects.requireNonNull(builder.programDir, "programDir"));
        List<Path> libs = new ArrayList<>();
        for (Path lib : builder.libDirs) {
            libs.add(normalize(lib));
        }
        this.libDirs = List.copyOf(libs);
        this.mode = Objects.requireNonNull(builder.mode, "mode");
        this.ignoreVendor = builder.ignoreVendor;
        this.vendorDir = builder.vendorDir == null ? null : normalize(builder.vendorDir);
        this.scanRootOnly = builder.scanRootOnly;
        this.strict = builder.strict;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getProgramDir() {
        return programDir;
    }

    public List<Path> getLibDirs() {
        return libDirs;
    }

    public CodeMode getMode() {
        return mode;
    }

    public boolean isIgnoreVendor() {
        return ignoreVendor;
    }

    public Optional<Path> getVendorDir() {
        return Optional.ofNullable(vendorDir);
    }

    public boolean isScanRootOnly() {
        return scanRootOnly;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Directories searched for each name, in priority order: the program directory, then the library
     * directories as listed. Duplicates keep their first position; the vendor directory is dropped
     * when vendor libraries are ignored.
     */
    public List<Path> searchPath() {
        List<Path> path = new ArrayList<>();
        path.add(programDir);
        path.addAll(libDirs);
        List<Path> result = new ArrayList<>();
        for (Path dir : path) {
            if (result.contains(dir)) {
                continue;
            }
            if (ignoreVendor && dir.equals(vendorDir)) {
                continue;
            }
            result.add(dir);
        }
        return result;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    public static final class Builder {
        private Path programDir = Path.of(".");
        private final List<Path> libDirs = new ArrayList<>();
        private CodeMode mode = CodeMode.DRAFT;
        private boolean ignoreVendor;
        private Path vendorDir;
        private boolean scanRootOnly;
        private boolean strict;

        private Builder() {}

        public Builder programDir(Path programDir) {
            this.programDir = programDir;
            return this;
        }

        public Builder libDirs(List<Path> libDirs) {
            this.libDirs.clear();
            this.libDirs.addAll(libDirs);
            return this;
        }

        public Builder addLibDir(Path libDir) {
            this.libDirs.add(libDir);
            return this;
        }

        public Builder mode(CodeMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder ignoreVendor(boolean ignoreVendor) {
            this.ignoreVendor = ignoreVendor;
            return this;
        }

        public Builder vendorDir(Path vendorDir) {
            this.vendorDir = vendorDir;
            return this;
        }

        public Builder scanRootOnly(boolean scanRootOnly) {
            this.scanRootOnly = scanRootOnly;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public ResolverOptions build() {
            return new ResolverOptions(this);
        }
    }
}
