package com.sattline.lint.loader.resolve;

import java.util.Locale;

/** Selects the file-name extension used when looking up source files. */
public enum CodeMode {
    OFFICIAL(".x"),
    DRAFT(".s");

    private final String extension;

    CodeMode(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public String fileName(String logicalName) {
        return logicalName + extension;
    }

    /** Parses {@code official} or {@code draft}, ignoring case. */
    public static CodeMode fromName(String name) {
        String normalized = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        for (CodeMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown code mode '" + name + "' (expected official or draft)");
    }
}
