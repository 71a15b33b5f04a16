package com.sattline.lint.loader.merge;

import com.sattline.lint.loader.ast.SourceLocation;
import java.util.Objects;

/**
 * Two declarations of the same datatype or module-type name. The first one stays in the
 * {@link BasePicture}; the second is only reported here.
 */
public final class MergeConflict {

    public enum Kind {
        DATATYPE,
        MODULE_TYPE
    }

    private final Kind kind;
    private final String name;
    private final String keptFile;
    private final SourceLocation keptLocation;
    private final String ignoredFile;
    private final SourceLocation ignoredLocation;

    public MergeConflict(
            Kind kind,
            String name,
            String keptFile,
            SourceLocation keptLocation,
            String ignoredFile,
            SourceLocation ignoredLocation) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
        this.keptFile = Objects.requireNonNull(keptFile, "keptFile");
        this.keptLocation = Objects.requireNonNull(keptLocation, "keptLocation");
        this.ignoredFile = Objects.requireNonNull(ignoredFile, "ignoredFile");
        this.ignoredLocation = Objects.requireNonNull(ignoredLocation, "ignoredLocation");
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /** Logical name of the file whose declaration was kept. */
    public String getKeptFile() {
        return keptFile;
    }

    public SourceLocation getKeptLocation() {
        return keptLocation;
    }

    /** Logical name of the file whose declaration was dropped. */
    public String getIgnoredFile() {
        return ignoredFile;
    }

    public SourceLocation getIgnoredLocation() {
        return ignoredLocation;
    }

    @Override
    public String toString() {
        return kind + " '" + name + "' declared in " + keptFile + " (" + keptLocation + ") and "
                + ignoredFile + " (" + ignoredLocation + ")";
    }
}
