package com.sattline.lint.loader.resolve;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/** A referenced name has no file in any searched directory. */
public final class MissingDependencyException extends ResolutionException {
    private final String referencingName;
    private final Path referencingPath;

    public MissingDependencyException(
            String name, String referencingName, Path referencingPath, List<String> referenceChain) {
        super(
                "Missing dependency '" + name + "'"
                        + (referencingName == null ? "" : " referenced by '" + referencingName + "'")
                        + " (" + String.join(" -> ", referenceChain) + ")",
                name,
                referenceChain);
        this.referencingName = referencingName;
        this.referencingPath = referencingPath;
    }

    /** Logical name of the program that referenced the missing one; empty for the root itself. */
    public Optional<String> getReferencingName() {
        return Optional.ofNullable(referencingName);
    }

    /** File the reference was read from; empty for the root itself. */
    public Optional<Path> getReferencingPath() {
        return Optional.ofNullable(referencingPath);
    }
}
