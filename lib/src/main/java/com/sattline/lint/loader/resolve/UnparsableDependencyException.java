package com.sattline.lint.loader.resolve;

import com.sattline.lint.loader.SattLineParseException;
import java.nio.file.Path;
import java.util.List;

/** A file was found for a name but could not be parsed. */
public final class UnparsableDependencyException extends ResolutionException {
    private final Path path;

    public UnparsableDependencyException(
            String name, Path path, SattLineParseException cause, List<String> referenceChain) {
        super(
                "Failed to parse '" + name + "': " + cause.getMessage()
                        + " (" + String.join(" -> ", referenceChain) + ")",
                name,
                referenceChain,
                cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    public SattLineParseException getParseError() {
        return (SattLineParseException) getCause();
    }
}
