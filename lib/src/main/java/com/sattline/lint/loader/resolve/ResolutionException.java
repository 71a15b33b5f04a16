package com.sattline.lint.loader.resolve;

import java.util.List;

/**
 * Checked exception signalling that dependency resolution stopped before the work queue was empty.
 * Only strict runs raise it: one of the subclasses on the first missing or unparsable file, this
 * type directly when a file or directory on the search path cannot be read.
 */
public class ResolutionException extends Exception {
    private final String name;
    private final List<String> referenceChain;

    public ResolutionException(String message, String name, List<String> referenceChain) {
        this(message, name, referenceChain, null);
    }

    public ResolutionException(String message, String name, List<String> referenceChain, Throwable cause) {
        super(message, cause);
        this.name = name;
        this.referenceChain = List.copyOf(referenceChain);
    }

    /** Logical name being resolved when the run stopped. */
    public String getName() {
        return name;
    }

    /** Names from the root program down to {@link #getName()}. */
    public List<String> getReferenceChain() {
        return referenceChain;
    }
}
