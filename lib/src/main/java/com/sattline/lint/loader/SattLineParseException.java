package com.sattline.lint.loader;

import com.sattline.lint.loader.ast.SourceLocation;
import java.util.Objects;

/**
 * Checked exception signalling that one source file could not be turned into a syntax tree, either
 * because the text does not match the grammar or because the parse tree has a shape the tree builder
 * does not recognise. The failure is local to the file it names.
 */
public final class SattLineParseException extends Exception {
    private final SourceLocation location;
    private final String detail;

    public SattLineParseException(String detail, SourceLocation location) {
        this(detail, location, null);
    }

    public SattLineParseException(String detail, SourceLocation location, Throwable cause) {
        super(location + ": " + detail, cause);
        this.location = Objects.requireNonNull(location, "location");
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** The message without the location prefix. */
    public String getDetail() {
        return detail;
    }
}
