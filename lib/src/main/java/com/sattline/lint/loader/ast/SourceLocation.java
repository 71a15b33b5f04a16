package com.sattline.lint.loader.ast;

import java.util.Objects;

/** File and position of a syntax element. Lines and columns are 1-based; 0 means unknown. */
public final class SourceLocation {

    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.line = line;
        this.column = column;
    }

    public static SourceLocation of(String sourceName, int line) {
        return new SourceLocation(sourceName, line, 0);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation other)) {
            return false;
        }
        return line == other.line && column == other.column && sourceName.equals(other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column);
    }

    @Override
    public String toString() {
        if (column > 0) {
            return sourceName + ":" + line + ":" + column;
        }
        return sourceName + ":" + line;
    }
}
