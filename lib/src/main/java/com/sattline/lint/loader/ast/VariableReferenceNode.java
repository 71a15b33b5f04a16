package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

/** A possibly dotted reference such as {@code Motor.Speed}; the first segment names the variable. */
public final class VariableReferenceNode implements ExpressionNode {
    private final List<String> path;
    private final SourceLocation location;

    public VariableReferenceNode(List<String> path, SourceLocation location) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Variable reference requires at least one name");
        }
        this.path = List.copyOf(path);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getRootName() {
        return path.get(0);
    }

    public List<String> getPath() {
        return path;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return String.join(".", path);
    }
}
