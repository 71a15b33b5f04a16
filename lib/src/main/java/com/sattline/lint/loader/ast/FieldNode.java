package com.sattline.lint.loader.ast;

import java.util.Objects;
import java.util.Optional;

public final class FieldNode {
    private final String name;
    private final TypeReference type;
    private final LiteralNode defaultValue;
    private final SourceLocation location;

    public FieldNode(String name, TypeReference type, LiteralNode defaultValue, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.defaultValue = defaultValue;
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public TypeReference getType() {
        return type;
    }

    public Optional<LiteralNode> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public SourceLocation getLocation() {
        return location;
    }
}
