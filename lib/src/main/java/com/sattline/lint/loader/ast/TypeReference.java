package com.sattline.lint.loader.ast;

import java.util.Objects;
import java.util.Set;

/** A type name appearing in a type position (variable, parameter, field, alias or submodule). */
public final class TypeReference {

    private static final Set<String> BUILTIN_TYPES =
            Set.of(
                    "integer",
                    "real",
                    "boolean",
                    "bool",
                    "string",
                    "time",
                    "duration",
                    "identstring",
                    "tagstring",
                    "linestring",
                    "maxstring");

    private final String name;
    private final SourceLocation location;

    public TypeReference(String name, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.location = Objects.requireNonNull(location, "location");
    }

    public static boolean isBuiltin(String typeName) {
        return BUILTIN_TYPES.contains(Names.key(typeName));
    }

    public String getName() {
        return name;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public boolean isBuiltin() {
        return isBuiltin(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
