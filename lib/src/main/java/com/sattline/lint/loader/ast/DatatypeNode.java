package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A named type definition. Records carry fields; aliases carry the referenced type and no fields.
 */
public final class DatatypeNode {
    private final String name;
    private final DatatypeKind kind;
    private final List<FieldNode> fields;
    private final TypeReference aliasOf;
    private final SourceLocation location;

    private DatatypeNode(
            String name,
            DatatypeKind kind,
            List<FieldNode> fields,
            TypeReference aliasOf,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.fields = List.copyOf(fields);
        this.aliasOf = aliasOf;
        this.location = Objects.requireNonNull(location, "location");
    }

    public static DatatypeNode record(String name, List<FieldNode> fields, SourceLocation location) {
        return new DatatypeNode(name, DatatypeKind.RECORD, fields, null, location);
    }

    public static DatatypeNode alias(String name, TypeReference aliasOf, SourceLocation location) {
        return new DatatypeNode(
                name, DatatypeKind.ALIAS, List.of(), Objects.requireNonNull(aliasOf, "aliasOf"), location);
    }

    public String getName() {
        return name;
    }

    public DatatypeKind getKind() {
        return kind;
    }

    public List<FieldNode> getFields() {
        return fields;
    }

    public Optional<TypeReference> getAliasOf() {
        return Optional.ofNullable(aliasOf);
    }

    public SourceLocation getLocation() {
        return location;
    }
}
