package com.sattline.lint.loader.ast;

import java.util.Objects;

/**
 * A literal with its resolved value: {@link Long} for integers, {@link Double} for reals,
 * {@link Boolean} and unquoted {@link String}.
 */
public final class LiteralNode implements ExpressionNode {
    private final LiteralKind kind;
    private final Object value;
    private final SourceLocation location;

    public LiteralNode(LiteralKind kind, Object value, SourceLocation location) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
        this.location = Objects.requireNonNull(location, "location");
    }

    public LiteralKind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return kind == LiteralKind.STRING ? "\"" + value + "\"" : String.valueOf(value);
    }
}
