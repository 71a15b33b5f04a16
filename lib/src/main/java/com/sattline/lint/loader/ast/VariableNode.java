package com.sattline.lint.loader.ast;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A declared variable. The qualifier set is fixed at construction; usage counts are tracked by the
 * analyzer in its own tables, never on the node.
 */
public final class VariableNode {
    private final String name;
    private final TypeReference type;
    private final Set<VariableQualifier> qualifiers;
    private final ExpressionNode initialValue;
    private final SourceLocation location;

    public VariableNode(
            String name,
            TypeReference type,
            Set<VariableQualifier> qualifiers,
            ExpressionNode initialValue,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.qualifiers =
                qualifiers.isEmpty()
                        ? Collections.emptySet()
                        : Collections.unmodifiableSet(EnumSet.copyOf(qualifiers));
        this.initialValue = initialValue;
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public TypeReference getType() {
        return type;
    }

    public Set<VariableQualifier> getQualifiers() {
        return qualifiers;
    }

    public boolean isConstant() {
        return qualifiers.contains(VariableQualifier.CONST);
    }

    public Optional<ExpressionNode> getInitialValue() {
        return Optional.ofNullable(initialValue);
    }

    public SourceLocation getLocation() {
        return location;
    }
}
