package com.sattline.lint.loader.ast;

import java.util.Objects;
import java.util.Optional;

public final class TransitionNode implements StatementNode {
    private final String name;
    private final ExpressionNode condition;
    private final SourceLocation location;

    public TransitionNode(String name, ExpressionNode condition, SourceLocation location) {
        this.name = name;
        this.condition = Objects.requireNonNull(condition, "condition");
        this.location = Objects.requireNonNull(location, "location");
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public ExpressionNode getCondition() {
        return condition;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
