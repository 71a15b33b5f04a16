package com.sattline.lint.loader.ast;

import java.util.Objects;

public final class AssignmentNode implements StatementNode {
    private final VariableReferenceNode target;
    private final ExpressionNode value;
    private final SourceLocation location;

    public AssignmentNode(VariableReferenceNode target, ExpressionNode value, SourceLocation location) {
        this.target = Objects.requireNonNull(target, "target");
        this.value = Objects.requireNonNull(value, "value");
        this.location = Objects.requireNonNull(location, "location");
    }

    public VariableReferenceNode getTarget() {
        return target;
    }

    public ExpressionNode getValue() {
        return value;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
