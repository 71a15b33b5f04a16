package com.sattline.lint.loader.ast;

import java.util.Objects;

public final class UnaryExpressionNode implements ExpressionNode {
    private final UnaryOperator operator;
    private final ExpressionNode operand;
    private final SourceLocation location;

    public UnaryExpressionNode(UnaryOperator operator, ExpressionNode operand, SourceLocation location) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.operand = Objects.requireNonNull(operand, "operand");
        this.location = Objects.requireNonNull(location, "location");
    }

    public UnaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getOperand() {
        return operand;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return (operator == UnaryOperator.NOT ? "NOT " : "-") + operand;
    }
}
