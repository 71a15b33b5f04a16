package com.sattline.lint.loader.ast;

import java.util.Objects;

public final class BinaryExpressionNode implements ExpressionNode {
    private final BinaryOperator operator;
    private final ExpressionNode left;
    private final ExpressionNode right;

    public BinaryExpressionNode(BinaryOperator operator, ExpressionNode left, ExpressionNode right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public BinaryOperator getOperator() {
        return operator;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    @Override
    public SourceLocation getLocation() {
        return left.getLocation();
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
