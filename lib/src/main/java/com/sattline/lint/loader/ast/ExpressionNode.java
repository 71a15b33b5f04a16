package com.sattline.lint.loader.ast;

public sealed interface ExpressionNode
        permits LiteralNode,
                VariableReferenceNode,
                UnaryExpressionNode,
                BinaryExpressionNode,
                CallExpressionNode {

    SourceLocation getLocation();
}
