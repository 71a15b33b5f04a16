package com.sattline.lint.loader.ast;

public sealed interface StatementNode
        permits AssignmentNode,
                IfStatementNode,
                WhileStatementNode,
                CallStatementNode,
                SequenceStepNode,
                TransitionNode {

    SourceLocation getLocation();
}
