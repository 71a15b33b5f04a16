package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

/** One {@code IF}/{@code ELSIF} arm: a condition and the statements guarded by it. */
public final class ConditionalBranchNode {
    private final ExpressionNode condition;
    private final List<StatementNode> statements;
    private final SourceLocation location;

    public ConditionalBranchNode(ExpressionNode condition, List<StatementNode> statements, SourceLocation location) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.statements = List.copyOf(statements);
        this.location = Objects.requireNonNull(location, "location");
    }

    public ExpressionNode getCondition() {
        return condition;
    }

    public List<StatementNode> getStatements() {
        return statements;
    }

    /** Position of the {@code IF} or {@code ELSIF} keyword opening this arm. */
    public SourceLocation getLocation() {
        return location;
    }
}
