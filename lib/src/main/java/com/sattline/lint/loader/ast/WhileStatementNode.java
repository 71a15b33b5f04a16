package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

public final class WhileStatementNode implements StatementNode {
    private final ExpressionNode condition;
    private final List<StatementNode> body;
    private final SourceLocation location;

    public WhileStatementNode(ExpressionNode condition, List<StatementNode> body, SourceLocation location) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = List.copyOf(body);
        this.location = Objects.requireNonNull(location, "location");
    }

    public ExpressionNode getCondition() {
        return condition;
    }

    public List<StatementNode> getBody() {
        return body;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
