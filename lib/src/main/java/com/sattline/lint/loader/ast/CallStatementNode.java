package com.sattline.lint.loader.ast;

import java.util.Objects;

public final class CallStatementNode implements StatementNode {
    private final CallExpressionNode call;

    public CallStatementNode(CallExpressionNode call) {
        this.call = Objects.requireNonNull(call, "call");
    }

    public CallExpressionNode getCall() {
        return call;
    }

    @Override
    public SourceLocation getLocation() {
        return call.getLocation();
    }
}
