package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

public final class CallExpressionNode implements ExpressionNode {
    private final String functionName;
    private final List<ExpressionNode> arguments;
    private final SourceLocation location;

    public CallExpressionNode(String functionName, List<ExpressionNode> arguments, SourceLocation location) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.arguments = List.copyOf(arguments);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<ExpressionNode> getArguments() {
        return arguments;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    @Override
    public String toString() {
        StringBuilder text = new StringBuilder(functionName).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                text.append(", ");
            }
            text.append(arguments.get(i));
        }
        return text.append(')').toString();
    }
}
