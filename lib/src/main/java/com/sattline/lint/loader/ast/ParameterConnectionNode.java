package com.sattline.lint.loader.ast;

import java.util.Objects;

/** {@code Parameter => expression} inside a submodule invocation. */
public final class ParameterConnectionNode {
    private final String parameterName;
    private final ExpressionNode value;
    private final SourceLocation location;

    public ParameterConnectionNode(String parameterName, ExpressionNode value, SourceLocation location) {
        this.parameterName = Objects.requireNonNull(parameterName, "parameterName");
        this.value = Objects.requireNonNull(value, "value");
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getParameterName() {
        return parameterName;
    }

    public ExpressionNode getValue() {
        return value;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
