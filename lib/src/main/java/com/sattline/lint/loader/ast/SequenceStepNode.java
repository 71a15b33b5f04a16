package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

public final class SequenceStepNode implements StatementNode {
    private final String name;
    private final boolean initial;
    private final List<StatementNode> statements;
    private final SourceLocation location;

    public SequenceStepNode(
            String name, boolean initial, List<StatementNode> statements, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.initial = initial;
        this.statements = List.copyOf(statements);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public boolean isInitial() {
        return initial;
    }

    public List<StatementNode> getStatements() {
        return statements;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
