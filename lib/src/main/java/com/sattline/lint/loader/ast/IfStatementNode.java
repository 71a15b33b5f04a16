package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

public final class IfStatementNode implements StatementNode {
    private final List<ConditionalBranchNode> branches;
    private final List<StatementNode> elseStatements;
    private final SourceLocation location;

    public IfStatementNode(
            List<ConditionalBranchNode> branches,
            List<StatementNode> elseStatements,
            SourceLocation location) {
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("IF statement requires at least one branch");
        }
        this.branches = List.copyOf(branches);
        this.elseStatements = List.copyOf(elseStatements);
        this.location = Objects.requireNonNull(location, "location");
    }

    public List<ConditionalBranchNode> getBranches() {
        return branches;
    }

    public List<StatementNode> getElseStatements() {
        return elseStatements;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }
}
