package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * An ordered list of statements. Equation blocks hold plain statements; sequences hold
 * {@link SequenceStepNode} and {@link TransitionNode} entries in source order.
 */
public final class CodeSequenceNode {
    private final String name;
    private final CodeSequenceKind kind;
    private final List<StatementNode> statements;
    private final SourceLocation location;

    public CodeSequenceNode(
            String name, CodeSequenceKind kind, List<StatementNode> statements, SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statements = List.copyOf(statements);
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public CodeSequenceKind getKind() {
        return kind;
    }

    public List<StatementNode> getStatements() {
        return statements;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
