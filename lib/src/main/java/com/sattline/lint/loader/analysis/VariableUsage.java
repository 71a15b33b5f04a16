package com.sattline.lint.loader.analysis;

import com.sattline.lint.loader.ast.VariableNode;

/** Mutable read/write tally for one declared variable while a scope is walked. */
final class VariableUsage {
    private final VariableNode variable;
    private final String scopeName;
    private int reads;
    private int writes;

    VariableUsage(VariableNode variable, String scopeName) {
        this.variable = variable;
        this.scopeName = scopeName;
    }

    void recordRead() {
        reads++;
    }

    void recordWrite() {
        writes++;
    }

    VariableNode getVariable() {
        return variable;
    }

    String getScopeName() {
        return scopeName;
    }

    int getReads() {
        return reads;
    }

    int getWrites() {
        return writes;
    }

    UsageEntry toEntry() {
        return new UsageEntry(
                variable.getName(),
                scopeName,
                variable.getType().getName(),
                variable.getQualifiers(),
                variable.getLocation(),
                reads,
                writes);
    }
}
