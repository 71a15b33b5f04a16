package com.sattline.lint.loader.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public final class ModuleTypeNode {
    private final String name;
    private final List<VariableNode> parameters;
    private final ModuleBodyNode body;
    private final Set<String> uses;
    private final SourceLocation location;

    public ModuleTypeNode(
            String name,
            List<VariableNode> parameters,
            ModuleBodyNode body,
            Set<String> uses,
            SourceLocation location) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body, "body");
        this.uses = Collections.unmodifiableSet(new LinkedHashSet<>(uses));
        this.location = Objects.requireNonNull(location, "location");
    }

    public String getName() {
        return name;
    }

    public List<VariableNode> getParameters() {
        return parameters;
    }

    public ModuleBodyNode getBody() {
        return body;
    }

    public List<VariableNode> getLocalVariables() {
        return body.getLocalVariables();
    }

    public List<CodeSequenceNode> getCodeSequences() {
        return body.getCodeSequences();
    }

    /** Names of the datatypes and module types this module type refers to, in first-use order. */
    public Set<String> getUses() {
        return uses;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
