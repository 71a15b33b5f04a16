package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

/** Local variables, submodule instances and code shared by the BasePicture and module types. */
public final class ModuleBodyNode {
    private final List<VariableNode> localVariables;
    private final List<SubmoduleNode> submodules;
    private final List<CodeSequenceNode> codeSequences;
    private final SourceLocation location;

    public ModuleBodyNode(
            List<VariableNode> localVariables,
            List<SubmoduleNode> submodules,
            List<CodeSequenceNode> codeSequences,
            SourceLocation location) {
        this.localVariables = List.copyOf(localVariables);
        this.submodules = List.copyOf(submodules);
        this.codeSequences = List.copyOf(codeSequences);
        this.location = Objects.requireNonNull(location, "location");
    }

    public static ModuleBodyNode empty(SourceLocation location) {
        return new ModuleBodyNode(List.of(), List.of(), List.of(), location);
    }

    public List<VariableNode> getLocalVariables() {
        return localVariables;
    }

    public List<SubmoduleNode> getSubmodules() {
        return submodules;
    }

    public List<CodeSequenceNode> getCodeSequences() {
        return codeSequences;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
