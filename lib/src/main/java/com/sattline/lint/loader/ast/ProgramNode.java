package com.sattline.lint.loader.ast;

import java.util.List;
import java.util.Objects;

/** Syntax tree of one source file: its type definitions and its BasePicture-level body. */
public final class ProgramNode {
    private final String sourceName;
    private final SourceLocation location;
    private final List<DatatypeNode> datatypes;
    private final List<ModuleTypeNode> moduleTypes;
    private final ModuleBodyNode body;

    public ProgramNode(
            String sourceName,
            SourceLocation location,
            List<DatatypeNode> datatypes,
            List<ModuleTypeNode> moduleTypes,
            ModuleBodyNode body) {
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName");
        this.location = Objects.requireNonNull(location, "location");
        this.datatypes = List.copyOf(datatypes);
        this.moduleTypes = List.copyOf(moduleTypes);
        this.body = Objects.requireNonNull(body, "body");
    }

    public String getSourceName() {
        return sourceName;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public List<DatatypeNode> getDatatypes() {
        return datatypes;
    }

    public List<ModuleTypeNode> getModuleTypes() {
        return moduleTypes;
    }

    public ModuleBodyNode getBody() {
        return body;
    }
}
