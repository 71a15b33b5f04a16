package com.sattline.lint.loader.merge;

import com.sattline.lint.loader.ast.DatatypeNode;
import com.sattline.lint.loader.ast.ModuleBodyNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.ast.Names;
import com.sattline.lint.loader.ast.VariableNode;
import com.sattline.lint.loader.resolve.ProjectGraph;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Project-wide symbol space: the root program's own body plus every datatype and module type
 * declared by any resolved file. Lookups ignore case. Read-only once built.
 */
public final class BasePicture {
    private final String rootName;
    private final ModuleBodyNode body;
    private final Map<String, Declaration<DatatypeNode>> datatypes;
    private final Map<String, Declaration<ModuleTypeNode>> moduleTypes;
    private final ProjectGraph graph;

    BasePicture(
            String rootName,
            ModuleBodyNode body,
            Map<String, Declaration<DatatypeNode>> datatypes,
            Map<String, Declaration<ModuleTypeNode>> moduleTypes,
            ProjectGraph graph) {
        this.rootName = Objects.requireNonNull(rootName, "rootName");
        this.body = Objects.requireNonNull(body, "body");
        this.datatypes = Collections.unmodifiableMap(new LinkedHashMap<>(datatypes));
        this.moduleTypes = Collections.unmodifiableMap(new LinkedHashMap<>(moduleTypes));
        this.graph = graph;
    }

    public String getRootName() {
        return rootName;
    }

    /** Global variables, submodule instances and code of the root program. */
    public ModuleBodyNode getBody() {
        return body;
    }

    public List<VariableNode> getGlobalVariables() {
        return body.getLocalVariables();
    }

    /** Datatypes in merge order. */
    public List<DatatypeNode> getDatatypes() {
        return datatypes.values().stream().map(Declaration::getNode).toList();
    }

    /** Module types in merge order. */
    public List<ModuleTypeNode> getModuleTypes() {
        return moduleTypes.values().stream().map(Declaration::getNode).toList();
    }

    public Optional<DatatypeNode> findDatatype(String name) {
        return Optional.ofNullable(datatypes.get(Names.key(name))).map(Declaration::getNode);
    }

    public Optional<ModuleTypeNode> findModuleType(String name) {
        return Optional.ofNullable(moduleTypes.get(Names.key(name))).map(Declaration::getNode);
    }

    /** Logical name of the file that contributed the datatype. */
    public Optional<String> getDatatypeOrigin(String name) {
        return Optional.ofNullable(datatypes.get(Names.key(name))).map(Declaration::getFileName);
    }

    /** Logical name of the file that contributed the module type. */
    public Optional<String> getModuleTypeOrigin(String name) {
        return Optional.ofNullable(moduleTypes.get(Names.key(name))).map(Declaration::getFileName);
    }

    /** The graph this picture was merged from; empty for a picture built from a single file. */
    public Optional<ProjectGraph> getGraph() {
        return Optional.ofNullable(graph);
    }

    @Override
    public String toString() {
        return "BasePicture " + rootName + " (" + datatypes.size() + " datatypes, " + moduleTypes.size()
                + " module types, " + body.getLocalVariables().size() + " globals, "
                + body.getCodeSequences().size() + " code blocks)";
    }

    static final class Declaration<T> {
        private final T node;
        private final String fileName;

        Declaration(T node, String fileName) {
            this.node = node;
            this.fileName = fileName;
        }

        T getNode() {
            return node;
        }

        String getFileName() {
            return fileName;
        }
    }
}
