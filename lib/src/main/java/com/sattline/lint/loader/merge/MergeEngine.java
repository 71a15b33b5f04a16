package com.sattline.lint.loader.merge;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.ast.DatatypeNode;
import com.sattline.lint.loader.ast.ModuleBodyNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.ast.Names;
import com.sattline.lint.loader.ast.ProgramNode;
import com.sattline.lint.loader.ast.SourceLocation;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.SourceFile;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Unions the type tables of every successfully parsed file into one {@link BasePicture}. Files are
 * visited in graph discovery order and the first declaration of a name wins; later ones become
 * {@link MergeConflict}s. Missing and unparsable files contribute nothing.
 */
public final class MergeEngine {

    private final DiagnosticsSink diagnostics;

    public MergeEngine() {
        this(DiagnosticsSink.NONE);
    }

    public MergeEngine(DiagnosticsSink diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public MergeResult merge(ProjectGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, BasePicture.Declaration<DatatypeNode>> datatypes = new LinkedHashMap<>();
        Map<String, BasePicture.Declaration<ModuleTypeNode>> moduleTypes = new LinkedHashMap<>();
        List<MergeConflict> conflicts = new ArrayList<>();

        for (SourceFile file : graph.getResolved()) {
            ProgramNode program = file.getProgram().orElseThrow();
            insertAll(
                    MergeConflict.Kind.DATATYPE,
                    program.getDatatypes(),
                    DatatypeNode::getName,
                    DatatypeNode::getLocation,
                    file.getName(),
                    datatypes,
                    conflicts);
            insertAll(
                    MergeConflict.Kind.MODULE_TYPE,
                    program.getModuleTypes(),
                    ModuleTypeNode::getName,
                    ModuleTypeNode::getLocation,
                    file.getName(),
                    moduleTypes,
                    conflicts);
        }

        ModuleBodyNode rootBody =
                graph.getRoot()
                        .flatMap(SourceFile::getProgram)
                        .map(ProgramNode::getBody)
                        .orElseGet(() -> ModuleBodyNode.empty(SourceLocation.of(graph.getRootName(), 0)));
        BasePicture basePicture =
                new BasePicture(graph.getRootName(), rootBody, datatypes, moduleTypes, graph);
        diagnostics.trace(
                TraceEvent.info(
                        TraceEvent.Stage.MERGE,
                        "Merged " + graph.getResolved().size() + " files into " + basePicture
                                + " with " + conflicts.size() + " conflicts",
                        graph.getRootName()));
        return new MergeResult(basePicture, conflicts);
    }

    /** Picture of a single file's own declarations, without resolution. */
    public static BasePicture single(String rootName, ProgramNode program) {
        Map<String, BasePicture.Declaration<DatatypeNode>> datatypes = new LinkedHashMap<>();
        Map<String, BasePicture.Declaration<ModuleTypeNode>> moduleTypes = new LinkedHashMap<>();
        List<MergeConflict> ignored = new ArrayList<>();
        insertAll(MergeConflict.Kind.DATATYPE, program.getDatatypes(), DatatypeNode::getName,
                DatatypeNode::getLocation, rootName, datatypes, ignored);
        insertAll(MergeConflict.Kind.MODULE_TYPE, program.getModuleTypes(), ModuleTypeNode::getName,
                ModuleTypeNode::getLocation, rootName, moduleTypes, ignored);
        return new BasePicture(rootName, program.getBody(), datatypes, moduleTypes, null);
    }

    private static <T> void insertAll(
            MergeConflict.Kind kind,
            List<T> declarations,
            Function<T, String> nameOf,
            Function<T, SourceLocation> locationOf,
            String fileName,
            Map<String, BasePicture.Declaration<T>> table,
            List<MergeConflict> conflicts) {
        for (T declaration : declarations) {
            String name = nameOf.apply(declaration);
            BasePicture.Declaration<T> existing =
                    table.putIfAbsent(Names.key(name), new BasePicture.Declaration<>(declaration, fileName));
            if (existing != null) {
                conflicts.add(
                        new MergeConflict(
                                kind,
                                name,
                                existing.getFileName(),
                                locationOf.apply(existing.getNode()),
                                fileName,
                                locationOf.apply(declaration)));
            }
        }
    }
}
