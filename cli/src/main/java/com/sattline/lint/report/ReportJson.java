package com.sattline.lint.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sattline.lint.Version;
import com.sattline.lint.loader.ProjectAnalysis;
import com.sattline.lint.loader.analysis.UsageCategory;
import com.sattline.lint.loader.analysis.UsageEntry;
import com.sattline.lint.loader.ast.SourceLocation;
import com.sattline.lint.loader.ast.VariableQualifier;
import com.sattline.lint.loader.merge.MergeConflict;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.SourceFile;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Machine-readable report of one analysis run. Output is stable for a given input: files keep
 * discovery order, usage entries keep declaration order, and every object has a fixed key order.
 */
public final class ReportJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private ReportJson() {}

    public static ObjectNode toTree(ProjectAnalysis analysis) {
        ProjectGraph graph = analysis.getGraph();
        ObjectNode root = MAPPER.createObjectNode();
        root.put("tool", Version.RUNTIME);
        root.put("root", graph.getRootName());
        root.put("mode", graph.getMode().name().toLowerCase(Locale.ROOT));
        root.put("rootLoaded", analysis.isRootLoaded());

        ArrayNode files = root.putArray("files");
        for (SourceFile file : graph.getFiles()) {
            ObjectNode node = files.addObject();
            node.put("name", file.getName());
            node.put("status", file.getStatus().name().toLowerCase(Locale.ROOT));
            node.put("path", file.getPath().map(Path::toString).orElse(null));
            node.put("referencedBy", file.getReferencedBy().orElse(null));
            file.getError().ifPresent(error -> node.put("error", error.getMessage()));
            file.getReadError().ifPresent(error -> node.put("error", String.valueOf(error.getMessage())));
        }

        ArrayNode conflicts = root.putArray("conflicts");
        for (MergeConflict conflict : analysis.getConflicts()) {
            ObjectNode node = conflicts.addObject();
            node.put("kind", conflict.getKind().name().toLowerCase(Locale.ROOT));
            node.put("name", conflict.getName());
            node.put("keptFile", conflict.getKeptFile());
            node.put("keptAt", location(conflict.getKeptLocation()));
            node.put("ignoredFile", conflict.getIgnoredFile());
            node.put("ignoredAt", location(conflict.getIgnoredLocation()));
        }

        ObjectNode usage = root.putObject("usage");
        usage.put("analyzedVariables", analysis.getUsageReport().getAnalyzedVariables());
        for (UsageCategory category : UsageCategory.values()) {
            ArrayNode entries = usage.putArray(category.getLabel());
            for (UsageEntry entry : analysis.getUsageReport().get(category)) {
                ObjectNode node = entries.addObject();
                node.put("variable", entry.getVariableName());
                node.put("scope", entry.getScopeName());
                node.put("type", entry.getDeclaredType());
                ArrayNode qualifiers = node.putArray("qualifiers");
                for (VariableQualifier qualifier : entry.getQualifiers()) {
                    qualifiers.add(qualifier.name());
                }
                node.put("location", location(entry.getLocation()));
                node.put("reads", entry.getReadCount());
                node.put("writes", entry.getWriteCount());
            }
        }
        return root;
    }

    public static String toJsonString(ProjectAnalysis analysis) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(toTree(analysis)) + "\n";
    }

    public static void write(ProjectAnalysis analysis, Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("path is null");
        }
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, toTree(analysis));
            out.write('\n');
        }
    }

    private static String location(SourceLocation location) {
        return location.isKnown() ? location.toString() : null;
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
