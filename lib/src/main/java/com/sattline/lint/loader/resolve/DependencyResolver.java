package com.sattline.lint.loader.resolve;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.AntlrSourceParser;
import com.sattline.lint.loader.ParseNode;
import com.sattline.lint.loader.SattLineParseException;
import com.sattline.lint.loader.SourceParser;
import com.sattline.lint.loader.TreeBuildResult;
import com.sattline.lint.loader.TreeBuilder;
import com.sattline.lint.loader.ast.Names;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Discovers the root program and every library it transitively references.
 *
 * <p>Names are processed from a work queue; each name is looked up at most once, so diamond and
 * cyclic references terminate without recursion. For every name the search path is walked in order
 * and the first directory holding a matching file wins.</p>
 *
 * <p>Lenient runs record every failure in the returned graph and keep going; strict runs throw on the
 * first one.</p>
 */
public final class DependencyResolver {

    private final SourceParser parser;
    private final TreeBuilder treeBuilder;
    private final ResolverOptions options;
    private final DiagnosticsSink diagnostics;
    private final SourceReader reader;

    public DependencyResolver(ResolverOptions options) {
        this(new AntlrSourceParser(), new TreeBuilder(), options, DiagnosticsSink.NONE);
    }

    public DependencyResolver(
            SourceParser parser, TreeBuilder treeBuilder, ResolverOptions options, DiagnosticsSink diagnostics) {
        this(parser, treeBuilder, options, diagnostics, SourceReader.FILES);
    }

    DependencyResolver(
            SourceParser parser,
            TreeBuilder treeBuilder,
            ResolverOptions options,
            DiagnosticsSink diagnostics,
            SourceReader reader) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.treeBuilder = Objects.requireNonNull(treeBuilder, "treeBuilder");
        this.options = Objects.requireNonNull(options, "options");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public ProjectGraph resolve(String rootName) throws ResolutionException {
        validateName(rootName);
        List<Path> searchPath = options.searchPath();
        diagnostics.trace(
                TraceEvent.info(
                        TraceEvent.Stage.RESOLVE,
                        "Resolving '" + rootName + "' in " + options.getMode() + " mode, search path " + searchPath,
                        rootName));
        if (options.isIgnoreVendor()) {
            options.getVendorDir()
                    .ifPresent(vendor -> diagnostics.trace(
                            TraceEvent.info(TraceEvent.Stage.RESOLVE, "Vendor directory excluded: " + vendor, rootName)));
        }
        for (Path dir : searchPath) {
            if (!Files.isDirectory(dir)) {
                diagnostics.trace(
                        TraceEvent.warning(
                                TraceEvent.Stage.RESOLVE, "Search directory does not exist: " + dir, rootName, 0));
            }
        }

        Map<String, SourceFile> files = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        Deque<PendingName> queue = new ArrayDeque<>();
        seen.add(Names.key(rootName));
        queue.add(new PendingName(rootName, null));

        while (!queue.isEmpty()) {
            PendingName pending = queue.poll();
            SourceFile file = resolveOne(pending, searchPath, files);
            files.put(Names.key(pending.name), file);

            switch (file.getStatus()) {
                case MISSING -> {
                    diagnostics.trace(
                            TraceEvent.warning(
                                    TraceEvent.Stage.RESOLVE,
                                    "Missing " + file.getFileName()
                                            + (pending.referencedBy == null ? "" : " referenced by " + pending.referencedBy),
                                    pending.name,
                                    0));
                    if (options.isStrict()) {
                        throw new MissingDependencyException(
                                pending.name,
                                pending.referencedBy,
                                referencingPath(files, pending),
                                ProjectGraph.referenceChain(files, pending.name));
                    }
                }
                case PARSE_ERROR -> {
                    SattLineParseException error = file.getError().orElseThrow();
                    diagnostics.trace(
                            TraceEvent.error(
                                    TraceEvent.Stage.RESOLVE,
                                    "Parse error: " + error.getDetail(),
                                    error.getLocation().getSourceName(),
                                    error.getLocation().getLine()));
                    if (options.isStrict()) {
                        throw new UnparsableDependencyException(
                                pending.name,
                                file.getPath().orElseThrow(),
                                error,
                                ProjectGraph.referenceChain(files, pending.name));
                    }
                }
                case UNREADABLE -> {
                    Path path = file.getPath().orElseThrow();
                    IOException error = file.getReadError().orElseThrow();
                    diagnostics.trace(
                            TraceEvent.error(
                                    TraceEvent.Stage.RESOLVE,
                                    "Unreadable " + path + ": " + error.getMessage(),
                                    pending.name,
                                    0));
                    if (options.isStrict()) {
                        throw new ResolutionException(
                                "Failed to read source file: " + path,
                                pending.name,
                                ProjectGraph.referenceChain(files, pending.name),
                                error);
                    }
                }
                case OK -> {
                    diagnostics.trace(
                            TraceEvent.info(
                                    TraceEvent.Stage.RESOLVE,
                                    "Loaded " + file.getPath().orElseThrow(),
                                    pending.name));
                    if (options.isScanRootOnly()) {
                        continue;
                    }
                    for (String reference : file.getReferencedNames()) {
                        if (seen.add(Names.key(reference))) {
                            queue.add(new PendingName(reference, pending.name));
                        }
                    }
                }
            }
        }

        return new ProjectGraph(
                rootName,
                options.getMode(),
                options.isIgnoreVendor(),
                options.isScanRootOnly(),
                new ArrayList<>(files.values()));
    }

    private SourceFile resolveOne(PendingName pending, List<Path> searchPath, Map<String, SourceFile> files)
            throws ResolutionException {
        String extension = options.getMode().getExtension();
        Path path = locate(pending, searchPath, files);
        if (path == null) {
            return SourceFile.missing(pending.name, extension, pending.referencedBy);
        }
        String text;
        try {
            text = reader.read(path);
        } catch (IOException ex) {
            return SourceFile.unreadable(pending.name, extension, path, ex, pending.referencedBy);
        }
        String sourceName = path.toString();
        try {
            ParseNode tree = parser.parse(sourceName, text);
            TreeBuildResult result = treeBuilder.build(tree, sourceName);
            return SourceFile.ok(pending.name, extension, path, tree, result, pending.referencedBy);
        } catch (SattLineParseException ex) {
            return SourceFile.parseError(pending.name, extension, path, ex, pending.referencedBy);
        }
    }

    /**
     * First directory in {@code searchPath} holding the file, or {@code null}. A directory that
     * cannot be listed is skipped with a warning, or aborts a strict run.
     */
    private Path locate(PendingName pending, List<Path> searchPath, Map<String, SourceFile> files)
            throws ResolutionException {
        String fileName = options.getMode().fileName(pending.name);
        for (Path dir : searchPath) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            Path exact = dir.resolve(fileName);
            if (Files.isRegularFile(exact)) {
                return exact;
            }
            List<Path> entries;
            try {
                entries = reader.list(dir);
            } catch (IOException ex) {
                if (options.isStrict()) {
                    throw new ResolutionException(
                            "Failed to list directory: " + dir, pending.name, pendingChain(files, pending), ex);
                }
                diagnostics.trace(
                        TraceEvent.warning(
                                TraceEvent.Stage.RESOLVE,
                                "Skipping unreadable directory " + dir + ": " + ex.getMessage(),
                                pending.name,
                                0));
                continue;
            }
            for (Path entry : entries) {
                if (entry.getFileName().toString().equalsIgnoreCase(fileName)) {
                    return entry;
                }
            }
        }
        return null;
    }

    private static List<String> pendingChain(Map<String, SourceFile> files, PendingName pending) {
        List<String> chain = new ArrayList<>();
        if (pending.referencedBy != null) {
            chain.addAll(ProjectGraph.referenceChain(files, pending.referencedBy));
        }
        chain.add(pending.name);
        return chain;
    }

    private static Path referencingPath(Map<String, SourceFile> files, PendingName pending) {
        if (pending.referencedBy == null) {
            return null;
        }
        SourceFile referrer = files.get(Names.key(pending.referencedBy));
        return referrer == null ? null : referrer.getPath().orElse(null);
    }

    private static void validateName(String rootName) {
        Objects.requireNonNull(rootName, "rootName");
        if (rootName.isBlank() || rootName.contains("/") || rootName.contains("\\")) {
            throw new IllegalArgumentException("Root name must be a logical program name: '" + rootName + "'");
        }
    }

    private static final class PendingName {
        private final String name;
        private final String referencedBy;

        private PendingName(String name, String referencedBy) {
            this.name = name;
            this.referencedBy = referencedBy;
        }
    }
}
