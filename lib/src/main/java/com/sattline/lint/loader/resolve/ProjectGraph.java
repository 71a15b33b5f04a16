package com.sattline.lint.loader.resolve;

import com.sattline.lint.loader.ast.Names;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every file considered while resolving one root program, in discovery order. The graph is
 * immutable: the resolver builds it once and every later stage only reads it.
 */
public final class ProjectGraph {
    private final String rootName;
    private final CodeMode mode;
    private final boolean ignoreVendor;
    private final boolean scanRootOnly;
    private final Map<String, SourceFile> files;

    public ProjectGraph(
            String rootName,
            CodeMode mode,
            boolean ignoreVendor,
            boolean scanRootOnly,
            List<SourceFile> files) {
        this.rootName = Objects.requireNonNull(rootName, "rootName");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.ignoreVendor = ignoreVendor;
        this.scanRootOnly = scanRootOnly;
        Map<String, SourceFile> byName = new LinkedHashMap<>();
        for (SourceFile file : files) {
            if (byName.putIfAbsent(Names.key(file.getName()), file) != null) {
                throw new IllegalArgumentException("Duplicate graph entry for " + file.getName());
            }
        }
        this.files = Collections.unmodifiableMap(byName);
    }

    public String getRootName() {
        return rootName;
    }

    public CodeMode getMode() {
        return mode;
    }

    public boolean isIgnoreVendor() {
        return ignoreVendor;
    }

    /** When set, only the root was parsed and its references were deliberately not followed. */
    public boolean isScanRootOnly() {
        return scanRootOnly;
    }

    public List<SourceFile> getFiles() {
        return List.copyOf(files.values());
    }

    public int size() {
        return files.size();
    }

    public Optional<SourceFile> find(String name) {
        return Optional.ofNullable(files.get(Names.key(name)));
    }

    public Optional<SourceFile> getRoot() {
        return find(rootName);
    }

    public List<SourceFile> getFiles(FileStatus status) {
        return files.values().stream().filter(file -> file.getStatus() == status).collect(Collectors.toList());
    }

    public List<SourceFile> getResolved() {
        return getFiles(FileStatus.OK);
    }

    public List<SourceFile> getMissing() {
        return getFiles(FileStatus.MISSING);
    }

    public List<SourceFile> getParseErrors() {
        return getFiles(FileStatus.PARSE_ERROR);
    }

    public List<SourceFile> getUnreadable() {
        return getFiles(FileStatus.UNREADABLE);
    }

    public boolean hasFailures() {
        return files.values().stream().anyMatch(file -> !file.isOk());
    }

    /** Referenced names per successfully parsed file, keyed by the referencing file's name. */
    public Map<String, Set<String>> getEdges() {
        Map<String, Set<String>> edges = new LinkedHashMap<>();
        for (SourceFile file : files.values()) {
            if (file.isOk()) {
                edges.put(file.getName(), file.getReferencedNames());
            }
        }
        return Collections.unmodifiableMap(edges);
    }

    /** Names referenced by some parsed file that have no entry in the graph. */
    public List<String> getUnresolvedReferences() {
        List<String> dangling = new ArrayList<>();
        for (SourceFile file : files.values()) {
            for (String reference : file.getReferencedNames()) {
                if (!files.containsKey(Names.key(reference)) && !dangling.contains(reference)) {
                    dangling.add(reference);
                }
            }
        }
        return dangling;
    }

    /** Names from the root down to {@code name}, following the first reference to each file. */
    public List<String> referenceChain(String name) {
        return referenceChain(files, name);
    }

    static List<String> referenceChain(Map<String, SourceFile> files, String name) {
        List<String> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String current = name;
        while (current != null && visited.add(Names.key(current))) {
            chain.add(0, current);
            SourceFile file = files.get(Names.key(current));
            current = file == null ? null : file.getReferencedBy().orElse(null);
        }
        return chain;
    }
}
