package com.sattline.lint.loader;

import com.sattline.lint.diagnostics.DiagnosticsSink;
import com.sattline.lint.loader.analysis.UsageReport;
import com.sattline.lint.loader.analysis.VariableUsageAnalyzer;
import com.sattline.lint.loader.merge.MergeEngine;
import com.sattline.lint.loader.merge.MergeResult;
import com.sattline.lint.loader.resolve.DependencyResolver;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.ResolutionException;
import com.sattline.lint.loader.resolve.ResolverOptions;
import java.util.Objects;
import java.util.logging.Logger;

/** Entry point for loading a SattLine project: resolve, merge, then analyse variable usage. */
public final class SattLineProjectLoader {
    private static final Logger LOGGER = Logger.getLogger(SattLineProjectLoader.class.getName());

    private final ResolverOptions options;
    private final DiagnosticsSink diagnostics;

    public SattLineProjectLoader(ResolverOptions options) {
        this(options, DiagnosticsSink.NONE);
    }

    public SattLineProjectLoader(ResolverOptions options, DiagnosticsSink diagnostics) {
        this.options = Objects.requireNonNull(options, "options");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /** Resolution only. */
    public ProjectGraph resolve(String rootName) throws ResolutionException {
        DependencyResolver resolver =
                new DependencyResolver(
                        new AntlrSourceParser(diagnostics), new TreeBuilder(), options, diagnostics);
        return resolver.resolve(rootName);
    }

    /**
     * Runs the whole pipeline. Under strict options the first missing or unparsable file is thrown
     * and nothing is analysed; otherwise the analysis covers whatever resolved.
     */
    public ProjectAnalysis load(String rootName) throws ResolutionException {
        ProjectGraph graph = resolve(rootName);
        if (graph.hasFailures()) {
            LOGGER.warning(
                    "Resolved '" + rootName + "' with " + graph.getMissing().size() + " missing, "
                            + graph.getParseErrors().size() + " unparsable and "
                            + graph.getUnreadable().size() + " unreadable files");
        }
        MergeResult merged = new MergeEngine(diagnostics).merge(graph);
        if (merged.hasConflicts()) {
            LOGGER.info(merged.getConflicts().size() + " merge conflicts for '" + rootName + "'");
        }
        UsageReport usage = new VariableUsageAnalyzer(diagnostics).analyze(merged.getBasePicture());
        return new ProjectAnalysis(graph, merged, usage);
    }
}
