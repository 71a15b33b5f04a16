package com.sattline.lint.loader;

import com.sattline.lint.loader.analysis.UsageReport;
import com.sattline.lint.loader.merge.BasePicture;
import com.sattline.lint.loader.merge.MergeConflict;
import com.sattline.lint.loader.merge.MergeResult;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.SourceFile;
import java.util.List;
import java.util.Objects;

/** Everything one run of {@link SattLineProjectLoader} produced. */
public final class ProjectAnalysis {
    private final ProjectGraph graph;
    private final MergeResult mergeResult;
    private final UsageReport usageReport;

    public ProjectAnalysis(ProjectGraph graph, MergeResult mergeResult, UsageReport usageReport) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.mergeResult = Objects.requireNonNull(mergeResult, "mergeResult");
        this.usageReport = Objects.requireNonNull(usageReport, "usageReport");
    }

    public ProjectGraph getGraph() {
        return graph;
    }

    public MergeResult getMergeResult() {
        return mergeResult;
    }

    public BasePicture getBasePicture() {
        return mergeResult.getBasePicture();
    }

    public List<MergeConflict> getConflicts() {
        return mergeResult.getConflicts();
    }

    public UsageReport getUsageReport() {
        return usageReport;
    }

    /** True when the root program itself was found and parsed. */
    public boolean isRootLoaded() {
        return graph.getRoot().map(SourceFile::isOk).orElse(false);
    }
}
