package com.sattline.lint.report;

import com.sattline.lint.loader.ast.DatatypeNode;
import com.sattline.lint.loader.ast.ModuleTypeNode;
import com.sattline.lint.loader.merge.BasePicture;
import com.sattline.lint.loader.merge.MergeConflict;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.SourceFile;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/** Human-readable console summaries for the command line. */
public final class SummaryPrinter {

    private final PrintStream out;

    public SummaryPrinter(PrintStream out) {
        this.out = out;
    }

    public void resolution(ProjectGraph graph, boolean showMissing) {
        out.println("Resolution of '" + graph.getRootName() + "' ("
                + graph.getMode().name().toLowerCase(Locale.ROOT) + " mode)");
        out.println("  found:        " + graph.getResolved().size());
        out.println("  missing:      " + graph.getMissing().size());
        out.println("  parse errors: " + graph.getParseErrors().size());
        for (SourceFile file : graph.getParseErrors()) {
            out.println("    " + file.getError().map(Throwable::getMessage).orElse(file.getName()));
        }
        out.println("  unreadable:   " + graph.getUnreadable().size());
        for (SourceFile file : graph.getUnreadable()) {
            out.println("    " + file.getPath().orElseThrow() + ": "
                    + file.getReadError().map(Throwable::getMessage).orElse(""));
        }
        if (showMissing) {
            for (SourceFile file : graph.getMissing()) {
                out.println("    missing " + file.getFileName() + " via "
                        + String.join(" -> ", graph.referenceChain(file.getName())));
            }
        }
    }

    public void conflicts(List<MergeConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return;
        }
        out.println("Merge conflicts (" + conflicts.size() + ")");
        for (MergeConflict conflict : conflicts) {
            out.println("  " + conflict);
        }
    }

    public void basePicture(BasePicture basePicture) {
        out.println(basePicture);
        for (DatatypeNode datatype : basePicture.getDatatypes()) {
            out.println("  datatype " + datatype.getName() + " from "
                    + basePicture.getDatatypeOrigin(datatype.getName()).orElse("?"));
        }
        for (ModuleTypeNode moduleType : basePicture.getModuleTypes()) {
            out.println("  module type " + moduleType.getName() + " from "
                    + basePicture.getModuleTypeOrigin(moduleType.getName()).orElse("?"));
        }
    }
}
