package com.sattline.lint.cli;

import com.sattline.lint.Version;
import com.sattline.lint.config.ConfigurationException;
import com.sattline.lint.config.LintConfig;
import com.sattline.lint.config.LintConfigLoader;
import com.sattline.lint.diagnostics.LoggingDiagnosticsSink;
import com.sattline.lint.loader.ProjectAnalysis;
import com.sattline.lint.loader.SattLineProjectLoader;
import com.sattline.lint.loader.resolve.CodeMode;
import com.sattline.lint.loader.resolve.MissingDependencyException;
import com.sattline.lint.loader.resolve.ProjectGraph;
import com.sattline.lint.loader.resolve.ResolutionException;
import com.sattline.lint.loader.resolve.ResolverOptions;
import com.sattline.lint.loader.resolve.SourceFile;
import com.sattline.lint.report.AstDumper;
import com.sattline.lint.report.ReportJson;
import com.sattline.lint.report.SummaryPrinter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/** Command line front end: {@code sattlint [root] [options]}. */
public final class SattLintCli {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_ANALYSIS = 2;
    static final int EXIT_OUTPUT = 3;

    static final String DEFAULT_ROOT = "BasePicture";

    private static final Logger PACKAGE_LOGGER = Logger.getLogger("com.sattline.lint");

    private SattLintCli() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Testable entry point that returns an exit code instead of calling System.exit. */
    public static int run(String[] args) {
        return run(args, System.out, System.err);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            err.println();
            CliArgs.printHelp(err);
            return EXIT_USAGE;
        }
        if (parsed.help) {
            CliArgs.printHelp(out);
            return EXIT_OK;
        }
        if (parsed.version) {
            out.println(Version.RUNTIME);
            return EXIT_OK;
        }

        LintConfig config = LintConfig.empty();
        if (parsed.config != null) {
            try {
                config = LintConfigLoader.load(Paths.get(parsed.config));
            } catch (ConfigurationException ex) {
                err.println("Error: " + ex.getMessage());
                return EXIT_USAGE;
            }
        }

        boolean debug = !parsed.noDebug && (config.debug == null || config.debug);
        configureLogging(debug, parsed.verbose);

        String rootName = firstNonNull(parsed.root, config.root, DEFAULT_ROOT);
        ResolverOptions options;
        try {
            options = toResolverOptions(parsed, config);
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        }
        SattLineProjectLoader loader = new SattLineProjectLoader(options, new LoggingDiagnosticsSink());
        SummaryPrinter summary = new SummaryPrinter(out);

        if (parsed.dryRun) {
            ProjectGraph graph;
            try {
                graph = loader.resolve(rootName);
            } catch (ResolutionException ex) {
                printResolutionFailure(err, ex);
                return EXIT_ANALYSIS;
            } catch (IllegalArgumentException ex) {
                err.println("Error: " + ex.getMessage());
                return EXIT_USAGE;
            }
            summary.resolution(graph, parsed.showMissing);
            return rootLoaded(graph) ? EXIT_OK : EXIT_ANALYSIS;
        }

        ProjectAnalysis analysis;
        try {
            analysis = loader.load(rootName);
        } catch (ResolutionException ex) {
            printResolutionFailure(err, ex);
            return EXIT_ANALYSIS;
        } catch (IllegalArgumentException ex) {
            err.println("Error: " + ex.getMessage());
            return EXIT_USAGE;
        }

        summary.resolution(analysis.getGraph(), parsed.showMissing);
        if (!analysis.isRootLoaded()) {
            err.println("Error: root program '" + rootName + "' could not be loaded");
            return EXIT_ANALYSIS;
        }
        summary.conflicts(analysis.getConflicts());
        summary.basePicture(analysis.getBasePicture());
        out.print(analysis.getUsageReport().summary());

        SourceFile root = analysis.getGraph().getRoot().orElseThrow();
        try {
            if (parsed.dumpParseTree != null) {
                writeText(Paths.get(parsed.dumpParseTree), root.getParseTree().orElseThrow().pretty());
            }
            if (parsed.dumpAst != null) {
                writeText(Paths.get(parsed.dumpAst), AstDumper.dump(root.getProgram().orElseThrow()));
            }
            if (parsed.reportJson != null) {
                ReportJson.write(analysis, Paths.get(parsed.reportJson));
            }
        } catch (IOException ex) {
            err.println("Error: could not write output: " + ex.getMessage());
            return EXIT_OUTPUT;
        }
        return EXIT_OK;
    }

    static ResolverOptions toResolverOptions(CliArgs parsed, LintConfig config) {
        ResolverOptions.Builder builder = ResolverOptions.builder();
        builder.programDir(Paths.get(firstNonNull(parsed.programsDir, config.programsDir, ".")));
        List<String> libs = parsed.libsDirs != null ? parsed.libsDirs : config.libsDirs;
        if (libs != null) {
            for (String lib : libs) {
                builder.addLibDir(Paths.get(lib));
            }
        }
        String mode = firstNonNull(parsed.mode, config.mode, "draft");
        builder.mode(CodeMode.fromName(mode));
        String vendorDir = firstNonNull(parsed.vendorDir, config.vendorDir, null);
        if (vendorDir != null) {
            builder.vendorDir(Paths.get(vendorDir));
        }
        builder.ignoreVendor(parsed.vendorIgnore || Boolean.TRUE.equals(config.ignoreVendor));
        builder.scanRootOnly(parsed.scanRootOnly || Boolean.TRUE.equals(config.scanRootOnly));
        builder.strict(parsed.strict || Boolean.TRUE.equals(config.strict));
        return builder.build();
    }

    private static boolean rootLoaded(ProjectGraph graph) {
        return graph.getRoot().map(SourceFile::isOk).orElse(false);
    }

    private static void printResolutionFailure(PrintStream err, ResolutionException ex) {
        err.println("Error: " + ex.getMessage());
        if (ex instanceof MissingDependencyException missing) {
            missing.getReferencingName().ifPresent(name -> err.println("  referenced by " + name));
            missing.getReferencingPath().ifPresent(path -> err.println("  in " + path));
        }
        err.println("  chain: " + String.join(" -> ", ex.getReferenceChain()));
    }

    private static void writeText(Path path, String text) throws IOException {
        Path parent = path.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }

    /** Debug wins over verbose; without either only warnings reach the console. */
    static void configureLogging(boolean debug, boolean verbose) {
        Level level = debug ? Level.FINE : verbose ? Level.INFO : Level.WARNING;
        for (Handler handler : PACKAGE_LOGGER.getHandlers()) {
            PACKAGE_LOGGER.removeHandler(handler);
        }
        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(new SimpleFormatter());
        PACKAGE_LOGGER.addHandler(console);
        PACKAGE_LOGGER.setLevel(level);
        PACKAGE_LOGGER.setUseParentHandlers(false);
    }

    private static String firstNonNull(String first, String second, String fallback) {
        if (first != null) {
            return first;
        }
        return second != null ? second : fallback;
    }

    static final class CliArgs {
        boolean help;
        boolean version;
        String root;
        String programsDir;
        List<String> libsDirs;
        String mode;
        String vendorDir;
        boolean vendorIgnore;
        boolean scanRootOnly;
        boolean strict;
        boolean noDebug;
        boolean showMissing;
        boolean verbose;
        boolean dryRun;
        String dumpParseTree;
        String dumpAst;
        String reportJson;
        String config;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();
            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) {
                    continue;
                }
                switch (a) {
                    case "--help", "-h" -> out.help = true;
                    case "--version" -> out.version = true;
                    case "--programs-dir", "-p" -> out.programsDir = requireValue(args, ++i, a);
                    case "--libs-dirs", "-l" -> out.libsDirs = splitList(requireValue(args, ++i, a));
                    case "--mode", "-m" -> {
                        out.mode = requireValue(args, ++i, a);
                        CodeMode.fromName(out.mode);
                    }
                    case "--vendor-dir" -> out.vendorDir = requireValue(args, ++i, a);
                    case "--vendor-ignore" -> out.vendorIgnore = true;
                    case "--scan-root-only" -> out.scanRootOnly = true;
                    case "--strict" -> out.strict = true;
                    case "--no-debug" -> out.noDebug = true;
                    case "--show-missing" -> out.showMissing = true;
                    case "--verbose", "-v" -> out.verbose = true;
                    case "--dry-run" -> out.dryRun = true;
                    case "--dump-parse-tree" -> out.dumpParseTree = requireValue(args, ++i, a);
                    case "--dump-ast" -> out.dumpAst = requireValue(args, ++i, a);
                    case "--report-json" -> out.reportJson = requireValue(args, ++i, a);
                    case "--config" -> out.config = requireValue(args, ++i, a);
                    default -> {
                        if (a.startsWith("-")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        if (out.root != null) {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                        out.root = a;
                    }
                }
            }
            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return v;
        }

        static List<String> splitList(String value) {
            List<String> items = new ArrayList<>();
            for (String item : value.split(",")) {
                if (!item.isBlank()) {
                    items.add(item.trim());
                }
            }
            return items;
        }

        static void printHelp(PrintStream out) {
            out.println("Usage: sattlint [root] [options]");
            out.println();
            out.println("Resolves a SattLine program and its libraries, merges their type tables and");
            out.println("reports unused, read-only and write-only variables. Root defaults to "
                    + DEFAULT_ROOT + ".");
            out.println();
            out.println("Options:");
            out.println("  -p, --programs-dir DIR    Directory holding the root program (default .)");
            out.println("  -l, --libs-dirs A,B       Library directories, searched in order");
            out.println("  -m, --mode MODE           official (.x) or draft (.s, default)");
            out.println("      --vendor-dir DIR      Vendor library directory");
            out.println("      --vendor-ignore       Leave the vendor directory out of the search");
            out.println("      --scan-root-only      Load the root program without following references");
            out.println("      --strict              Stop at the first missing or unparsable file");
            out.println("      --show-missing        List missing files with their reference chains");
            out.println("      --dry-run             Resolve only");
            out.println("      --dump-parse-tree F   Write the root parse tree to F");
            out.println("      --dump-ast F          Write the root syntax tree to F");
            out.println("      --report-json F       Write a JSON report to F");
            out.println("      --config F.toml       Read settings from a TOML file");
            out.println("      --no-debug            Turn off debug tracing");
            out.println("  -v, --verbose             Log progress");
            out.println("      --version             Print the version");
            out.println("  -h, --help                Show this help");
            out.println();
            out.println("Exit codes: 0 ok, 1 usage or configuration error, 2 root not loaded or strict");
            out.println("failure, 3 output could not be written.");
        }
    }
}
