package com.sattline.lint.loader.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sattline.lint.diagnostics.RecordingDiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.AntlrSourceParser;
import com.sattline.lint.loader.TestSources;
import com.sattline.lint.loader.TreeBuilder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DependencyResolverTest {

    @Test
    void resolvesReferencesTransitively() throws Exception {
        Path project = Files.createTempDirectory("sattline-resolve");
        Path programs = project.resolve("programs");
        Path libs = project.resolve("libs");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(libs, "Pump.s", "Pump", "Valve");
        TestSources.writeModuleType(libs, "Valve.s", "Valve");

        ProjectGraph graph = resolver(options(programs).addLibDir(libs)).resolve("Plant");

        assertEquals(List.of("Plant", "Pump", "Valve"), names(graph.getFiles()));
        assertTrue(graph.getFiles().stream().allMatch(SourceFile::isOk));
        assertFalse(graph.hasFailures());
        assertEquals(List.of("Pump"), List.copyOf(graph.getEdges().get("Plant")));
        assertEquals("Pump", graph.find("valve").orElseThrow().getReferencedBy().orElseThrow());
        assertEquals(List.of("Plant", "Pump", "Valve"), graph.referenceChain("Valve"));
    }

    @Test
    void earlierLibraryDirectoryShadowsLaterOne() throws Exception {
        Path project = Files.createTempDirectory("sattline-shadow");
        Path programs = project.resolve("programs");
        Path first = project.resolve("first");
        Path second = project.resolve("second");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(second, "Pump.s", "Pump");
        TestSources.writeModuleType(first, "Pump.s", "Pump");

        ProjectGraph graph =
                resolver(options(programs).addLibDir(first).addLibDir(second)).resolve("Plant");
        Path chosen = graph.find("Pump").orElseThrow().getPath().orElseThrow();
        assertEquals(first.toAbsolutePath().normalize(), chosen.getParent());

        ProjectGraph reversed =
                resolver(options(programs).addLibDir(second).addLibDir(first)).resolve("Plant");
        assertEquals(
                second.toAbsolutePath().normalize(),
                reversed.find("Pump").orElseThrow().getPath().orElseThrow().getParent());
    }

    @Test
    void modeSelectsTheFileExtension() throws Exception {
        Path programs = Files.createTempDirectory("sattline-mode");
        writeRoot(programs, "Plant.x", "Pump");
        writeRoot(programs, "Plant.s");
        TestSources.writeModuleType(programs, "Pump.x", "Pump");

        ProjectGraph official = resolver(options(programs).mode(CodeMode.OFFICIAL)).resolve("Plant");
        assertEquals(2, official.getResolved().size());
        assertEquals("Pump.x", official.find("Pump").orElseThrow().getFileName());

        ProjectGraph draft = resolver(options(programs).mode(CodeMode.DRAFT)).resolve("Plant");
        assertEquals(List.of("Plant"), names(draft.getFiles()));
    }

    @Test
    void fileNamesMatchIgnoringCase() throws Exception {
        Path programs = Files.createTempDirectory("sattline-case");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(programs, "PUMP.s", "Pump");

        ProjectGraph graph = resolver(options(programs)).resolve("Plant");

        assertTrue(graph.find("Pump").orElseThrow().isOk());
    }

    @Test
    void lenientResolutionRecordsMissingFiles() throws Exception {
        Path programs = Files.createTempDirectory("sattline-missing");
        writeRoot(programs, "Plant.s", "Pump", "Mixer");
        TestSources.writeModuleType(programs, "Pump.s", "Pump");

        ProjectGraph graph = resolver(options(programs)).resolve("Plant");

        assertTrue(graph.hasFailures());
        assertEquals(List.of("Mixer"), names(graph.getMissing()));
        SourceFile mixer = graph.getMissing().get(0);
        assertEquals(FileStatus.MISSING, mixer.getStatus());
        assertTrue(mixer.getPath().isEmpty());
        assertEquals("Plant", mixer.getReferencedBy().orElseThrow());
        assertTrue(graph.getRoot().orElseThrow().isOk());
    }

    @Test
    void strictResolutionStopsAtMissingFileWithChain() throws Exception {
        Path programs = Files.createTempDirectory("sattline-strict");
        Path libs = programs.resolve("libs");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(libs, "Pump.s", "Pump", "Mixer");

        MissingDependencyException ex =
                assertThrows(
                        MissingDependencyException.class,
                        () -> resolver(options(programs).addLibDir(libs).strict(true)).resolve("Plant"));

        assertEquals("Mixer", ex.getName());
        assertEquals("Pump", ex.getReferencingName().orElseThrow());
        assertEquals(libs.toAbsolutePath().normalize().resolve("Pump.s"), ex.getReferencingPath().orElseThrow());
        assertEquals(List.of("Plant", "Pump", "Mixer"), ex.getReferenceChain());
    }

    @Test
    void missingRootIsRecordedNotThrownWhenLenient() throws Exception {
        Path programs = Files.createTempDirectory("sattline-noroot");

        ProjectGraph graph = resolver(options(programs)).resolve("Plant");

        assertEquals(1, graph.size());
        assertFalse(graph.getRoot().orElseThrow().isOk());
        assertTrue(graph.getRoot().orElseThrow().getReferencedBy().isEmpty());
    }

    @Test
    void parseErrorsAreRecordedOrThrown() throws Exception {
        Path programs = Files.createTempDirectory("sattline-parse");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.write(programs, "Pump.s", "BasePicture", "LocalVariables", "  rpm real;", "ENDDEF");

        ProjectGraph graph = resolver(options(programs)).resolve("Plant");
        SourceFile pump = graph.find("Pump").orElseThrow();
        assertEquals(FileStatus.PARSE_ERROR, pump.getStatus());
        assertEquals(3, pump.getError().orElseThrow().getLocation().getLine());
        assertTrue(pump.getProgram().isEmpty());
        assertEquals(List.of(pump), graph.getParseErrors());

        UnparsableDependencyException ex =
                assertThrows(
                        UnparsableDependencyException.class,
                        () -> resolver(options(programs).strict(true)).resolve("Plant"));
        assertEquals("Pump", ex.getName());
        assertEquals(pump.getPath().orElseThrow(), ex.getPath());
        assertEquals(List.of("Plant", "Pump"), ex.getReferenceChain());
    }

    @Test
    void cyclesResolveEachFileOnce() throws Exception {
        Path programs = Files.createTempDirectory("sattline-cycle");
        writeRoot(programs, "Plant.s", "Alpha", "Beta");
        TestSources.writeModuleType(programs, "Alpha.s", "Alpha", "Beta");
        TestSources.writeModuleType(programs, "Beta.s", "Beta", "Alpha");

        ProjectGraph graph = resolver(options(programs)).resolve("Plant");

        assertEquals(List.of("Plant", "Alpha", "Beta"), names(graph.getFiles()));
        assertFalse(graph.hasFailures());
    }

    @Test
    void scanRootOnlyLoadsJustTheRoot() throws Exception {
        Path programs = Files.createTempDirectory("sattline-rootonly");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(programs, "Pump.s", "Pump");

        ProjectGraph graph = resolver(options(programs).scanRootOnly(true)).resolve("Plant");

        assertEquals(List.of("Plant"), names(graph.getFiles()));
        assertTrue(graph.isScanRootOnly());
        assertEquals(List.of("Pump"), graph.getUnresolvedReferences());
    }

    @Test
    void ignoredVendorDirectoryIsNotSearched() throws Exception {
        Path project = Files.createTempDirectory("sattline-vendor");
        Path programs = project.resolve("programs");
        Path vendor = project.resolve("vendor");
        writeRoot(programs, "Plant.s", "Pump");
        TestSources.writeModuleType(vendor, "Pump.s", "Pump");

        ResolverOptions.Builder base = options(programs).addLibDir(vendor).vendorDir(vendor);
        assertTrue(resolver(base.ignoreVendor(false)).resolve("Plant").find("Pump").orElseThrow().isOk());

        ProjectGraph ignored = resolver(base.ignoreVendor(true)).resolve("Plant");
        assertEquals(FileStatus.MISSING, ignored.find("Pump").orElseThrow().getStatus());
        assertTrue(ignored.isIgnoreVendor());
    }

    @Test
    void resolutionIsDeterministicAndLeavesNoDanglingEdges() throws Exception {
        Path programs = Files.createTempDirectory("sattline-determinism");
        writeRoot(programs, "Plant.s", "Pump", "Mixer", "Tank");
        TestSources.writeModuleType(programs, "Pump.s", "Pump", "Valve", "Mixer");
        TestSources.writeModuleType(programs, "Mixer.s", "Mixer", "Valve");
        TestSources.writeModuleType(programs, "Valve.s", "Valve", "Sensor");

        ProjectGraph first = resolver(options(programs)).resolve("Plant");
        ProjectGraph second = resolver(options(programs)).resolve("Plant");

        assertEquals(names(first.getFiles()), names(second.getFiles()));
        assertEquals(
                first.getFiles().stream().map(SourceFile::getStatus).collect(Collectors.toList()),
                second.getFiles().stream().map(SourceFile::getStatus).collect(Collectors.toList()));
        assertTrue(first.getUnresolvedReferences().isEmpty());
        for (SourceFile file : first.getFiles()) {
            for (String reference : file.getReferencedNames()) {
                assertTrue(first.find(reference).isPresent(), reference);
            }
        }
        assertEquals(List.of("Tank", "Sensor"), names(first.getMissing()));
    }

    @Test
    void emitsResolveTraceEvents() throws Exception {
        Path programs = Files.createTempDirectory("sattline-trace");
        writeRoot(programs, "Plant.s", "Pump");
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();

        new DependencyResolver(new AntlrSourceParser(sink), new TreeBuilder(), options(programs).build(), sink)
                .resolve("Plant");

        List<TraceEvent> events = sink.getEvents(TraceEvent.Stage.RESOLVE);
        assertTrue(events.stream().anyMatch(event -> event.getLevel() == TraceEvent.Level.WARNING
                && event.getMessage().startsWith("Missing Pump.s")));
    }

    @Test
    void unreadableFileIsRecordedWhenLenientAndThrownWhenStrict() throws Exception {
        Path programs = Files.createTempDirectory("sattline-unreadable");
        writeRoot(programs, "Plant.s", "Pump", "Valve");
        TestSources.writeModuleType(programs, "Pump.s", "Pump");
        TestSources.writeModuleType(programs, "Valve.s", "Valve");
        Path pump = programs.toAbsolutePath().normalize().resolve("Pump.s");
        FailingReader reader = new FailingReader(pump, null);
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();

        ProjectGraph graph = resolver(options(programs), reader, sink).resolve("Plant");

        SourceFile unreadable = graph.find("Pump").orElseThrow();
        assertEquals(FileStatus.UNREADABLE, unreadable.getStatus());
        assertEquals(pump, unreadable.getPath().orElseThrow());
        assertEquals("disk on fire", unreadable.getReadError().orElseThrow().getMessage());
        assertTrue(graph.find("Valve").orElseThrow().isOk());
        assertEquals(List.of(unreadable), graph.getUnreadable());
        assertTrue(graph.hasFailures());
        assertTrue(sink.getEvents(TraceEvent.Stage.RESOLVE).stream()
                .anyMatch(event -> event.getLevel() == TraceEvent.Level.ERROR
                        && event.getMessage().startsWith("Unreadable " + pump)));

        ResolutionException ex =
                assertThrows(
                        ResolutionException.class,
                        () -> resolver(options(programs).strict(true), reader, sink).resolve("Plant"));
        assertEquals("Pump", ex.getName());
        assertEquals(List.of("Plant", "Pump"), ex.getReferenceChain());
        assertTrue(ex.getCause() instanceof IOException);
    }

    @Test
    void unlistableDirectoryIsSkippedWhenLenientAndThrownWhenStrict() throws Exception {
        Path project = Files.createTempDirectory("sattline-unlistable");
        Path programs = project.resolve("programs");
        Path broken = project.resolve("broken");
        Path libs = project.resolve("libs");
        writeRoot(programs, "Plant.s", "Pump");
        Files.createDirectories(broken);
        TestSources.writeModuleType(libs, "Pump.s", "Pump");
        FailingReader reader = new FailingReader(null, broken.toAbsolutePath().normalize());
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();

        ProjectGraph graph =
                resolver(options(programs).addLibDir(broken).addLibDir(libs), reader, sink).resolve("Plant");

        assertTrue(graph.find("Pump").orElseThrow().isOk());
        assertTrue(sink.getEvents(TraceEvent.Stage.RESOLVE).stream()
                .anyMatch(event -> event.getLevel() == TraceEvent.Level.WARNING
                        && event.getMessage().startsWith("Skipping unreadable directory")));

        ResolutionException ex =
                assertThrows(
                        ResolutionException.class,
                        () -> resolver(options(programs).addLibDir(broken).addLibDir(libs).strict(true), reader, sink)
                                .resolve("Plant"));
        assertEquals(List.of("Plant", "Pump"), ex.getReferenceChain());
    }

    @Test
    void warnsAboutSearchDirectoriesThatDoNotExist() throws Exception {
        Path project = Files.createTempDirectory("sattline-nodir");
        Path programs = project.resolve("programs");
        Path vendor = project.resolve("vendor");
        writeRoot(programs, "Plant.s");
        Path typo = project.resolve("libz");
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();

        resolver(options(programs).addLibDir(typo).vendorDir(vendor).ignoreVendor(true), SourceReader.FILES, sink)
                .resolve("Plant");

        List<String> messages =
                sink.getEvents(TraceEvent.Stage.RESOLVE).stream().map(TraceEvent::getMessage).collect(Collectors.toList());
        assertTrue(messages.contains("Search directory does not exist: " + typo.toAbsolutePath().normalize()), messages.toString());
        assertTrue(messages.contains("Vendor directory excluded: " + vendor.toAbsolutePath().normalize()), messages.toString());
    }

    @Test
    void builtinTypeNamesAreNotDependencies() throws Exception {
        Path programs = Files.createTempDirectory("sattline-builtins");
        TestSources.write(
                programs,
                "Plant.s",
                "BasePicture",
                "LocalVariables",
                "    debug_flag: BOOL;",
                "    enabled: Boolean;",
                "    temp_counter: INTEGER;",
                "    max_speed: REAL;",
                "ENDDEF");

        ProjectGraph graph = resolver(options(programs).strict(true)).resolve("Plant");

        assertEquals(List.of("Plant"), names(graph.getFiles()));
        assertTrue(graph.getFiles().get(0).getReferencedNames().isEmpty());
    }

    @Test
    void rejectsRootNamesThatArePaths() throws Exception {
        Path programs = Files.createTempDirectory("sattline-badroot");

        assertThrows(IllegalArgumentException.class, () -> resolver(options(programs)).resolve("dir/Plant"));
        assertThrows(IllegalArgumentException.class, () -> resolver(options(programs)).resolve(" "));
    }

    private static ResolverOptions.Builder options(Path programs) {
        return ResolverOptions.builder().programDir(programs);
    }

    private static DependencyResolver resolver(ResolverOptions.Builder options) {
        return new DependencyResolver(options.build());
    }

    private static DependencyResolver resolver(
            ResolverOptions.Builder options, SourceReader reader, RecordingDiagnosticsSink sink) {
        return new DependencyResolver(new AntlrSourceParser(), new TreeBuilder(), options.build(), sink, reader);
    }

    private static List<String> names(List<SourceFile> files) {
        return files.stream().map(SourceFile::getName).collect(Collectors.toList());
    }

    /** Root program with one submodule per referenced type. */
    static void writeRoot(Path dir, String fileName, String... types) throws Exception {
        String[] lines = new String[types.length + 4];
        lines[0] = "BasePicture";
        lines[1] = types.length == 0 ? "" : "SubModules";
        for (int i = 0; i < types.length; i++) {
            lines[i + 2] = "    M" + i + " Invocation: " + types[i] + ";";
        }
        lines[types.length + 2] = "";
        lines[types.length + 3] = "ENDDEF";
        TestSources.write(dir, fileName, lines);
    }

    /** Reads through to the file system except for one file and one directory that fail. */
    private static final class FailingReader implements SourceReader {
        private final Path unreadableFile;
        private final Path unlistableDir;

        FailingReader(Path unreadableFile, Path unlistableDir) {
            this.unreadableFile = unreadableFile;
            this.unlistableDir = unlistableDir;
        }

        @Override
        public String read(Path file) throws IOException {
            if (file.equals(unreadableFile)) {
                throw new IOException("disk on fire");
            }
            return SourceReader.FILES.read(file);
        }

        @Override
        public List<Path> list(Path dir) throws IOException {
            if (dir.equals(unlistableDir)) {
                throw new IOException("permission denied");
            }
            return SourceReader.FILES.list(dir);
        }
    }
}
