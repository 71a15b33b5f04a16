package com.sattline.lint.loader.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.sattline.lint.diagnostics.RecordingDiagnosticsSink;
import com.sattline.lint.diagnostics.TraceEvent;
import com.sattline.lint.loader.TestSources;
import com.sattline.lint.loader.ast.ProgramNode;
import com.sattline.lint.loader.ast.VariableQualifier;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;

class VariableUsageAnalyzerTest {

    @Test
    void classifiesUnusedReadOnlyAndWriteOnlyVariables() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    temp_counter: integer;",
                        "    max_speed: real;",
                        "    debug_flag: boolean;",
                        "    output: real;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        output = max_speed * 2.0;",
                        "        IF output > max_speed THEN",
                        "            output = max_speed;",
                        "        ENDIF;",
                        "        debug_flag = True;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertEquals(List.of("temp_counter"), names(report.getUnused()));
        assertEquals(List.of("max_speed"), names(report.getReadOnlyNotConst()));
        assertEquals(3, report.getReadOnlyNotConst().get(0).getReadCount());
        assertEquals(0, report.getReadOnlyNotConst().get(0).getWriteCount());
        assertEquals(List.of("debug_flag"), names(report.getWriteWithoutRead()));
        assertEquals(4, report.getAnalyzedVariables());

        UsageEntry unused = report.getUnused().get(0);
        assertEquals("BasePicture.s", unused.getScopeName());
        assertEquals("integer", unused.getDeclaredType());
        assertEquals(3, unused.getLocation().getLine());
    }

    @Test
    void constantsThatAreOnlyReadAreNotReported() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    max_speed: real Const := 12.5;",
                        "    speed: real;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        speed = max_speed;",
                        "        IF speed > max_speed THEN",
                        "            speed = max_speed;",
                        "        ENDIF;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertTrue(report.isClean(), report.summary());
        assertEquals(2, report.getAnalyzedVariables());
    }

    @Test
    void unusedConstantIsStillUnused() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    limit: integer Const := 3;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertEquals(List.of("limit"), names(report.getUnused()));
        assertEquals(Set.of(VariableQualifier.CONST), report.getUnused().get(0).getQualifiers());
    }

    @Test
    void localsShadowGlobalsAndParametersHideThem() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "TypeDefinitions",
                        "    Worker = MODULEDEFINITION",
                        "        ModuleParameters",
                        "            gain: real;",
                        "        LocalVariables",
                        "            level: integer;",
                        "        ModuleCode",
                        "            EquationBlock Run:",
                        "                level = level + 1;",
                        "                shared_total = gain * 2.0;",
                        "    ENDDEF;",
                        "LocalVariables",
                        "    level: integer;",
                        "    gain: real;",
                        "    shared_total: real;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        IF shared_total > 5.0 THEN",
                        "            level = 0;",
                        "        ENDIF;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        // Worker.level is read and written, so only the global copy shows up
        assertEquals(List.of("gain"), names(report.getUnused()));
        assertEquals("BasePicture.s", report.getUnused().get(0).getScopeName());
        assertEquals(List.of("level"), names(report.getWriteWithoutRead()));
        assertEquals("BasePicture.s", report.getWriteWithoutRead().get(0).getScopeName());
        assertTrue(report.getReadOnlyNotConst().isEmpty());
        // globals, then Worker's local; parameters are not classified
        assertEquals(4, report.getAnalyzedVariables());
    }

    @Test
    void connectionsInitialisersTransitionsAndCallArgumentsAreReads() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    setpoint: real;",
                        "    base: real;",
                        "    scaled: real := base * 2.0;",
                        "    start_cmd: boolean;",
                        "    log_level: integer;",
                        "    running: boolean;",
                        "SubModules",
                        "    P1 Invocation: Pump (Target => setpoint);",
                        "ModuleCode",
                        "    Sequence Fill",
                        "        SeqInitStep Idle",
                        "            running = False;",
                        "        SeqTransition Wait_For start_cmd",
                        "        SeqStep Filling",
                        "            Trace(log_level, running);",
                        "    EndSequence",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertEquals(
                List.of("setpoint", "base", "start_cmd", "log_level"), names(report.getReadOnlyNotConst()));
        assertEquals(List.of("scaled"), names(report.getUnused()));
        assertTrue(report.getWriteWithoutRead().isEmpty());
    }

    @Test
    void fieldWritesCountAgainstTheRootVariable() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    Motor: MotorData;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        Motor.Speed = 1.0;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertEquals(List.of("Motor"), names(report.getWriteWithoutRead()));
        assertEquals("MotorData", report.getWriteWithoutRead().get(0).getDeclaredType());
    }

    @Test
    void namesMatchIgnoringCase() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "LocalVariables",
                        "    Flow: real;",
                        "    Total: real;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        TOTAL = total + FLOW;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        assertEquals(List.of("Flow"), names(report.getReadOnlyNotConst()));
        assertTrue(report.getUnused().isEmpty());
        assertTrue(report.getWriteWithoutRead().isEmpty());
    }

    @Test
    void everyVariableLandsInAtMostOneCategory() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s",
                        "BasePicture",
                        "TypeDefinitions",
                        "    Station = MODULEDEFINITION",
                        "        LocalVariables",
                        "            a, b, c: integer;",
                        "            k: integer Const := 1;",
                        "        ModuleCode",
                        "            EquationBlock Run:",
                        "                a = b + k;",
                        "    ENDDEF;",
                        "LocalVariables",
                        "    x, y, z: integer;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        x = y;",
                        "        y = x;",
                        "ENDDEF");

        UsageReport report = new VariableUsageAnalyzer().analyze(program);

        List<UsageEntry> all =
                Stream.of(report.getUnused(), report.getReadOnlyNotConst(), report.getWriteWithoutRead())
                        .flatMap(List::stream)
                        .collect(Collectors.toList());
        Set<String> seen = new HashSet<>();
        for (UsageEntry entry : all) {
            assertTrue(seen.add(entry.getScopeName() + "." + entry.getVariableName()), entry.toString());
        }
        assertEquals(List.of("z", "c"), names(report.getUnused()));
        assertEquals(List.of("b"), names(report.getReadOnlyNotConst()));
        assertEquals(List.of("a"), names(report.getWriteWithoutRead()));
        assertEquals("Station", report.getWriteWithoutRead().get(0).getScopeName());
    }

    @Test
    void reportsProgressToTheDiagnosticsSink() throws Exception {
        ProgramNode program =
                TestSources.program("BasePicture.s", "BasePicture", "LocalVariables", "    idle: integer;", "ENDDEF");
        RecordingDiagnosticsSink sink = new RecordingDiagnosticsSink();

        new VariableUsageAnalyzer(sink).analyze(program);

        List<TraceEvent> events = sink.getEvents(TraceEvent.Stage.ANALYZE);
        assertEquals(2, events.size());
        assertTrue(events.get(0).getMessage().startsWith("unused: "));
        assertTrue(events.get(1).getMessage().startsWith("Analysed 1 variables"));
    }

    @Test
    void summaryListsCategoriesByScope() throws Exception {
        ProgramNode program =
                TestSources.program(
                        "BasePicture.s", "BasePicture", "LocalVariables", "    idle, spare: integer;", "ENDDEF");

        String summary = new VariableUsageAnalyzer().analyze(program).summary();

        assertTrue(summary.contains("unused (2)"), summary);
        assertTrue(summary.contains("BasePicture.s: idle, spare"), summary);
        assertTrue(summary.contains("write-without-read (0)"), summary);
    }

    private static List<String> names(List<UsageEntry> entries) {
        return entries.stream().map(UsageEntry::getVariableName).collect(Collectors.toList());
    }
}
