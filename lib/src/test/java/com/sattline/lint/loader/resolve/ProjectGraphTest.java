package com.sattline.lint.loader.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProjectGraphTest {

    @Test
    void referenceChainFollowsFirstReferences() {
        Map<String, SourceFile> files = new LinkedHashMap<>();
        files.put("plant", SourceFile.missing("Plant", ".s", null));
        files.put("pump", SourceFile.missing("Pump", ".s", "Plant"));
        files.put("valve", SourceFile.missing("Valve", ".s", "PUMP"));

        assertEquals(List.of("Plant", "PUMP", "Valve"), ProjectGraph.referenceChain(files, "Valve"));
        assertEquals(List.of("Plant"), ProjectGraph.referenceChain(files, "Plant"));
        assertEquals(List.of("Ghost"), ProjectGraph.referenceChain(files, "Ghost"));
    }

    @Test
    void referenceChainStopsOnCycles() {
        Map<String, SourceFile> files = new LinkedHashMap<>();
        files.put("alpha", SourceFile.missing("Alpha", ".s", "Beta"));
        files.put("beta", SourceFile.missing("Beta", ".s", "Alpha"));

        assertEquals(List.of("Beta", "Alpha"), ProjectGraph.referenceChain(files, "Alpha"));
    }

    @Test
    void rejectsDuplicateEntries() {
        List<SourceFile> files =
                List.of(SourceFile.missing("Pump", ".s", null), SourceFile.missing("PUMP", ".s", null));

        assertThrows(
                IllegalArgumentException.class,
                () -> new ProjectGraph("Pump", CodeMode.DRAFT, false, false, files));
    }
}
