package com.sattline.lint.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sattline.lint.loader.ProjectAnalysis;
import com.sattline.lint.loader.SattLineProjectLoader;
import com.sattline.lint.loader.resolve.ResolverOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReportJsonTest {

    @Test
    void reportIsStableAndListsConflicts() throws Exception {
        Path programs = Files.createTempDirectory("sattlint-report");
        Files.writeString(
                programs.resolve("Plant.s"),
                String.join(
                        "\n",
                        "BasePicture",
                        "LocalVariables",
                        "    flag: boolean;",
                        "SubModules",
                        "    A Invocation: LibA;",
                        "    B Invocation: LibB;",
                        "    C Invocation: Ghost;",
                        "ModuleCode",
                        "    EquationBlock Main:",
                        "        flag = True;",
                        "ENDDEF",
                        ""));
        for (String lib : List.of("LibA", "LibB")) {
            Files.writeString(
                    programs.resolve(lib + ".s"),
                    String.join(
                            "\n",
                            "BasePicture",
                            "TypeDefinitions",
                            "    " + lib + " = MODULEDEFINITION ENDDEF;",
                            "    Settings = RECORD",
                            "        Gain: real := 1.0;",
                            "    ENDDEF;",
                            "ENDDEF",
                            ""));
        }
        ProjectAnalysis analysis =
                new SattLineProjectLoader(ResolverOptions.builder().programDir(programs).build()).load("Plant");

        String first = ReportJson.toJsonString(analysis);
        String second = ReportJson.toJsonString(analysis);
        assertEquals(first, second);
        assertTrue(first.endsWith("}\n"));

        JsonNode json = new ObjectMapper().readTree(first);
        List<String> keys = new ArrayList<>();
        for (Iterator<String> it = json.fieldNames(); it.hasNext(); ) {
            keys.add(it.next());
        }
        assertEquals(List.of("tool", "root", "mode", "rootLoaded", "files", "conflicts", "usage"), keys);
        assertEquals("missing", json.get("files").get(3).get("status").asText());
        assertTrue(json.get("files").get(3).get("path").isNull());

        JsonNode conflict = json.get("conflicts").get(0);
        assertEquals("datatype", conflict.get("kind").asText());
        assertEquals("Settings", conflict.get("name").asText());
        assertEquals("LibA", conflict.get("keptFile").asText());
        assertEquals("LibB", conflict.get("ignoredFile").asText());

        JsonNode writeOnly = json.get("usage").get("write-without-read").get(0);
        assertEquals("flag", writeOnly.get("variable").asText());
        assertEquals(1, writeOnly.get("writes").asInt());
        assertEquals("Plant", writeOnly.get("scope").asText());
    }
}
