/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of TimingsImporter.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.timingsimporter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyParser;
import com.xilinx.timingsimporter.support.LibertyTestFiles;
import com.xilinx.timingsimporter.util.FileTools;

public class TestTimingsImporter {

    private static final String QUIET = "--log-suppress-below";

    private static String fixture(String name) {
        return LibertyTestFiles.getPath(name).toAbsolutePath().toString();
    }

    @Test
    public void testLibertyToJSONAndBack(@TempDir Path tempDir) {
        Path json = tempDir.resolve("demo.json");
        Path lib = tempDir.resolve("out").resolve("demo.lib");
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_JSON_CMD,
                "-i", fixture(LibertyTestFiles.DEMO_LIB), "-o", json.toString(), QUIET, "ALL"}));
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.JSON_TO_LIBERTY_CMD,
                "--input", json.toString(), "--output", lib.toString(), QUIET, "ALL"}));

        LibertyGroup original = LibertyParser.parseLiberty(LibertyTestFiles.getPath(LibertyTestFiles.DEMO_LIB));
        Assertions.assertEquals(original, LibertyParser.parseJson(json));
        Assertions.assertEquals(original, LibertyParser.parseLiberty(lib));
    }

    @Test
    public void testLibertyToJSONDropsHeader(@TempDir Path tempDir) {
        Path json = tempDir.resolve("assp.json");
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {"libertytojson",
                "-i", fixture(LibertyTestFiles.ASSP_CELL_LIB), "-o", json.toString(), QUIET, "ALL"}));
        Assertions.assertNotNull(LibertyParser.parseJson(json).get("cell ASSP"));
    }

    private static String writeDemoWithHeader(Path tempDir) {
        List<String> lines = new ArrayList<>();
        lines.add("demo_lib");
        lines.addAll(LibertyTestFiles.getLines(LibertyTestFiles.DEMO_LIB));
        Path lib = tempDir.resolve("demo_timings.lib");
        FileTools.writeLinesToTextFile(lines, lib.toString());
        return lib.toString();
    }

    @Test
    public void testLibertyToSDF(@TempDir Path tempDir) {
        Path sdf = tempDir.resolve("timings.sdf");
        Path json = tempDir.resolve("timings.json");
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_SDF_CMD,
                "-i", writeDemoWithHeader(tempDir), "-i", fixture(LibertyTestFiles.ASSP_CELL_LIB),
                "-o", sdf.toString(), "--voltage", "1.2", "--timescale", "1ps", "--json", json.toString(),
                "--normalize-cell-names", "--normalize-port-names", QUIET, "ALL"}));

        List<String> lines = FileTools.getLinesFromTextFile(sdf);
        Assertions.assertEquals("(DELAYFILE", lines.get(0));
        Assertions.assertTrue(lines.contains("    (DESIGN \"demo_lib\")"));
        Assertions.assertTrue(lines.contains("    (VOLTAGE 1.2:1.2:1.2)"));
        Assertions.assertTrue(lines.contains("    (TIMESCALE 1ps)"));
        Assertions.assertTrue(lines.contains("        (CELLTYPE \"ASSP_EN_EQ_1_MODE_0_EQ_0\")"));
        Assertions.assertTrue(lines.contains("                (IOPATH SEL_0 FBIO_3 (:0.5:) (:1.0:))"));
        Assertions.assertTrue(lines.contains("            (SETUP SEL_0 (negedge CLK) (0.1::0.2))"));

        JsonObject dump = JsonParser.parseString(FileTools.getStringFromTextFile(json.toString())).getAsJsonObject();
        Assertions.assertEquals("1ps", dump.getAsJsonObject("header").get("timescale").getAsString());
        Assertions.assertTrue(dump.getAsJsonObject("cells").has("DFF"));
    }

    @Test
    public void testValidateRoundTrip(@TempDir Path tempDir) {
        Path list = tempDir.resolve("libs.txt");
        FileTools.writeLinesToTextFile(Arrays.asList(fixture(LibertyTestFiles.DEMO_LIB),
                fixture(LibertyTestFiles.TABLES_LIB)), list.toString());
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.VALIDATE_ROUND_TRIP_CMD,
                "-l", list.toString(), "--output-json-root-dir", tempDir.resolve("json").toString(), QUIET, "ALL"}));
        Path tablesCore = RoundTripValidator.getOutputNameCore(Paths.get(fixture(LibertyTestFiles.TABLES_LIB)));
        Assertions.assertTrue(Files.exists(tempDir.resolve("json").resolve(tablesCore + ".json")));
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.VALIDATE_ROUND_TRIP_CMD,
                "-l", list.toString(), "--similarity-method", "normal", QUIET, "ALL"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.VALIDATE_ROUND_TRIP_CMD,
                "-l", list.toString(), "--similarity-method", "fast", QUIET, "ALL"}));

        FileTools.writeLinesToTextFile(Arrays.asList(fixture(LibertyTestFiles.BROKEN_LIB)), list.toString());
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.VALIDATE_ROUND_TRIP_CMD,
                "-l", list.toString(), QUIET, "ALL"}));
    }

    @Test
    public void testLibertyDiff(@TempDir Path tempDir) {
        Path written = tempDir.resolve("demo.lib");
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_JSON_CMD,
                "-i", fixture(LibertyTestFiles.DEMO_LIB), "-o", tempDir.resolve("demo.json").toString(),
                QUIET, "ALL"}));
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.JSON_TO_LIBERTY_CMD,
                "-i", tempDir.resolve("demo.json").toString(), "-o", written.toString(), QUIET, "ALL"}));
        Assertions.assertEquals(0, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_DIFF_CMD,
                fixture(LibertyTestFiles.DEMO_LIB), written.toString(), "--print-diff", "--side-by-side",
                "--compute-similarity", "--similarity-method", "normal", QUIET, "ALL"}));
    }

    @Test
    public void testLibertyDiffNeedsTwoFiles() {
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_DIFF_CMD,
                fixture(LibertyTestFiles.DEMO_LIB), QUIET, "ALL"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_DIFF_CMD,
                fixture(LibertyTestFiles.DEMO_LIB), fixture(LibertyTestFiles.TABLES_LIB),
                "--similarity-method", "fast", QUIET, "ALL"}));
    }

    @Test
    public void testFailures(@TempDir Path tempDir) {
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_JSON_CMD,
                "-i", fixture(LibertyTestFiles.BROKEN_LIB), "-o", tempDir.resolve("b.json").toString(),
                QUIET, "ALL"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_JSON_CMD,
                "-i", fixture(LibertyTestFiles.DEMO_LIB)}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_SDF_CMD,
                "-i", tempDir.resolve("missing.lib").toString(), "-o", tempDir.resolve("x.sdf").toString(),
                QUIET, "ALL"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_JSON_CMD,
                "-i", fixture(LibertyTestFiles.DEMO_LIB), "-o", tempDir.resolve("d.json").toString(),
                QUIET, "LOUD"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {"Unknown"}));
    }

    @Test
    public void testLibertyToSDFUnwritableOutput(@TempDir Path tempDir) {
        Path blocker = tempDir.resolve("blocker");
        FileTools.writeStringToTextFile("not a directory", blocker.toString());
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_SDF_CMD,
                "-i", fixture(LibertyTestFiles.ASSP_CELL_LIB), "-o", blocker.resolve("timings.sdf").toString(),
                QUIET, "ALL"}));
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_SDF_CMD,
                "-i", fixture(LibertyTestFiles.ASSP_CELL_LIB), "-o", tempDir.resolve("timings.sdf").toString(),
                "--json", blocker.resolve("timings.json").toString(), QUIET, "ALL"}));
        Assertions.assertTrue(Files.exists(tempDir.resolve("timings.sdf")));
    }

    @Test
    public void testLibertyToSDFNeedsLibraryHeader(@TempDir Path tempDir) {
        Assertions.assertEquals(1, TimingsImporter.run(new String[] {TimingsImporter.LIBERTY_TO_SDF_CMD,
                "-i", fixture(LibertyTestFiles.DEMO_LIB), "-o", tempDir.resolve("timings.sdf").toString(),
                QUIET, "ALL"}));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "--help", TimingsImporter.LIBERTY_TO_SDF_CMD, TimingsImporter.LIBERTY_DIFF_CMD})
    public void testHelp(String command) {
        String[] args = command.isEmpty() ? new String[0]
                : command.startsWith("-") ? new String[] {command} : new String[] {command, "-h"};
        Assertions.assertEquals(0, TimingsImporter.run(args));
    }
}
