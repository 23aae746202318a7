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

package com.xilinx.timingsimporter.liberty;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.xilinx.timingsimporter.support.LibertyTestFiles;
import com.xilinx.timingsimporter.util.FileTools;

public class TestLibertyWriter {

    private static LibertyGroup timing(String relatedPin) {
        LibertyGroup timing = new LibertyGroup();
        timing.add("related_pin", new LibertyScalar(relatedPin));
        return timing;
    }

    private static LibertyGroup createLibrary() {
        LibertyGroup pin = new LibertyGroup();
        pin.add("timing", timing("A"));
        pin.add("timing", timing("B"));

        LibertyGroup cell = new LibertyGroup();
        cell.add("area", new LibertyScalar(1L));
        cell.add("pin Y", pin);
        cell.add("index_1", LibertyArray.of(Arrays.asList(0.1, 0.2)));
        cell.add("values", LibertyArray.ofRows(Arrays.asList(Arrays.asList(1L, 2L), Arrays.asList(3L, 4L))));

        LibertyGroup library = new LibertyGroup();
        library.add(LibertyNode.DEFINE_KEY, LibertyGroup.createDefine("my_attr", "cell", "string"));
        library.add("comp_attribute capacitive_load_unit", new LibertyScalar("1,pf"));
        library.add("time_unit", new LibertyScalar("1ns"));
        library.add("cell INV", cell);

        LibertyGroup root = new LibertyGroup();
        root.add("library lib", library);
        return root;
    }

    @Test
    public void testWriteLibrary() {
        List<String> expected = Arrays.asList(
                "library (lib) {",
                "  define (my_attr,cell,string);",
                "  capacitive_load_unit (1,pf);",
                "  time_unit : \"1ns\";",
                "  cell (INV) {",
                "    area : 1;",
                "    pin (Y) {",
                "      timing () {",
                "        related_pin : \"A\";",
                "      }",
                "      timing () {",
                "        related_pin : \"B\";",
                "      }",
                "    }",
                "    index_1 (\"0.1, 0.2\");",
                "    values ( \\",
                "            \"1, 2\", \\",
                "            \"3, 4\" \\",
                "    );",
                "  }",
                "}");
        Assertions.assertEquals(expected, new LibertyWriter(2).write(createLibrary()));
    }

    @Test
    public void testWrittenLibraryReadsBack() {
        LibertyGroup root = createLibrary();
        Assertions.assertEquals(root, LibertyParser.parseLiberty(new LibertyWriter(4).write(root)));
    }

    @ParameterizedTest
    @ValueSource(strings = {LibertyTestFiles.DEMO_LIB, LibertyTestFiles.TABLES_LIB})
    public void testRoundTrip(String fileName) {
        LibertyGroup root = LibertyParser.parseLiberty(LibertyTestFiles.getPath(fileName));
        List<String> written = new LibertyWriter().write(root);
        Assertions.assertEquals(root, LibertyParser.parseLiberty(written));
        Assertions.assertEquals(written, new LibertyWriter().write(LibertyParser.parseLiberty(written)));
    }

    @Test
    public void testWriteToFile(@TempDir Path tempDir) {
        Path libFile = tempDir.resolve("out").resolve("lib.lib");
        LibertyGroup root = createLibrary();
        new LibertyWriter().write(root, libFile);
        Assertions.assertEquals(root, LibertyParser.parseLiberty(FileTools.getLinesFromTextFile(libFile)));
    }

    @Test
    public void testQuotedDecimalWrittenBare() {
        LibertyGroup cell = new LibertyGroup();
        cell.add("slew", new LibertyScalar("0.5"));
        cell.add("version", new LibertyScalar("1.2.3"));
        LibertyGroup root = new LibertyGroup();
        root.add("cell A", cell);
        Assertions.assertEquals(Arrays.asList("cell (A) {", "  slew : 0.5;", "  version : \"1.2.3\";", "}"),
                new LibertyWriter(2).write(root));
    }

    @ParameterizedTest
    @CsvSource({
        "1.0, 1.0",
        "0.5, 0.5",
        "100.0, 100.0",
        "1.0E-4, 0.0001",
        "1.25E10, 12500000000.0",
        "-0.25, -0.25",
    })
    public void testFormatDouble(double value, String expected) {
        Assertions.assertEquals(expected, LibertyWriter.formatNumber(value));
    }

    @Test
    public void testFormatIntegral() {
        Assertions.assertEquals("3", LibertyWriter.formatNumber(3L));
        Assertions.assertEquals("-7", LibertyWriter.formatNumber(-7));
    }

    @Test
    public void testRootMustHoldOneEntry() {
        LibertyGroup root = new LibertyGroup();
        root.add("library a", new LibertyGroup());
        root.add("library b", new LibertyGroup());
        Assertions.assertThrows(LibertyWriteException.class, () -> new LibertyWriter().write(root));
        Assertions.assertThrows(LibertyWriteException.class, () -> new LibertyWriter().write(new LibertyGroup()));
    }

    @Test
    public void testGroupUnderComplexAttribute() {
        LibertyGroup library = new LibertyGroup();
        library.add("comp_attribute voltage_map", new LibertyGroup());
        LibertyGroup root = new LibertyGroup();
        root.add("library a", library);
        LibertyWriteException e = Assertions.assertThrows(LibertyWriteException.class,
                () -> new LibertyWriter().write(root));
        Assertions.assertEquals("comp_attribute voltage_map", e.getKey());
    }

    @Test
    public void testMalformedDefine() {
        LibertyGroup define = new LibertyGroup();
        define.add(LibertyGroup.DEFINE_ATTRIBUTE_NAME, new LibertyScalar("x"));
        LibertyGroup library = new LibertyGroup();
        library.add(LibertyNode.DEFINE_KEY, define);
        LibertyGroup root = new LibertyGroup();
        root.add("library a", library);
        Assertions.assertThrows(LibertyWriteException.class, () -> new LibertyWriter().write(root));
    }

    @Test
    public void testNestedAttributeList() {
        LibertyAttributeList inner = new LibertyAttributeList();
        inner.add(new LibertyScalar("a"));
        LibertyAttributeList outer = new LibertyAttributeList();
        outer.add(inner);
        LibertyGroup library = new LibertyGroup();
        library.put("names", outer);
        LibertyGroup root = new LibertyGroup();
        root.add("library a", library);
        Assertions.assertThrows(LibertyWriteException.class, () -> new LibertyWriter().write(root));
    }

    @Test
    public void testNegativeIndent() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new LibertyWriter(-1));
    }
}
