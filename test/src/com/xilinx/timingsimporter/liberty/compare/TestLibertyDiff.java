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

package com.xilinx.timingsimporter.liberty.compare;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.timingsimporter.liberty.LibertyParser;
import com.xilinx.timingsimporter.liberty.LibertyWriter;
import com.xilinx.timingsimporter.liberty.compare.LibertyDiff.SimilarityMethod;
import com.xilinx.timingsimporter.support.LibertyTestFiles;

public class TestLibertyDiff {

    @Test
    public void testCleanLines() {
        List<String> lines = Arrays.asList(
                "cell (A) { /* c */",
                "\tarea : \"1.50\"; } x : y;",
                "",
                "   ");
        Assertions.assertEquals(Arrays.asList("cell(A){", "area:1.5;}", "x:y;"), LibertyDiff.cleanLines(lines));
    }

    @Test
    public void testCleanLinesJoinsContinuations() {
        List<String> lines = Arrays.asList(
                "values ( \\",
                "  \"1, 2\", \\",
                "  \"3, 4\" \\",
                ");");
        Assertions.assertEquals(Collections.singletonList("values(1.0,2.0,3.0,4.0);"),
                LibertyDiff.cleanLines(lines));
    }

    @Test
    public void testCleanOptions() {
        LibertyDiff.CleanOptions options = new LibertyDiff.CleanOptions();
        options.removeQuotes = false;
        options.unifyNumbers = false;
        Assertions.assertEquals(Collections.singletonList("a:\"1.50\";"),
                LibertyDiff.cleanLines(Collections.singletonList("a : \"1.50\";"), options));
    }

    @ParameterizedTest
    @CsvSource({
        "abcd, abce, NORMAL, 0.75",
        "abcd, abce, QUICK, 0.75",
        "abcd, abce, REAL_QUICK, 1.0",
        "abxcd, abcd, NORMAL, 0.8888888888888888",
        "abcd, dcba, NORMAL, 0.25",
        "abcd, dcba, QUICK, 1.0",
        "abc, xyz, NORMAL, 0.0",
    })
    public void testSimilarity(String a, String b, SimilarityMethod method, double expected) {
        double similarity = LibertyDiff.similarity(Collections.singletonList(a), Collections.singletonList(b), method);
        Assertions.assertEquals(expected, similarity, 1e-9);
    }

    @Test
    public void testSimilarityOfEmptyInputs() {
        Assertions.assertEquals(1.0, LibertyDiff.similarity(Collections.emptyList(), Collections.emptyList(),
                SimilarityMethod.NORMAL));
    }

    @Test
    public void testSimilarityMethodFromName() {
        Assertions.assertEquals(SimilarityMethod.REAL_QUICK, SimilarityMethod.fromName("real_quick"));
        Assertions.assertEquals(SimilarityMethod.QUICK, SimilarityMethod.fromName(" Quick "));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SimilarityMethod.fromName("fast"));
    }

    @Test
    public void testDiff() {
        List<String> diff = LibertyDiff.diff(Arrays.asList("a", "b", "c"), Arrays.asList("a", "x", "c"));
        Assertions.assertEquals(Arrays.asList("  a", "- b", "+ x", "  c"), diff);
        Assertions.assertTrue(LibertyDiff.hasDifferences(diff));
        Assertions.assertFalse(LibertyDiff.hasDifferences(
                LibertyDiff.diff(Arrays.asList("a", "b"), Arrays.asList("a", "b"))));
    }

    @Test
    public void testDiffOfLargeFiles() {
        int size = 20000;
        List<String> a = new ArrayList<>(size);
        List<String> b = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            a.add("pin(P" + i + "){direction:input;}");
            b.add(i % 1000 == 0 ? "pin(Q" + i + "){direction:output;}" : a.get(i));
        }
        List<String> diff = LibertyDiff.diff(a, b);
        Assertions.assertEquals(size + 20, diff.size());
        Assertions.assertEquals(20, diff.stream().filter(l -> l.startsWith("- ")).count());
        Assertions.assertEquals(20, diff.stream().filter(l -> l.startsWith("+ ")).count());
        Assertions.assertEquals("- pin(P0){direction:input;}", diff.get(0));
        Assertions.assertEquals("+ pin(Q0){direction:output;}", diff.get(1));
        Assertions.assertEquals("  pin(P1){direction:input;}", diff.get(2));
    }

    @Test
    public void testDiffOrdersRemovalsFirst() {
        Assertions.assertEquals(Arrays.asList("- a", "- b", "+ x", "+ y", "  c", "+ z"),
                LibertyDiff.diff(Arrays.asList("a", "b", "c"), Arrays.asList("x", "y", "c", "z")));
        Assertions.assertEquals(Arrays.asList("+ a"), LibertyDiff.diff(Collections.emptyList(),
                Arrays.asList("a")));
        Assertions.assertEquals(Arrays.asList("  a", "- b", "  c"), LibertyDiff.diff(Arrays.asList("a", "b", "c"),
                Arrays.asList("a", "c")));
    }

    @Test
    public void testSideBySide() {
        List<String> rows = LibertyDiff.sideBySide(Arrays.asList("a", "b", "c", "dddddddd"),
                Arrays.asList("a", "x", "c"), 5);
        Assertions.assertEquals(Arrays.asList(
                "a       a",
                "b     | x",
                "c       c",
                "ddddd < "), rows);
    }

    @Test
    public void testWrittenLibraryIsSimilar() {
        List<String> original = LibertyTestFiles.getLines(LibertyTestFiles.DEMO_LIB);
        List<String> written = new LibertyWriter().write(LibertyParser.parseLiberty(original));
        List<String> a = LibertyDiff.cleanLines(original);
        List<String> b = LibertyDiff.cleanLines(written);
        Assertions.assertTrue(LibertyDiff.similarity(a, b, SimilarityMethod.NORMAL) > 0.95);
        Assertions.assertEquals(1.0, LibertyDiff.similarity(a, b, SimilarityMethod.REAL_QUICK), 0.05);
    }
}
