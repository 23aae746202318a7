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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyJson;
import com.xilinx.timingsimporter.liberty.LibertyParser;
import com.xilinx.timingsimporter.liberty.LibertyWriter;
import com.xilinx.timingsimporter.liberty.compare.LibertyDiff;
import com.xilinx.timingsimporter.liberty.compare.LibertyDiff.SimilarityMethod;
import com.xilinx.timingsimporter.timing.LibertyTimingSource;
import com.xilinx.timingsimporter.util.FileTools;
import com.xilinx.timingsimporter.util.MessageGenerator;
import com.xilinx.timingsimporter.util.Params;

/**
 * Checks that Liberty files survive a trip through the Document, the JSON
 * interchange form and back to Liberty text. Every file goes through these
 * stages, a failed stage causing the remaining ones to be skipped:
 * <ol>
 * <li>lib-to-json: parse the Liberty file and write its JSON form</li>
 * <li>json-to-lib: read the JSON back and write Liberty text</li>
 * <li>newlib-to-json: parse the written Liberty text</li>
 * <li>comparison-json: both Documents must be equal</li>
 * <li>comparison-lib: both Liberty texts must be similar enough after cleaning</li>
 * </ol>
 *
 * Created on: Oct 11, 2026
 */
public class RoundTripValidator {

    public static final String LIB_TO_JSON = "lib-to-json";
    public static final String JSON_TO_LIB = "json-to-lib";
    public static final String NEWLIB_TO_JSON = "newlib-to-json";
    public static final String COMPARISON_JSON = "comparison-json";
    public static final String COMPARISON_LIB = "comparison-lib";

    public static final String[] STAGES = {LIB_TO_JSON, JSON_TO_LIB, NEWLIB_TO_JSON, COMPARISON_JSON,
        COMPARISON_LIB};

    private final MessageGenerator log;

    private Path outputJsonRootDir;

    private Path outputLibRootDir;

    private boolean printLibDiff = false;

    private double similarityThreshold = Params.TI_SIMILARITY_THRESHOLD;

    private SimilarityMethod similarityMethod = SimilarityMethod.QUICK;

    private final Map<String, Integer> failures = new LinkedHashMap<>();

    private final Map<String, Integer> skips = new LinkedHashMap<>();

    private int fileCount = 0;

    public RoundTripValidator(MessageGenerator log) {
        this.log = log;
        for (String stage : STAGES) {
            failures.put(stage, 0);
            skips.put(stage, 0);
        }
    }

    public void setOutputJsonRootDir(Path outputJsonRootDir) {
        this.outputJsonRootDir = outputJsonRootDir;
    }

    public void setOutputLibRootDir(Path outputLibRootDir) {
        this.outputLibRootDir = outputLibRootDir;
    }

    public void setPrintLibDiff(boolean printLibDiff) {
        this.printLibDiff = printLibDiff;
    }

    public void setSimilarityThreshold(double similarityThreshold) {
        this.similarityThreshold = similarityThreshold;
    }

    /**
     * Sets how the Liberty texts are compared. Defaults to
     * {@link SimilarityMethod#QUICK}; {@link SimilarityMethod#NORMAL} is exact
     * but its run time grows with the square of the file size.
     */
    public void setSimilarityMethod(SimilarityMethod similarityMethod) {
        this.similarityMethod = similarityMethod;
    }

    public SimilarityMethod getSimilarityMethod() {
        return similarityMethod;
    }

    /**
     * Reads a list of Liberty files, one path per line. Blank lines and lines
     * starting with '#' are ignored; relative paths are resolved against the
     * directory of the list file.
     * @param listFile The list file
     * @return The listed paths
     */
    public static List<Path> readFileList(Path listFile) {
        Path base = listFile.toAbsolutePath().getParent();
        List<Path> files = new ArrayList<>();
        for (String line : FileTools.getLinesFromTextFile(listFile)) {
            String entry = line.trim();
            if (entry.isEmpty() || entry.startsWith("#")) continue;
            Path p = Paths.get(entry);
            files.add(p.isAbsolute() || base == null ? p : base.resolve(p));
        }
        return files;
    }

    /**
     * Builds the path, relative to an output root directory and without
     * extension, that receives the outputs for a Liberty file. The parent
     * directories of the file are mirrored so files of the same name in
     * different directories do not overwrite each other.
     * @param libFile The Liberty file
     * @return The relative path, e.g. {@code data/libs/cell} for
     * {@code /data/libs/cell.lib}
     */
    public static Path getOutputNameCore(Path libFile) {
        Path normalized = libFile.normalize();
        Path core = null;
        Path parent = normalized.getParent();
        if (parent != null) {
            for (Path element : parent) {
                String name = element.toString();
                if (name.isEmpty() || name.equals(".") || name.equals("..")) continue;
                core = core == null ? element : core.resolve(name);
            }
        }
        String stem = FileTools.removeFileExtension(normalized.getFileName().toString());
        return core == null ? Paths.get(stem) : core.resolve(stem);
    }

    /**
     * Validates every file.
     * @param libFiles Liberty files to check
     * @return True if no stage failed for any file.
     */
    public boolean validate(List<Path> libFiles) {
        boolean allPassed = true;
        for (Path libFile : libFiles) {
            allPassed &= validate(libFile);
        }
        printSummary();
        return allPassed;
    }

    /**
     * Runs all stages on one file.
     * @param libFile The Liberty file
     * @return True if every stage passed.
     */
    public boolean validate(Path libFile) {
        fileCount++;
        String name = getOutputNameCore(libFile).toString();
        log.info("Validating " + libFile);

        List<String> originalLines;
        LibertyGroup original;
        String json;
        try {
            originalLines = new ArrayList<>(FileTools.getLinesFromTextFile(libFile));
            LibertyTimingSource.splitHeader(originalLines);
            original = LibertyParser.parseLiberty(originalLines);
            json = LibertyJson.toJson(original);
            if (outputJsonRootDir != null) {
                FileTools.makeParentDirs(outputJsonRootDir.resolve(name + ".json"));
                FileTools.writeStringToTextFile(json, outputJsonRootDir.resolve(name + ".json").toString());
            }
        } catch (RuntimeException e) {
            return fail(LIB_TO_JSON, libFile, e);
        }

        List<String> newLines;
        try {
            newLines = new LibertyWriter().write(LibertyParser.parseJson(json));
            if (outputLibRootDir != null) {
                FileTools.makeParentDirs(outputLibRootDir.resolve(name + ".lib"));
                FileTools.writeLinesToTextFile(newLines, outputLibRootDir.resolve(name + ".lib").toString());
            }
        } catch (RuntimeException e) {
            return fail(JSON_TO_LIB, libFile, e);
        }

        LibertyGroup reparsed;
        try {
            reparsed = LibertyParser.parseLiberty(newLines);
        } catch (RuntimeException e) {
            return fail(NEWLIB_TO_JSON, libFile, e);
        }

        boolean passed = true;
        if (!original.equals(reparsed)) {
            log.error(COMPARISON_JSON + ": Documents of " + libFile + " differ after the round trip");
            failures.merge(COMPARISON_JSON, 1, Integer::sum);
            passed = false;
        }

        List<String> cleanedOriginal = LibertyDiff.cleanLines(originalLines);
        List<String> cleanedNew = LibertyDiff.cleanLines(newLines);
        double similarity = LibertyDiff.similarity(cleanedOriginal, cleanedNew, similarityMethod);
        if (similarity < similarityThreshold) {
            log.error(COMPARISON_LIB + ": Liberty text of " + libFile + " has similarity " + similarity
                    + " below " + similarityThreshold);
            failures.merge(COMPARISON_LIB, 1, Integer::sum);
            passed = false;
            if (printLibDiff) {
                for (String line : LibertyDiff.diff(cleanedOriginal, cleanedNew)) {
                    System.out.println(line);
                }
            }
        } else {
            log.info(COMPARISON_LIB + ": similarity " + similarity);
        }
        return passed;
    }

    private boolean fail(String stage, Path libFile, RuntimeException e) {
        log.error(stage + ": " + libFile + ": " + e.getMessage());
        failures.merge(stage, 1, Integer::sum);
        boolean after = false;
        for (String s : STAGES) {
            if (after) skips.merge(s, 1, Integer::sum);
            if (s.equals(stage)) after = true;
        }
        return false;
    }

    public Map<String, Integer> getFailures() {
        return failures;
    }

    public Map<String, Integer> getSkips() {
        return skips;
    }

    public boolean hasFailures() {
        for (int count : failures.values()) {
            if (count > 0) return true;
        }
        return false;
    }

    public void printSummary() {
        MessageGenerator.printHeader("Round trip summary");
        System.out.println("Files validated: " + fileCount);
        for (String stage : STAGES) {
            System.out.printf("  %-16s failed: %d  skipped: %d%n", stage, failures.get(stage), skips.get(stage));
        }
    }
}
