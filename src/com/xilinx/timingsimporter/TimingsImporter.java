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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyJson;
import com.xilinx.timingsimporter.liberty.LibertyParseException;
import com.xilinx.timingsimporter.liberty.LibertyWriteException;
import com.xilinx.timingsimporter.liberty.LibertyWriter;
import com.xilinx.timingsimporter.liberty.compare.LibertyDiff;
import com.xilinx.timingsimporter.liberty.compare.LibertyDiff.SimilarityMethod;
import com.xilinx.timingsimporter.sdf.SDFMappingException;
import com.xilinx.timingsimporter.sdf.SDFModel;
import com.xilinx.timingsimporter.sdf.SDFWriter;
import com.xilinx.timingsimporter.timing.LibertyTimingMapper;
import com.xilinx.timingsimporter.timing.LibertyTimingSource;
import com.xilinx.timingsimporter.util.FileTools;
import com.xilinx.timingsimporter.util.MessageGenerator;
import com.xilinx.timingsimporter.util.MessageGenerator.Severity;
import com.xilinx.timingsimporter.util.Params;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command line entry point. Each conversion direction is a subcommand with
 * its own options.
 */
public final class TimingsImporter {

    public static final String LIBERTY_TO_JSON_CMD = "LibertyToJSON";
    public static final String JSON_TO_LIBERTY_CMD = "JSONToLiberty";
    public static final String LIBERTY_TO_SDF_CMD = "LibertyToSDF";
    public static final String VALIDATE_ROUND_TRIP_CMD = "ValidateRoundTrip";
    public static final String LIBERTY_DIFF_CMD = "LibertyDiff";

    private static final String INPUT_OPT = "i";
    private static final String OUTPUT_OPT = "o";
    private static final String LIST_OPT = "l";
    private static final String HELP_OPT = "h";
    private static final String LOG_OPT = "log-suppress-below";
    private static final String VOLTAGE_OPT = "voltage";
    private static final String TIMESCALE_OPT = "timescale";
    private static final String JSON_OPT = "json";
    private static final String NORMALIZE_CELL_NAMES_OPT = "normalize-cell-names";
    private static final String NORMALIZE_PORT_NAMES_OPT = "normalize-port-names";
    private static final String OUTPUT_JSON_ROOT_DIR_OPT = "output-json-root-dir";
    private static final String OUTPUT_LIB_ROOT_DIR_OPT = "output-lib-root-dir";
    private static final String PRINT_LIB_DIFF_OPT = "print-lib-diff";
    private static final String LIB_SIMILARITY_THRESHOLD_OPT = "lib-similarity-threshold";
    private static final String PRINT_DIFF_OPT = "print-diff";
    private static final String SIDE_BY_SIDE_OPT = "side-by-side";
    private static final String COMPUTE_SIMILARITY_OPT = "compute-similarity";
    private static final String SIMILARITY_METHOD_OPT = "similarity-method";

    private static final int SIDE_BY_SIDE_WIDTH = 60;

    private TimingsImporter() {
    }

    private static void printMainHelp() {
        MessageGenerator.printHeader("TimingsImporter");
        System.out.println("Convert Liberty timing files to JSON, back to Liberty, or to SDF.\n");
        System.out.println("Usage: TimingsImporter <command> [options]\n");
        System.out.println("Available commands:");
        System.out.println("  " + LIBERTY_TO_JSON_CMD + "        Convert a Liberty file to its JSON form");
        System.out.println("  " + JSON_TO_LIBERTY_CMD + "        Convert a JSON file back to Liberty");
        System.out.println("  " + LIBERTY_TO_SDF_CMD + "         Extract the timings of Liberty files into SDF");
        System.out.println("  " + VALIDATE_ROUND_TRIP_CMD + "    Check Liberty files survive a JSON round trip");
        System.out.println("  " + LIBERTY_DIFF_CMD + "          Compare two Liberty files");
        System.out.println();
        System.out.println("Use 'TimingsImporter <command> --help' for command-specific options.");
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs a subcommand.
     * @param args Command name followed by its options
     * @return The exit status, 0 on success.
     */
    public static int run(String[] args) {
        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help") || args[0].equals("-?")) {
            printMainHelp();
            return 0;
        }
        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        if (command.equalsIgnoreCase(LIBERTY_TO_JSON_CMD)) {
            return runLibertyToJSON(commandArgs);
        } else if (command.equalsIgnoreCase(JSON_TO_LIBERTY_CMD)) {
            return runJSONToLiberty(commandArgs);
        } else if (command.equalsIgnoreCase(LIBERTY_TO_SDF_CMD)) {
            return runLibertyToSDF(commandArgs);
        } else if (command.equalsIgnoreCase(VALIDATE_ROUND_TRIP_CMD)) {
            return runValidateRoundTrip(commandArgs);
        } else if (command.equalsIgnoreCase(LIBERTY_DIFF_CMD)) {
            return runLibertyDiff(commandArgs);
        }
        System.err.println("ERROR: Unknown command '" + command + "'");
        printMainHelp();
        return 1;
    }

    private static OptionParser createOptionParser() {
        OptionParser optParser = new OptionParser();
        optParser.accepts(LOG_OPT, "Lowest message level printed (INFO, WARNING, ERROR, ALL)")
                .withRequiredArg()
                .defaultsTo(Params.getLogSuppressBelow().name());
        optParser.acceptsAll(Arrays.asList(HELP_OPT, "help", "?"), "Print Help")
                .forHelp();
        return optParser;
    }

    private static void addInputOutputOptions(OptionParser optParser, String inputDesc, String outputDesc) {
        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs(inputDesc);
        optParser.acceptsAll(Arrays.asList(OUTPUT_OPT, "output"))
                .withRequiredArg()
                .required()
                .describedAs(outputDesc);
    }

    private static void printHelp(String command, String description, OptionParser optParser) {
        MessageGenerator.printHeader(command);
        System.out.println(description + "\n");
        try {
            optParser.printHelpOn(System.out);
        } catch (IOException ioException) {
            ioException.printStackTrace();
        }
    }

    /**
     * Parses subcommand options, printing help on request or on error.
     * @return The options or null if the command should not run.
     */
    private static OptionSet parseOptions(String command, String description, OptionParser optParser,
                                          String[] args) {
        OptionSet opts;
        try {
            opts = optParser.parse(args);
        } catch (Exception parseException) {
            System.err.println("ERROR: " + parseException.getMessage());
            printHelp(command, description, optParser);
            return null;
        }
        if (opts.has(HELP_OPT)) {
            printHelp(command, description, optParser);
            return null;
        }
        try {
            Severity.fromName((String) opts.valueOf(LOG_OPT));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return null;
        }
        return opts;
    }

    private static MessageGenerator createLog(OptionSet opts) {
        return new MessageGenerator(Severity.fromName((String) opts.valueOf(LOG_OPT)));
    }

    private static int runLibertyToJSON(String[] args) {
        String description = "Convert a Liberty file to its JSON form.";
        OptionParser optParser = createOptionParser();
        addInputOutputOptions(optParser, "Input Liberty file", "Output JSON file");
        OptionSet opts = parseOptions(LIBERTY_TO_JSON_CMD, description, optParser, args);
        if (opts == null) return hasHelp(args) ? 0 : 1;
        MessageGenerator log = createLog(opts);

        Path input = Paths.get((String) opts.valueOf(INPUT_OPT));
        Path output = Paths.get((String) opts.valueOf(OUTPUT_OPT));
        try {
            LibertyTimingSource source = LibertyTimingSource.read(input);
            LibertyJson.writeJson(source.getDocument(), output);
        } catch (LibertyParseException | UncheckedIOException e) {
            log.error(input + ": " + e.getMessage());
            return 1;
        }
        log.info("Wrote " + output);
        return 0;
    }

    private static int runJSONToLiberty(String[] args) {
        String description = "Convert a JSON file back to Liberty.";
        OptionParser optParser = createOptionParser();
        addInputOutputOptions(optParser, "Input JSON file", "Output Liberty file");
        OptionSet opts = parseOptions(JSON_TO_LIBERTY_CMD, description, optParser, args);
        if (opts == null) return hasHelp(args) ? 0 : 1;
        MessageGenerator log = createLog(opts);

        Path input = Paths.get((String) opts.valueOf(INPUT_OPT));
        Path output = Paths.get((String) opts.valueOf(OUTPUT_OPT));
        try {
            LibertyGroup document = LibertyJson.readJson(input);
            new LibertyWriter().write(document, output);
        } catch (LibertyParseException | LibertyWriteException | UncheckedIOException e) {
            log.error(input + ": " + e.getMessage());
            return 1;
        }
        log.info("Wrote " + output);
        return 0;
    }

    private static int runLibertyToSDF(String[] args) {
        String description = "Extract the timings of one or more Liberty files into a single SDF file.";
        OptionParser optParser = createOptionParser();
        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs("Input Liberty file, may be repeated");
        optParser.acceptsAll(Arrays.asList(OUTPUT_OPT, "output"))
                .withRequiredArg()
                .required()
                .describedAs("Output SDF file");
        optParser.accepts(VOLTAGE_OPT, "Operating voltage written to the SDF header")
                .withRequiredArg()
                .ofType(Double.class);
        optParser.accepts(TIMESCALE_OPT, "SDF timescale, defaults to the library time_unit")
                .withRequiredArg();
        optParser.accepts(JSON_OPT, "Also dump the SDF content as JSON to this file")
                .withRequiredArg();
        optParser.accepts(NORMALIZE_CELL_NAMES_OPT, "Replace indexing brackets in cell names");
        optParser.accepts(NORMALIZE_PORT_NAMES_OPT, "Replace indexing brackets in port names");
        OptionSet opts = parseOptions(LIBERTY_TO_SDF_CMD, description, optParser, args);
        if (opts == null) return hasHelp(args) ? 0 : 1;
        MessageGenerator log = createLog(opts);

        LibertyTimingMapper mapper = new LibertyTimingMapper(log);
        mapper.setNormalizeCellNames(opts.has(NORMALIZE_CELL_NAMES_OPT));
        mapper.setNormalizePortNames(opts.has(NORMALIZE_PORT_NAMES_OPT));
        if (opts.has(VOLTAGE_OPT)) {
            mapper.setVoltage((Double) opts.valueOf(VOLTAGE_OPT));
        }
        if (opts.has(TIMESCALE_OPT)) {
            mapper.setTimescale((String) opts.valueOf(TIMESCALE_OPT));
        }

        List<LibertyTimingSource> sources = new ArrayList<>();
        for (Object input : opts.valuesOf(INPUT_OPT)) {
            try {
                sources.add(LibertyTimingSource.read(Paths.get((String) input)));
            } catch (LibertyParseException | UncheckedIOException e) {
                log.error(input + ": " + e.getMessage());
                return 1;
            }
        }
        Path output = Paths.get((String) opts.valueOf(OUTPUT_OPT));
        try {
            SDFModel model = mapper.map(sources);
            SDFWriter.write(model, output);
            if (opts.has(JSON_OPT)) {
                SDFWriter.writeJSON(model, Paths.get((String) opts.valueOf(JSON_OPT)));
            }
            log.info("Wrote " + model.getElementCount() + " SDF entries to " + output);
        } catch (SDFMappingException | UncheckedIOException e) {
            log.error(e.getMessage());
            return 1;
        }
        return 0;
    }

    private static int runValidateRoundTrip(String[] args) {
        String description = "Check that Liberty files survive the trip to JSON and back.";
        OptionParser optParser = createOptionParser();
        optParser.acceptsAll(Arrays.asList(LIST_OPT, "list"))
                .withRequiredArg()
                .required()
                .describedAs("File listing the Liberty files to check, one per line");
        optParser.accepts(OUTPUT_JSON_ROOT_DIR_OPT, "Directory receiving the intermediate JSON files")
                .withRequiredArg();
        optParser.accepts(OUTPUT_LIB_ROOT_DIR_OPT, "Directory receiving the regenerated Liberty files")
                .withRequiredArg();
        optParser.accepts(PRINT_LIB_DIFF_OPT, "Print the diff of Liberty files that are not similar enough");
        optParser.accepts(LIB_SIMILARITY_THRESHOLD_OPT, "Lowest accepted similarity of the Liberty texts")
                .withRequiredArg()
                .ofType(Double.class)
                .defaultsTo(Params.TI_SIMILARITY_THRESHOLD);
        optParser.accepts(SIMILARITY_METHOD_OPT, "normal, quick or real_quick")
                .withRequiredArg()
                .defaultsTo("quick");
        OptionSet opts = parseOptions(VALIDATE_ROUND_TRIP_CMD, description, optParser, args);
        if (opts == null) return hasHelp(args) ? 0 : 1;
        MessageGenerator log = createLog(opts);

        RoundTripValidator validator = new RoundTripValidator(log);
        if (opts.has(OUTPUT_JSON_ROOT_DIR_OPT)) {
            validator.setOutputJsonRootDir(Paths.get((String) opts.valueOf(OUTPUT_JSON_ROOT_DIR_OPT)));
        }
        if (opts.has(OUTPUT_LIB_ROOT_DIR_OPT)) {
            validator.setOutputLibRootDir(Paths.get((String) opts.valueOf(OUTPUT_LIB_ROOT_DIR_OPT)));
        }
        validator.setPrintLibDiff(opts.has(PRINT_LIB_DIFF_OPT));
        validator.setSimilarityThreshold((Double) opts.valueOf(LIB_SIMILARITY_THRESHOLD_OPT));

        List<Path> files;
        try {
            validator.setSimilarityMethod(SimilarityMethod.fromName((String) opts.valueOf(SIMILARITY_METHOD_OPT)));
            files = RoundTripValidator.readFileList(Paths.get((String) opts.valueOf(LIST_OPT)));
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.error(e.getMessage());
            return 1;
        }
        return validator.validate(files) ? 0 : 1;
    }

    private static int runLibertyDiff(String[] args) {
        String description = "Compare two Liberty files after removing insignificant differences.\n"
                + "Usage: TimingsImporter " + LIBERTY_DIFF_CMD + " <first.lib> <second.lib> [options]";
        OptionParser optParser = createOptionParser();
        optParser.accepts(PRINT_DIFF_OPT, "Print the line diff");
        optParser.accepts(SIDE_BY_SIDE_OPT, "Print both files side by side");
        optParser.accepts(COMPUTE_SIMILARITY_OPT, "Print the similarity of the files (0-1)");
        optParser.accepts(SIMILARITY_METHOD_OPT, "normal, quick or real_quick")
                .withRequiredArg()
                .defaultsTo("quick");
        OptionSet opts = parseOptions(LIBERTY_DIFF_CMD, description, optParser, args);
        if (opts == null) return hasHelp(args) ? 0 : 1;
        MessageGenerator log = createLog(opts);

        List<?> files = opts.nonOptionArguments();
        if (files.size() != 2) {
            log.error("Expected two Liberty files, got " + files.size());
            printHelp(LIBERTY_DIFF_CMD, description, optParser);
            return 1;
        }
        List<String> a;
        List<String> b;
        SimilarityMethod method;
        try {
            a = LibertyDiff.cleanLines(FileTools.getLinesFromTextFile(files.get(0).toString()));
            b = LibertyDiff.cleanLines(FileTools.getLinesFromTextFile(files.get(1).toString()));
            method = SimilarityMethod.fromName((String) opts.valueOf(SIMILARITY_METHOD_OPT));
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.error(e.getMessage());
            return 1;
        }
        if (opts.has(PRINT_DIFF_OPT)) {
            for (String line : LibertyDiff.diff(a, b)) {
                System.out.println(line);
            }
        }
        if (opts.has(SIDE_BY_SIDE_OPT)) {
            for (String line : LibertyDiff.sideBySide(a, b, SIDE_BY_SIDE_WIDTH)) {
                System.out.println(line);
            }
        }
        if (opts.has(COMPUTE_SIMILARITY_OPT)) {
            System.out.println("Similarity between documents: " + LibertyDiff.similarity(a, b, method));
        }
        return 0;
    }

    private static boolean hasHelp(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help") || arg.equals("-?")) return true;
        }
        return false;
    }
}
