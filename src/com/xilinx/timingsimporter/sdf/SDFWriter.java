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

package com.xilinx.timingsimporter.sdf;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import com.xilinx.timingsimporter.liberty.LibertyWriter;
import com.xilinx.timingsimporter.util.FileTools;
import com.xilinx.timingsimporter.util.MessageGenerator;

/**
 * Renders an {@link SDFModel} as SDF 3.0 text, or as JSON for inspection.
 *
 * Created on: Oct 8, 2026
 */
public class SDFWriter {

    private static final int INDENT = 4;

    public static List<String> write(SDFModel model) {
        List<String> lines = new ArrayList<>();
        SDFHeader h = model.getHeader();
        lines.add("(DELAYFILE");
        addRecord(lines, 1, "SDFVERSION", quote(h.getSdfVersion()));
        addRecord(lines, 1, "DESIGN", quote(h.getDesign()));
        if (h.getDate() != null) addRecord(lines, 1, "DATE", quote(h.getDate()));
        if (h.getVendor() != null) addRecord(lines, 1, "VENDOR", quote(h.getVendor()));
        addRecord(lines, 1, "PROGRAM", quote(h.getProgram()));
        addRecord(lines, 1, "VERSION", quote(h.getProgramVersion()));
        addRecord(lines, 1, "DIVIDER", h.getDivider());
        if (h.getVoltage() != null) addRecord(lines, 1, "VOLTAGE", h.getVoltage());
        addRecord(lines, 1, "TIMESCALE", h.getTimescale());

        for (Map.Entry<String, Map<String, Map<String, SDFElement>>> cell : model.getCells().entrySet()) {
            for (Map.Entry<String, Map<String, SDFElement>> instance : cell.getValue().entrySet()) {
                writeCell(lines, cell.getKey(), instance.getKey(), instance.getValue().values());
            }
        }
        lines.add(")");
        return lines;
    }

    public static void write(SDFModel model, Path sdfFile) {
        FileTools.makeParentDirs(sdfFile);
        FileTools.writeLinesToTextFile(write(model), sdfFile.toString());
    }

    private static void writeCell(List<String> lines, String cell, String instance,
                                  Iterable<SDFElement> elements) {
        List<SDFElement> paths = new ArrayList<>();
        List<SDFElement> checks = new ArrayList<>();
        for (SDFElement e : elements) {
            if (e.getType().isTimingCheck()) {
                checks.add(e);
            } else {
                paths.add(e);
            }
        }
        lines.add(pad(1) + "(CELL");
        addRecord(lines, 2, "CELLTYPE", quote(cell));
        addRecord(lines, 2, "INSTANCE", instance);
        if (!paths.isEmpty()) {
            lines.add(pad(2) + "(DELAY");
            lines.add(pad(3) + "(ABSOLUTE");
            for (SDFElement e : paths) {
                StringBuilder sb = new StringBuilder();
                sb.append(pad(4)).append("(IOPATH ").append(e.getFromPort()).append(' ').append(e.getToPort());
                for (SDFDelay d : e.getDelayPaths().values()) {
                    sb.append(' ').append(toTriple(d));
                }
                sb.append(')');
                lines.add(sb.toString());
            }
            lines.add(pad(3) + ")");
            lines.add(pad(2) + ")");
        }
        if (!checks.isEmpty()) {
            lines.add(pad(2) + "(TIMINGCHECK");
            for (SDFElement e : checks) {
                String ref = e.getEdge() == null ? e.getFromPort()
                        : "(" + e.getEdge().getKeyword() + " " + e.getFromPort() + ")";
                SDFDelay d = e.getDelay(SDFElement.PATH_NOMINAL);
                lines.add(pad(3) + "(" + e.getType() + " " + e.getToPort() + " " + ref + " "
                        + toTriple(d == null ? SDFDelay.EMPTY : d) + ")");
            }
            lines.add(pad(2) + ")");
        }
        lines.add(pad(1) + ")");
    }

    private static void addRecord(List<String> lines, int depth, String keyword, String value) {
        lines.add(pad(depth) + "(" + keyword + " " + value + ")");
    }

    private static String pad(int depth) {
        return MessageGenerator.makeWhiteSpace(depth * INDENT);
    }

    private static String quote(String s) {
        return "\"" + s + "\"";
    }

    /**
     * @return The triple as {@code (min:avg:max)}, missing slots left empty.
     */
    public static String toTriple(SDFDelay d) {
        return "(" + format(d.getMin()) + ":" + format(d.getAvg()) + ":" + format(d.getMax()) + ")";
    }

    private static String format(Double d) {
        return d == null ? "" : LibertyWriter.formatNumber(d);
    }

    /**
     * Dumps the model as JSON: a "header" object and a "cells" object nested as
     * cell, instance, element name, all in model order.
     */
    public static JsonObject toJSON(SDFModel model) {
        SDFHeader h = model.getHeader();
        JsonObject header = new JsonObject();
        header.addProperty("sdfversion", h.getSdfVersion());
        header.addProperty("design", h.getDesign());
        header.addProperty("date", h.getDate());
        header.addProperty("vendor", h.getVendor());
        header.addProperty("program", h.getProgram());
        header.addProperty("version", h.getProgramVersion());
        header.addProperty("divider", h.getDivider());
        header.addProperty("voltage", h.getVoltage());
        header.addProperty("timescale", h.getTimescale());

        JsonObject cells = new JsonObject();
        for (Map.Entry<String, Map<String, Map<String, SDFElement>>> cell : model.getCells().entrySet()) {
            JsonObject instances = new JsonObject();
            for (Map.Entry<String, Map<String, SDFElement>> instance : cell.getValue().entrySet()) {
                JsonObject elements = new JsonObject();
                for (SDFElement e : instance.getValue().values()) {
                    elements.add(e.getName(), toJSON(e));
                }
                instances.add(instance.getKey(), elements);
            }
            cells.add(cell.getKey(), instances);
        }

        JsonObject json = new JsonObject();
        json.add("header", header);
        json.add("cells", cells);
        return json;
    }

    private static JsonObject toJSON(SDFElement e) {
        JsonObject json = new JsonObject();
        json.addProperty("type", e.getType().getLowerCaseName());
        json.addProperty("name", e.getName());
        json.addProperty("from_pin", e.getFromPort());
        json.addProperty("to_pin", e.getToPort());
        json.addProperty("from_pin_edge", e.getEdge() == null ? null : e.getEdge().getKeyword());
        json.addProperty("is_absolute", e.isAbsolute());
        JsonObject paths = new JsonObject();
        for (Map.Entry<String, SDFDelay> p : e.getDelayPaths().entrySet()) {
            JsonObject triple = new JsonObject();
            triple.addProperty("avg", p.getValue().getAvg());
            triple.addProperty("min", p.getValue().getMin());
            triple.addProperty("max", p.getValue().getMax());
            paths.add(p.getKey(), triple);
        }
        json.add("delay_paths", paths);
        return json;
    }

    public static void writeJSON(SDFModel model, Path jsonFile) {
        Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();
        FileTools.makeParentDirs(jsonFile);
        FileTools.writeStringToTextFile(gson.toJson(toJSON(model)), jsonFile.toString());
    }
}
