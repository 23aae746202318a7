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

package com.xilinx.timingsimporter.timing;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyNode;
import com.xilinx.timingsimporter.sdf.SDFHeader;
import com.xilinx.timingsimporter.sdf.SDFMappingException;
import com.xilinx.timingsimporter.sdf.SDFModel;
import com.xilinx.timingsimporter.util.MessageGenerator;
import com.xilinx.timingsimporter.util.Pair;
import com.xilinx.timingsimporter.util.StringTools;

/**
 * Extracts the delays and timing checks of Liberty timing files into an
 * {@link SDFModel}. A file is either a whole library (root group
 * {@code library}) or a single cell (root group {@code cell}) described by its
 * header line.
 * <p>
 * Every {@code timing} group of every pin is classified by pin direction and
 * timing type and passed to the matching {@link TimingEntryHandler}. Groups
 * that cannot be converted are skipped with a message; malformed headers and
 * conditions abort the conversion with an {@link SDFMappingException}.
 *
 * Created on: Oct 9, 2026
 */
public class LibertyTimingMapper {

    public static final String LIBRARY_GROUP = "library";

    public static final String CELL_GROUP = "cell";

    public static final String PIN_GROUP = "pin";

    public static final String TIMING_GROUP = "timing";

    private final MessageGenerator log;

    private final TimingEntryHandler combinational;

    private final TimingEntryHandler sequentialInput;

    private boolean normalizeCellNames = false;

    private boolean normalizePortNames = false;

    private Double voltage;

    private String timescale;

    private String date;

    public LibertyTimingMapper() {
        this(MessageGenerator.fromParams());
    }

    public LibertyTimingMapper(MessageGenerator log) {
        this.log = log;
        this.combinational = new CombinationalTimingHandler(log);
        this.sequentialInput = new SequentialTimingHandler(log);
    }

    /**
     * Replaces indexing brackets in cell and instance names, e.g. "X[3]"
     * becomes "X_3".
     */
    public void setNormalizeCellNames(boolean normalizeCellNames) {
        this.normalizeCellNames = normalizeCellNames;
    }

    /**
     * Replaces indexing brackets in port names, e.g. "A[3]" becomes "A_3".
     */
    public void setNormalizePortNames(boolean normalizePortNames) {
        this.normalizePortNames = normalizePortNames;
    }

    public void setVoltage(Double voltage) {
        this.voltage = voltage;
    }

    /**
     * @param timescale Timescale of the produced SDF, e.g. "1ns". If not set,
     * the {@code time_unit} of the first library is used, else "1ns".
     */
    public void setTimescale(String timescale) {
        this.timescale = timescale;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public SDFModel map(LibertyTimingSource source) {
        return map(Collections.singletonList(source));
    }

    /**
     * Converts all sources into one model. The design name comes from the
     * first source.
     * @param sources Parsed timing files with their headers
     * @return The SDF model
     */
    public SDFModel map(List<LibertyTimingSource> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("ERROR: No timing sources to convert");
        }
        SDFModel model = new SDFModel(new SDFHeader(null));
        String libraryTimeUnit = null;
        for (LibertyTimingSource source : sources) {
            Pair<String, LibertyGroup> root = getRoot(source.getDocument());
            String rootType = LibertyNode.getKeyType(root.getFirst());
            String rootName = LibertyNode.getKeyParameter(root.getFirst());
            if (rootType.equals(LIBRARY_GROUP)) {
                String design = getLibraryDesignName(source.getHeader(), rootName);
                if (model.getHeader().getDesign() == null) {
                    model.getHeader().setDesign(design);
                }
                if (libraryTimeUnit == null) {
                    libraryTimeUnit = root.getSecond().getString("time_unit");
                }
                mapLibrary(root.getSecond(), source.getHeader(), model);
            } else if (rootType.equals(CELL_GROUP)) {
                LibertyHeader header = LibertyHeader.parse(source.getHeader());
                if (model.getHeader().getDesign() == null) {
                    model.getHeader().setDesign(header.getDesign());
                }
                String instance = header.getInstance() == null ? header.getCell() : header.getInstance();
                mapCell(header.getCell(), instance, header.getKfactor(), root.getSecond(), model);
            } else {
                throw new SDFMappingException("ERROR: Root group '" + root.getFirst()
                        + "' is not a timing library, expected '" + LIBRARY_GROUP + "' or '" + CELL_GROUP + "'");
            }
        }

        SDFHeader header = model.getHeader();
        if (timescale != null) {
            header.setTimescale(timescale);
        } else if (libraryTimeUnit != null) {
            header.setTimescale(libraryTimeUnit);
        }
        if (voltage != null) {
            header.setVoltage(voltage);
        }
        header.setDate(date != null ? date
                : LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
        return model;
    }

    private static Pair<String, LibertyGroup> getRoot(LibertyGroup document) {
        if (document.size() != 1) {
            throw new SDFMappingException("ERROR: Expected a single root group, found " + document.size()
                    + " root entries");
        }
        Map.Entry<String, LibertyNode> e = document.getChildren().entrySet().iterator().next();
        if (!e.getValue().isGroup()) {
            throw new SDFMappingException("ERROR: Root entry '" + e.getKey() + "' is not a timing library");
        }
        return new Pair<>(e.getKey(), (LibertyGroup) e.getValue());
    }

    /**
     * Design name of a library file: the header's design if the header follows
     * the grammar, else the whole header text.
     * @throws SDFMappingException if the library has no header.
     */
    static String getLibraryDesignName(String headerText, String libraryName) {
        LibertyHeader header = LibertyHeader.tryParse(headerText);
        if (header != null) {
            return header.getDesign();
        }
        if (headerText != null && !headerText.trim().isEmpty()) {
            return headerText.trim();
        }
        throw new SDFMappingException("ERROR: Library '" + libraryName + "' has no header line naming the design");
    }

    private void mapLibrary(LibertyGroup library, String headerText, SDFModel model) {
        LibertyHeader header = LibertyHeader.tryParse(headerText);
        double kfactor = header == null ? 1.0 : header.getKfactor();
        for (Pair<String, LibertyGroup> cell : library.getGroups(CELL_GROUP)) {
            mapCell(cell.getFirst(), cell.getFirst(), kfactor, cell.getSecond(), model);
        }
    }

    private void mapCell(String cellName, String instance, double kfactor, LibertyGroup cell, SDFModel model) {
        for (Pair<String, LibertyGroup> pin : cell.getGroups(PIN_GROUP)) {
            String pinName = pin.getFirst();
            String directionName = pin.getSecond().getString("direction");
            PinDirection direction = PinDirection.fromName(directionName);
            if (direction == null) {
                log.warning("Pin " + pinName + " of cell " + cellName + " has unknown direction '" + directionName
                        + "', skipping");
                continue;
            }
            for (Pair<String, LibertyGroup> timing : pin.getSecond().getGroups(TIMING_GROUP)) {
                mapTimingEntry(cellName, instance, kfactor, pinName, direction, timing.getSecond(), model);
            }
        }
    }

    private void mapTimingEntry(String cellName, String instance, double kfactor, String pinName,
                                PinDirection direction, LibertyGroup timing, SDFModel model) {
        String timingType = timing.getString("timing_type");
        RiseFallDelay delays = RiseFallDelay.fromTimingGroup(timing, kfactor);
        if (delays.isEmpty()) {
            log.info("No delays in timing of pin " + pinName + " of cell " + cellName + ", skipping");
            return;
        }
        String sdfCell = cellName + WhenClauseParser.getCellSuffix(timing.getString("when"))
                + getEdgeSuffix(timingType);

        List<String> relatedPins = new ArrayList<>();
        String related = timing.getString("related_pin");
        if (related != null) {
            for (String r : related.trim().split("\\s+")) {
                if (!r.isEmpty()) relatedPins.add(portName(r));
            }
        }
        TimingEntry entry = new TimingEntry(cellName(sdfCell), cellName(instance), portName(pinName),
                relatedPins, timingType, delays);
        getHandler(TimingClassification.classify(direction, timingType)).handle(entry, model);
    }

    private TimingEntryHandler getHandler(TimingClassification classification) {
        if (!classification.isSequential()) {
            return combinational;
        }
        switch (classification.getDirection()) {
            case INPUT:
            case INOUT:
                return sequentialInput;
            case OUTPUT:
                return (entry, model) -> log.info("Skipping sequential timing of output " + entry);
            default:
                throw new RuntimeException("ERROR: Unhandled pin direction " + classification.getDirection());
        }
    }

    /**
     * @return "_" plus the upper case timing type for falling edge variants,
     * empty otherwise.
     */
    static String getEdgeSuffix(String timingType) {
        if (timingType == null) return "";
        if (timingType.equals("falling_edge") || timingType.endsWith("_falling")) {
            return "_" + timingType.toUpperCase();
        }
        return "";
    }

    private String cellName(String name) {
        return normalizeCellNames ? StringTools.removeIndexingBrackets(name) : name;
    }

    private String portName(String name) {
        return normalizePortNames ? StringTools.removeIndexingBrackets(name) : name;
    }
}
