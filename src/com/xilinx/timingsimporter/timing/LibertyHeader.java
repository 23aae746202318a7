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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.xilinx.timingsimporter.sdf.SDFMappingException;

/**
 * The one-line header preceding a timing file, of the form
 * {@code <cell> cell <design> [kfactor <f>] [instance <name>]}.
 */
public class LibertyHeader {

    private static final Pattern HEADER = Pattern.compile(
            "^\\s*(\\S+)\\s+cell\\s+(\\S+)(?:\\s+kfactor\\s+(\\S+))?(?:\\s+instance\\s+(\\S+))?\\s*$");

    private final String cell;

    private final String design;

    private final double kfactor;

    private final String instance;

    public LibertyHeader(String cell, String design, double kfactor, String instance) {
        this.cell = cell;
        this.design = design;
        this.kfactor = kfactor;
        this.instance = instance;
    }

    /**
     * @param header Header text
     * @return The parsed header
     * @throws SDFMappingException if the text does not follow the header grammar.
     */
    public static LibertyHeader parse(String header) {
        LibertyHeader h = tryParse(header);
        if (h == null) {
            throw new SDFMappingException("ERROR: Malformed header '" + header
                    + "', expected '<cell> cell <design> [kfactor <f>] [instance <name>]'");
        }
        return h;
    }

    /**
     * @param header Header text, may be null
     * @return The parsed header or null if the text does not follow the grammar.
     */
    public static LibertyHeader tryParse(String header) {
        if (header == null) return null;
        Matcher m = HEADER.matcher(header);
        if (!m.matches()) return null;
        double kfactor = 1.0;
        if (m.group(3) != null) {
            try {
                kfactor = Double.parseDouble(m.group(3));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return new LibertyHeader(m.group(1), m.group(2), kfactor, m.group(4));
    }

    public static boolean matches(String header) {
        return tryParse(header) != null;
    }

    public String getCell() {
        return cell;
    }

    public String getDesign() {
        return design;
    }

    public double getKfactor() {
        return kfactor;
    }

    /**
     * @return The instance name or null if the header names none.
     */
    public String getInstance() {
        return instance;
    }

    @Override
    public String toString() {
        return cell + " cell " + design + " kfactor " + kfactor + (instance == null ? "" : " instance " + instance);
    }
}
