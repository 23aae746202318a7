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

/**
 * Header records of an SDF file.
 *
 * Created on: Oct 7, 2026
 */
public class SDFHeader {

    public static final String SDF_VERSION = "3.0";

    public static final String DEFAULT_DIVIDER = "/";

    public static final String DEFAULT_TIMESCALE = "1ns";

    public static final String PROGRAM_NAME = "TimingsImporter";

    public static final String PROGRAM_VERSION = "1.0.0";

    private String design;

    private String sdfVersion = SDF_VERSION;

    private String voltage;

    private String date;

    private String vendor;

    private String timescale = DEFAULT_TIMESCALE;

    private String divider = DEFAULT_DIVIDER;

    private String program = PROGRAM_NAME;

    private String programVersion = PROGRAM_VERSION;

    public SDFHeader(String design) {
        this.design = design;
    }

    public String getDesign() {
        return design;
    }

    public void setDesign(String design) {
        this.design = design;
    }

    public String getSdfVersion() {
        return sdfVersion;
    }

    public void setSdfVersion(String sdfVersion) {
        this.sdfVersion = sdfVersion;
    }

    /**
     * @return The voltage as a triple, e.g. "1.0:1.0:1.0", or null if not set.
     */
    public String getVoltage() {
        return voltage;
    }

    public void setVoltage(String voltage) {
        this.voltage = voltage;
    }

    /**
     * Sets the voltage to the same value in all three slots.
     */
    public void setVoltage(double v) {
        String s = Double.toString(v);
        this.voltage = s + ":" + s + ":" + s;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getVendor() {
        return vendor;
    }

    public void setVendor(String vendor) {
        this.vendor = vendor;
    }

    public String getTimescale() {
        return timescale;
    }

    public void setTimescale(String timescale) {
        this.timescale = timescale;
    }

    public String getDivider() {
        return divider;
    }

    public void setDivider(String divider) {
        this.divider = divider;
    }

    public String getProgram() {
        return program;
    }

    public void setProgram(String program) {
        this.program = program;
    }

    public String getProgramVersion() {
        return programVersion;
    }

    public void setProgramVersion(String programVersion) {
        this.programVersion = programVersion;
    }
}
