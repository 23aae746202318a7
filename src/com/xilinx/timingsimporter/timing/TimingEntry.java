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

import java.util.List;

/**
 * One Liberty timing group prepared for SDF conversion, with every name
 * already in its final (SDF) form.
 */
public class TimingEntry {
    /**
     * SDF cell type, including condition and edge suffixes.
     */
    public String sdfCell;
    /**
     * Instance of the cell.
     */
    public String instance;
    /**
     * Pin owning the timing group.
     */
    public String pin;
    /**
     * Pins listed in {@code related_pin}, empty if there are none.
     */
    public List<String> relatedPins;
    /**
     * Value of {@code timing_type}, null if absent.
     */
    public String timingType;
    /**
     * Scaled delays of the group.
     */
    public RiseFallDelay delays;

    public TimingEntry(String sdfCell, String instance, String pin, List<String> relatedPins, String timingType,
                       RiseFallDelay delays) {
        this.sdfCell = sdfCell;
        this.instance = instance;
        this.pin = pin;
        this.relatedPins = relatedPins;
        this.timingType = timingType;
        this.delays = delays;
    }

    @Override
    public String toString() {
        return sdfCell + "/" + instance + " pin " + pin + " (" + timingType + ")";
    }
}
