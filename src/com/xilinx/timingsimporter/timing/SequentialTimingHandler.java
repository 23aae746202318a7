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

import com.xilinx.timingsimporter.sdf.SDFEdge;
import com.xilinx.timingsimporter.sdf.SDFElement;
import com.xilinx.timingsimporter.sdf.SDFElementType;
import com.xilinx.timingsimporter.sdf.SDFModel;
import com.xilinx.timingsimporter.util.MessageGenerator;
import com.xilinx.timingsimporter.util.Pair;

/**
 * Produces timing checks for clocked timing groups of input and inout pins.
 * The checked port is the owning pin, the reference port the related pin.
 */
public class SequentialTimingHandler implements TimingEntryHandler {

    private final MessageGenerator log;

    public SequentialTimingHandler(MessageGenerator log) {
        this.log = log;
    }

    @Override
    public void handle(TimingEntry entry, SDFModel model) {
        if (TimingCheckTable.isIgnored(entry.timingType)) {
            log.info("Timing type " + entry.timingType + " has no SDF timing check, skipping " + entry);
            return;
        }
        Pair<SDFElementType, SDFEdge> check = TimingCheckTable.getCheck(entry.timingType);
        if (check == null) {
            log.warning("Unsupported timing type " + entry.timingType + ", skipping " + entry);
            return;
        }
        if (entry.relatedPins.isEmpty()) {
            log.warning("No related_pin in timing of " + entry + ", skipping");
            return;
        }
        for (String related : entry.relatedPins) {
            SDFElement e = SDFElement.createTimingCheck(check.getFirst(), entry.pin, related, check.getSecond(),
                    entry.delays.getRiseOrFall());
            model.addElement(entry.sdfCell, entry.instance, e);
        }
    }
}
