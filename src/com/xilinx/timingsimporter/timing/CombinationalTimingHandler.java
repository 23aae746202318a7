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

import com.xilinx.timingsimporter.sdf.SDFElement;
import com.xilinx.timingsimporter.sdf.SDFModel;
import com.xilinx.timingsimporter.util.MessageGenerator;

/**
 * Produces one IOPATH per related pin, rise delay as the fast path and fall
 * delay as the nominal path.
 */
public class CombinationalTimingHandler implements TimingEntryHandler {

    private final MessageGenerator log;

    public CombinationalTimingHandler(MessageGenerator log) {
        this.log = log;
    }

    @Override
    public void handle(TimingEntry entry, SDFModel model) {
        if ("clear".equals(entry.timingType)) {
            log.info("Skipping clear timing of " + entry);
            return;
        }
        if (entry.relatedPins.isEmpty()) {
            log.warning("No related_pin in timing of " + entry + ", skipping");
            return;
        }
        for (String related : entry.relatedPins) {
            SDFElement path = SDFElement.createIOPath(related, entry.pin, entry.delays.getRise(),
                    entry.delays.getFall());
            model.addElement(entry.sdfCell, entry.instance, path);
        }
    }
}
