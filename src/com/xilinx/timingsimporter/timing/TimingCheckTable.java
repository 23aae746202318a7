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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.xilinx.timingsimporter.sdf.SDFEdge;
import com.xilinx.timingsimporter.sdf.SDFElementType;
import com.xilinx.timingsimporter.util.Pair;

/**
 * Maps sequential Liberty timing types to SDF timing checks.
 */
public class TimingCheckTable {

    private static final Map<String, Pair<SDFElementType, SDFEdge>> checks = new HashMap<>();

    /** Sequential timing types with no SDF timing check counterpart */
    public static final Set<String> IGNORED_TIMING_TYPES = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("min_pulse_width", "minimum_period", "skew_rising", "skew_falling", "preset",
                    "non_seq_setup_rising", "non_seq_setup_falling", "non_seq_hold_rising",
                    "non_seq_hold_falling", "nochange_high_high", "nochange_high_low", "nochange_low_high",
                    "nochange_low_low", "max_clock_tree_path", "min_clock_tree_path")));

    static {
        for (SDFElementType type : new SDFElementType[] {SDFElementType.SETUP, SDFElementType.HOLD,
                SDFElementType.REMOVAL, SDFElementType.RECOVERY}) {
            checks.put(type.getLowerCaseName() + "_rising", new Pair<>(type, SDFEdge.POSEDGE));
            checks.put(type.getLowerCaseName() + "_falling", new Pair<>(type, SDFEdge.NEGEDGE));
        }
    }

    /**
     * @param timingType A sequential timing type such as "setup_rising"
     * @return The check kind and reference edge or null if the type has no check.
     */
    public static Pair<SDFElementType, SDFEdge> getCheck(String timingType) {
        return checks.get(timingType);
    }

    public static boolean isIgnored(String timingType) {
        return IGNORED_TIMING_TYPES.contains(timingType);
    }
}
