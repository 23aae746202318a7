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
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Direction of the pin owning a timing group together with whether the group
 * describes sequential behavior. Selects how the group is turned into SDF.
 */
public class TimingClassification {

    /** Timing types that describe combinational (non-clocked) arcs */
    public static final Set<String> COMBINATIONAL_TIMING_TYPES = Collections.unmodifiableSet(new HashSet<>(
            Arrays.asList("combinational", "three_state_disable", "three_state_enable", "rising_edge",
                    "falling_edge", "clear")));

    private final PinDirection direction;

    private final boolean isSequential;

    public TimingClassification(PinDirection direction, boolean isSequential) {
        this.direction = direction;
        this.isSequential = isSequential;
    }

    /**
     * @param direction Direction of the owning pin
     * @param timingType Value of the {@code timing_type} attribute, null if absent
     */
    public static TimingClassification classify(PinDirection direction, String timingType) {
        boolean sequential = timingType != null && !COMBINATIONAL_TIMING_TYPES.contains(timingType);
        return new TimingClassification(direction, sequential);
    }

    public PinDirection getDirection() {
        return direction;
    }

    public boolean isSequential() {
        return isSequential;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimingClassification)) return false;
        TimingClassification other = (TimingClassification) o;
        return direction == other.direction && isSequential == other.isSequential;
    }

    @Override
    public int hashCode() {
        return Objects.hash(direction, isSequential);
    }

    @Override
    public String toString() {
        return direction + (isSequential ? " sequential" : " combinational");
    }
}
