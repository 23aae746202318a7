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

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.sdf.SDFDelay;

/**
 * Rise and fall delay triples of one Liberty timing group.
 */
public class RiseFallDelay {

    private final SDFDelay rise;

    private final SDFDelay fall;

    public RiseFallDelay(SDFDelay rise, SDFDelay fall) {
        this.rise = rise;
        this.fall = fall;
    }

    /**
     * Reads {@code intrinsic_rise}, {@code intrinsic_rise_min},
     * {@code intrinsic_rise_max} and their fall counterparts. Values may be
     * numbers or numeric strings; anything else counts as missing.
     * @param timing The timing group
     * @param kfactor Multiplier applied to every value
     * @return The scaled rise and fall triples
     */
    public static RiseFallDelay fromTimingGroup(LibertyGroup timing, double kfactor) {
        SDFDelay rise = new SDFDelay(timing.getDouble("intrinsic_rise"), timing.getDouble("intrinsic_rise_min"),
                timing.getDouble("intrinsic_rise_max"));
        SDFDelay fall = new SDFDelay(timing.getDouble("intrinsic_fall"), timing.getDouble("intrinsic_fall_min"),
                timing.getDouble("intrinsic_fall_max"));
        return new RiseFallDelay(rise.scale(kfactor), fall.scale(kfactor));
    }

    public SDFDelay getRise() {
        return rise;
    }

    public SDFDelay getFall() {
        return fall;
    }

    public boolean isEmpty() {
        return rise.isEmpty() && fall.isEmpty();
    }

    /**
     * @return The rise triple unless it is empty, then the fall triple.
     */
    public SDFDelay getRiseOrFall() {
        return rise.isEmpty() ? fall : rise;
    }

    @Override
    public String toString() {
        return "{rise: " + rise + ", fall: " + fall + "}";
    }
}
