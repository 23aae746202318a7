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

import java.util.Objects;

/**
 * A delay triple. Any slot may be missing (null). Instances are immutable.
 *
 * Created on: Oct 7, 2026
 */
public class SDFDelay {

    public static final SDFDelay EMPTY = new SDFDelay(null, null, null);

    private final Double avg;

    private final Double min;

    private final Double max;

    public SDFDelay(Double avg, Double min, Double max) {
        this.avg = avg;
        this.min = min;
        this.max = max;
    }

    public Double getAvg() {
        return avg;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    /**
     * A triple counts as empty when no slot carries a non-zero value.
     */
    public boolean isEmpty() {
        return isUnset(avg) && isUnset(min) && isUnset(max);
    }

    private static boolean isUnset(Double d) {
        return d == null || d == 0.0;
    }

    /**
     * Multiplies every present slot.
     * @param factor Scaling factor (a library kfactor)
     * @return The scaled triple
     */
    public SDFDelay scale(double factor) {
        return new SDFDelay(scale(avg, factor), scale(min, factor), scale(max, factor));
    }

    private static Double scale(Double d, double factor) {
        return d == null ? null : d * factor;
    }

    /**
     * Combines two triples taking the worst case of each slot. The larger value
     * wins in every slot (min included); a missing value never wins over a
     * present one.
     * @param other The triple to merge with
     * @return The merged triple
     */
    public SDFDelay merge(SDFDelay other) {
        if (other == null) return this;
        return new SDFDelay(worst(avg, other.avg), worst(min, other.min), worst(max, other.max));
    }

    private static Double worst(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return Math.max(a, b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SDFDelay)) return false;
        SDFDelay other = (SDFDelay) o;
        return Objects.equals(avg, other.avg) && Objects.equals(min, other.min) && Objects.equals(max, other.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(avg, min, max);
    }

    @Override
    public String toString() {
        return "{avg: " + avg + ", min: " + min + ", max: " + max + "}";
    }
}
