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

package com.xilinx.timingsimporter.liberty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A numeric array attribute, either flat ({@code index_1 ("0.1, 0.2");}) or
 * two-dimensional ({@code values ("1, 2", "3, 4");}). The number of
 * dimensions is fixed at construction and survives a writer round trip.
 */
public class LibertyArray extends LibertyNode {

    private final List<List<Number>> rows;

    private final boolean twoDimensional;

    private LibertyArray(List<List<Number>> rows, boolean twoDimensional) {
        this.rows = rows;
        this.twoDimensional = twoDimensional;
    }

    /**
     * Creates a flat array.
     * @param values The numbers in source order
     * @return The new array
     */
    public static LibertyArray of(List<? extends Number> values) {
        List<List<Number>> rows = new ArrayList<>(1);
        rows.add(normalize(values));
        return new LibertyArray(rows, false);
    }

    /**
     * Creates a two-dimensional array.
     * @param rows The rows in source order
     * @return The new array
     */
    public static LibertyArray ofRows(List<? extends List<? extends Number>> rows) {
        List<List<Number>> copy = new ArrayList<>(rows.size());
        for (List<? extends Number> row : rows) {
            copy.add(normalize(row));
        }
        return new LibertyArray(copy, true);
    }

    private static List<Number> normalize(List<? extends Number> values) {
        List<Number> out = new ArrayList<>(values.size());
        for (Number n : values) {
            out.add(new LibertyScalar(n).getNumber());
        }
        return out;
    }

    @Override
    public LibertyNodeType getType() {
        return twoDimensional ? LibertyNodeType.ARRAY_2D : LibertyNodeType.ARRAY;
    }

    public boolean isTwoDimensional() {
        return twoDimensional;
    }

    /**
     * @return The values of a flat array.
     * @throws IllegalStateException if the array is two-dimensional.
     */
    public List<Number> getValues() {
        if (twoDimensional) {
            throw new IllegalStateException("ERROR: Array is two-dimensional, use getRows()");
        }
        return Collections.unmodifiableList(rows.get(0));
    }

    /**
     * @return The rows of this array; a flat array has exactly one row.
     */
    public List<List<Number>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LibertyArray)) return false;
        LibertyArray other = (LibertyArray) o;
        if (twoDimensional != other.twoDimensional || rows.size() != other.rows.size()) {
            return false;
        }
        for (int i = 0; i < rows.size(); i++) {
            List<Number> a = rows.get(i);
            List<Number> b = other.rows.get(i);
            if (a.size() != b.size()) return false;
            for (int j = 0; j < a.size(); j++) {
                if (Double.compare(a.get(j).doubleValue(), b.get(j).doubleValue()) != 0) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = twoDimensional ? 1 : 0;
        for (List<Number> row : rows) {
            for (Number n : row) {
                h = 31 * h + Double.hashCode(n.doubleValue());
            }
            h = 31 * h + row.size();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (twoDimensional) sb.append('[');
        boolean firstRow = true;
        for (List<Number> row : rows) {
            if (!firstRow) sb.append(", ");
            firstRow = false;
            sb.append('[');
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(LibertyWriter.formatNumber(row.get(i)));
            }
            sb.append(']');
        }
        if (twoDimensional) sb.append(']');
        return sb.toString();
    }
}
