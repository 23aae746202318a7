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

import java.util.Objects;

/**
 * A string or numeric leaf of a Liberty document. Whether a value is a string
 * or a number follows the quoting of the source: {@code 0.5} is a number while
 * {@code "0.5"} stays a string.
 */
public class LibertyScalar extends LibertyNode {

    private final Object value;

    public LibertyScalar(String value) {
        this.value = Objects.requireNonNull(value);
    }

    public LibertyScalar(long value) {
        this.value = value;
    }

    public LibertyScalar(double value) {
        this.value = value;
    }

    /**
     * Creates a numeric scalar, keeping integral values as {@link Long} and all
     * others as {@link Double}.
     * @param value The number
     */
    public LibertyScalar(Number value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            this.value = value.longValue();
        } else {
            this.value = value.doubleValue();
        }
    }

    @Override
    public LibertyNodeType getType() {
        return LibertyNodeType.SCALAR;
    }

    public Object getValue() {
        return value;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public Number getNumber() {
        return (Number) value;
    }

    public String getString() {
        return (String) value;
    }

    /**
     * Interprets this scalar as a number. Numeric strings such as {@code "0.5"}
     * are converted.
     * @return The value as a double or null if the value does not represent a number.
     */
    public Double getDoubleValue() {
        if (isNumber()) {
            return getNumber().doubleValue();
        }
        try {
            return Double.parseDouble(getString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LibertyScalar)) return false;
        LibertyScalar other = (LibertyScalar) o;
        if (isNumber() && other.isNumber()) {
            return Double.compare(getNumber().doubleValue(), other.getNumber().doubleValue()) == 0;
        }
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        if (isNumber()) {
            return Double.hashCode(getNumber().doubleValue());
        }
        return value.hashCode();
    }

    @Override
    public String toString() {
        return isString() ? "\"" + value + "\"" : LibertyWriter.formatNumber(getNumber());
    }
}
