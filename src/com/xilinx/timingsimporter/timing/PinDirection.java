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

/**
 * Direction of a Liberty pin.
 */
public enum PinDirection {
    INPUT,
    OUTPUT,
    INOUT;

    /**
     * Reads a Liberty {@code direction} value, ignoring case.
     * @param name The attribute value, may be null
     * @return The direction or null if the value is missing or not a known direction.
     */
    public static PinDirection fromName(String name) {
        if (name == null) return null;
        for (PinDirection d : values()) {
            if (d.name().equalsIgnoreCase(name.trim())) {
                return d;
            }
        }
        return null;
    }
}
