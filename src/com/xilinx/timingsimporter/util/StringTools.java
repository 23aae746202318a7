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

package com.xilinx.timingsimporter.util;

/**
 * A set of String utility methods.
 */
public class StringTools {

    /**
     * Replaces bus indexing brackets so a name is usable as a plain identifier:
     * {@code FBIO[22] --> FBIO_22}, {@code clk --> clk}.
     * @param s The name
     * @return The name with '[' turned into '_' and ']' removed.
     */
    public static String removeIndexingBrackets(String s) {
        if (s.indexOf('[') == -1 && s.indexOf(']') == -1) return s;
        return s.replace("[", "_").replace("]", "");
    }
}
