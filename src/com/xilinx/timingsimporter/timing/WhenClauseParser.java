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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.xilinx.timingsimporter.sdf.SDFMappingException;
import com.xilinx.timingsimporter.util.Pair;

/**
 * Reads the {@code when} condition of a timing group. Only conjunctions of
 * single bit comparisons are understood, e.g. {@code A == 1'b1 && B == 1'b0}.
 */
public class WhenClauseParser {

    private static final Pattern CLAUSE = Pattern.compile("(\\w+(?:\\[\\d+\\])?)\\s*==\\s*1'b([01])");

    /**
     * @param when The condition text
     * @return (signal, bit) pairs in order of appearance; empty for a blank condition.
     * @throws SDFMappingException if a non-blank condition holds no comparison.
     */
    public static List<Pair<String, String>> parse(String when) {
        List<Pair<String, String>> clauses = new ArrayList<>();
        if (when == null || when.trim().isEmpty()) {
            return clauses;
        }
        Matcher m = CLAUSE.matcher(when);
        while (m.find()) {
            clauses.add(new Pair<>(m.group(1), m.group(2)));
        }
        if (clauses.isEmpty()) {
            throw new SDFMappingException("ERROR: Cannot parse when condition '" + when + "'");
        }
        return clauses;
    }

    /**
     * Builds the cell name suffix for a condition: {@code _<SIG>_EQ_<bit>} for
     * every comparison.
     * @param when The condition text, may be null
     * @return The suffix, empty for a blank condition.
     */
    public static String getCellSuffix(String when) {
        StringBuilder sb = new StringBuilder();
        for (Pair<String, String> clause : parse(when)) {
            sb.append('_').append(clause.getFirst()).append("_EQ_").append(clause.getSecond());
        }
        return sb.toString();
    }
}
