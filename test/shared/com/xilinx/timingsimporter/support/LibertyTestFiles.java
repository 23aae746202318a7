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

package com.xilinx.timingsimporter.support;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyParser;
import com.xilinx.timingsimporter.util.FileTools;

public class LibertyTestFiles {
    public static final Path dirPath = Paths.get("test", "resources", "liberty");

    public static final String DEMO_LIB = "demo_lib.lib";
    public static final String TABLES_LIB = "tables.lib";
    public static final String ASSP_CELL_LIB = "assp_cell.lib";
    public static final String BROKEN_LIB = "broken.lib";

    public static Path getPath(String name) {
        return dirPath.resolve(name);
    }

    public static String getString(String name) {
        return getPath(name).toString();
    }

    public static List<String> getLines(String name) {
        return FileTools.getLinesFromTextFile(getPath(name));
    }

    /**
     * Parses Liberty text given line by line.
     */
    public static LibertyGroup parse(String... lines) {
        return LibertyParser.parseLiberty(Arrays.asList(lines));
    }
}
