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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.xilinx.timingsimporter.liberty.LibertyGroup;
import com.xilinx.timingsimporter.liberty.LibertyParser;
import com.xilinx.timingsimporter.util.FileTools;

/**
 * A parsed timing file together with the header line that preceded it.
 */
public class LibertyTimingSource {

    /** Start of a line that is Liberty text: a comment, a brace, or a statement or group opening */
    private static final Pattern LIBERTY_TEXT = Pattern.compile(
            "^\\s*(?:/\\*|//|#|\\*|[{}]|[A-Za-z_][\\w.\\[\\]]*\\s*[(:{])");

    private final String header;

    private final LibertyGroup document;

    /**
     * @param header Header text, null if the file had none
     * @param document Document root as returned by the parser
     */
    public LibertyTimingSource(String header, LibertyGroup document) {
        this.header = header;
        this.document = document;
    }

    /**
     * Parses the lines of a timing file. The first non-blank line is taken as
     * the header, and not parsed as Liberty text, if it follows the
     * {@link LibertyHeader} grammar or does not read as Liberty text at all,
     * e.g. {@code eos3 timings}.
     * @param lines Lines of the file
     * @return The parsed source, with a null header if there was none.
     */
    public static LibertyTimingSource fromLines(List<String> lines) {
        List<String> body = new ArrayList<>(lines);
        String header = splitHeader(body);
        return new LibertyTimingSource(header, LibertyParser.parseLiberty(body));
    }

    public static LibertyTimingSource read(Path libFile) {
        return fromLines(FileTools.getLinesFromTextFile(libFile));
    }

    /**
     * Removes the header line from the lines, if present.
     * @param lines Lines of a timing file, modified in place
     * @return The header or null if the file has none.
     */
    public static String splitHeader(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.trim().isEmpty()) continue;
            if (isHeader(line)) {
                lines.remove(i);
                return line.trim();
            }
            return null;
        }
        return null;
    }

    /**
     * @return True if the line is a header: it follows the header grammar or
     * does not start like Liberty text.
     */
    public static boolean isHeader(String line) {
        if (LibertyHeader.matches(line)) {
            return true;
        }
        return !line.trim().isEmpty() && !LIBERTY_TEXT.matcher(line).find();
    }

    public String getHeader() {
        return header;
    }

    public LibertyGroup getDocument() {
        return document;
    }
}
