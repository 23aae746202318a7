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

/**
 * Thrown when Liberty text (or its JSON interchange form) cannot be turned into
 * a document tree.
 */
public class LibertyParseException extends RuntimeException {

    private final int lineNumber;

    private final String line;

    public LibertyParseException(String message) {
        super(message);
        this.lineNumber = -1;
        this.line = null;
    }

    public LibertyParseException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.line = null;
    }

    /**
     * @param lineNumber 1-based line number inside the normalized text
     * @param line Text of the offending normalized line
     * @param reason What went wrong
     * @param cause The underlying lexer error, may be null
     */
    public LibertyParseException(int lineNumber, String line, String reason, Throwable cause) {
        super("ERROR: " + reason + " on normalized line " + lineNumber + ": " + line.trim(), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public static LibertyParseException multipleRootObjects(int count) {
        return new LibertyParseException("ERROR: Expected exactly one root object but found " + count
                + " (multiple root objects)");
    }

    /**
     * @return The 1-based normalized line number of the failure or -1 if unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return The offending normalized line or null if unknown.
     */
    public String getLine() {
        return line;
    }
}
