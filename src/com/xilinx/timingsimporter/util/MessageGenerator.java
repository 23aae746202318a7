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

import java.io.PrintStream;

/**
 * Common class for generating messages. Every message carries a
 * {@link Severity}; messages below the threshold chosen at construction are
 * dropped. The threshold cannot change afterwards, so one instance can be
 * shared by all stages of a run.
 */
public class MessageGenerator {

    /**
     * Message severities in increasing order. {@link #ALL} is only meaningful as
     * a threshold, where it suppresses every message.
     */
    public enum Severity {
        INFO,
        WARNING,
        ERROR,
        ALL;

        /**
         * Parses a severity name, ignoring case.
         * @param name One of INFO, WARNING, ERROR, ALL
         * @return The matching severity
         */
        public static Severity fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("ERROR: Unknown log level '" + name
                        + "', expected one of INFO, WARNING, ERROR, ALL", e);
            }
        }
    }

    /** Prints nothing, used where a caller does not care about messages */
    public static final MessageGenerator SILENT = new MessageGenerator(Severity.ALL);

    private final Severity suppressBelow;

    private final PrintStream out;

    public MessageGenerator(Severity suppressBelow) {
        this(suppressBelow, System.out);
    }

    public MessageGenerator(Severity suppressBelow, PrintStream out) {
        this.suppressBelow = suppressBelow;
        this.out = out;
    }

    /**
     * Creates a generator using the threshold configured through
     * {@link Params#TI_LOG_SUPPRESS_BELOW}.
     */
    public static MessageGenerator fromParams() {
        return new MessageGenerator(Params.getLogSuppressBelow());
    }

    public Severity getSuppressBelow() {
        return suppressBelow;
    }

    /**
     * Checks if messages of the given severity are printed.
     * @param severity Message severity
     * @return True if the message passes the threshold.
     */
    public boolean isEnabled(Severity severity) {
        return severity != Severity.ALL && severity.ordinal() >= suppressBelow.ordinal();
    }

    /**
     * Prints a message as {@code SEVERITY: message} if it passes the threshold.
     * @param severity Message severity
     * @param msg The message
     */
    public void log(Severity severity, String msg) {
        if (isEnabled(severity)) {
            out.println(severity + ": " + msg);
        }
    }

    public void info(String msg) {
        log(Severity.INFO, msg);
    }

    public void warning(String msg) {
        log(Severity.WARNING, msg);
    }

    public void error(String msg) {
        log(Severity.ERROR, msg);
    }

    /**
     * Used as a general way to create an error message and send it to
     * std.err.
     * @param msg The message to print to standard error
     */
    public static void briefError(String msg) {
        System.err.println(msg);
    }

    /**
     * Prints a generic header to standard out to separate operations.
     * @param s Header text
     */
    public static void printHeader(String s) {
        String bar = "==============================================================================";
        double whiteSpace = (72 - s.length())/2.0;
        String left = makeWhiteSpace((int)(whiteSpace));
        String right = makeWhiteSpace((int)(whiteSpace+0.5));
        System.out.println(bar);
        System.out.println("== "+ left + s + right +" ==");
        System.out.println(bar);
    }

    /**
     * Creates a whitespace string with length number of spaces.
     * @param length Number of spaces in the string.
     * @return The newly created whitespace string.
     */
    public static String makeWhiteSpace(int length) {
        if (length < 1)
            return "";
        StringBuilder sb = new StringBuilder(length);
        for (int i=0; i<length; i++) {
            sb.append(" ");
        }
        return sb.toString();
    }
}
