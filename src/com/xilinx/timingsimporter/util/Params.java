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

import com.xilinx.timingsimporter.util.MessageGenerator.Severity;

/**
 * Aims to be a centralized helper class to manage global TimingsImporter
 * settings. Each setting can be given as an environment variable or as a JVM
 * property of the same name; command line options take precedence.
 */
public class Params {

    public static String TI_LOG_SUPPRESS_BELOW_NAME = "TI_LOG_SUPPRESS_BELOW";

    public static String TI_SIMILARITY_THRESHOLD_NAME = "TI_SIMILARITY_THRESHOLD";

    public static String TI_INDENT_WIDTH_NAME = "TI_INDENT_WIDTH";

    public static Severity TI_DEFAULT_LOG_SUPPRESS_BELOW = Severity.ERROR;

    public static double TI_DEFAULT_SIMILARITY_THRESHOLD = 0.999;

    public static int TI_DEFAULT_INDENT_WIDTH = 2;

    /**
     * The minimal severity of messages that are printed, one of INFO, WARNING,
     * ERROR or ALL (which silences everything).
     */
    public static String TI_LOG_SUPPRESS_BELOW = getParamValue(TI_LOG_SUPPRESS_BELOW_NAME);

    /**
     * Similarity (0 to 1) of cleaned Liberty texts below which a round trip is
     * reported as failed.
     */
    public static double TI_SIMILARITY_THRESHOLD = getParamOrDefaultDoubleSetting(TI_SIMILARITY_THRESHOLD_NAME,
            TI_DEFAULT_SIMILARITY_THRESHOLD);

    /**
     * Number of spaces per nesting level in written Liberty files.
     */
    public static int TI_INDENT_WIDTH = getParamOrDefaultIntSetting(TI_INDENT_WIDTH_NAME, TI_DEFAULT_INDENT_WIDTH);

    /**
     * @return The configured log threshold, or {@link #TI_DEFAULT_LOG_SUPPRESS_BELOW}
     *         if none (or an unknown one) was set.
     */
    public static Severity getLogSuppressBelow() {
        if (TI_LOG_SUPPRESS_BELOW == null) {
            return TI_DEFAULT_LOG_SUPPRESS_BELOW;
        }
        try {
            return Severity.fromName(TI_LOG_SUPPRESS_BELOW);
        } catch (IllegalArgumentException e) {
            System.err.println("WARNING: Couldn't interpret the value '" + TI_LOG_SUPPRESS_BELOW
                    + "' from the parameter '" + TI_LOG_SUPPRESS_BELOW_NAME + "' as a log level.");
            return TI_DEFAULT_LOG_SUPPRESS_BELOW;
        }
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the system parameter to get.
     * @return The set string value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }

    /**
     * Checks the parameter value of the provided key. If it is set to a parsable
     * integer, it returns the set value. Otherwise it will return the default value.
     *
     * @param key          Name of the system parameter to check.
     * @param defaultValue The default value to return if the parameter is not set.
     * @return The system parameter value if is set, otherwise defaultValue.
     */
    public static int getParamOrDefaultIntSetting(String key, int defaultValue) {
        String value = getParamValue(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("WARNING: Couldn't interpret the value '" + value
                        + "' from the parameter '" + key + "' as an integer.");
            }
        }
        return defaultValue;
    }

    /**
     * Same as {@link #getParamOrDefaultIntSetting(String, int)} for floating point values.
     */
    public static double getParamOrDefaultDoubleSetting(String key, double defaultValue) {
        String value = getParamValue(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("WARNING: Couldn't interpret the value '" + value
                        + "' from the parameter '" + key + "' as a number.");
            }
        }
        return defaultValue;
    }
}
