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

package com.xilinx.timingsimporter.sdf;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One IOPATH or timing check entry of an SDF cell instance.
 *
 * Created on: Oct 7, 2026
 */
public class SDFElement {

    /** Path class of the rise delay of an IOPATH */
    public static final String PATH_FAST = "fast";
    /** Path class of the fall delay of an IOPATH and of timing check values */
    public static final String PATH_NOMINAL = "nominal";

    private final SDFElementType type;

    private final String name;

    /** Related (IOPATH) or reference (timing check) port */
    private final String fromPort;

    /** Target port */
    private final String toPort;

    /** Edge of the reference port, null for IOPATHs */
    private final SDFEdge edge;

    private final boolean isAbsolute;

    private final Map<String, SDFDelay> delayPaths = new LinkedHashMap<>();

    public SDFElement(SDFElementType type, String name, String fromPort, String toPort, SDFEdge edge,
                      boolean isAbsolute) {
        this.type = type;
        this.name = name;
        this.fromPort = fromPort;
        this.toPort = toPort;
        this.edge = edge;
        this.isAbsolute = isAbsolute;
    }

    /**
     * Creates an absolute IOPATH named {@code iopath_<from>_<to>}.
     * @param from Related input port
     * @param to Output port
     * @param rise Rise delay, stored under {@link #PATH_FAST}
     * @param fall Fall delay, stored under {@link #PATH_NOMINAL}
     */
    public static SDFElement createIOPath(String from, String to, SDFDelay rise, SDFDelay fall) {
        SDFElement e = new SDFElement(SDFElementType.IOPATH, "iopath_" + from + "_" + to, from, to, null, true);
        e.putDelay(PATH_FAST, rise);
        e.putDelay(PATH_NOMINAL, fall);
        return e;
    }

    /**
     * Creates a timing check named {@code <check>_<port>_<refport>}.
     * @param type The check kind
     * @param port Checked (data) port
     * @param refPort Reference (clock) port
     * @param edge Active edge of the reference port
     * @param delay Check value, stored under {@link #PATH_NOMINAL}
     */
    public static SDFElement createTimingCheck(SDFElementType type, String port, String refPort, SDFEdge edge,
                                               SDFDelay delay) {
        String name = type.getLowerCaseName() + "_" + port + "_" + refPort;
        SDFElement e = new SDFElement(type, name, refPort, port, edge, false);
        e.putDelay(PATH_NOMINAL, delay);
        return e;
    }

    public SDFElementType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getFromPort() {
        return fromPort;
    }

    public String getToPort() {
        return toPort;
    }

    public SDFEdge getEdge() {
        return edge;
    }

    public boolean isAbsolute() {
        return isAbsolute;
    }

    public void putDelay(String pathClass, SDFDelay delay) {
        delayPaths.put(pathClass, delay);
    }

    public SDFDelay getDelay(String pathClass) {
        return delayPaths.get(pathClass);
    }

    public Map<String, SDFDelay> getDelayPaths() {
        return Collections.unmodifiableMap(delayPaths);
    }

    /**
     * Merges the delays of another element with the same name into this one,
     * path class by path class, keeping the worst case.
     * @param other Element colliding with this one
     */
    public void merge(SDFElement other) {
        for (Map.Entry<String, SDFDelay> e : other.delayPaths.entrySet()) {
            SDFDelay existing = delayPaths.get(e.getKey());
            delayPaths.put(e.getKey(), existing == null ? e.getValue() : existing.merge(e.getValue()));
        }
    }

    @Override
    public String toString() {
        return type + " " + name + " " + delayPaths;
    }
}
