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
 * In-memory SDF content: a header plus the elements of every cell instance,
 * organized as cell type, then instance name, then element name. All levels
 * keep insertion order.
 *
 * Created on: Oct 7, 2026
 */
public class SDFModel {

    private final SDFHeader header;

    private final Map<String, Map<String, Map<String, SDFElement>>> cells = new LinkedHashMap<>();

    public SDFModel(SDFHeader header) {
        this.header = header;
    }

    public SDFHeader getHeader() {
        return header;
    }

    /**
     * Adds an element to a cell instance. If the instance already holds an
     * element of the same name, the two are merged keeping the worst case
     * delays.
     * @param cell SDF cell type
     * @param instance Instance name
     * @param element The element to add
     * @return The element now stored under the element's name
     */
    public SDFElement addElement(String cell, String instance, SDFElement element) {
        Map<String, SDFElement> elements = cells.computeIfAbsent(cell, k -> new LinkedHashMap<>())
                .computeIfAbsent(instance, k -> new LinkedHashMap<>());
        SDFElement existing = elements.get(element.getName());
        if (existing == null) {
            elements.put(element.getName(), element);
            return element;
        }
        existing.merge(element);
        return existing;
    }

    public SDFElement getElement(String cell, String instance, String name) {
        Map<String, SDFElement> elements = getElements(cell, instance);
        return elements.get(name);
    }

    /**
     * @return The elements of the instance by name, empty if there are none.
     */
    public Map<String, SDFElement> getElements(String cell, String instance) {
        Map<String, Map<String, SDFElement>> instances = cells.get(cell);
        if (instances == null || !instances.containsKey(instance)) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(instances.get(instance));
    }

    public Map<String, Map<String, Map<String, SDFElement>>> getCells() {
        return Collections.unmodifiableMap(cells);
    }

    public int getElementCount() {
        int count = 0;
        for (Map<String, Map<String, SDFElement>> instances : cells.values()) {
            for (Map<String, SDFElement> elements : instances.values()) {
                count += elements.size();
            }
        }
        return count;
    }
}
