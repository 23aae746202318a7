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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Values that shared a single key inside one group, in arrival order. Created
 * only by {@link LibertyGroup#add(String, LibertyNode)} when a key repeats, so
 * a list always has at least two elements when built from text.
 */
public class LibertyAttributeList extends LibertyNode implements Iterable<LibertyNode> {

    private final List<LibertyNode> values;

    public LibertyAttributeList() {
        values = new ArrayList<>();
    }

    public LibertyAttributeList(List<LibertyNode> values) {
        this.values = new ArrayList<>(values);
    }

    @Override
    public LibertyNodeType getType() {
        return LibertyNodeType.ATTRIBUTE_LIST;
    }

    public void add(LibertyNode value) {
        values.add(value);
    }

    public LibertyNode get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    public List<LibertyNode> getValues() {
        return Collections.unmodifiableList(values);
    }

    @Override
    public Iterator<LibertyNode> iterator() {
        return getValues().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LibertyAttributeList)) return false;
        return values.equals(((LibertyAttributeList) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
