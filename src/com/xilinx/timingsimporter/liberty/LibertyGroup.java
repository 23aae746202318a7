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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.xilinx.timingsimporter.util.Pair;

/**
 * A Liberty group such as {@code library}, {@code cell}, {@code pin} or
 * {@code timing}. Children are stored in source order under their keys. A
 * child group's type and parameter are encoded in its key as
 * {@code "type parameter"}, e.g. {@code "pin QAI"}, or just {@code "timing"}
 * when the parameter is empty.
 *
 * Created on: Oct 2, 2026
 */
public class LibertyGroup extends LibertyNode {

    public static final String DEFINE_ATTRIBUTE_NAME = "attribute_name";
    public static final String DEFINE_GROUP_NAME = "group_name";
    public static final String DEFINE_ATTRIBUTE_TYPE = "attribute_type";

    private final Map<String, LibertyNode> children = new LinkedHashMap<>();

    public LibertyGroup() {
    }

    /**
     * Creates the group representing a {@code define (attribute, group, type);}
     * statement.
     */
    public static LibertyGroup createDefine(String attributeName, String groupName, String attributeType) {
        LibertyGroup define = new LibertyGroup();
        define.add(DEFINE_ATTRIBUTE_NAME, new LibertyScalar(attributeName));
        define.add(DEFINE_GROUP_NAME, new LibertyScalar(groupName));
        define.add(DEFINE_ATTRIBUTE_TYPE, new LibertyScalar(attributeType));
        return define;
    }

    @Override
    public LibertyNodeType getType() {
        return LibertyNodeType.GROUP;
    }

    /**
     * Adds a child. If the key is already present, the existing and the new
     * value are collapsed into a {@link LibertyAttributeList} (or the new value
     * is appended to the list already present). Arrival order is preserved.
     * @param key The child key
     * @param value The child value
     */
    public void add(String key, LibertyNode value) {
        LibertyNode existing = children.get(key);
        if (existing == null) {
            children.put(key, value);
        } else if (existing.isAttributeList()) {
            ((LibertyAttributeList) existing).add(value);
        } else {
            LibertyAttributeList list = new LibertyAttributeList();
            list.add(existing);
            list.add(value);
            children.put(key, list);
        }
    }

    /**
     * Sets a child, replacing any existing value of the key.
     */
    public void put(String key, LibertyNode value) {
        children.put(key, value);
    }

    public LibertyNode get(String key) {
        return children.get(key);
    }

    public boolean containsKey(String key) {
        return children.containsKey(key);
    }

    public Set<String> getKeys() {
        return Collections.unmodifiableSet(children.keySet());
    }

    public Map<String, LibertyNode> getChildren() {
        return Collections.unmodifiableMap(children);
    }

    public int size() {
        return children.size();
    }

    /**
     * Checks whether this group holds exactly the three fields of a
     * {@code define} statement.
     */
    public boolean isDefine() {
        if (children.size() != 3) return false;
        for (String field : new String[] {DEFINE_ATTRIBUTE_NAME, DEFINE_GROUP_NAME, DEFINE_ATTRIBUTE_TYPE}) {
            LibertyNode n = children.get(field);
            if (n == null || !n.isScalar()) return false;
        }
        return true;
    }

    /**
     * Gets all child groups of the given type, flattening repeated keys. A child
     * matches if its key is exactly the type (empty parameter) or starts with the
     * type followed by a space.
     * @param type Group type such as "cell", "pin" or "timing"
     * @return Pairs of (parameter, group) in source order.
     */
    public List<Pair<String, LibertyGroup>> getGroups(String type) {
        List<Pair<String, LibertyGroup>> groups = new ArrayList<>();
        for (Map.Entry<String, LibertyNode> e : children.entrySet()) {
            String key = e.getKey();
            if (!getKeyType(key).equals(type) || isComplexAttributeKey(key)) continue;
            String parameter = getKeyParameter(key);
            LibertyNode value = e.getValue();
            if (value.isGroup()) {
                groups.add(new Pair<>(parameter, (LibertyGroup) value));
            } else if (value.isAttributeList()) {
                for (LibertyNode n : (LibertyAttributeList) value) {
                    if (n.isGroup()) {
                        groups.add(new Pair<>(parameter, (LibertyGroup) n));
                    }
                }
            }
        }
        return groups;
    }

    /**
     * Looks up a simple attribute by name. Bare attribute calls stored under
     * {@code "comp_attribute name"} are found as well. If the attribute was
     * repeated, the last value wins.
     * @param name Attribute name
     * @return The scalar value or null if there is none.
     */
    public LibertyScalar getScalar(String name) {
        LibertyNode n = children.get(name);
        if (n == null) {
            n = children.get(COMPLEX_ATTRIBUTE_PREFIX + name);
        }
        if (n != null && n.isAttributeList()) {
            LibertyAttributeList list = (LibertyAttributeList) n;
            n = list.get(list.size() - 1);
        }
        return n != null && n.isScalar() ? (LibertyScalar) n : null;
    }

    /**
     * @param name Attribute name
     * @return The attribute's value as text (numbers formatted as in the writer) or null if absent.
     */
    public String getString(String name) {
        LibertyScalar s = getScalar(name);
        if (s == null) return null;
        return s.isString() ? s.getString() : LibertyWriter.formatNumber(s.getNumber());
    }

    /**
     * @param name Attribute name
     * @return The attribute's numeric value or null if it is absent or not numeric.
     */
    public Double getDouble(String name) {
        LibertyScalar s = getScalar(name);
        return s == null ? null : s.getDoubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LibertyGroup)) return false;
        // LinkedHashMap equality ignores order, compare key order explicitly
        LibertyGroup other = (LibertyGroup) o;
        return children.equals(other.children)
                && new ArrayList<>(children.keySet()).equals(new ArrayList<>(other.children.keySet()));
    }

    @Override
    public int hashCode() {
        return children.hashCode();
    }

    @Override
    public String toString() {
        return children.toString();
    }
}
