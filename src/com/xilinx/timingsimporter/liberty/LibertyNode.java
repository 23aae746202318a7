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
 * Base class of the Liberty document tree. A document is a tree of
 * {@link LibertyGroup}s whose children are other groups, scalars, numeric
 * arrays or lists of values collected from repeated keys.
 *
 * Created on: Oct 2, 2026
 */
public abstract class LibertyNode {

    /** Key prefix marking a bare attribute call statement, i.e. {@code name (value);} */
    public static final String COMPLEX_ATTRIBUTE_PREFIX = "comp_attribute ";

    /** Key of the special {@code define (attribute, group, type);} statement */
    public static final String DEFINE_KEY = "define";

    public abstract LibertyNodeType getType();

    public boolean isScalar() {
        return getType() == LibertyNodeType.SCALAR;
    }

    public boolean isGroup() {
        return getType() == LibertyNodeType.GROUP;
    }

    public boolean isArray() {
        return getType() == LibertyNodeType.ARRAY || getType() == LibertyNodeType.ARRAY_2D;
    }

    public boolean isAttributeList() {
        return getType() == LibertyNodeType.ATTRIBUTE_LIST;
    }

    /**
     * Checks if the provided key denotes a complex (bare call) attribute.
     * @param key Child key inside a group
     * @return True if the key starts with {@link #COMPLEX_ATTRIBUTE_PREFIX}.
     */
    public static boolean isComplexAttributeKey(String key) {
        return key.startsWith(COMPLEX_ATTRIBUTE_PREFIX);
    }

    /**
     * Gets the group type portion of a {@code "type name"} key.
     * @param key The child key
     * @return Everything before the first space, or the whole key if it has none.
     */
    public static String getKeyType(String key) {
        int idx = key.indexOf(' ');
        return idx == -1 ? key : key.substring(0, idx);
    }

    /**
     * Gets the parameter portion of a {@code "type name"} key.
     * @param key The child key
     * @return Everything after the first space, or an empty string if the key has none.
     */
    public static String getKeyParameter(String key) {
        int idx = key.indexOf(' ');
        return idx == -1 ? "" : key.substring(idx + 1);
    }
}
