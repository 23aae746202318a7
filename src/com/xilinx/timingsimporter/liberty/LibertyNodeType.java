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
 * Tags the kind of value held by a {@link LibertyNode}.
 */
public enum LibertyNodeType {
    /** A string or numeric leaf */
    SCALAR,
    /** A flat list of numbers */
    ARRAY,
    /** A list of rows of numbers, i.e. lookup table values */
    ARRAY_2D,
    /** A named group with ordered children */
    GROUP,
    /** Several values that shared one key inside a group */
    ATTRIBUTE_LIST;
}
