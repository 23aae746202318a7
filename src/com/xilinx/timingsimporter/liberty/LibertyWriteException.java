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
 * Thrown when a document contains a shape that has no Liberty text
 * representation. Carries the offending key/value pair.
 */
public class LibertyWriteException extends RuntimeException {

    private final String key;

    private final transient LibertyNode value;

    public LibertyWriteException(String key, LibertyNode value, String message) {
        super(message + "\nkey: " + key + "\nvalue:\n" + value);
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public LibertyNode getValue() {
        return value;
    }
}
