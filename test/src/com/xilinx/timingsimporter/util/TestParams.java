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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestParams {

    private static final String KEY = "TI_TEST_PARAM_SETTING";

    @AfterEach
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    public void testUnsetParamUsesDefault() {
        Assertions.assertNull(Params.getParamValue(KEY));
        Assertions.assertEquals(4, Params.getParamOrDefaultIntSetting(KEY, 4));
        Assertions.assertEquals(0.5, Params.getParamOrDefaultDoubleSetting(KEY, 0.5));
    }

    @Test
    public void testParamFromJvmProperty() {
        System.setProperty(KEY, " 8 ");
        Assertions.assertEquals(" 8 ", Params.getParamValue(KEY));
        Assertions.assertEquals(8, Params.getParamOrDefaultIntSetting(KEY, 4));
        Assertions.assertEquals(8.0, Params.getParamOrDefaultDoubleSetting(KEY, 0.5));
    }

    @Test
    public void testMalformedParamUsesDefault() {
        System.setProperty(KEY, "eight");
        Assertions.assertEquals(4, Params.getParamOrDefaultIntSetting(KEY, 4));
        Assertions.assertEquals(0.5, Params.getParamOrDefaultDoubleSetting(KEY, 0.5));
    }
}
