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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestSDFDelay {

    @Test
    public void testIsEmpty() {
        Assertions.assertTrue(SDFDelay.EMPTY.isEmpty());
        Assertions.assertTrue(new SDFDelay(0.0, null, 0.0).isEmpty());
        Assertions.assertFalse(new SDFDelay(null, 0.1, null).isEmpty());
    }

    @Test
    public void testScale() {
        SDFDelay scaled = new SDFDelay(0.5, null, 1.5).scale(2.0);
        Assertions.assertEquals(new SDFDelay(1.0, null, 3.0), scaled);
    }

    @Test
    public void testMergeKeepsLargerValues() {
        SDFDelay a = new SDFDelay(0.5, 0.1, null);
        SDFDelay b = new SDFDelay(0.4, 0.2, 0.9);
        Assertions.assertEquals(new SDFDelay(0.5, 0.2, 0.9), a.merge(b));
        Assertions.assertEquals(a.merge(b), b.merge(a));
        Assertions.assertSame(a, a.merge(null));
    }

    @Test
    public void testElementMerge() {
        SDFModel model = new SDFModel(new SDFHeader("top"));
        model.addElement("AND2", "u1", SDFElement.createIOPath("A", "Y",
                new SDFDelay(0.5, null, null), new SDFDelay(0.7, null, null)));
        SDFElement merged = model.addElement("AND2", "u1", SDFElement.createIOPath("A", "Y",
                new SDFDelay(0.6, null, null), new SDFDelay(0.2, null, null)));

        Assertions.assertEquals(1, model.getElementCount());
        Assertions.assertSame(merged, model.getElement("AND2", "u1", "iopath_A_Y"));
        Assertions.assertEquals(new SDFDelay(0.6, null, null), merged.getDelay(SDFElement.PATH_FAST));
        Assertions.assertEquals(new SDFDelay(0.7, null, null), merged.getDelay(SDFElement.PATH_NOMINAL));
    }

    @Test
    public void testTimingCheckElement() {
        SDFElement check = SDFElement.createTimingCheck(SDFElementType.HOLD, "D", "CLK", SDFEdge.POSEDGE,
                new SDFDelay(0.03, null, null));
        Assertions.assertEquals("hold_D_CLK", check.getName());
        Assertions.assertEquals("CLK", check.getFromPort());
        Assertions.assertEquals("D", check.getToPort());
        Assertions.assertFalse(check.isAbsolute());
        Assertions.assertTrue(check.getType().isTimingCheck());
        Assertions.assertEquals("posedge", check.getEdge().getKeyword());
    }
}
