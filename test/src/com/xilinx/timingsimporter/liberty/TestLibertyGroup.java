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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.xilinx.timingsimporter.util.Pair;

public class TestLibertyGroup {

    @Test
    public void testAddCollapsesRepeatedKeys() {
        LibertyGroup g = new LibertyGroup();
        g.add("x", new LibertyScalar(1L));
        Assertions.assertTrue(g.get("x").isScalar());
        g.add("x", new LibertyScalar(2L));
        g.add("x", new LibertyScalar(3L));
        Assertions.assertTrue(g.get("x").isAttributeList());
        LibertyAttributeList list = (LibertyAttributeList) g.get("x");
        Assertions.assertEquals(3, list.size());
        Assertions.assertEquals(new LibertyScalar(3L), list.get(2));
        Assertions.assertEquals(1, g.size());

        g.put("x", new LibertyScalar("y"));
        Assertions.assertEquals("y", g.getString("x"));
    }

    @Test
    public void testGetGroups() {
        LibertyGroup cell = new LibertyGroup();
        cell.add("pin A", new LibertyGroup());
        cell.add("area", new LibertyScalar(1.5));
        cell.add("pin B", new LibertyGroup());
        cell.add("pin B", new LibertyGroup());
        cell.add("pinmap", new LibertyGroup());
        cell.add("comp_attribute pin", new LibertyScalar("z"));

        List<Pair<String, LibertyGroup>> pins = cell.getGroups("pin");
        Assertions.assertEquals(3, pins.size());
        Assertions.assertEquals("A", pins.get(0).getFirst());
        Assertions.assertEquals("B", pins.get(1).getFirst());
        Assertions.assertEquals("B", pins.get(2).getFirst());
        Assertions.assertTrue(cell.getGroups("area").isEmpty());
    }

    @Test
    public void testScalarLookup() {
        LibertyGroup g = new LibertyGroup();
        g.add("comp_attribute voltage_map", new LibertyScalar("VDD"));
        g.add("slew", new LibertyScalar("0.25"));
        g.add("size", new LibertyScalar(4L));
        g.add("size", new LibertyScalar(8L));

        Assertions.assertEquals("VDD", g.getString("voltage_map"));
        Assertions.assertEquals(0.25, g.getDouble("slew"));
        Assertions.assertEquals("8", g.getString("size"));
        Assertions.assertEquals(8.0, g.getDouble("size"));
        Assertions.assertNull(g.getDouble("voltage_map"));
        Assertions.assertNull(g.getScalar("missing"));
        Assertions.assertNull(g.getString("missing"));
    }

    @Test
    public void testDefine() {
        LibertyGroup define = LibertyGroup.createDefine("my_attr", "cell", "string");
        Assertions.assertTrue(define.isDefine());
        define.add("extra", new LibertyScalar("x"));
        Assertions.assertFalse(define.isDefine());
        Assertions.assertFalse(new LibertyGroup().isDefine());
    }

    @Test
    public void testEqualityRespectsOrder() {
        LibertyGroup a = new LibertyGroup();
        a.add("x", new LibertyScalar(1L));
        a.add("y", new LibertyScalar(2.0));
        LibertyGroup b = new LibertyGroup();
        b.add("x", new LibertyScalar(1.0));
        b.add("y", new LibertyScalar(2L));
        LibertyGroup c = new LibertyGroup();
        c.add("y", new LibertyScalar(2L));
        c.add("x", new LibertyScalar(1L));

        Assertions.assertEquals(a, b);
        Assertions.assertEquals(a.hashCode(), b.hashCode());
        Assertions.assertNotEquals(a, c);
    }

    @ParameterizedTest
    @CsvSource({
        "'cell AND2', cell, AND2",
        "'timing', timing, ''",
        "'ff IQ, IQN', ff, 'IQ, IQN'",
        "'comp_attribute voltage_map', comp_attribute, voltage_map",
    })
    public void testKeyParts(String key, String type, String parameter) {
        Assertions.assertEquals(type, LibertyNode.getKeyType(key));
        Assertions.assertEquals(parameter, LibertyNode.getKeyParameter(key));
    }
}
