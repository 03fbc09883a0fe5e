/*
 *
 * Copyright (c) 2025, The RTLProbe Authors.
 * All rights reserved.
 *
 * This file is part of RTLProbe.
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

package com.rtlprobe.netlist;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestRTLWire {

    @Test
    public void testInputThenOutputIsRejected() {
        RTLModule m = new RTLDesign("d").addModule("m");
        RTLWire w = m.addWire("w", 2);
        w.setPortInput(true);
        RTLConfigurationException e = Assertions.assertThrows(RTLConfigurationException.class,
                () -> w.setPortOutput(true));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: "));
        Assertions.assertTrue(e.getMessage().contains("m.w"));
        Assertions.assertTrue(w.isPortInput());
        Assertions.assertFalse(w.isPortOutput());
    }

    @Test
    public void testOutputThenInputIsRejected() {
        RTLWire w = new RTLWire("w", 1);
        w.setPortOutput(true);
        Assertions.assertThrows(RTLConfigurationException.class, () -> w.setPortInput(true));
        w.setPortOutput(false);
        w.setPortInput(true);
        Assertions.assertEquals(RTLPortDirection.INPUT, w.getDirection());
    }

    @Test
    public void testNegativeWidth() {
        Assertions.assertThrows(RTLConfigurationException.class, () -> new RTLWire("w", -1));
    }

    @Test
    public void testPublicNames() {
        Assertions.assertTrue(new RTLWire("data", 1).isPublicName());
        Assertions.assertFalse(new RTLWire("$auto$opt.cc:12$3", 1).isPublicName());
    }

    @Test
    public void testIdsAreModuleLocal() {
        RTLDesign d = new RTLDesign("d");
        RTLModule m1 = d.addModule("m1");
        RTLModule m2 = d.addModule("m2");
        RTLWire a = m1.addWire("a", 1);
        RTLWire b = m1.addWire("b", 1);
        RTLWire c = m2.addWire("a", 1);
        Assertions.assertEquals(0, a.getId());
        Assertions.assertEquals(1, b.getId());
        Assertions.assertEquals(0, c.getId());
        Assertions.assertNotEquals(a, c);
        Assertions.assertEquals("m2.a", c.getFullName());
    }
}
