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

package com.rtlprobe.trace;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;

public class TestSearchNode {

    @Test
    public void testSameWiresAreEqual() {
        RTLDesign d = new RTLDesign("d");
        RTLModule m = d.addModule("m");
        RTLWire a = m.addWire("a", 4);
        RTLWire b = m.addWire("b", 1);

        SearchNode whole = new SearchNode(m, new RTLSigSpec(a));
        SearchNode slice = new SearchNode(m, new RTLSigSpec(a, 1, 2));
        Assertions.assertEquals(whole, slice);
        Assertions.assertEquals(whole.hashCode(), slice.hashCode());

        SearchNode both = new SearchNode(m, new RTLSigSpec(a).append(b));
        Assertions.assertNotEquals(whole, both);
        Assertions.assertEquals(2, both.getWires().size());
    }

    @Test
    public void testModuleMatters() {
        RTLDesign d = new RTLDesign("d");
        RTLModule m1 = d.addModule("m1");
        RTLModule m2 = d.addModule("m2");
        SearchNode n1 = new SearchNode(m1, RTLSigSpec.constant("0"));
        SearchNode n2 = new SearchNode(m2, RTLSigSpec.constant("0"));
        Assertions.assertNotEquals(n1, n2);
        Assertions.assertTrue(n1.getWires().isEmpty());
    }
}
