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

package com.rtlprobe.instrument;

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.rtlprobe.netlist.DesignFixtures;
import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLConnection;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;

public class TestProbePortAggregator {

    private static final String PROBE_0 = "crtlreg_prbsig0WIRE0BITS0_2_INSTu_c0PORT3INSTu_bPORT3";
    private static final String PROBE_1 = "crtlreg_prbsig0WIRE1BITS1_3_INSTu_c0PORT4INSTu_bPORT4";

    @Test
    public void testProbePort() {
        RTLDesign d = DesignFixtures.createProbeHierarchy();
        new ProbePuller(false).pullProbes(d);
        List<ProbePortAggregator.ProbeCoordinate> coords = new ProbePortAggregator(false).createProbePort(d);

        Assertions.assertEquals(2, coords.size());
        Assertions.assertEquals(PROBE_0, coords.get(0).getWireName());
        Assertions.assertEquals(0, coords.get(0).getStartIndex());
        Assertions.assertEquals(2, coords.get(0).getWidth());
        Assertions.assertEquals(2, coords.get(1).getStartIndex());
        Assertions.assertEquals(2, coords.get(1).getWidth());
        Assertions.assertEquals(PROBE_1 + "[2+:2]", coords.get(1).toString());

        RTLModule top = d.getModule("A");
        RTLWire port = top.getWire(ProbePortAggregator.PORT_NAME);
        Assertions.assertEquals(4, port.getWidth());
        Assertions.assertTrue(port.isPortOutput());
        Assertions.assertTrue(port.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_PORT));
        Assertions.assertTrue(port.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_OUT));
        Assertions.assertEquals(3, port.getPortId());
        Assertions.assertEquals(3, top.getPorts().size());

        RTLWire p0 = top.getWire(PROBE_0);
        RTLWire p1 = top.getWire(PROBE_1);
        Assertions.assertFalse(p0.isPort());
        Assertions.assertTrue(p0.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_OUT));
        Assertions.assertTrue(p1.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_OUT));

        RTLConnection expected = new RTLConnection(port.asSigSpec(), new RTLSigSpec(p0).append(p1));
        Assertions.assertTrue(top.getConnections().contains(expected));
    }

    @Test
    public void testNoProbes() {
        RTLDesign d = DesignFixtures.createResetSelectorChain();
        List<ProbePortAggregator.ProbeCoordinate> coords = new ProbePortAggregator(false).createProbePort(d);
        Assertions.assertTrue(coords.isEmpty());
        Assertions.assertEquals(0, d.getModule("top").getWire(ProbePortAggregator.PORT_NAME).getWidth());
    }

    @Test
    public void testProbeNotAnOutput() {
        RTLDesign d = DesignFixtures.createResetSelectorChain();
        d.getModule("top").getWire("n1").setBoolAttribute(ProbeMarkers.REGSTATE_CELL_WIRE);
        RTLConfigurationException e = Assertions.assertThrows(RTLConfigurationException.class,
                () -> new ProbePortAggregator(false).createProbePort(d));
        Assertions.assertEquals("ERROR: Control register wire top.n1 is not an output.", e.getMessage());
    }

    @Test
    public void testNoTopModule() {
        RTLDesign d = new RTLDesign("two_tops");
        d.addModule("a");
        d.addModule("b");
        Assertions.assertThrows(RTLConfigurationException.class,
                () -> new ProbePortAggregator(false).createProbePort(d));
    }
}
