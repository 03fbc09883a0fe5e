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

import java.util.ArrayList;
import java.util.List;

import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;
import com.rtlprobe.util.MessageGenerator;

/**
 * Merges the register probe outputs of the top module into a single output
 * port, {@value #PORT_NAME}.
 */
public class ProbePortAggregator {

    public static final String PASS_NAME = "port_control_registers_probes";

    public static final String PORT_NAME = "auto_cover_out";

    /** Position of one probe inside the merged port */
    public static class ProbeCoordinate {
        private final String wireName;
        private final int startIndex;
        private final int width;

        public ProbeCoordinate(String wireName, int startIndex, int width) {
            this.wireName = wireName;
            this.startIndex = startIndex;
            this.width = width;
        }

        public String getWireName() {
            return wireName;
        }

        public int getStartIndex() {
            return startIndex;
        }

        public int getWidth() {
            return width;
        }

        @Override
        public String toString() {
            return wireName + "[" + startIndex + "+:" + width + "]";
        }
    }

    private final boolean verbose;

    public ProbePortAggregator(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Concatenates every selected probe wire of the top module, first wire
     * in the least significant bits, into a new output port.  The probe
     * wires stop being outputs.
     * @param design The design whose top module gets the port.
     * @return Where each probe lands in the new port.
     * @throws RTLConfigurationException if there is no top module or a probe
     * wire is not an output.
     */
    public List<ProbeCoordinate> createProbePort(RTLDesign design) {
        RTLModule top = design.getTopModule();
        if (top == null) {
            throw new RTLConfigurationException("ERROR: " + PASS_NAME + " requires a top module.");
        }
        List<ProbeCoordinate> coordinates = new ArrayList<>();
        RTLSigSpec probes = new RTLSigSpec();
        int nextIndex = 0;
        for (RTLWire wire : top.selectedWires()) {
            if (!wire.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_WIRE)) continue;
            if (!wire.isPortOutput()) {
                throw new RTLConfigurationException("ERROR: Control register wire " + wire.getFullName()
                        + " is not an output.");
            }
            MessageGenerator.verboseMessage(verbose, "Adding control register signal " + wire.getName() + " to port");
            coordinates.add(new ProbeCoordinate(wire.getName(), nextIndex, wire.getWidth()));
            nextIndex += wire.getWidth();
            probes.append(wire);
            wire.setPortOutput(false);
            wire.setBoolAttribute(ProbeMarkers.REGSTATE_CELL_OUT);
        }

        RTLWire port = top.addWire(PORT_NAME, probes.getWidth());
        port.setBoolAttribute(ProbeMarkers.REGSTATE_CELL_OUT);
        top.connect(port.asSigSpec(), probes);
        port.setPortOutput(true);
        port.setBoolAttribute(ProbeMarkers.REGSTATE_CELL_PORT);
        top.fixupPorts();

        MessageGenerator.briefMessage("Start logging control register coordinates");
        for (int i = 0; i < coordinates.size(); i++) {
            ProbeCoordinate c = coordinates.get(i);
            MessageGenerator.briefMessage("Control register " + i + " starts at " + c.getStartIndex()
                    + " and has width " + c.getWidth());
        }
        MessageGenerator.briefMessage("End of logging control register coordinates");
        return coordinates;
    }
}
