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

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;
import com.rtlprobe.util.MessageGenerator;

/**
 * Merges the inputs of the top module into a single input port,
 * {@value #PORT_NAME}, so a fuzzer can drive all of them at once.
 */
public class FuzzInputAggregator {

    public static final String PASS_NAME = "port_fuzz_inputs";

    public static final String PORT_NAME = "fuzz_in";

    private final boolean verbose;

    public FuzzInputAggregator(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Replaces the selected inputs of the top module by slices of a new input
     * port.  Inputs marked {@link ProbeMarkers#CELLIFT_IN} and inputs named
     * in the exclusion list stay as they are.
     * @param design The design whose top module gets the port.
     * @param excludedSignals Names of inputs to leave alone.
     * @return The new port.
     */
    public RTLWire createFuzzPort(RTLDesign design, Collection<String> excludedSignals) {
        RTLModule top = design.getTopModule();
        if (top == null) {
            throw new RTLConfigurationException("ERROR: " + PASS_NAME + " requires a top module.");
        }
        Set<String> excluded = new HashSet<>(excludedSignals);
        RTLSigSpec fuzzed = new RTLSigSpec();
        List<RTLWire> wires = top.selectedWires();
        for (RTLWire wire : wires) {
            if (excluded.contains(wire.getName())) continue;
            if (!wire.isPortInput() || wire.hasAttribute(ProbeMarkers.CELLIFT_IN)) continue;
            MessageGenerator.verboseMessage(verbose, "Adding input " + wire.getName() + " to fuzzing port");
            fuzzed.append(wire);
            wire.setPortInput(false);
        }

        RTLWire port = top.addWire(PORT_NAME, fuzzed.getWidth());
        port.setBoolAttribute(ProbeMarkers.FUZZ_WIRE);
        top.connect(fuzzed, port.asSigSpec());
        port.setPortInput(true);
        port.setBoolAttribute(ProbeMarkers.PORT);
        top.fixupPorts();
        return port;
    }
}
