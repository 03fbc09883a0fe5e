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
import java.util.Comparator;
import java.util.List;

import com.rtlprobe.hierarchy.ModuleDependencyGraph;
import com.rtlprobe.netlist.RTLCell;
import com.rtlprobe.netlist.RTLCellTypes;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLTools;
import com.rtlprobe.netlist.RTLWire;
import com.rtlprobe.util.MessageGenerator;

/**
 * Makes the state of marked registers observable at the top of a design.
 *
 * Every register cell carrying the {@link ProbeMarkers#REGSTATE_CELL}
 * attribute gets one new output wire per wire chunk of its Q port.  Modules
 * instantiating a module with such probe outputs get matching outputs of
 * their own, bound to the probe ports of the instance, so every probe ends
 * up as an output of the top module once all modules are processed deepest
 * first.
 */
public class ProbePuller {

    public static final String PASS_NAME = "pull_control_registers_probes";

    public static final String REGISTER_PROBE_PREFIX = "crtlreg_prbsig";

    private final boolean verbose;

    public ProbePuller(boolean verbose) {
        this.verbose = verbose;
    }

    /**
     * Pulls probes through the modules reachable from the selection of the
     * design.
     * @param design The design to instrument.
     * @return The modules processed, in processing order.
     * @throws com.rtlprobe.netlist.RTLConfigurationException if the selection is empty.
     * @throws com.rtlprobe.netlist.RTLStructuralException if the module
     * hierarchy is recursive or a module holds processes.
     */
    public List<RTLModule> pullProbes(RTLDesign design) {
        List<RTLModule> selected = design.requireSelectedModules(PASS_NAME);
        List<RTLModule> ordered = ModuleDependencyGraph.build(design, selected, PASS_NAME).getSortedModules();
        return pullProbes(ordered);
    }

    /**
     * Pulls probes through the provided modules.  Modules already marked with
     * {@link ProbeMarkers#REGSTATE_CELLS_PROBES} are skipped.
     * @param modulesInDependencyOrder Modules ordered so that every module
     * follows the modules it instantiates.
     * @return The modules processed.
     */
    public List<RTLModule> pullProbes(List<RTLModule> modulesInDependencyOrder) {
        List<RTLModule> processed = new ArrayList<>();
        for (RTLModule module : modulesInDependencyOrder) {
            if (module.getBoolAttribute(ProbeMarkers.REGSTATE_CELLS_PROBES)) {
                MessageGenerator.briefMessage("Skipping module " + module.getName()
                        + ", its register probes have already been pulled.");
                continue;
            }
            createRegisterProbes(module);
            processed.add(module);
        }
        return processed;
    }

    /**
     * Adds the probe outputs of a single module.  Every module it
     * instantiates must have been processed already.
     * @param module The module to instrument.
     */
    public void createRegisterProbes(RTLModule module) {
        MessageGenerator.verboseMessage(verbose, "Creating control register probes for module " + module.getName());
        module.requireNoProcesses(PASS_NAME);

        List<RTLCell> cells = new ArrayList<>(module.selectedCells());
        cells.sort(Comparator.comparingInt(RTLCell::getId));
        for (RTLCell cell : cells) {
            if (cell.hasAttribute(ProbeMarkers.REGSTATE_CELL)) {
                probeRegister(module, cell);
            } else if (cell.isModuleInstance()) {
                threadSubmoduleProbes(module, cell);
            }
        }
        module.fixupPorts();
        module.setBoolAttribute(ProbeMarkers.REGSTATE_CELLS_PROBES);
    }

    private void probeRegister(RTLModule module, RTLCell cell) {
        RTLSigSpec q = cell.getPort(RTLCellTypes.STORAGE_OUTPUT_PORT);
        if (q == null) {
            MessageGenerator.briefWarning("Register " + cell.getFullName() + " has no "
                    + RTLCellTypes.STORAGE_OUTPUT_PORT + " port, no probe created.");
            return;
        }
        int chunkIdx = 0;
        for (RTLSigChunk chunk : q.wireChunks()) {
            String name = getUniqueWireName(module, getRegisterProbeName(cell, chunkIdx, chunk));
            MessageGenerator.verboseMessage(verbose, "Adding control register wire in module " + module.getName()
                    + ": " + name + " (width: " + chunk.getWidth() + ")");
            RTLWire probe = module.addWire(name, chunk.getWidth());
            module.connect(probe, new RTLSigSpec(chunk));
            probe.setPortOutput(true);
            probe.setBoolAttribute(ProbeMarkers.REGSTATE_CELL_WIRE);
            chunkIdx++;
        }
    }

    private void threadSubmoduleProbes(RTLModule module, RTLCell cell) {
        RTLModule submodule = cell.getSubmodule();
        if (!submodule.getBoolAttribute(ProbeMarkers.REGSTATE_CELLS_PROBES)) {
            throw new IllegalStateException("Module " + submodule.getName() + " instantiated by "
                    + cell.getFullName() + " must be processed before module " + module.getName());
        }
        for (RTLWire subWire : new ArrayList<>(submodule.getWires())) {
            if (!subWire.getBoolAttribute(ProbeMarkers.REGSTATE_CELL_WIRE)) continue;
            String name = getUniqueWireName(module, getInstanceProbeName(subWire, cell));
            MessageGenerator.verboseMessage(verbose, "Adding wire in module " + module.getName() + " from submodule "
                    + submodule.getName() + " (cell " + cell.getName() + "): " + name);
            RTLWire probe = module.addWire(name, subWire.getWidth());
            cell.setPort(subWire.getName(), probe);
            probe.setPortOutput(true);
            probe.setBoolAttribute(ProbeMarkers.REGSTATE_CELL_WIRE);
        }
    }

    /**
     * @return The name of the probe wire of a chunk of a register's output.
     */
    public static String getRegisterProbeName(RTLCell cell, int chunkIdx, RTLSigChunk chunk) {
        return RTLTools.sanitizeWireName(REGISTER_PROBE_PREFIX + cell.getId() + "WIRE" + chunkIdx
                + "BITS" + chunk.getOffset() + "_" + chunk.getEnd() + "_");
    }

    /**
     * @return The name of the wire bound to a probe port of a module instance.
     * Instance names differing only in characters removed by
     * {@link RTLTools#sanitizeWireName(String)} map to the same name here,
     * see {@link #getUniqueWireName(RTLModule, String)}.
     */
    public static String getInstanceProbeName(RTLWire subWire, RTLCell cell) {
        return RTLTools.sanitizeWireName(subWire.getName() + "INST" + cell.getName() + "PORT" + subWire.getPortId());
    }

    /**
     * Makes a wire name unique inside a module by appending "_1", "_2", ...
     * until no wire of the module uses it.  Cells are processed in id order,
     * so the suffixes are stable across runs.
     * @param module The module the wire will be added to.
     * @param name The preferred name.
     * @return The preferred name if it is free, otherwise the first free
     * suffixed variant.
     */
    public static String getUniqueWireName(RTLModule module, String name) {
        if (module.getWire(name) == null) return name;
        int suffix = 1;
        while (module.getWire(name + "_" + suffix) != null) {
            suffix++;
        }
        return name + "_" + suffix;
    }
}
