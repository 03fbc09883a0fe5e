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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.rtlprobe.hierarchy.ModuleDependencyGraph;
import com.rtlprobe.hierarchy.ModuleParentMap;
import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;
import com.rtlprobe.netlist.RTLTools;
import com.rtlprobe.netlist.RTLWire;
import com.rtlprobe.util.MessageGenerator;
import com.rtlprobe.util.Params;

/**
 * Finds the select signal of the nearest multiplexer a signal flows into.
 *
 * The search walks a double-ended worklist of {@link SearchNode}s starting at
 * the named wire.  Every wire-backed chunk of an expanded node is handed to
 * the {@link TraversalRule}s in a fixed order: selector inputs first, then
 * built-in cell fan-in, direct connections, descent into instances and
 * ascent into the parent module.  Renaming steps (connections and module
 * boundaries) go to the front of the worklist and steps through logic go
 * to the back.  No node is expanded twice, so the search ends on any
 * finite netlist.  The netlist is never modified.
 */
public class SelectTracer {

    public static final String PASS_NAME = "find_next_mux";

    private final List<TraversalRule> rules;

    public SelectTracer() {
        this(Params.getResetPattern());
    }

    /**
     * @param resetPattern Substring identifying select lines driven by resets.
     */
    public SelectTracer(String resetPattern) {
        this(Arrays.asList(
                new SelectorInputRule(resetPattern),
                new CellFanInRule(),
                new DirectConnectionRule(),
                new SubmoduleDescentRule(),
                new HierarchyAscentRule()));
    }

    public SelectTracer(List<TraversalRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public List<TraversalRule> getRules() {
        return rules;
    }

    /**
     * Searches for the next multiplexer select reachable from a wire.
     * @param startModule The module holding the wire.
     * @param startWireName Name of the wire to start from.
     * @param design The design; its selected modules determine module parents.
     * @param verbose Print every step of the search.
     * @return The location found ({@link SelectLocation#NONE} if there is
     * none) and the nodes expanded.
     * @throws RTLConfigurationException if the wire does not exist.
     * @throws com.rtlprobe.netlist.RTLStructuralException if an expanded
     * module still holds processes.
     */
    public SelectTraceResult locateNextSelect(RTLModule startModule, String startWireName, RTLDesign design,
                                              boolean verbose) {
        RTLWire start = startModule.getWire(startWireName);
        if (start == null) {
            throw new RTLConfigurationException("ERROR: The wire " + startWireName + " does not exist in module "
                    + startModule.getName() + ".");
        }
        TraceContext ctx = new TraceContext(ModuleParentMap.build(design.selectedModules()), verbose);
        ctx.seed(startModule, start.asSigSpec());

        SearchNode node;
        while ((node = ctx.next()) != null) {
            RTLModule module = node.getModule();
            module.requireNoProcesses(PASS_NAME);
            for (RTLSigChunk chunk : node.getSignal().chunks()) {
                if (!chunk.isWire()) {
                    ctx.log("Skipping constant chunk " + chunk);
                    continue;
                }
                ctx.log("Intermediate wire: " + chunk + " (module: " + module.getName() + ")");
                for (TraversalRule rule : rules) {
                    SelectLocation location = rule.apply(ctx, module, chunk);
                    if (location != null) {
                        return new SelectTraceResult(location, ctx.getExpandedNodes());
                    }
                }
            }
        }
        return new SelectTraceResult(SelectLocation.NONE, ctx.getExpandedNodes());
    }

    /**
     * Finds the single module holding the start wire among the modules
     * reachable from the selection.
     * @param design The design.
     * @param wireName Name of the start wire.
     * @param moduleFilter Substring the module name must contain, or null/empty
     * to consider every module.
     * @return The module holding the wire.
     * @throws RTLConfigurationException if the selection is empty, no module
     * matches the filter, the wire cannot be found or is found in more than
     * one module.
     * @throws com.rtlprobe.netlist.RTLStructuralException if the module
     * hierarchy is recursive.
     */
    public static RTLModule findStartModule(RTLDesign design, String wireName, String moduleFilter) {
        List<RTLModule> selected = design.requireSelectedModules(PASS_NAME);
        List<RTLModule> ordered = ModuleDependencyGraph.build(design, selected, PASS_NAME).getSortedModules();
        boolean filtered = moduleFilter != null && !moduleFilter.isEmpty();
        List<RTLModule> candidates = new ArrayList<>();
        for (RTLModule m : ordered) {
            if (!filtered || m.getName().contains(moduleFilter)) candidates.add(m);
        }
        if (candidates.isEmpty() && filtered) {
            throw new RTLConfigurationException("ERROR: The module " + moduleFilter + " does not exist.");
        }
        List<RTLModule> withWire = RTLTools.findModulesWithWire(candidates, wireName);
        if (withWire.size() > 1) {
            throw new RTLConfigurationException("ERROR: The wire " + wireName
                    + " is present in more than one module.");
        }
        if (withWire.isEmpty()) {
            throw new RTLConfigurationException("ERROR: The wire " + wireName
                    + " does not exist in any of the selected modules.");
        }
        return withWire.get(0);
    }

    /**
     * Locates the start module and runs the search from there, reporting the
     * outcome.
     */
    public SelectLocation findNextMux(RTLDesign design, String wireName, String moduleFilter, boolean verbose) {
        RTLModule start = findStartModule(design, wireName, moduleFilter);
        SelectLocation location = locateNextSelect(start, wireName, design, verbose).getLocation();
        MessageGenerator.briefMessage("Mux select: " + location.getSignalName());
        MessageGenerator.briefMessage("Module: " + location.getModuleName());
        return location;
    }
}
