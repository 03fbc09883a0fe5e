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

package com.rtlprobe.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

import org.jgrapht.Graph;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.TopologicalOrderIterator;

import com.rtlprobe.netlist.RTLCell;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLStructuralException;

/**
 * Instantiation graph of the modules of a design.  An edge goes from an
 * instantiated module to the module instantiating it, so a topological walk
 * visits the deepest modules first.
 */
public class ModuleDependencyGraph {

    /** Edge labelled with the first cell found creating the instantiation */
    private static class InstantiationEdge extends DefaultEdge {
        private final String cellName;

        InstantiationEdge(String cellName) {
            this.cellName = cellName;
        }

        @Override
        public String toString() {
            return "(" + getSource() + " -> " + getTarget() + " via " + cellName + ")";
        }
    }

    private final Graph<RTLModule, InstantiationEdge> graph;

    private ModuleDependencyGraph() {
        this.graph = new DefaultDirectedGraph<>(InstantiationEdge.class);
    }

    /**
     * Builds the instantiation graph reachable from the selected modules.
     * Modules instantiated by selected cells join the graph even when they
     * are not selected themselves.
     * @param design The design the modules belong to.
     * @param selectedModules Modules the analysis starts from.
     * @param passName Name of the calling pass, used in error messages.
     * @return The acyclic graph.
     * @throws RTLStructuralException if the instantiations form a cycle.
     */
    public static ModuleDependencyGraph build(RTLDesign design, Collection<RTLModule> selectedModules,
                                              String passName) {
        ModuleDependencyGraph g = new ModuleDependencyGraph();
        Deque<RTLModule> worklist = new ArrayDeque<>(selectedModules);
        while (!worklist.isEmpty()) {
            RTLModule module = worklist.poll();
            g.graph.addVertex(module);
            for (RTLCell cell : module.selectedCells()) {
                RTLModule instantiated = design.getSubmodule(cell);
                if (instantiated == null) continue;
                if (!g.graph.containsVertex(instantiated)) {
                    g.graph.addVertex(instantiated);
                    worklist.add(instantiated);
                }
                if (!g.graph.containsEdge(instantiated, module)) {
                    g.graph.addEdge(instantiated, module, new InstantiationEdge(cell.getName()));
                }
            }
        }
        if (!g.isAcyclic()) {
            throw new RTLStructuralException("ERROR: Recursive modules are not supported by " + passName + ".");
        }
        return g;
    }

    private boolean isAcyclic() {
        CycleDetector<RTLModule, InstantiationEdge> cycleDetector = new CycleDetector<>(graph);
        return !cycleDetector.detectCycles();
    }

    /**
     * @return The modules of this graph, every module after all the modules
     * it instantiates.  Ties are broken by module name.
     */
    public List<RTLModule> getSortedModules() {
        List<RTLModule> sorted = new ArrayList<>(graph.vertexSet().size());
        Iterator<RTLModule> it = new TopologicalOrderIterator<>(graph,
                Comparator.comparing(RTLModule::getName));
        while (it.hasNext()) {
            sorted.add(it.next());
        }
        return sorted;
    }
}
