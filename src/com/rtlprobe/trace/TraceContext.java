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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.rtlprobe.hierarchy.ModuleParentMap;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.util.MessageGenerator;

/**
 * State of one select search: the worklist, the nodes already expanded and
 * the parent of each instantiated module.  Discarded when the search ends.
 */
public class TraceContext {

    private final Deque<SearchNode> worklist = new ArrayDeque<>();

    private final Set<SearchNode> visited = new HashSet<>();

    private final List<SearchNode> expanded = new ArrayList<>();

    private final ModuleParentMap parentMap;

    private final boolean verbose;

    public TraceContext(ModuleParentMap parentMap, boolean verbose) {
        this.parentMap = parentMap;
        this.verbose = verbose;
    }

    public ModuleParentMap getParentMap() {
        return parentMap;
    }

    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Queues the signal the search starts from.
     */
    public void seed(RTLModule module, RTLSigSpec signal) {
        worklist.addLast(new SearchNode(module, signal));
    }

    /**
     * Queues a signal to be expanded before everything already queued.
     */
    public void pushFront(EdgeKind kind, RTLModule module, RTLSigSpec signal) {
        SearchNode node = new SearchNode(module, signal);
        worklist.addFirst(node);
        log("  Adding " + node + " through " + kind.getDescription());
    }

    /**
     * Queues a signal to be expanded after everything already queued.
     */
    public void pushBack(EdgeKind kind, RTLModule module, RTLSigSpec signal) {
        SearchNode node = new SearchNode(module, signal);
        worklist.addLast(node);
        log("  Adding " + node + " through " + kind.getDescription());
    }

    /**
     * Takes the next node that has not been expanded yet and records it as
     * expanded.
     * @return The node, or null once the worklist is exhausted.
     */
    public SearchNode next() {
        while (!worklist.isEmpty()) {
            SearchNode node = worklist.pollFirst();
            if (visited.add(node)) {
                expanded.add(node);
                return node;
            }
            log("Already explored " + node);
        }
        return null;
    }

    /**
     * @return A read-only view of the nodes expanded so far, in order.
     */
    public List<SearchNode> getExpandedNodes() {
        return Collections.unmodifiableList(expanded);
    }

    public void log(String msg) {
        MessageGenerator.verboseMessage(verbose, msg);
    }
}
