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

import java.util.Objects;
import java.util.Set;

import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;

/**
 * A signal of a module waiting to be expanded by the select tracer.
 *
 * Two nodes are equal when they are in the same module and reference the
 * same set of wires: a wire reached once as a whole and once through a slice
 * is expanded only once.
 */
public class SearchNode {

    private final RTLModule module;

    private final RTLSigSpec signal;

    private final Set<RTLWire> wires;

    public SearchNode(RTLModule module, RTLSigSpec signal) {
        this.module = Objects.requireNonNull(module);
        this.signal = Objects.requireNonNull(signal);
        this.wires = signal.getWires();
    }

    public RTLModule getModule() {
        return module;
    }

    public RTLSigSpec getSignal() {
        return signal;
    }

    public Set<RTLWire> getWires() {
        return wires;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SearchNode other = (SearchNode) o;
        return module == other.module && wires.equals(other.wires);
    }

    @Override
    public int hashCode() {
        return Objects.hash(module.getName(), wires);
    }

    @Override
    public String toString() {
        return signal + " (module: " + module.getName() + ")";
    }
}
