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

import java.util.Map;

import com.rtlprobe.netlist.RTLCell;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;

/**
 * Moves forward through built-in cells: when a cell reads the chunk, all of
 * its outputs are queued at the back.
 */
public class CellFanInRule implements TraversalRule {

    @Override
    public EdgeKind getKind() {
        return EdgeKind.CELL_FAN_IN;
    }

    @Override
    public SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk) {
        RTLWire wire = chunk.getWire();
        for (RTLCell cell : module.selectedCells()) {
            if (cell.isModuleInstance() || !readsWire(cell, wire)) continue;
            for (Map.Entry<String, RTLSigSpec> e : cell.getConnections().entrySet()) {
                if (cell.isOutput(e.getKey())) {
                    ctx.pushBack(getKind(), module, e.getValue());
                }
            }
        }
        return null;
    }

    private static boolean readsWire(RTLCell cell, RTLWire wire) {
        for (Map.Entry<String, RTLSigSpec> e : cell.getConnections().entrySet()) {
            if (e.getValue().references(wire) && cell.isInput(e.getKey())) return true;
        }
        return false;
    }
}
