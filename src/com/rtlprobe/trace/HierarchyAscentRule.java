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

import com.rtlprobe.netlist.RTLCell;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLWire;

/**
 * Climbs to the parent of the current module: every instance of the module
 * in its parent binding a port named like the chunk's wire queues the bound
 * signal at the front.
 */
public class HierarchyAscentRule implements TraversalRule {

    @Override
    public EdgeKind getKind() {
        return EdgeKind.HIERARCHY_ASCENT;
    }

    @Override
    public SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk) {
        RTLWire wire = chunk.getWire();
        if (wire.getModule() != module) return null;
        RTLModule parent = ctx.getParentMap().getParent(module);
        if (parent == null) return null;
        for (RTLCell cell : parent.selectedCells()) {
            if (cell.getSubmodule() != module) continue;
            RTLSigSpec bound = cell.getPort(wire.getName());
            if (bound != null) {
                ctx.pushFront(getKind(), parent, bound);
            }
        }
        return null;
    }
}
