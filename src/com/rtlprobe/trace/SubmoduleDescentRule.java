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
 * Descends into module instances that read the chunk: the port wire inside
 * the instantiated module is queued at the front.
 */
public class SubmoduleDescentRule implements TraversalRule {

    @Override
    public EdgeKind getKind() {
        return EdgeKind.SUBMODULE_DESCENT;
    }

    @Override
    public SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk) {
        RTLWire wire = chunk.getWire();
        for (RTLCell cell : module.selectedCells()) {
            RTLModule submodule = cell.getSubmodule();
            if (submodule == null) continue;
            for (Map.Entry<String, RTLSigSpec> e : cell.getConnections().entrySet()) {
                String port = e.getKey();
                if (!e.getValue().references(wire) || cell.isOutput(port)) continue;
                RTLWire portWire = submodule.getWire(port);
                if (portWire == null) {
                    ctx.log("  Port " + port + " of " + cell.getName() + " has no wire in module "
                            + submodule.getName());
                    continue;
                }
                ctx.pushFront(getKind(), submodule, portWire.asSigSpec());
            }
        }
        return null;
    }
}
