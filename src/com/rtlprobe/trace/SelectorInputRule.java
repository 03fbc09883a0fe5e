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
import com.rtlprobe.netlist.RTLCellTypes;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;
import com.rtlprobe.netlist.RTLSigSpec;
import com.rtlprobe.netlist.RTLTools;
import com.rtlprobe.netlist.RTLWire;

/**
 * Stops the search at the first selector reading the chunk on a data input.
 * A selector reached through its select input, or whose select line looks
 * like a reset (its name contains the reset pattern) or is a constant, is
 * not a decision point: the search continues past its output instead.
 */
public class SelectorInputRule implements TraversalRule {

    private final String resetPattern;

    public SelectorInputRule(String resetPattern) {
        this.resetPattern = resetPattern;
    }

    @Override
    public EdgeKind getKind() {
        return EdgeKind.SELECTOR_INPUT;
    }

    @Override
    public SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk) {
        RTLWire wire = chunk.getWire();
        for (RTLCell cell : module.selectedCells()) {
            if (!cell.isSelector()) continue;
            for (Map.Entry<String, RTLSigSpec> e : cell.getConnections().entrySet()) {
                String port = e.getKey();
                if (!e.getValue().references(wire) || !cell.isInput(port)) continue;
                ctx.log("    Found selector " + cell.getName() + " reading " + wire.getName() + " on port " + port);

                RTLSigSpec select = cell.getPort(RTLCellTypes.SELECT_PORT);
                RTLWire selectWire = select == null || select.isFullyConst() ? null
                        : select.getWires().iterator().next();
                if (port.equals(RTLCellTypes.SELECT_PORT) || selectWire == null
                        || selectWire.getName().contains(resetPattern)) {
                    RTLSigSpec output = cell.getPort(RTLCellTypes.OUTPUT_PORT);
                    if (output != null) {
                        ctx.pushBack(getKind(), module, output);
                    }
                    continue;
                }
                ctx.log("    Select line " + selectWire.getName() + " is a good candidate.");
                return new SelectLocation(RTLTools.findBetterWireName(module, selectWire), module.getName());
            }
        }
        return null;
    }
}
