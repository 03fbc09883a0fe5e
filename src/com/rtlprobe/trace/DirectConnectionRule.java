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

import com.rtlprobe.netlist.RTLConnection;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;

/**
 * Follows direct connections from their driving side to the driven side.
 * Driven signals are queued at the front since a connection only renames a
 * signal.
 */
public class DirectConnectionRule implements TraversalRule {

    @Override
    public EdgeKind getKind() {
        return EdgeKind.DIRECT_CONNECTION;
    }

    @Override
    public SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk) {
        for (RTLConnection conn : module.getConnections()) {
            if (conn.getRhs().references(chunk.getWire())) {
                ctx.pushFront(getKind(), module, conn.getLhs());
            }
        }
        return null;
    }
}
