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

import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLSigChunk;

/**
 * Follows one kind of edge away from a chunk being expanded, adding the
 * signals found at the other end to the worklist of the search.
 */
public interface TraversalRule {

    EdgeKind getKind();

    /**
     * Applies this rule to a wire-backed chunk of the node being expanded.
     * @param ctx State of the running search.
     * @param module The module of the node.
     * @param chunk The chunk to expand, never a constant.
     * @return The location ending the search, or null to keep searching.
     */
    SelectLocation apply(TraceContext ctx, RTLModule module, RTLSigChunk chunk);
}
