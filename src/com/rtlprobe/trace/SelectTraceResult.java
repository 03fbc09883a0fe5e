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

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a select search along with the nodes expanded to get there.
 */
public class SelectTraceResult {

    private final SelectLocation location;

    private final List<SearchNode> expandedNodes;

    public SelectTraceResult(SelectLocation location, List<SearchNode> expandedNodes) {
        this.location = location;
        this.expandedNodes = Collections.unmodifiableList(expandedNodes);
    }

    public SelectLocation getLocation() {
        return location;
    }

    /**
     * @return The nodes in the order they were expanded.
     */
    public List<SearchNode> getExpandedNodes() {
        return expandedNodes;
    }

    public boolean isFound() {
        return location.isFound();
    }
}
