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

/**
 * The kinds of netlist edges the select tracer follows.
 */
public enum EdgeKind {
    /** A selector cell reads the signal on a data or select input */
    SELECTOR_INPUT("selector input"),
    /** A built-in cell reads the signal, the search continues at its outputs */
    CELL_FAN_IN("cell fan-in"),
    /** A direct connection is driven by the signal */
    DIRECT_CONNECTION("direct connection"),
    /** An instance of another module reads the signal on one of its ports */
    SUBMODULE_DESCENT("submodule connection"),
    /** The signal is visible at a port of the instantiating module */
    HIERARCHY_ASCENT("parent module connection");

    private final String description;

    EdgeKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
