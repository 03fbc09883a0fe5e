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

package com.rtlprobe.instrument;

/**
 * Names of the boolean attributes the instrumentation passes use to mark
 * cells, wires and modules.  Other tools in a flow rely on these names.
 */
public class ProbeMarkers {

    /** Cell: a register whose state must be observable */
    public static final String REGSTATE_CELL = "regstate_cell";

    /** Wire: output carrying a copy of a register's state */
    public static final String REGSTATE_CELL_WIRE = "regstate_cell_wire";

    /** Module: register probes have been pulled through this module */
    public static final String REGSTATE_CELLS_PROBES = "regstate_cells_probes";

    /** Wire: a probe wire merged into the top level probe port, and that port */
    public static final String REGSTATE_CELL_OUT = "regstate_cell_out";

    /** Wire: the top level probe port */
    public static final String REGSTATE_CELL_PORT = "regstate_cell_port";

    /** Wire: input that must not be merged into the fuzzing port */
    public static final String CELLIFT_IN = "cellift_in";

    /** Wire: the top level fuzzing port */
    public static final String FUZZ_WIRE = "fuzz_wire";

    /** Wire: a port created by an aggregation pass */
    public static final String PORT = "port";

    private ProbeMarkers() {
    }
}
