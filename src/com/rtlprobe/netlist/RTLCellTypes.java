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

package com.rtlprobe.netlist;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Port directions of the built-in (internal) cell types found in
 * synthesized netlists.  Cells whose type is not listed here and does not
 * name a module must carry explicit port directions.
 */
public class RTLCellTypes {

    public static final String MUX = "$mux";
    public static final String PMUX = "$pmux";
    public static final String GATE_MUX = "$_MUX_";

    public static final String DFF = "$dff";
    public static final String ADFF = "$adff";

    /** Select port of selector cells */
    public static final String SELECT_PORT = "S";
    /** Output port of combinational cells */
    public static final String OUTPUT_PORT = "Y";
    /** Output port of storage cells */
    public static final String STORAGE_OUTPUT_PORT = "Q";

    private static final Map<String, Map<String, RTLPortDirection>> cellTypes;

    private static final Set<String> selectorTypes;

    static {
        cellTypes = new HashMap<>();
        selectorTypes = new HashSet<>();

        String[] unary = {"$not", "$pos", "$neg", "$reduce_and", "$reduce_or", "$reduce_xor",
                "$reduce_xnor", "$reduce_bool", "$logic_not", "$_NOT_", "$_BUF_"};
        for (String type : unary) {
            addType(type, new String[]{"A"}, new String[]{"Y"});
        }
        String[] binary = {"$and", "$or", "$xor", "$xnor", "$shl", "$shr", "$sshl", "$sshr", "$shift",
                "$shiftx", "$lt", "$le", "$eq", "$ne", "$eqx", "$nex", "$ge", "$gt", "$add", "$sub",
                "$mul", "$div", "$mod", "$pow", "$logic_and", "$logic_or", "$_AND_", "$_OR_", "$_XOR_",
                "$_NAND_", "$_NOR_", "$_XNOR_", "$_ANDNOT_", "$_ORNOT_"};
        for (String type : binary) {
            addType(type, new String[]{"A", "B"}, new String[]{"Y"});
        }
        for (String type : new String[]{MUX, PMUX, GATE_MUX}) {
            addType(type, new String[]{"A", "B", SELECT_PORT}, new String[]{OUTPUT_PORT});
            selectorTypes.add(type);
        }
        addType("$bmux", new String[]{"A", SELECT_PORT}, new String[]{OUTPUT_PORT});
        addType("$demux", new String[]{"A", SELECT_PORT}, new String[]{OUTPUT_PORT});

        addStorageType(DFF, "CLK", "D");
        addStorageType("$dffe", "CLK", "EN", "D");
        addStorageType(ADFF, "CLK", "ARST", "D");
        addStorageType("$adffe", "CLK", "ARST", "EN", "D");
        addStorageType("$sdff", "CLK", "SRST", "D");
        addStorageType("$sdffe", "CLK", "SRST", "EN", "D");
        addStorageType("$sdffce", "CLK", "SRST", "EN", "D");
        addStorageType("$dffsr", "CLK", "SET", "CLR", "D");
        addStorageType("$dffsre", "CLK", "SET", "CLR", "EN", "D");
        addStorageType("$aldff", "CLK", "ALOAD", "AD", "D");
        addStorageType("$dlatch", "EN", "D");
        addStorageType("$adlatch", "EN", "ARST", "D");
        addStorageType("$ff", "D");
        addStorageType("$_DFF_P_", "C", "D");
        addStorageType("$_DFF_N_", "C", "D");
        addStorageType("$_DFFE_PP_", "C", "E", "D");
    }

    private static void addType(String type, String[] inputs, String[] outputs) {
        Map<String, RTLPortDirection> ports = new LinkedHashMap<>();
        for (String in : inputs) {
            ports.put(in, RTLPortDirection.INPUT);
        }
        for (String out : outputs) {
            ports.put(out, RTLPortDirection.OUTPUT);
        }
        cellTypes.put(type, Collections.unmodifiableMap(ports));
    }

    private static void addStorageType(String type, String... inputs) {
        addType(type, inputs, new String[]{STORAGE_OUTPUT_PORT});
    }

    /**
     * Gets the direction of a port of a built-in cell type.
     * @param type The cell type, for example "$mux".
     * @param port The port name, for example "S".
     * @return The direction or null if the type or port is unknown.
     */
    public static RTLPortDirection getPortDirection(String type, String port) {
        Map<String, RTLPortDirection> ports = cellTypes.get(type);
        return ports == null ? null : ports.get(port);
    }

    /**
     * Checks if cells of this type route one of their data inputs to the output
     * based on the value of the select port.
     */
    public static boolean isSelector(String type) {
        return selectorTypes.contains(type);
    }
}
