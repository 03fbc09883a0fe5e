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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Reads the JSON netlist format written by Yosys' 'write_json' command.
 *
 * In that format every net bit is a number and wires ("netnames") list the
 * numbers of their bits.  Wires sharing bits are aliases of each other: the
 * reader picks one canonical wire per bit (ports first, then public names,
 * then auto-generated names, ties broken by name) and turns every alias into
 * a direct connection driven by the canonical wire.  Cell ports are expressed
 * with canonical wires.
 *
 * Object keys are visited in sorted order so that the ids of wires and
 * cells do not depend on the layout of the file.
 */
public class RTLJsonReader {

    public static final String MODULES = "modules";
    public static final String ATTRIBUTES = "attributes";
    public static final String PARAMETERS = "parameters";
    public static final String PORTS = "ports";
    public static final String CELLS = "cells";
    public static final String NETNAMES = "netnames";
    public static final String PROCESSES = "processes";
    public static final String DIRECTION = "direction";
    public static final String BITS = "bits";
    public static final String TYPE = "type";
    public static final String PORT_DIRECTIONS = "port_directions";
    public static final String CONNECTIONS = "connections";

    private static final String UNNAMED_BIT_PREFIX = "$auto_bit";

    public static RTLDesign readDesign(Path fileName) throws IOException {
        try (BufferedReader br = Files.newBufferedReader(fileName, StandardCharsets.UTF_8)) {
            String name = fileName.getFileName().toString();
            int dot = name.lastIndexOf('.');
            return readDesign(br, dot > 0 ? name.substring(0, dot) : name);
        }
    }

    public static RTLDesign readDesign(Reader reader, String designName) {
        JSONObject root;
        try {
            root = new JSONObject(new JSONTokener(reader));
        } catch (JSONException e) {
            throw new RTLConfigurationException("ERROR: Malformed JSON netlist " + designName + ": " + e.getMessage(), e);
        }
        return readDesign(root, designName);
    }

    public static RTLDesign readDesign(JSONObject root, String designName) {
        RTLDesign design = new RTLDesign(designName);
        JSONObject modules = root.optJSONObject(MODULES);
        if (modules == null) {
            throw new RTLConfigurationException("ERROR: JSON netlist " + designName + " has no '" + MODULES + "' entry.");
        }
        try {
            for (String moduleName : new TreeSet<>(modules.keySet())) {
                readModule(design, moduleName, modules.getJSONObject(moduleName));
            }
        } catch (JSONException e) {
            throw new RTLConfigurationException("ERROR: Malformed JSON netlist " + designName + ": " + e.getMessage(), e);
        }
        return design;
    }

    private static void readModule(RTLDesign design, String moduleName, JSONObject json) {
        RTLModule module = design.addModule(moduleName);
        readAttributes(module, json.optJSONObject(ATTRIBUTES));

        JSONObject netnames = json.optJSONObject(NETNAMES);
        JSONObject ports = json.optJSONObject(PORTS);
        Map<String, JSONArray> wireBits = new HashMap<>();
        if (netnames != null) {
            for (String name : netnames.keySet()) {
                wireBits.put(name, netnames.getJSONObject(name).getJSONArray(BITS));
            }
        }
        if (ports != null) {
            for (String name : ports.keySet()) {
                wireBits.putIfAbsent(name, ports.getJSONObject(name).getJSONArray(BITS));
            }
        }

        for (String name : new TreeSet<>(wireBits.keySet())) {
            RTLWire wire = module.addWire(name, wireBits.get(name).length());
            if (netnames != null && netnames.has(name)) {
                readAttributes(wire, netnames.getJSONObject(name).optJSONObject(ATTRIBUTES));
            }
            if (ports != null && ports.has(name)) {
                String dir = ports.getJSONObject(name).getString(DIRECTION);
                RTLPortDirection direction = RTLPortDirection.getEnum(dir);
                if (direction == RTLPortDirection.INOUT) {
                    throw new RTLConfigurationException("ERROR: Port " + wire.getFullName()
                            + " is both input and output!");
                }
                wire.setPortInput(direction == RTLPortDirection.INPUT);
                wire.setPortOutput(direction == RTLPortDirection.OUTPUT);
            }
        }
        module.fixupPorts();

        // Pick the canonical wire of every bit
        List<RTLWire> byPriority = new ArrayList<>(module.getWires());
        byPriority.sort(Comparator.comparingInt((RTLWire w) -> w.isPort() ? 0 : (w.isPublicName() ? 1 : 2))
                .thenComparing(RTLWire::getName));
        Map<Integer, RTLSigChunk> owners = new HashMap<>();
        for (RTLWire w : byPriority) {
            JSONArray bits = wireBits.get(w.getName());
            for (int i = 0; i < bits.length(); i++) {
                Object bit = bits.get(i);
                if (bit instanceof Number) {
                    owners.putIfAbsent(((Number) bit).intValue(), new RTLSigChunk(w, i, 1));
                }
            }
        }

        // Aliases become connections driven by the canonical wires
        for (RTLWire w : module.getWires()) {
            JSONArray bits = wireBits.get(w.getName());
            int runStart = -1;
            for (int i = 0; i <= bits.length(); i++) {
                boolean alias = i < bits.length() && !isOwnBit(owners, bits.get(i), w, i);
                if (alias && runStart == -1) {
                    runStart = i;
                } else if (!alias && runStart != -1) {
                    RTLSigSpec rhs = toSigSpec(module, owners, bits, runStart, i);
                    module.connect(new RTLSigSpec(w, runStart, i - runStart), rhs);
                    runStart = -1;
                }
            }
        }

        JSONObject cells = json.optJSONObject(CELLS);
        if (cells != null) {
            for (String cellName : new TreeSet<>(cells.keySet())) {
                readCell(module, owners, cellName, cells.getJSONObject(cellName));
            }
        }

        JSONArray processes = json.optJSONArray(PROCESSES);
        if (processes != null) {
            for (int i = 0; i < processes.length(); i++) {
                module.addProcess(processes.getString(i));
            }
        }
    }

    private static void readCell(RTLModule module, Map<Integer, RTLSigChunk> owners, String cellName,
                                 JSONObject json) {
        RTLCell cell = module.addCell(cellName, json.getString(TYPE));
        readAttributes(cell, json.optJSONObject(ATTRIBUTES));
        JSONObject params = json.optJSONObject(PARAMETERS);
        if (params != null) {
            for (String key : new TreeSet<>(params.keySet())) {
                cell.setParameter(key, params.get(key).toString());
            }
        }
        JSONObject dirs = json.optJSONObject(PORT_DIRECTIONS);
        if (dirs != null) {
            for (String port : dirs.keySet()) {
                cell.setPortDirection(port, RTLPortDirection.getEnum(dirs.getString(port)));
            }
        }
        JSONObject conns = json.optJSONObject(CONNECTIONS);
        if (conns != null) {
            for (String port : conns.keySet()) {
                JSONArray bits = conns.getJSONArray(port);
                cell.setPort(port, toSigSpec(module, owners, bits, 0, bits.length()));
            }
        }
    }

    private static boolean isOwnBit(Map<Integer, RTLSigChunk> owners, Object bit, RTLWire wire, int index) {
        if (!(bit instanceof Number)) return false;
        RTLSigChunk owner = owners.get(((Number) bit).intValue());
        return owner.getWire() == wire && owner.getOffset() == index;
    }

    private static RTLSigSpec toSigSpec(RTLModule module, Map<Integer, RTLSigChunk> owners, JSONArray bits,
                                        int start, int end) {
        RTLSigSpec sig = new RTLSigSpec();
        for (int i = start; i < end; i++) {
            Object bit = bits.get(i);
            if (bit instanceof Number) {
                int id = ((Number) bit).intValue();
                RTLSigChunk owner = owners.get(id);
                if (owner == null) {
                    // A net bit no wire claims: give it a wire of its own
                    RTLWire w = module.addWire(UNNAMED_BIT_PREFIX + id, 1);
                    owner = new RTLSigChunk(w);
                    owners.put(id, owner);
                }
                sig.append(owner);
            } else {
                String value = bit.toString();
                if (value.length() != 1) {
                    throw new RTLConfigurationException("ERROR: Illegal bit value '" + value + "' in module "
                            + module.getName());
                }
                sig.append(RTLSigChunk.constant(value));
            }
        }
        return sig;
    }

    private static void readAttributes(RTLAttributeObject obj, JSONObject attributes) {
        if (attributes == null) return;
        for (String key : new TreeSet<>(attributes.keySet())) {
            obj.setAttribute(key, attributes.get(key).toString());
        }
    }
}
