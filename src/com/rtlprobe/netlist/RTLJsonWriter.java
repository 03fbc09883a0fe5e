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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Writes a design in the JSON netlist format of Yosys ('read_json').
 *
 * Direct connections are folded into the bit numbering: both sides of a
 * connection share the same net numbers, and wires driven by constants list
 * the constant bits.  Reading the output back with {@link RTLJsonReader}
 * therefore yields an equivalent, but not necessarily identical, netlist.
 */
public class RTLJsonWriter {

    public static final String CREATOR = "RTLProbe";

    /** First net number; 0 and 1 are reserved by the format */
    private static final int FIRST_NET = 2;

    public static void writeDesign(Path fileName, RTLDesign design) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(fileName, StandardCharsets.UTF_8)) {
            writeDesign(bw, design);
        }
    }

    public static void writeDesign(Writer writer, RTLDesign design) throws IOException {
        writer.write(toJson(design).toString(2));
        writer.write(System.lineSeparator());
    }

    public static JSONObject toJson(RTLDesign design) {
        JSONObject modules = new JSONObject();
        for (RTLModule m : design.getModules()) {
            modules.put(m.getName(), toJson(m));
        }
        JSONObject root = new JSONObject();
        root.put("creator", CREATOR);
        root.put(RTLJsonReader.MODULES, modules);
        return root;
    }

    private static JSONObject toJson(RTLModule module) {
        BitNumbering numbering = new BitNumbering(module);

        JSONObject ports = new JSONObject();
        for (RTLWire port : module.getPorts()) {
            JSONObject p = new JSONObject();
            p.put(RTLJsonReader.DIRECTION, port.getDirection().getJsonName());
            p.put(RTLJsonReader.BITS, numbering.bits(port.asSigSpec()));
            ports.put(port.getName(), p);
        }

        JSONObject netnames = new JSONObject();
        for (RTLWire w : module.getWires()) {
            JSONObject n = new JSONObject();
            n.put("hide_name", w.isPublicName() ? 0 : 1);
            n.put(RTLJsonReader.BITS, numbering.bits(w.asSigSpec()));
            n.put(RTLJsonReader.ATTRIBUTES, new JSONObject(w.getAttributesMap()));
            netnames.put(w.getName(), n);
        }

        JSONObject cells = new JSONObject();
        for (RTLCell c : module.getCells()) {
            JSONObject cell = new JSONObject();
            cell.put("hide_name", c.isPublicName() ? 0 : 1);
            cell.put(RTLJsonReader.TYPE, c.getType());
            cell.put(RTLJsonReader.PARAMETERS, new JSONObject(c.getParameters()));
            cell.put(RTLJsonReader.ATTRIBUTES, new JSONObject(c.getAttributesMap()));
            JSONObject dirs = new JSONObject();
            JSONObject conns = new JSONObject();
            for (Map.Entry<String, RTLSigSpec> e : c.getConnections().entrySet()) {
                RTLPortDirection dir = c.getDirection(e.getKey());
                if (dir != null) dirs.put(e.getKey(), dir.getJsonName());
                conns.put(e.getKey(), numbering.bits(e.getValue()));
            }
            cell.put(RTLJsonReader.PORT_DIRECTIONS, dirs);
            cell.put(RTLJsonReader.CONNECTIONS, conns);
            cells.put(c.getName(), cell);
        }

        JSONObject json = new JSONObject();
        json.put(RTLJsonReader.ATTRIBUTES, new JSONObject(module.getAttributesMap()));
        json.put(RTLJsonReader.PORTS, ports);
        json.put(RTLJsonReader.CELLS, cells);
        json.put(RTLJsonReader.NETNAMES, netnames);
        if (module.hasProcesses()) {
            json.put(RTLJsonReader.PROCESSES, new JSONArray(module.getProcesses()));
        }
        return json;
    }

    /**
     * Numbers the bits of a module, merging bits joined by direct connections.
     */
    private static class BitNumbering {

        private final Map<RTLWire, Integer> base = new HashMap<>();

        private final int[] parent;

        private final String[] constants;

        private final int[] netIds;

        BitNumbering(RTLModule module) {
            int count = 0;
            for (RTLWire w : module.getWires()) {
                base.put(w, count);
                count += w.getWidth();
            }
            parent = new int[count];
            constants = new String[count];
            netIds = new int[count];
            for (int i = 0; i < count; i++) {
                parent[i] = i;
            }
            for (RTLConnection conn : module.getConnections()) {
                List<RTLSigChunk> lhs = conn.getLhs().bits();
                List<RTLSigChunk> rhs = conn.getRhs().bits();
                for (int i = 0; i < lhs.size(); i++) {
                    join(lhs.get(i), rhs.get(i));
                }
            }
            int next = FIRST_NET;
            for (int i = 0; i < count; i++) {
                int root = find(i);
                if (constants[root] == null && netIds[root] == 0) {
                    netIds[root] = next++;
                }
            }
        }

        private int index(RTLSigChunk bit) {
            return base.get(bit.getWire()) + bit.getOffset();
        }

        private int find(int i) {
            while (parent[i] != i) {
                parent[i] = parent[parent[i]];
                i = parent[i];
            }
            return i;
        }

        private void join(RTLSigChunk a, RTLSigChunk b) {
            if (!a.isWire() && !b.isWire()) return;
            if (!a.isWire() || !b.isWire()) {
                RTLSigChunk w = a.isWire() ? a : b;
                RTLSigChunk c = a.isWire() ? b : a;
                constants[find(index(w))] = c.getData();
                return;
            }
            int ra = find(index(a));
            int rb = find(index(b));
            if (ra == rb) return;
            parent[ra] = rb;
            if (constants[rb] == null) constants[rb] = constants[ra];
        }

        JSONArray bits(RTLSigSpec sig) {
            JSONArray array = new JSONArray();
            for (RTLSigChunk bit : sig.bits()) {
                if (!bit.isWire()) {
                    array.put(bit.getData());
                    continue;
                }
                int root = find(index(bit));
                if (constants[root] != null) {
                    array.put(constants[root]);
                } else {
                    array.put(netIds[root]);
                }
            }
            return array;
        }
    }
}
