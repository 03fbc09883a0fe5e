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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * A collection of utility methods for working with netlists.
 */
public class RTLTools {

    /** Characters that are not allowed in names of generated wires */
    public static final String ILLEGAL_NAME_CHARS = "$:.\\[]";

    /**
     * Strips all characters that are illegal in identifiers of generated
     * wires ('$', ':', '.', '\', '[' and ']').
     * @param wireName The raw name.
     * @return The sanitized name.
     */
    public static String sanitizeWireName(String wireName) {
        StringBuilder sb = new StringBuilder(wireName.length());
        for (int i = 0; i < wireName.length(); i++) {
            char c = wireName.charAt(i);
            if (ILLEGAL_NAME_CHARS.indexOf(c) == -1) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Looks through the direct connections of a module for a public alias of
     * the provided wire, which is easier to recognize for a user than an
     * auto-generated name.
     * @param module The module of the wire.
     * @param wire The wire to find an alias for.
     * @return The name of the first public whole-wire alias found, or the name
     * of the wire itself.
     */
    public static String findBetterWireName(RTLModule module, RTLWire wire) {
        for (RTLConnection conn : module.getConnections()) {
            RTLSigSpec lhs = conn.getLhs();
            RTLSigSpec rhs = conn.getRhs();
            if (rhs.isWire() && rhs.asWire() == wire) {
                if (lhs.isWire() && lhs.asWire().isPublicName()) return lhs.asWire().getName();
            } else if (lhs.isWire() && lhs.asWire() == wire) {
                if (rhs.isWire() && rhs.asWire().isPublicName()) return rhs.asWire().getName();
            }
        }
        return wire.getName();
    }

    /**
     * Finds the modules among the provided ones that contain a wire by the
     * provided name.
     * @param modules The modules to search.
     * @param wireName The name of the wire.
     * @return The modules holding such a wire, in the order provided.
     */
    public static List<RTLModule> findModulesWithWire(Collection<RTLModule> modules, String wireName) {
        List<RTLModule> result = new ArrayList<>();
        for (RTLModule m : modules) {
            if (m.getWire(wireName) != null) result.add(m);
        }
        return result;
    }

    /**
     * Reads a JSON netlist, as produced by Yosys' 'write_json' command.
     * @param fileName Path to the JSON file.
     * @return The design.
     */
    public static RTLDesign readJsonNetlist(Path fileName) {
        try {
            return RTLJsonReader.readDesign(fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read netlist " + fileName, e);
        }
    }

    public static RTLDesign readJsonNetlist(String fileName) {
        return readJsonNetlist(Paths.get(fileName));
    }

    /**
     * Writes a design as a JSON netlist that Yosys' 'read_json' command accepts.
     * @param fileName Path of the file to write.
     * @param design The design to write.
     */
    public static void writeJsonNetlist(Path fileName, RTLDesign design) {
        try {
            RTLJsonWriter.writeDesign(fileName, design);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't write netlist " + fileName, e);
        }
    }

    public static void writeJsonNetlist(String fileName, RTLDesign design) {
        writeJsonNetlist(Paths.get(fileName), design);
    }
}
