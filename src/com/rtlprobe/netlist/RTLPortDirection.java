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
/**
 *
 */
package com.rtlprobe.netlist;

/**
 * Provides basic directional options for ports.
 */
public enum RTLPortDirection {
    INPUT,
    OUTPUT,
    INOUT;

    private final String jsonName;

    RTLPortDirection() {
        jsonName = toString().toLowerCase();
    }

    public static RTLPortDirection getEnum(String s) {
        s = s.toUpperCase();
        if (s.equals("BIDIR")) return INOUT;
        return valueOf(s);
    }

    /**
     * Gets the direction implied by a wire's port flags.
     * @param wire The wire to inspect.
     * @return The direction or null if the wire is not a port.
     */
    public static RTLPortDirection getDir(RTLWire wire) {
        if (wire.isPortInput()) return INPUT;
        if (wire.isPortOutput()) return OUTPUT;
        return null;
    }

    public boolean isInput() {
        return this == INPUT || this == INOUT;
    }

    public boolean isOutput() {
        return this == OUTPUT || this == INOUT;
    }

    /**
     * @return The lower case name used in JSON netlists ("input", "output", "inout").
     */
    public String getJsonName() {
        return jsonName;
    }
}
