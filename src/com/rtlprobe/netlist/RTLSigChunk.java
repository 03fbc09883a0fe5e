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

import java.util.Objects;

/**
 * A contiguous piece of a signal: either a bit range of one wire, or a
 * run of constant bits.  Chunks are immutable.
 */
public final class RTLSigChunk {

    private final RTLWire wire;

    private final int offset;

    private final int width;

    /** Constant bits, least significant bit first. Null for wire chunks. */
    private final String data;

    public RTLSigChunk(RTLWire wire) {
        this(wire, 0, wire.getWidth());
    }

    public RTLSigChunk(RTLWire wire, int offset, int width) {
        if (wire == null) {
            throw new IllegalArgumentException("Wire chunk requires a wire, use constant() for constants");
        }
        if (offset < 0 || width < 0 || offset + width > wire.getWidth()) {
            throw new RTLConfigurationException("ERROR: Chunk [" + (offset + width - 1) + ":" + offset
                    + "] is out of range of wire " + wire.getFullName() + " (width " + wire.getWidth() + ")");
        }
        this.wire = wire;
        this.offset = offset;
        this.width = width;
        this.data = null;
    }

    private RTLSigChunk(String data) {
        this.wire = null;
        this.offset = 0;
        this.width = data.length();
        this.data = data;
    }

    /**
     * Creates a constant chunk.
     * @param lsbFirstBits Bits made of '0', '1', 'x' or 'z', least significant bit first.
     * @return The constant chunk.
     */
    public static RTLSigChunk constant(String lsbFirstBits) {
        for (int i = 0; i < lsbFirstBits.length(); i++) {
            char c = lsbFirstBits.charAt(i);
            if (c != '0' && c != '1' && c != 'x' && c != 'z') {
                throw new RTLConfigurationException("ERROR: Illegal constant bit '" + c + "' in " + lsbFirstBits);
            }
        }
        return new RTLSigChunk(lsbFirstBits);
    }

    public boolean isWire() {
        return wire != null;
    }

    /**
     * @return The wire of this chunk, or null if it is a constant.
     */
    public RTLWire getWire() {
        return wire;
    }

    public int getOffset() {
        return offset;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return The first bit index after this chunk.
     */
    public int getEnd() {
        return offset + width;
    }

    /**
     * @return Constant bits, least significant bit first, or null for a wire chunk.
     */
    public String getData() {
        return data;
    }

    /**
     * @return True if this chunk covers all bits of its wire.
     */
    public boolean isWholeWire() {
        return wire != null && offset == 0 && width == wire.getWidth();
    }

    /**
     * Gets a sub-range of this chunk.
     * @param relOffset Offset relative to the start of this chunk.
     * @param relWidth Number of bits.
     * @return The sub-range as a new chunk.
     */
    public RTLSigChunk extract(int relOffset, int relWidth) {
        if (wire == null) return new RTLSigChunk(data.substring(relOffset, relOffset + relWidth));
        return new RTLSigChunk(wire, offset + relOffset, relWidth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RTLSigChunk other = (RTLSigChunk) o;
        return offset == other.offset && width == other.width && wire == other.wire
                && Objects.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(wire == null ? 0 : System.identityHashCode(wire), offset, width, data);
    }

    @Override
    public String toString() {
        if (wire == null) {
            return width + "'b" + new StringBuilder(data).reverse();
        }
        if (isWholeWire()) return wire.getName();
        if (width == 1) return wire.getName() + "[" + offset + "]";
        return wire.getName() + "[" + (getEnd() - 1) + ":" + offset + "]";
    }
}
