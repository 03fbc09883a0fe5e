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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A signal reference: a concatenation of chunks, least significant chunk
 * first.  Adjacent chunks of the same wire (and adjacent constants) are
 * merged as they are appended, so a signal made of one whole wire always
 * holds exactly one chunk.
 */
public class RTLSigSpec {

    private final List<RTLSigChunk> chunks;

    private int width;

    public RTLSigSpec() {
        chunks = new ArrayList<>(1);
    }

    public RTLSigSpec(RTLWire wire) {
        this();
        append(new RTLSigChunk(wire));
    }

    public RTLSigSpec(RTLWire wire, int offset, int width) {
        this();
        append(new RTLSigChunk(wire, offset, width));
    }

    public RTLSigSpec(RTLSigChunk chunk) {
        this();
        append(chunk);
    }

    /**
     * Copy constructor
     * @param sig
     */
    public RTLSigSpec(RTLSigSpec sig) {
        chunks = new ArrayList<>(sig.chunks);
        width = sig.width;
    }

    /**
     * Creates a constant signal.
     * @param lsbFirstBits Bits made of '0', '1', 'x' or 'z', least significant bit first.
     */
    public static RTLSigSpec constant(String lsbFirstBits) {
        return new RTLSigSpec(RTLSigChunk.constant(lsbFirstBits));
    }

    /**
     * Appends a chunk to the most significant end of this signal.
     * @param chunk The chunk to append.
     * @return This signal.
     */
    public RTLSigSpec append(RTLSigChunk chunk) {
        if (chunk.getWidth() == 0) return this;
        width += chunk.getWidth();
        if (!chunks.isEmpty()) {
            RTLSigChunk last = chunks.get(chunks.size() - 1);
            if (last.isWire() && last.getWire() == chunk.getWire() && last.getEnd() == chunk.getOffset()) {
                chunks.set(chunks.size() - 1,
                        new RTLSigChunk(last.getWire(), last.getOffset(), last.getWidth() + chunk.getWidth()));
                return this;
            }
            if (!last.isWire() && !chunk.isWire()) {
                chunks.set(chunks.size() - 1, RTLSigChunk.constant(last.getData() + chunk.getData()));
                return this;
            }
        }
        chunks.add(chunk);
        return this;
    }

    public RTLSigSpec append(RTLSigSpec sig) {
        for (RTLSigChunk c : sig.chunks) {
            append(c);
        }
        return this;
    }

    public RTLSigSpec append(RTLWire wire) {
        return append(new RTLSigChunk(wire));
    }

    public int getWidth() {
        return width;
    }

    public boolean isEmpty() {
        return width == 0;
    }

    /**
     * @return The chunks of this signal, least significant first.
     */
    public List<RTLSigChunk> chunks() {
        return Collections.unmodifiableList(chunks);
    }

    /**
     * @return The chunks of this signal that are backed by a wire.
     */
    public List<RTLSigChunk> wireChunks() {
        List<RTLSigChunk> result = new ArrayList<>(chunks.size());
        for (RTLSigChunk c : chunks) {
            if (c.isWire()) result.add(c);
        }
        return result;
    }

    /**
     * @return The single-bit chunks of this signal, least significant first.
     */
    public List<RTLSigChunk> bits() {
        List<RTLSigChunk> result = new ArrayList<>(width);
        for (RTLSigChunk c : chunks) {
            for (int i = 0; i < c.getWidth(); i++) {
                result.add(c.extract(i, 1));
            }
        }
        return result;
    }

    /**
     * @return True if this signal is exactly one whole wire.
     */
    public boolean isWire() {
        return chunks.size() == 1 && chunks.get(0).isWholeWire();
    }

    /**
     * @return The wire this signal is made of.
     * @throws IllegalStateException if {@link #isWire()} is false.
     */
    public RTLWire asWire() {
        if (!isWire()) {
            throw new IllegalStateException("Signal " + this + " is not a single whole wire");
        }
        return chunks.get(0).getWire();
    }

    /**
     * @return True if this signal is made of exactly one chunk.
     */
    public boolean isChunk() {
        return chunks.size() == 1;
    }

    public boolean isFullyConst() {
        for (RTLSigChunk c : chunks) {
            if (c.isWire()) return false;
        }
        return true;
    }

    /**
     * Gets the distinct wires referenced by this signal, in chunk order.
     */
    public Set<RTLWire> getWires() {
        Set<RTLWire> wires = new LinkedHashSet<>();
        for (RTLSigChunk c : chunks) {
            if (c.isWire()) wires.add(c.getWire());
        }
        return wires;
    }

    /**
     * Checks if any bit of the provided wire is part of this signal.
     */
    public boolean references(RTLWire wire) {
        for (RTLSigChunk c : chunks) {
            if (c.getWire() == wire) return true;
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return chunks.equals(((RTLSigSpec) o).chunks);
    }

    @Override
    public int hashCode() {
        return chunks.hashCode();
    }

    @Override
    public String toString() {
        if (chunks.size() == 1) return chunks.get(0).toString();
        StringBuilder sb = new StringBuilder("{");
        for (int i = chunks.size() - 1; i >= 0; i--) {
            sb.append(' ');
            sb.append(chunks.get(i));
        }
        sb.append(" }");
        return sb.toString();
    }
}
