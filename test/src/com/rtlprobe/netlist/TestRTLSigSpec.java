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

import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestRTLSigSpec {

    @Test
    public void testAdjacentChunksMerge() {
        RTLModule m = new RTLDesign("d").addModule("m");
        RTLWire w = m.addWire("w", 8);
        RTLSigSpec sig = new RTLSigSpec(w, 0, 3).append(new RTLSigChunk(w, 3, 5));
        Assertions.assertTrue(sig.isWire());
        Assertions.assertSame(w, sig.asWire());
        Assertions.assertEquals(8, sig.getWidth());
    }

    @Test
    public void testConstantsMerge() {
        RTLSigSpec sig = RTLSigSpec.constant("01").append(RTLSigChunk.constant("1"));
        Assertions.assertEquals(1, sig.chunks().size());
        Assertions.assertTrue(sig.isFullyConst());
        Assertions.assertEquals("3'b110", sig.toString());
    }

    @Test
    public void testIllegalConstant() {
        Assertions.assertThrows(RTLConfigurationException.class, () -> RTLSigChunk.constant("012"));
    }

    @Test
    public void testMixedSignal() {
        RTLModule m = new RTLDesign("d").addModule("m");
        RTLWire a = m.addWire("a", 4);
        RTLWire b = m.addWire("b", 2);
        RTLSigSpec sig = new RTLSigSpec(a, 1, 2).append(RTLSigChunk.constant("0")).append(b);

        Assertions.assertEquals(5, sig.getWidth());
        Assertions.assertFalse(sig.isWire());
        Assertions.assertFalse(sig.isFullyConst());
        Assertions.assertEquals(3, sig.chunks().size());
        List<RTLSigChunk> wireChunks = sig.wireChunks();
        Assertions.assertEquals(2, wireChunks.size());
        Assertions.assertTrue(sig.references(a));
        Assertions.assertTrue(sig.references(b));
        Assertions.assertEquals("{ b 1'b0 a[2:1] }", sig.toString());
        Assertions.assertEquals(5, sig.bits().size());
    }

    @Test
    public void testChunkOutOfRange() {
        RTLWire w = new RTLWire("w", 4);
        Assertions.assertThrows(RTLConfigurationException.class, () -> new RTLSigChunk(w, 3, 2));
    }

    @Test
    public void testAsWireOnSlice() {
        RTLWire w = new RTLWire("w", 4);
        RTLSigSpec slice = new RTLSigSpec(w, 0, 2);
        Assertions.assertTrue(slice.isChunk());
        Assertions.assertEquals("w[1:0]", slice.toString());
        Assertions.assertThrows(IllegalStateException.class, slice::asWire);
    }
}
