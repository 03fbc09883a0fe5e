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
import java.io.StringWriter;
import java.nio.file.Path;

import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestRTLJsonWriter {

    @Test
    public void testWriteAndReadBack(@TempDir Path tempDir) {
        RTLDesign d = RTLTools.readJsonNetlist(TestRTLJsonReader.getNetlistPath("hier_mux.json"));
        Path out = tempDir.resolve("hier_mux_out.json");
        RTLTools.writeJsonNetlist(out, d);

        RTLDesign readBack = RTLTools.readJsonNetlist(out);
        Assertions.assertEquals(d.getModules().size(), readBack.getModules().size());
        for (RTLModule m : d.getModules()) {
            RTLModule other = readBack.getModule(m.getName());
            Assertions.assertNotNull(other);
            Assertions.assertEquals(m.getWires().size(), other.getWires().size());
            Assertions.assertEquals(m.getPorts().size(), other.getPorts().size());
            Assertions.assertEquals(m.getConnections().size(), other.getConnections().size());
            for (RTLCell c : m.getCells()) {
                RTLCell oc = other.getCell(c.getName());
                Assertions.assertEquals(c.getType(), oc.getType());
                Assertions.assertEquals(c.getConnections().keySet(), oc.getConnections().keySet());
                for (String port : c.getConnections().keySet()) {
                    Assertions.assertEquals(c.getPort(port).toString(), oc.getPort(port).toString());
                }
            }
        }
        Assertions.assertEquals("top", readBack.getTopModule().getName());
    }

    @Test
    public void testConnectionsShareBits() {
        RTLDesign d = new RTLDesign("d");
        RTLModule m = d.addModule("m");
        RTLWire a = DesignFixtures.addInput(m, "a", 2);
        RTLWire b = m.addWire("b", 2);
        RTLWire c = m.addWire("c", 3);
        m.connect(b, a);
        m.connect(new RTLSigSpec(c, 0, 2), RTLSigSpec.constant("10"));
        m.fixupPorts();

        JSONObject module = RTLJsonWriter.toJson(d).getJSONObject("modules").getJSONObject("m");
        JSONObject netnames = module.getJSONObject("netnames");
        JSONArray aBits = netnames.getJSONObject("a").getJSONArray("bits");
        JSONArray bBits = netnames.getJSONObject("b").getJSONArray("bits");
        JSONArray cBits = netnames.getJSONObject("c").getJSONArray("bits");
        Assertions.assertEquals(aBits.toString(), bBits.toString());
        Assertions.assertEquals("1", cBits.get(0));
        Assertions.assertEquals("0", cBits.get(1));
        Assertions.assertTrue(cBits.get(2) instanceof Integer);
        Assertions.assertEquals("input", module.getJSONObject("ports").getJSONObject("a").getString("direction"));
    }

    @Test
    public void testProcessesAreWritten() throws IOException {
        RTLDesign d = new RTLDesign("d");
        d.addModule("m").addProcess("$proc$m.v:1$1");
        StringWriter sw = new StringWriter();
        RTLJsonWriter.writeDesign(sw, d);
        JSONObject root = new JSONObject(sw.toString());
        Assertions.assertEquals(RTLJsonWriter.CREATOR, root.getString("creator"));
        JSONArray processes = root.getJSONObject("modules").getJSONObject("m").getJSONArray("processes");
        Assertions.assertEquals("$proc$m.v:1$1", processes.getString(0));
    }
}
