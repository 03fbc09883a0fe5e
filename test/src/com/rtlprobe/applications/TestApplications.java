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

package com.rtlprobe.applications;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.rtlprobe.MainEntrypoint;
import com.rtlprobe.instrument.FuzzInputAggregator;
import com.rtlprobe.instrument.ProbeMarkers;
import com.rtlprobe.instrument.ProbePortAggregator;
import com.rtlprobe.netlist.DesignFixtures;
import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;
import com.rtlprobe.netlist.RTLTools;
import com.rtlprobe.netlist.TestRTLJsonReader;

public class TestApplications {

    private static String captureOutput(Runnable r) {
        PrintStream original = System.out;
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
            System.setOut(ps);
            r.run();
        } finally {
            System.setOut(original);
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testFindNextMux() {
        String input = TestRTLJsonReader.getNetlistPath("hier_mux.json").toString();
        String out = captureOutput(() -> FindNextMux.main(new String[]{"-i", input, "data"}));
        Assertions.assertTrue(out.contains("Mux select: sel_leaf"), out);
        Assertions.assertTrue(out.contains("Module: leaf"), out);
    }

    @Test
    public void testFindNextMuxModuleFilter() {
        String input = TestRTLJsonReader.getNetlistPath("hier_mux.json").toString();
        RTLConfigurationException e = Assertions.assertThrows(RTLConfigurationException.class,
                () -> FindNextMux.main(new String[]{"-i", input, "-m", "leaf", "data"}));
        Assertions.assertEquals("ERROR: The wire data does not exist in any of the selected modules.",
                e.getMessage());
    }

    @Test
    public void testFindNextMuxWithoutWire() {
        String input = TestRTLJsonReader.getNetlistPath("hier_mux.json").toString();
        Assertions.assertThrows(RTLConfigurationException.class,
                () -> FindNextMux.main(new String[]{"-i", input}));
    }

    @Test
    public void testListModuleTypes() {
        String input = TestRTLJsonReader.getNetlistPath("hier_mux.json").toString();
        String out = captureOutput(() -> ListModuleTypes.main(new String[]{"-i", input}));
        Assertions.assertTrue(out.contains("Module type: leaf"), out);
        Assertions.assertTrue(out.contains("Module type: top"), out);

        out = captureOutput(() -> ListModuleTypes.main(new String[]{"-i", input, "-s", "to*"}));
        Assertions.assertFalse(out.contains("Module type: leaf"), out);
        Assertions.assertTrue(out.contains("Module type: top"), out);
    }

    @Test
    public void testProbeFlow(@TempDir Path tempDir) {
        Path input = tempDir.resolve("probes.json");
        Path pulled = tempDir.resolve("probes_pulled.json");
        Path ported = tempDir.resolve("probes_ported.json");
        RTLTools.writeJsonNetlist(input, DesignFixtures.createProbeHierarchy());

        PullControlRegisterProbes.main(new String[]{"-i", input.toString(), "-o", pulled.toString()});
        Assertions.assertTrue(Files.exists(pulled));
        RTLDesign d = RTLTools.readJsonNetlist(pulled);
        Assertions.assertTrue(d.getModule("A").getBoolAttribute(ProbeMarkers.REGSTATE_CELLS_PROBES));
        Assertions.assertEquals(4, d.getModule("A").getPorts().size());

        String out = captureOutput(() -> PortControlRegisterProbes.main(
                new String[]{"-i", pulled.toString(), "-o", ported.toString()}));
        Assertions.assertTrue(out.contains("Control register 1 starts at 2 and has width 2"), out);
        RTLModule top = RTLTools.readJsonNetlist(ported).getModule("A");
        Assertions.assertEquals(4, top.getWire(ProbePortAggregator.PORT_NAME).getWidth());
        Assertions.assertTrue(top.getWire(ProbePortAggregator.PORT_NAME).isPortOutput());
    }

    @Test
    public void testPortFuzzInputs(@TempDir Path tempDir) {
        Path input = tempDir.resolve("chain.json");
        Path output = tempDir.resolve("chain_fuzz.json");
        RTLTools.writeJsonNetlist(input, DesignFixtures.createResetSelectorChain());

        PortFuzzInputs.main(new String[]{"-i", input.toString(), "-o", output.toString(), "-x", "a,b"});
        RTLModule top = RTLTools.readJsonNetlist(output).getModule("top");
        Assertions.assertEquals(3, top.getWire(FuzzInputAggregator.PORT_NAME).getWidth());
        Assertions.assertTrue(top.getWire("a").isPortInput());
        Assertions.assertFalse(top.getWire("data_in").isPort());
    }

    @Test
    public void testMissingOutput(@TempDir Path tempDir) {
        Path input = tempDir.resolve("probes.json");
        RTLTools.writeJsonNetlist(input, DesignFixtures.createProbeHierarchy());
        RTLConfigurationException e = Assertions.assertThrows(RTLConfigurationException.class,
                () -> PullControlRegisterProbes.main(new String[]{"-i", input.toString()}));
        Assertions.assertEquals("ERROR: Missing required option -o/--output.", e.getMessage());
    }

    @Test
    public void testHelp() {
        String out = captureOutput(() -> PortFuzzInputs.main(new String[]{"-h"}));
        Assertions.assertTrue(out.contains("PortFuzzInputs"), out);
        Assertions.assertTrue(out.contains("--exclude"), out);
        out = captureOutput(() -> FindNextMux.main(new String[0]));
        Assertions.assertTrue(out.contains("--module"), out);
    }

    @Test
    public void testApplicationList() throws Throwable {
        Assertions.assertEquals(5, MainEntrypoint.getApplicationNames().size());
        Assertions.assertTrue(MainEntrypoint.getApplicationNames().contains("FindNextMux"));
        String out = captureOutput(() -> {
            try {
                MainEntrypoint.main(new String[]{"--list-apps"});
            } catch (Throwable t) {
                throw new RuntimeException(t);
            }
        });
        Assertions.assertTrue(out.contains("PullControlRegisterProbes"), out);
    }
}
