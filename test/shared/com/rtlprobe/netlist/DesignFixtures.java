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

/**
 * Small hand-built netlists shared by the tests.
 */
public class DesignFixtures {

    public static RTLWire addInput(RTLModule m, String name, int width) {
        RTLWire w = m.addWire(name, width);
        w.setPortInput(true);
        return w;
    }

    public static RTLWire addOutput(RTLModule m, String name, int width) {
        RTLWire w = m.addWire(name, width);
        w.setPortOutput(true);
        return w;
    }

    public static RTLCell addMux(RTLModule m, String name, RTLWire a, RTLWire b, RTLSigSpec s, RTLWire y) {
        RTLCell c = m.addCell(name, RTLCellTypes.MUX);
        c.setPort("A", a);
        c.setPort("B", b);
        c.setPort(RTLCellTypes.SELECT_PORT, s);
        c.setPort(RTLCellTypes.OUTPUT_PORT, y);
        return c;
    }

    public static RTLCell addMux(RTLModule m, String name, RTLWire a, RTLWire b, RTLWire s, RTLWire y) {
        return addMux(m, name, a, b, s.asSigSpec(), y);
    }

    public static RTLCell addGate(RTLModule m, String name, String type, RTLWire y, RTLWire... inputs) {
        RTLCell c = m.addCell(name, type);
        String[] ports = {"A", "B"};
        for (int i = 0; i < inputs.length; i++) {
            c.setPort(ports[i], inputs[i]);
        }
        c.setPort("Y", y);
        return c;
    }

    /**
     * Module "top": data_in goes through mux sel1 (select rstz_ctrl) into
     * n1, which feeds mux sel2 (select mode_sel) driving y.
     */
    public static RTLDesign createResetSelectorChain() {
        RTLDesign d = new RTLDesign("reset_chain");
        RTLModule top = d.addModule("top");
        RTLWire dataIn = addInput(top, "data_in", 1);
        RTLWire rstz = addInput(top, "rstz_ctrl", 1);
        RTLWire mode = addInput(top, "mode_sel", 1);
        RTLWire a = addInput(top, "a", 1);
        RTLWire b = addInput(top, "b", 1);
        RTLWire n1 = top.addWire("n1", 1);
        RTLWire y = addOutput(top, "y", 1);
        addMux(top, "sel1", dataIn, a, rstz, n1);
        addMux(top, "sel2", n1, b, mode, y);
        top.fixupPorts();
        top.setBoolAttribute(RTLModule.TOP_ATTRIBUTE);
        return d;
    }

    /**
     * Module "leaf" selects between in_sig and other with sel_leaf. Module
     * "top" instantiates it as u_leaf, feeding in_sig from data.
     */
    public static RTLDesign createDescentDesign() {
        RTLDesign d = new RTLDesign("descent");
        RTLModule leaf = d.addModule("leaf");
        RTLWire inSig = addInput(leaf, "in_sig", 1);
        RTLWire other = addInput(leaf, "other", 1);
        RTLWire selLeaf = addInput(leaf, "sel_leaf", 1);
        RTLWire out = addOutput(leaf, "out", 1);
        addMux(leaf, "m0", inSig, other, selLeaf, out);
        leaf.fixupPorts();

        RTLModule top = d.addModule("top");
        RTLWire data = addInput(top, "data", 1);
        RTLWire ctrl = addInput(top, "ctrl", 1);
        RTLWire res = addOutput(top, "res", 1);
        RTLCell u = top.addCell("u_leaf", "leaf");
        u.setPort("in_sig", data);
        u.setPort("other", RTLSigSpec.constant("0"));
        u.setPort("sel_leaf", ctrl);
        u.setPort("out", res);
        top.fixupPorts();
        return d;
    }

    /**
     * Module "child" forwards x to x_out.  Module "parent" instantiates it as
     * u_child and feeds c_out (bound to x_out) into mux pm selected by p_sel.
     */
    public static RTLDesign createAscentDesign() {
        RTLDesign d = new RTLDesign("ascent");
        RTLModule child = d.addModule("child");
        RTLWire x = addInput(child, "x", 1);
        RTLWire xOut = addOutput(child, "x_out", 1);
        child.connect(xOut, x);
        child.fixupPorts();

        RTLModule parent = d.addModule("parent");
        RTLWire pIn = addInput(parent, "p_in", 1);
        RTLWire pSel = addInput(parent, "p_sel", 1);
        RTLWire pB = addInput(parent, "p_b", 1);
        RTLWire pY = addOutput(parent, "p_y", 1);
        RTLWire cOut = parent.addWire("c_out", 1);
        RTLCell u = parent.addCell("u_child", "child");
        u.setPort("x", pIn);
        u.setPort("x_out", cOut);
        addMux(parent, "pm", cOut, pB, pSel, pY);
        parent.fixupPorts();
        return d;
    }

    /**
     * Three levels of hierarchy: "A" instantiates "B" as u_b, "B"
     * instantiates "C" as u_c[0].  "C" holds register r (the first cell of
     * "C") marked regstate_cell, whose Q port is {q_hi[2:1], q_lo}.
     */
    public static RTLDesign createProbeHierarchy() {
        RTLDesign d = new RTLDesign("probes");
        RTLModule c = d.addModule("C");
        RTLWire clk = addInput(c, "clk", 1);
        RTLWire dIn = addInput(c, "d", 4);
        RTLWire qLo = c.addWire("q_lo", 2);
        RTLWire qHi = c.addWire("q_hi", 4);
        RTLCell r = c.addCell("r", RTLCellTypes.DFF);
        r.setAttribute("regstate_cell", "1");
        r.setPort("CLK", clk);
        r.setPort("D", dIn);
        r.setPort(RTLCellTypes.STORAGE_OUTPUT_PORT, new RTLSigSpec(qLo).append(new RTLSigChunk(qHi, 1, 2)));
        c.fixupPorts();

        RTLModule b = d.addModule("B");
        RTLWire bClk = addInput(b, "clk", 1);
        RTLWire bd = addInput(b, "bd", 4);
        RTLCell uc = b.addCell("u_c[0]", "C");
        uc.setPort("clk", bClk);
        uc.setPort("d", bd);
        b.fixupPorts();

        RTLModule a = d.addModule("A");
        RTLWire aClk = addInput(a, "clk", 1);
        RTLWire ad = addInput(a, "ad", 4);
        RTLCell ub = a.addCell("u_b", "B");
        ub.setPort("clk", aClk);
        ub.setPort("bd", ad);
        a.fixupPorts();
        a.setBoolAttribute(RTLModule.TOP_ATTRIBUTE);
        return d;
    }

    /**
     * "top" instantiates "mid" and "leaf", "mid" instantiates "leaf".
     */
    public static RTLDesign createThreeLevelDesign() {
        RTLDesign d = new RTLDesign("three_levels");
        RTLModule top = d.addModule("top");
        RTLModule mid = d.addModule("mid");
        d.addModule("leaf");
        top.addCell("u_mid", "mid");
        top.addCell("u_leaf", "leaf");
        mid.addCell("u_leaf", "leaf");
        return d;
    }
}
