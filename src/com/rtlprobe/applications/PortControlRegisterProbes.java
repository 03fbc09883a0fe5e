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

import com.rtlprobe.instrument.ProbePortAggregator;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Merges the register probe outputs of the top module into one port.
 */
public class PortControlRegisterProbes {

    private static OptionSet getOptions(String[] args) {
        OptionParser p = new OptionParser() {
            {
                ToolOptions.acceptInput(this);
                ToolOptions.acceptOutput(this);
                ToolOptions.acceptVerboseAndHelp(this);
            }
        };
        return ToolOptions.parse(p, args, PortControlRegisterProbes.class.getSimpleName(),
                "Concatenates the control register probe signals of the top module to form the port '"
                + ProbePortAggregator.PORT_NAME + "'.");
    }

    public static void main(String[] args) {
        OptionSet options = getOptions(args);
        if (options == null) {
            // Help message was invoked
            return;
        }
        RTLDesign design = ToolOptions.readDesign(options);
        MessageGenerator.printHeader("Executing " + ProbePortAggregator.PASS_NAME);
        new ProbePortAggregator(ToolOptions.isVerbose(options)).createProbePort(design);
        ToolOptions.writeDesign(options, design);
    }
}
