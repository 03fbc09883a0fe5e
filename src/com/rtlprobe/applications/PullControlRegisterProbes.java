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

import com.rtlprobe.instrument.ProbePuller;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Pulls the probes of marked registers up to the top module.
 */
public class PullControlRegisterProbes {

    private static OptionSet getOptions(String[] args) {
        OptionParser p = new OptionParser() {
            {
                ToolOptions.acceptInput(this);
                ToolOptions.acceptOutput(this);
                ToolOptions.acceptSelect(this);
                ToolOptions.acceptVerboseAndHelp(this);
            }
        };
        return ToolOptions.parse(p, args, PullControlRegisterProbes.class.getSimpleName(),
                "Creates an output wire for every chunk of the output of each register marked '"
                + "regstate_cell' and threads it through the module hierarchy up to the top module.");
    }

    public static void main(String[] args) {
        OptionSet options = getOptions(args);
        if (options == null) {
            // Help message was invoked
            return;
        }
        RTLDesign design = ToolOptions.readDesign(options);
        MessageGenerator.printHeader("Executing " + ProbePuller.PASS_NAME);
        new ProbePuller(ToolOptions.isVerbose(options)).pullProbes(design);
        ToolOptions.writeDesign(options, design);
    }
}
