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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.rtlprobe.instrument.FuzzInputAggregator;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Merges the inputs of the top module into one fuzzing port.
 */
public class PortFuzzInputs {

    private static final List<String> EXCLUDE_OPTS = Arrays.asList("x", "exclude");

    private static OptionSet getOptions(String[] args) {
        OptionParser p = new OptionParser() {
            {
                ToolOptions.acceptInput(this);
                ToolOptions.acceptOutput(this);
                acceptsAll(EXCLUDE_OPTS, "Inputs to leave out of the fuzzing port, separated by commas")
                        .withRequiredArg().withValuesSeparatedBy(',');
                ToolOptions.acceptVerboseAndHelp(this);
            }
        };
        return ToolOptions.parse(p, args, PortFuzzInputs.class.getSimpleName(),
                "Concatenates the inputs of the top module to form the port '"
                + FuzzInputAggregator.PORT_NAME + "'.");
    }

    public static void main(String[] args) {
        OptionSet options = getOptions(args);
        if (options == null) {
            // Help message was invoked
            return;
        }
        List<String> excluded = options.has(EXCLUDE_OPTS.get(0))
                ? ToolOptions.toStrings(options.valuesOf(EXCLUDE_OPTS.get(0)))
                : Collections.emptyList();
        if (!excluded.isEmpty()) {
            MessageGenerator.briefMessage("Excluding signals " + String.join(",", excluded));
        }
        RTLDesign design = ToolOptions.readDesign(options);
        MessageGenerator.printHeader("Executing " + FuzzInputAggregator.PASS_NAME);
        new FuzzInputAggregator(ToolOptions.isVerbose(options)).createFuzzPort(design, excluded);
        ToolOptions.writeDesign(options, design);
    }
}
