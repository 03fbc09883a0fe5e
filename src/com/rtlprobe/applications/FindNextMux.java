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
import java.util.List;

import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.trace.SelectLocation;
import com.rtlprobe.trace.SelectTracer;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Command line front end of {@link SelectTracer}: prints the select signal
 * of the next multiplexer a wire flows into.
 */
public class FindNextMux {

    private static final List<String> MODULE_OPTS = Arrays.asList("m", "module");

    private static final String DESCRIPTION =
            "Finds the next multiplexer given the name of a wire and prints its select signal.\n"
            + "Usage: FindNextMux -i <netlist.json> [options] <name of the wire>";

    private static OptionSet getOptions(String[] args) {
        OptionParser p = new OptionParser() {
            {
                ToolOptions.acceptInput(this);
                ToolOptions.acceptSelect(this);
                acceptsAll(MODULE_OPTS, "Only consider modules whose name contains this string").withRequiredArg();
                ToolOptions.acceptVerboseAndHelp(this);
            }
        };
        return ToolOptions.parse(p, args, FindNextMux.class.getSimpleName(), DESCRIPTION);
    }

    public static SelectLocation run(RTLDesign design, OptionSet options) {
        List<?> positional = options.nonOptionArguments();
        if (positional.isEmpty()) {
            throw new RTLConfigurationException("ERROR: " + SelectTracer.PASS_NAME
                    + " requires an argument: the name of the wire.");
        }
        String wireName = positional.get(0).toString();
        Object moduleFilter = options.valueOf(MODULE_OPTS.get(0));
        return new SelectTracer().findNextMux(design, wireName,
                moduleFilter == null ? null : moduleFilter.toString(), ToolOptions.isVerbose(options));
    }

    public static void main(String[] args) {
        OptionSet options = getOptions(args);
        if (options == null) {
            // Help message was invoked
            return;
        }
        run(ToolOptions.readDesign(options), options);
    }
}
