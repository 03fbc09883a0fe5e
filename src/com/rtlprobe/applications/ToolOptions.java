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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLSelection;
import com.rtlprobe.netlist.RTLTools;
import com.rtlprobe.util.MessageGenerator;
import com.rtlprobe.util.Params;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Options shared by the command line tools.
 */
public class ToolOptions {

    public static final List<String> INPUT_OPTS = Arrays.asList("i", "input");
    public static final List<String> OUTPUT_OPTS = Arrays.asList("o", "output");
    public static final List<String> SELECT_OPTS = Arrays.asList("s", "select");
    public static final List<String> VERBOSE_OPTS = Arrays.asList("v", "verbose");
    public static final List<String> HELP_OPTS = Arrays.asList("?", "h", "help");

    static void acceptInput(OptionParser p) {
        p.acceptsAll(INPUT_OPTS, "Input JSON netlist (as written by 'yosys write_json')").withRequiredArg();
    }

    static void acceptOutput(OptionParser p) {
        p.acceptsAll(OUTPUT_OPTS, "Output JSON netlist").withRequiredArg();
    }

    static void acceptSelect(OptionParser p) {
        p.acceptsAll(SELECT_OPTS, "Modules to operate on, separated by commas, '*' wildcards allowed "
                + "(default: all modules)").withRequiredArg().withValuesSeparatedBy(',');
    }

    static void acceptVerboseAndHelp(OptionParser p) {
        p.acceptsAll(VERBOSE_OPTS, "Print every step taken");
        p.acceptsAll(HELP_OPTS, "Print this help message").forHelp();
    }

    static void printHelp(OptionParser p, String toolName, String description) {
        MessageGenerator.printHeader(toolName);
        System.out.println(description);
        try {
            p.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses the arguments, printing the help message when asked for or when
     * there are no arguments.
     * @return The options, or null if the help message was printed.
     */
    static OptionSet parse(OptionParser p, String[] args, String toolName, String description) {
        OptionSet options = p.parse(args);
        if (options.has(HELP_OPTS.get(0)) || args.length == 0) {
            printHelp(p, toolName, description);
            return null;
        }
        return options;
    }

    static boolean isVerbose(OptionSet options) {
        return options.has(VERBOSE_OPTS.get(0)) || Params.isVerbose();
    }

    /**
     * Reads the input netlist and applies the module selection, if any.
     */
    static RTLDesign readDesign(OptionSet options) {
        String input = requiredValue(options, INPUT_OPTS);
        RTLDesign design = RTLTools.readJsonNetlist(input);
        if (options.has(SELECT_OPTS.get(0))) {
            List<String> patterns = toStrings(options.valuesOf(SELECT_OPTS.get(0)));
            design.setSelection(RTLSelection.ofModules(patterns));
        }
        return design;
    }

    static void writeDesign(OptionSet options, RTLDesign design) {
        String output = requiredValue(options, OUTPUT_OPTS);
        RTLTools.writeJsonNetlist(output, design);
        MessageGenerator.briefMessage("Wrote netlist " + output);
    }

    static String requiredValue(OptionSet options, List<String> opts) {
        Object value = options.valueOf(opts.get(0));
        if (value == null) {
            throw new RTLConfigurationException("ERROR: Missing required option -" + opts.get(0)
                    + "/--" + opts.get(1) + ".");
        }
        return value.toString();
    }

    static List<String> toStrings(List<?> values) {
        String[] result = new String[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i).toString();
        }
        return Arrays.asList(result);
    }
}
