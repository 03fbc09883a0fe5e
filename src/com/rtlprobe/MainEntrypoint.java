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

package com.rtlprobe;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.rtlprobe.applications.FindNextMux;
import com.rtlprobe.applications.ListModuleTypes;
import com.rtlprobe.applications.PortControlRegisterProbes;
import com.rtlprobe.applications.PortFuzzInputs;
import com.rtlprobe.applications.PullControlRegisterProbes;
import com.rtlprobe.netlist.RTLException;
import com.rtlprobe.util.MessageGenerator;

/**
 * Main entry point of the RTLProbe jar: the first argument names the tool
 * to run, the remaining arguments are passed on to it.
 */
public class MainEntrypoint {
    interface MainStyleFunction<E extends Throwable> {
        void main(String[] args) throws E;
    }

    private static final Map<String, MainStyleFunction<?>> functions = new HashMap<>();
    private static final List<String> functionNames = new ArrayList<>();

    private static void addFunction(String name, MainStyleFunction<?> func) {
        functions.put(name.toLowerCase(), func);
        functionNames.add(name);
    }

    static {
        addFunction("FindNextMux", FindNextMux::main);
        addFunction("ListModuleTypes", ListModuleTypes::main);
        addFunction("PortControlRegisterProbes", PortControlRegisterProbes::main);
        addFunction("PortFuzzInputs", PortFuzzInputs::main);
        addFunction("PullControlRegisterProbes", PullControlRegisterProbes::main);
    }

    private static void listModes(PrintStream ps) {
        for (String name : functionNames) {
            ps.println("    " + name);
        }
    }

    public static List<String> getApplicationNames() {
        return functionNames;
    }

    public static void main(String[] args) throws Throwable {
        if (args.length == 0) {
            System.err.println("Need one argument to determine the application. Valid applications are (case-insensitive):");
            listModes(System.err);
            System.exit(1);
        }

        if (args[0].equals("--list-apps")) {
            System.out.println("Current list of available RTLProbe applications (case-insensitive):");
            listModes(System.out);
            return;
        }

        String application = args[0];
        MainStyleFunction<?> func = functions.get(application.toLowerCase());
        if (func == null) {
            System.err.println("Invalid application '" + application + "'. Valid applications are (case-insensitive): ");
            listModes(System.err);
            System.exit(1);
        }

        String[] childArgs = new String[args.length - 1];
        System.arraycopy(args, 1, childArgs, 0, args.length - 1);
        try {
            func.main(childArgs);
        } catch (RTLException e) {
            MessageGenerator.briefErrorAndExit(e.getMessage());
        }
    }
}
