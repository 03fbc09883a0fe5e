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

import com.rtlprobe.instrument.ModuleTypeLister;
import com.rtlprobe.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * Prints the module types of a netlist.
 */
public class ListModuleTypes {

    private static OptionSet getOptions(String[] args) {
        OptionParser p = new OptionParser() {
            {
                ToolOptions.acceptInput(this);
                ToolOptions.acceptSelect(this);
                ToolOptions.acceptVerboseAndHelp(this);
            }
        };
        return ToolOptions.parse(p, args, ListModuleTypes.class.getSimpleName(),
                "Lists the module types of the selected modules.");
    }

    public static void main(String[] args) {
        OptionSet options = getOptions(args);
        if (options == null) {
            // Help message was invoked
            return;
        }
        for (String type : ModuleTypeLister.listModuleTypes(ToolOptions.readDesign(options))) {
            MessageGenerator.briefMessage("Module type: " + type);
        }
    }
}
