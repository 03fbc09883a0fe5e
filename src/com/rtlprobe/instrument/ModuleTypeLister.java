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

package com.rtlprobe.instrument;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLModule;

/**
 * Lists the module types in the selection of a design.
 */
public class ModuleTypeLister {

    public static final String PASS_NAME = "list_module_types";

    /**
     * @param design The design.
     * @return The distinct names of the selected modules, sorted.
     * @throws com.rtlprobe.netlist.RTLConfigurationException if the selection is empty.
     */
    public static List<String> listModuleTypes(RTLDesign design) {
        TreeSet<String> names = new TreeSet<>();
        for (RTLModule m : design.requireSelectedModules(PASS_NAME)) {
            names.add(m.getName());
        }
        return new ArrayList<>(names);
    }
}
