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

package com.rtlprobe.hierarchy;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

import com.rtlprobe.netlist.RTLCell;
import com.rtlprobe.netlist.RTLModule;

/**
 * Assigns a single instantiating parent to every module instantiated by a
 * selected cell of the modules provided.  When a module is instantiated by
 * several modules, the first one found keeps the role.
 */
public class ModuleParentMap {

    private final Map<RTLModule, RTLModule> parents = new HashMap<>();

    public static ModuleParentMap build(Collection<RTLModule> modules) {
        ModuleParentMap map = new ModuleParentMap();
        for (RTLModule module : modules) {
            for (RTLCell cell : module.selectedCells()) {
                RTLModule child = cell.getSubmodule();
                if (child != null) {
                    map.parents.putIfAbsent(child, module);
                }
            }
        }
        return map;
    }

    /**
     * @return The parent of the module, or null if none is known.
     */
    public RTLModule getParent(RTLModule module) {
        return parents.get(module);
    }
}
