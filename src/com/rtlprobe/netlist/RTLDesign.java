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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top level container of a netlist: keeps track of all {@link RTLModule}
 * objects of a design and of the selection passes operate on.
 */
public class RTLDesign extends RTLName {

    private Map<String, RTLModule> modules;

    private RTLSelection selection = RTLSelection.ALL;

    public RTLDesign(String name) {
        super(name);
    }

    public RTLModule addModule(String name) {
        return addModule(new RTLModule(name));
    }

    /**
     * Adds the provided module to the design. All modules must be unique by
     * their name.
     * @param module The module to add.
     * @return The module that has been added.
     */
    public RTLModule addModule(RTLModule module) {
        if (modules == null) modules = getNewMap();
        RTLModule collision = modules.get(module.getName());
        if (collision != null && collision != module) {
            throw new RTLConfigurationException("ERROR: Failed to add module " + module.getName()
                    + " to design " + getName() + ". The design already contains a module with the same name.");
        }
        module.setDesign(this);
        modules.put(module.getName(), module);
        return module;
    }

    /**
     * Resolves a cell type to the module it instantiates.
     * @param name Name of the module (a cell type).
     * @return The module or null if no module by that name exists.
     */
    public RTLModule getModule(String name) {
        return modules == null ? null : modules.get(name);
    }

    /**
     * @param cell A cell of this design.
     * @return The module the cell instantiates, or null for built-in cells.
     */
    public RTLModule getSubmodule(RTLCell cell) {
        return getModule(cell.getType());
    }

    public Collection<RTLModule> getModules() {
        return modules == null ? Collections.emptyList() : modules.values();
    }

    /**
     * Gets the top module: the module carrying the 'top' attribute or, if none
     * does, the only module that no other module instantiates.
     * @return The top module, or null if it cannot be determined.
     */
    public RTLModule getTopModule() {
        for (RTLModule m : getModules()) {
            if (m.isTop()) return m;
        }
        Set<RTLModule> instantiated = new HashSet<>();
        for (RTLModule m : getModules()) {
            for (RTLCell c : m.getCells()) {
                RTLModule sub = getModule(c.getType());
                if (sub != null) instantiated.add(sub);
            }
        }
        RTLModule top = null;
        for (RTLModule m : getModules()) {
            if (instantiated.contains(m)) continue;
            if (top != null) return null;
            top = m;
        }
        return top;
    }

    public void setTopModule(RTLModule top) {
        for (RTLModule m : getModules()) {
            m.removeAttribute(RTLModule.TOP_ATTRIBUTE);
        }
        top.setBoolAttribute(RTLModule.TOP_ATTRIBUTE);
    }

    public RTLSelection getSelection() {
        return selection;
    }

    public void setSelection(RTLSelection selection) {
        this.selection = selection == null ? RTLSelection.ALL : selection;
    }

    /**
     * @return The modules in the current selection, in design order.
     */
    public List<RTLModule> selectedModules() {
        List<RTLModule> selected = new ArrayList<>();
        for (RTLModule m : getModules()) {
            if (selection.selected(m)) selected.add(m);
        }
        return selected;
    }

    /**
     * Gets the selected modules, failing if there are none.
     * @param passName Name of the calling pass, used in the error message.
     * @return The non-empty list of selected modules.
     */
    public List<RTLModule> requireSelectedModules(String passName) {
        List<RTLModule> selected = selectedModules();
        if (selected.isEmpty()) {
            throw new RTLConfigurationException("ERROR: " + passName + " cannot operate on an empty selection.");
        }
        return selected;
    }
}
