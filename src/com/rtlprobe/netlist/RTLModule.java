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
/**
 *
 */
package com.rtlprobe.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Represents a module of a design: a named, reusable circuit definition
 * holding wires, cells and direct connections.  A module can be
 * instantiated by cells of other modules, whose type is then the name of
 * this module.
 */
public class RTLModule extends RTLAttributeObject {

    /** Attribute marking the top module of a design */
    public static final String TOP_ATTRIBUTE = "top";

    private RTLDesign design;

    private Map<String, RTLWire> wires;

    private Map<String, RTLCell> cells;

    private List<RTLConnection> connections;

    /** Names of processes that were not yet converted into cells */
    private List<String> processes;

    private int nextWireId = 0;

    private int nextCellId = 0;

    public RTLModule(String name) {
        super(name);
    }

    /**
     * @return the design
     */
    public RTLDesign getDesign() {
        return design;
    }

    protected void setDesign(RTLDesign design) {
        if (this.design != null && this.design != design) {
            throw new RTLConfigurationException("ERROR: Module " + getName() + " is already attached to a design.");
        }
        this.design = design;
    }

    /**
     * Creates a new internal wire in this module.
     * @param name Name of the wire, must be unique in this module.
     * @param width Width of the wire in bits.
     * @return The new wire.
     */
    public RTLWire addWire(String name, int width) {
        return addWire(new RTLWire(name, width));
    }

    /**
     * Adds the wire to this module.  Checks for a name collision.
     *
     * @param wire The wire to add to this module.
     * @return The wire added to the module.
     */
    public RTLWire addWire(RTLWire wire) {
        if (wires == null) wires = getNewMap();
        if (wires.containsKey(wire.getName())) {
            throw new RTLConfigurationException("ERROR: Name collision inside module " +
                    getName() + ", trying to add wire " + wire.getName() +
                    " which already exists inside this module.");
        }
        wire.setModule(this, nextWireId++);
        wires.put(wire.getName(), wire);
        return wire;
    }

    /**
     * @param name Name of the wire
     * @return The wire, or null if no wire by that name exists in this module.
     */
    public RTLWire getWire(String name) {
        if (wires == null) return null;
        return wires.get(name);
    }

    public Collection<RTLWire> getWires() {
        if (wires == null) return Collections.emptyList();
        return wires.values();
    }

    /**
     * Creates a new cell in this module.
     * @param name Name of the cell, must be unique in this module.
     * @param type Type of the cell: a built-in type or the name of a module.
     * @return The new cell.
     */
    public RTLCell addCell(String name, String type) {
        return addCell(new RTLCell(name, type));
    }

    public RTLCell addCell(RTLCell cell) {
        if (cells == null) cells = getNewMap();
        if (cells.containsKey(cell.getName())) {
            throw new RTLConfigurationException("ERROR: Name collision inside module " +
                    getName() + ", trying to add cell " + cell.getName() +
                    " which already exists inside this module.");
        }
        cell.setModule(this, nextCellId++);
        cells.put(cell.getName(), cell);
        return cell;
    }

    public RTLCell getCell(String name) {
        if (cells == null) return null;
        return cells.get(name);
    }

    public Collection<RTLCell> getCells() {
        if (cells == null) return Collections.emptyList();
        return cells.values();
    }

    /**
     * Adds a direct connection: lhs is driven by rhs.
     * @param lhs The driven signal
     * @param rhs The driving signal
     * @return The new connection
     */
    public RTLConnection connect(RTLSigSpec lhs, RTLSigSpec rhs) {
        checkSignalOwnership(lhs);
        checkSignalOwnership(rhs);
        RTLConnection conn = new RTLConnection(lhs, rhs);
        if (connections == null) connections = new ArrayList<>();
        connections.add(conn);
        return conn;
    }

    public RTLConnection connect(RTLWire lhs, RTLSigSpec rhs) {
        return connect(lhs.asSigSpec(), rhs);
    }

    public RTLConnection connect(RTLWire lhs, RTLWire rhs) {
        return connect(lhs.asSigSpec(), rhs.asSigSpec());
    }

    private void checkSignalOwnership(RTLSigSpec sig) {
        for (RTLWire w : sig.getWires()) {
            if (w.getModule() != this) {
                throw new RTLConfigurationException("ERROR: Wire " + w.getFullName()
                        + " does not belong to module " + getName());
            }
        }
    }

    public List<RTLConnection> getConnections() {
        if (connections == null) return Collections.emptyList();
        return Collections.unmodifiableList(connections);
    }

    /**
     * Records a process (a behavioral block) that has not been converted into
     * cells yet.  Analysis passes refuse to run on such modules.
     * @param name Name of the process
     */
    public void addProcess(String name) {
        if (processes == null) processes = new ArrayList<>();
        processes.add(name);
    }

    public List<String> getProcesses() {
        if (processes == null) return Collections.emptyList();
        return Collections.unmodifiableList(processes);
    }

    public boolean hasProcesses() {
        return processes != null && !processes.isEmpty();
    }

    /**
     * Checks that this module only holds structural content.
     * @param passName Name of the calling pass, used in the error message.
     * @throws RTLStructuralException if unresolved processes are present.
     */
    public void requireNoProcesses(String passName) {
        if (hasProcesses()) {
            throw new RTLStructuralException("ERROR: Unexpected process in module " + getName() + ". "
                    + passName + " requires a `proc` pass before.");
        }
    }

    /**
     * Renumbers the port ids of this module after port flags changed.  Ports
     * keep their relative order; new ports are appended, sorted by name.
     * Port ids are 1-based.
     */
    public void fixupPorts() {
        List<RTLWire> ports = getPorts();
        for (int i = 0; i < ports.size(); i++) {
            ports.get(i).setPortId(i + 1);
        }
        for (RTLWire w : getWires()) {
            if (!w.isPort()) w.setPortId(0);
        }
    }

    /**
     * @return The port wires of this module, ordered by port id.  Ports that
     * have not been numbered yet (see {@link #fixupPorts()}) come last,
     * sorted by name.
     */
    public List<RTLWire> getPorts() {
        List<RTLWire> ports = new ArrayList<>();
        for (RTLWire w : getWires()) {
            if (w.isPort()) ports.add(w);
        }
        ports.sort(Comparator.comparingInt((RTLWire w) -> w.getPortId() == 0 ? Integer.MAX_VALUE : w.getPortId())
                .thenComparing(RTLWire::getName));
        return ports;
    }

    /**
     * @return The wires of this module that are in the current selection of the design.
     */
    public List<RTLWire> selectedWires() {
        List<RTLWire> selected = new ArrayList<>();
        RTLSelection selection = getSelection();
        for (RTLWire w : getWires()) {
            if (selection.selected(this, w)) selected.add(w);
        }
        return selected;
    }

    /**
     * @return The cells of this module that are in the current selection of the design.
     */
    public List<RTLCell> selectedCells() {
        List<RTLCell> selected = new ArrayList<>();
        RTLSelection selection = getSelection();
        for (RTLCell c : getCells()) {
            if (selection.selected(this, c)) selected.add(c);
        }
        return selected;
    }

    private RTLSelection getSelection() {
        return design == null ? RTLSelection.ALL : design.getSelection();
    }

    public boolean isTop() {
        return getBoolAttribute(TOP_ATTRIBUTE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        if (!super.equals(o)) return false;
        return design == ((RTLModule) o).design;
    }

    @Override
    public int hashCode() {
        return super.hashCode();
    }
}
