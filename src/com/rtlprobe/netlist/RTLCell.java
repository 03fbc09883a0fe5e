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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A cell in a module: an instance of either a built-in operation (see
 * {@link RTLCellTypes}) or of another {@link RTLModule}, in which case the
 * cell type is the name of that module.
 */
public class RTLCell extends RTLAttributeObject {

    private RTLModule module;

    /** Stable module-local identifier, assigned when the cell is added */
    private int id = -1;

    private final String type;

    /** Port connections, sorted by port name */
    private Map<String, RTLSigSpec> connections;

    private Map<String, RTLPortDirection> portDirections;

    private Map<String, String> parameters;

    public RTLCell(String name, String type) {
        super(name);
        this.type = type;
    }

    /**
     * @return the module containing this cell
     */
    public RTLModule getModule() {
        return module;
    }

    protected void setModule(RTLModule module, int id) {
        this.module = module;
        this.id = id;
    }

    /**
     * @return The module-local cell id, or -1 if the cell is not attached.
     */
    public int getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    /**
     * Connects a port of this cell to a signal, replacing any previous
     * connection of that port.
     * @param port Name of the port.
     * @param sig The signal to connect.
     */
    public void setPort(String port, RTLSigSpec sig) {
        if (connections == null) connections = new TreeMap<>();
        connections.put(port, sig);
    }

    public void setPort(String port, RTLWire wire) {
        setPort(port, wire.asSigSpec());
    }

    /**
     * @param port Name of the port.
     * @return The signal connected to the port, or null if unconnected.
     */
    public RTLSigSpec getPort(String port) {
        if (connections == null) return null;
        return connections.get(port);
    }

    public boolean hasPort(String port) {
        return connections != null && connections.containsKey(port);
    }

    public RTLSigSpec unsetPort(String port) {
        if (connections == null) return null;
        return connections.remove(port);
    }

    /**
     * @return The port connections of this cell, sorted by port name.
     */
    public Map<String, RTLSigSpec> getConnections() {
        return connections == null ? Collections.emptyMap() : Collections.unmodifiableMap(connections);
    }

    /**
     * Records the direction of a port.  Required for cells whose type is
     * neither a known built-in type nor a module of the design.
     */
    public void setPortDirection(String port, RTLPortDirection direction) {
        if (portDirections == null) portDirections = new TreeMap<>();
        portDirections.put(port, direction);
    }

    /**
     * Gets the direction of a port.  An explicit direction recorded on the
     * cell wins, then the port flags of the instantiated module, then the
     * built-in cell type table.
     * @param port Name of the port.
     * @return The direction, or null if it cannot be determined.
     */
    public RTLPortDirection getDirection(String port) {
        if (portDirections != null) {
            RTLPortDirection dir = portDirections.get(port);
            if (dir != null) return dir;
        }
        RTLModule submodule = getSubmodule();
        if (submodule != null) {
            RTLWire portWire = submodule.getWire(port);
            return portWire == null ? null : portWire.getDirection();
        }
        return RTLCellTypes.getPortDirection(type, port);
    }

    public boolean isInput(String port) {
        RTLPortDirection dir = getDirection(port);
        return dir != null && dir.isInput();
    }

    public boolean isOutput(String port) {
        RTLPortDirection dir = getDirection(port);
        return dir != null && dir.isOutput();
    }

    /**
     * @return The module instantiated by this cell, or null if this cell is a
     * built-in operation (or the cell is not attached to a design).
     */
    public RTLModule getSubmodule() {
        if (module == null || module.getDesign() == null) return null;
        return module.getDesign().getModule(type);
    }

    public boolean isModuleInstance() {
        return getSubmodule() != null;
    }

    public boolean isSelector() {
        return RTLCellTypes.isSelector(type);
    }

    public void setParameter(String key, String value) {
        if (parameters == null) parameters = getNewMap();
        parameters.put(key, value);
    }

    public String getParameter(String key) {
        return parameters == null ? null : parameters.get(key);
    }

    public Map<String, String> getParameters() {
        return parameters == null ? Collections.emptyMap() : parameters;
    }

    /**
     * @return The name of this cell prefixed by its module name ("module.cell").
     */
    public String getFullName() {
        return module == null ? getName() : module.getName() + "." + getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        if (!super.equals(o)) return false;
        RTLCell other = (RTLCell) o;
        return id == other.id && module == other.module;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), id);
    }
}
