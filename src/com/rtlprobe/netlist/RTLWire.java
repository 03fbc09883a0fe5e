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

import java.util.Objects;

/**
 * Represents a named, fixed-width signal carrier within an {@link RTLModule}.
 * A wire may also be a port of its module, in which case it is either an
 * input or an output, never both.
 */
public class RTLWire extends RTLAttributeObject {

    private RTLModule module;

    /** Stable module-local identifier, assigned when the wire is added */
    private int id = -1;

    private int width = 1;

    private boolean portInput;

    private boolean portOutput;

    /** Position of this wire in the port list of its module (1-based), 0 if not a port */
    private int portId;

    public RTLWire(String name, int width) {
        super(name);
        setWidth(width);
    }

    /**
     * @return the module that owns this wire
     */
    public RTLModule getModule() {
        return module;
    }

    protected void setModule(RTLModule module, int id) {
        this.module = module;
        this.id = id;
    }

    /**
     * Gets the identifier of this wire, unique inside its module and stable
     * for the lifetime of the module.
     * @return The module-local wire id, or -1 if the wire is not attached.
     */
    public int getId() {
        return id;
    }

    /**
     * @return the width
     */
    public int getWidth() {
        return width;
    }

    /**
     * @param width the width to set
     */
    public void setWidth(int width) {
        if (width < 0) {
            throw new RTLConfigurationException("ERROR: Wire " + getName() + " cannot have negative width " + width);
        }
        this.width = width;
    }

    public boolean isPortInput() {
        return portInput;
    }

    public boolean isPortOutput() {
        return portOutput;
    }

    public boolean isPort() {
        return portInput || portOutput;
    }

    /**
     * Changes the input flag of this wire.  Call {@link RTLModule#fixupPorts()}
     * after changing port flags.
     * @param portInput The new flag value.
     * @throws RTLConfigurationException if the wire would become both an input
     * and an output.
     */
    public void setPortInput(boolean portInput) {
        if (portInput && portOutput) {
            throw new RTLConfigurationException("ERROR: Wire " + getFullName() + " is both input and output!");
        }
        this.portInput = portInput;
    }

    /**
     * Changes the output flag of this wire.  Call {@link RTLModule#fixupPorts()}
     * after changing port flags.
     * @param portOutput The new flag value.
     * @throws RTLConfigurationException if the wire would become both an input
     * and an output.
     */
    public void setPortOutput(boolean portOutput) {
        if (portOutput && portInput) {
            throw new RTLConfigurationException("ERROR: Wire " + getFullName() + " is both input and output!");
        }
        this.portOutput = portOutput;
    }

    public int getPortId() {
        return portId;
    }

    protected void setPortId(int portId) {
        this.portId = portId;
    }

    /**
     * @return The port direction of this wire, or null if it is not a port.
     */
    public RTLPortDirection getDirection() {
        return RTLPortDirection.getDir(this);
    }

    /**
     * @return A signal spanning all bits of this wire.
     */
    public RTLSigSpec asSigSpec() {
        return new RTLSigSpec(this);
    }

    /**
     * @return The name of this wire prefixed by its module name ("module.wire").
     */
    public String getFullName() {
        return module == null ? getName() : module.getName() + "." + getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        if (!super.equals(o)) return false;
        RTLWire other = (RTLWire) o;
        return id == other.id && module == other.module;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), id);
    }
}
