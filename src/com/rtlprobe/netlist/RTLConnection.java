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

import java.util.Objects;

/**
 * A direct assignment between two signals of the same module, with no cell
 * in between.  The right hand side drives the left hand side.
 */
public class RTLConnection {

    private final RTLSigSpec lhs;

    private final RTLSigSpec rhs;

    public RTLConnection(RTLSigSpec lhs, RTLSigSpec rhs) {
        if (lhs.getWidth() != rhs.getWidth()) {
            throw new RTLConfigurationException("ERROR: Width mismatch in connection " + lhs + " = " + rhs
                    + " (" + lhs.getWidth() + " vs " + rhs.getWidth() + ")");
        }
        this.lhs = lhs;
        this.rhs = rhs;
    }

    /**
     * @return The driven side of the assignment.
     */
    public RTLSigSpec getLhs() {
        return lhs;
    }

    /**
     * @return The driving side of the assignment.
     */
    public RTLSigSpec getRhs() {
        return rhs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RTLConnection other = (RTLConnection) o;
        return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    @Override
    public String toString() {
        return lhs + " = " + rhs;
    }
}
