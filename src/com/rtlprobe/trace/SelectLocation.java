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

package com.rtlprobe.trace;

import java.util.Objects;

/**
 * Where the select tracer stopped: the name of a select signal and the
 * module holding it.
 */
public class SelectLocation {

    public static final String NONE_NAME = "NONE";

    /** Returned when no qualifying select signal is reachable */
    public static final SelectLocation NONE = new SelectLocation(NONE_NAME, NONE_NAME);

    private final String signalName;

    private final String moduleName;

    public SelectLocation(String signalName, String moduleName) {
        this.signalName = signalName;
        this.moduleName = moduleName;
    }

    public String getSignalName() {
        return signalName;
    }

    public String getModuleName() {
        return moduleName;
    }

    public boolean isFound() {
        return this != NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SelectLocation other = (SelectLocation) o;
        return signalName.equals(other.signalName) && moduleName.equals(other.moduleName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signalName, moduleName);
    }

    @Override
    public String toString() {
        return signalName + " (module: " + moduleName + ")";
    }
}
