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

/**
 * Raised when a pass is given bad arguments or the netlist holds malformed
 * names or port flags (for example a wire that is both an input and an
 * output, or a name that cannot be resolved).
 */
public class RTLConfigurationException extends RTLException {

    public RTLConfigurationException(String message) {
        super(message);
    }

    public RTLConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
