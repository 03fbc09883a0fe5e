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
 * Common ancestor of all fatal errors raised while analyzing or
 * instrumenting a netlist.  None of them are recoverable: they abort the
 * running pass.
 */
public class RTLException extends RuntimeException {

    public RTLException(String message) {
        super(message);
    }

    public RTLException(String message, Throwable cause) {
        super(message, cause);
    }
}
