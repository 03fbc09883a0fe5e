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

package com.rtlprobe.util;

/**
 * Global settings of RTLProbe.  Every setting can be provided either as an
 * environment variable or as a JVM property of the same name; the
 * environment variable wins.
 */
public class Params {

    public static final String RTLPROBE_RESET_PATTERN_NAME = "RTLPROBE_RESET_PATTERN";

    public static final String RTLPROBE_DEFAULT_RESET_PATTERN = "rstz";

    public static final String RTLPROBE_VERBOSE_NAME = "RTLPROBE_VERBOSE";

    /**
     * Substring that identifies reset-like select signals.  A selector whose
     * select wire name contains it does not end a search for the next
     * selector: the search continues past its output instead.
     */
    public static String getResetPattern() {
        String value = getParamValue(RTLPROBE_RESET_PATTERN_NAME);
        return value == null || value.isEmpty() ? RTLPROBE_DEFAULT_RESET_PATTERN : value;
    }

    /**
     * @return True if the tools should report every step they take.
     */
    public static boolean isVerbose() {
        return isParamSet(RTLPROBE_VERBOSE_NAME);
    }

    /**
     * Checks if the named parameter is set via an environment variable or by
     * a JVM parameter of the same name.
     *
     * @param key Name of the parameter
     * @return True if the parameter is set (as defined by {@link #isSet(String)}),
     *         false otherwise
     */
    public static boolean isParamSet(String key) {
        return isSet(System.getenv(key)) || isSet(System.getProperty(key));
    }

    /**
     * Checks if a parameter is set by examining the provided value.
     *
     * @param value An environment variable or JVM parameter value
     * @return True if value is neither null, empty, "0" nor "false"
     *         (case-insensitive).
     */
    public static boolean isSet(String value) {
        return !(value == null
               || value.length() == 0
               || value.equals("0")
               || value.equalsIgnoreCase("false"));
    }

    /**
     * Gets the string value of the provided parameter name.
     *
     * @param key Name of the parameter to get.
     * @return The value of the parameter, or null if none was set.
     */
    public static String getParamValue(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return value;
    }
}
