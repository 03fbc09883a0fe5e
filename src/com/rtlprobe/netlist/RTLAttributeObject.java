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

/**
 * All netlist objects that can carry attributes inherit from this class.
 * Attribute values are kept as strings.  Boolean markers follow the
 * convention of Yosys netlists: a 32-bit binary constant, where any set bit
 * means true.
 */
public class RTLAttributeObject extends RTLName {

    public static final String BOOL_TRUE = "00000000000000000000000000000001";

    public static final String BOOL_FALSE = "00000000000000000000000000000000";

    private Map<String,String> attributes;

    public RTLAttributeObject(String name) {
        super(name);
    }

    /**
     * Adds the attribute entry mapping for this object.
     * @param key Key entry for the attribute
     * @param value Value entry for the attribute
     * @return Old attribute value for the provided key
     */
    public String setAttribute(String key, String value) {
        if (attributes == null) attributes = getNewMap();
        return attributes.put(key, value);
    }

    public String getAttribute(String key) {
        if (attributes == null) return null;
        return attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes != null && attributes.containsKey(key);
    }

    /**
     * Convenience method to remove an attribute
     * @param key Name of the attribute
     * @return The old attribute value or null if none existed
     */
    public String removeAttribute(String key) {
        if (attributes == null) return null;
        return attributes.remove(key);
    }

    /**
     * Sets a boolean marker attribute to true.
     * @param key Name of the marker
     */
    public void setBoolAttribute(String key) {
        setBoolAttribute(key, true);
    }

    public void setBoolAttribute(String key, boolean value) {
        setAttribute(key, value ? BOOL_TRUE : BOOL_FALSE);
    }

    /**
     * Interprets the named attribute as a boolean marker.
     * @param key Name of the marker
     * @return True if the attribute exists and holds a non-zero value (or
     * the string "true"), false otherwise.
     */
    public boolean getBoolAttribute(String key) {
        return isTrueValue(getAttribute(key));
    }

    public static boolean isTrueValue(String value) {
        if (value == null || value.isEmpty() || value.equalsIgnoreCase("false")) return false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '0' && c != 'x' && c != 'z') return true;
        }
        return false;
    }

    /**
     * Get all attributes in native format
     */
    public Map<String, String> getAttributesMap() {
        if (attributes == null) {
            return Collections.emptyMap();
        }
        return attributes;
    }
}
