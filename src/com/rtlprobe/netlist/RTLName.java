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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * This class serves as the universal common ancestor for all netlist
 * objects.  Primarily it serves to manage the name of the object and to tell
 * apart public (user-given) names from auto-generated ones.
 */
public class RTLName implements Comparable<RTLName> {

    /** Prefix of names generated by synthesis passes rather than by the designer */
    public static final char PRIVATE_NAME_PREFIX = '$';

    /** Name of the netlist object */
    private final String name;

    public RTLName(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Checks if this name was given by the designer.  Auto-generated names
     * (such as those created by synthesis passes) start with '$'.
     * @return True if the name is public, false otherwise.
     */
    public boolean isPublicName() {
        return isPublicName(name);
    }

    public static boolean isPublicName(String name) {
        return name != null && !name.isEmpty() && name.charAt(0) != PRIVATE_NAME_PREFIX;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        RTLName other = (RTLName) obj;
        return Objects.equals(name, other.name);
    }

    public String toString() {
        return name;
    }

    /**
     * Netlist maps keep insertion order so that every pass sees objects in
     * the order they were read or created.
     */
    public static <K, V> Map<K, V> getNewMap() {
        return new LinkedHashMap<K,V>(4);
    }

    public int compareTo(RTLName o) {
        return this.getName().compareTo(o.getName());
    }
}
