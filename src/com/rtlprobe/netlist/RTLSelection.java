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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides which modules, wires and cells of a design are in scope of a pass.
 * Passes only consume the predicates; how the scope was chosen is up to the
 * caller.
 */
public interface RTLSelection {

    /** Selects every object of the design */
    RTLSelection ALL = module -> true;

    boolean selected(RTLModule module);

    default boolean selected(RTLModule module, RTLWire wire) {
        return selected(module);
    }

    default boolean selected(RTLModule module, RTLCell cell) {
        return selected(module);
    }

    /**
     * Selects whole modules whose names match one of the provided patterns.
     * A pattern may contain '*' wildcards.
     * @param patterns Module names or wildcard patterns.
     * @return The selection.
     */
    static RTLSelection ofModules(Collection<String> patterns) {
        List<Pattern> compiled = new ArrayList<>(patterns.size());
        for (String p : patterns) {
            compiled.add(Pattern.compile(convertWildcardToRegex(p)));
        }
        return module -> {
            for (Pattern p : compiled) {
                if (p.matcher(module.getName()).matches()) return true;
            }
            return false;
        };
    }

    static String convertWildcardToRegex(String wildcardPattern) {
        StringBuilder sb = new StringBuilder();
        for (int i=0; i < wildcardPattern.length(); i++) {
            char c = wildcardPattern.charAt(i);
            switch (c) {
                case '*':
                    sb.append(".*");
                    break;
                case '?': case '\\': case '{': case '}': case '|': case '.': case '+':
                case '^': case '$':  case '(': case ')': case '[': case ']':
                    sb.append("\\");
                    sb.append(c);
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
