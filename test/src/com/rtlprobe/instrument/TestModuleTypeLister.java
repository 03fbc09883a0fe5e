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

package com.rtlprobe.instrument;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.rtlprobe.netlist.DesignFixtures;
import com.rtlprobe.netlist.RTLConfigurationException;
import com.rtlprobe.netlist.RTLDesign;
import com.rtlprobe.netlist.RTLSelection;

public class TestModuleTypeLister {

    @Test
    public void testListModuleTypes() {
        RTLDesign d = DesignFixtures.createThreeLevelDesign();
        Assertions.assertEquals(Arrays.asList("leaf", "mid", "top"), ModuleTypeLister.listModuleTypes(d));

        d.setSelection(RTLSelection.ofModules(Arrays.asList("m*", "top")));
        Assertions.assertEquals(Arrays.asList("mid", "top"), ModuleTypeLister.listModuleTypes(d));
    }

    @Test
    public void testEmptySelection() {
        RTLDesign d = DesignFixtures.createThreeLevelDesign();
        d.setSelection(RTLSelection.ofModules(Collections.singletonList("none")));
        Assertions.assertThrows(RTLConfigurationException.class, () -> ModuleTypeLister.listModuleTypes(d));
    }
}
