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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestParams {

    @ParameterizedTest
    @CsvSource({
        "1, true",
        "true, true",
        "yes, true",
        "0, false",
        "false, false",
        "FALSE, false",
        "'', false",
    })
    public void testIsSet(String value, boolean expected) {
        Assertions.assertEquals(expected, Params.isSet(value));
    }

    @Test
    public void testNullIsNotSet() {
        Assertions.assertFalse(Params.isSet(null));
    }

    @Test
    public void testResetPatternProperty() {
        if (System.getenv(Params.RTLPROBE_RESET_PATTERN_NAME) != null) return;
        Assertions.assertEquals(Params.RTLPROBE_DEFAULT_RESET_PATTERN, Params.getResetPattern());
        System.setProperty(Params.RTLPROBE_RESET_PATTERN_NAME, "rst_n");
        try {
            Assertions.assertEquals("rst_n", Params.getResetPattern());
        } finally {
            System.clearProperty(Params.RTLPROBE_RESET_PATTERN_NAME);
        }
    }
}
