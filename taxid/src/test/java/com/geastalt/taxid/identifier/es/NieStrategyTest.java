/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

import com.geastalt.taxid.model.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NieStrategyTest {

    private final NieStrategy strategy = new NieStrategy();

    @ParameterizedTest
    @ValueSource(strings = {"X1234567L", "Y1234567X", "Z1234567R", "x-1234567-l"})
    @DisplayName("Should map the X, Y and Z prefixes to 0, 1 and 2")
    void shouldAcceptValidNies(String nie) {
        assertTrue(strategy.validate(nie).isValid());
    }

    @ParameterizedTest
    @CsvSource({
            "X123456L, INVALID_LENGTH",
            "X12345A7L, INVALID_FORMAT",
            "A1234567L, INVALID_PREFIX",
            "X1234567X, INVALID_CHECK_DIGIT"
    })
    void rejectsInvalidNies(String nie, ValidationErrorKind expected) {
        assertEquals(expected, strategy.validate(nie).getErrorKind().orElseThrow());
    }

    @Test
    void generatesWithDefaultPrefix() {
        assertEquals("X1234567L", strategy.generate(Map.of("number", "1234567")));
        assertEquals("Y1234567X", strategy.generate(Map.of("prefix", "y", "number", "1234567")));
    }

    @Test
    void parsesPrefix() {
        assertEquals("Y", strategy.parse("Y1234567X").orElseThrow().resolvedEntry("prefix").orElseThrow().code());
        assertEquals("X-1234567-L", strategy.format("X1234567L", null));
    }
}
