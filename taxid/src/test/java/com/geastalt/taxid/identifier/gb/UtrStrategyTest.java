/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.gb;

import com.geastalt.taxid.model.ValidationErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UtrStrategyTest {

    private final UtrStrategy strategy = new UtrStrategy();

    @ParameterizedTest
    @ValueSource(strings = {"1234567891", "12345 67891", "9876543219", "0000000001", "0000000060"})
    void acceptsValidUtrs(String utr) {
        assertTrue(strategy.validate(utr).isValid());
    }

    @ParameterizedTest
    @CsvSource({
            "123456789, INVALID_LENGTH",
            "12345678A1, INVALID_FORMAT",
            "1234567890, INVALID_CHECK_DIGIT"
    })
    void rejectsInvalidUtrs(String utr, ValidationErrorKind expected) {
        assertEquals(expected, strategy.validate(utr).getErrorKind().orElseThrow());
    }

    @Test
    void generatesAndFormats() {
        assertEquals("9876543219", strategy.generate(Map.of("reference", "987654321")));
        assertEquals("12345 67891", strategy.format("1234567891", null));
    }
}
