/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class Mod9ChecksumEngineTest {

    private final Mod9ChecksumEngine engine = new Mod9ChecksumEngine();

    @ParameterizedTest
    @CsvSource({
            "000012345678, 7",
            "000012050002, 8",
            "123456789012, 2",
            "100000000000, 8",
            "000000000000, 0"
    })
    @DisplayName("Should compute the leading check digit from the base number")
    void shouldComputeCheckDigit(String base, char expected) {
        assertEquals(expected, engine.compute(base));
    }

    @Test
    @DisplayName("Should map a raw result of 9 to 0")
    void shouldMapNineToZero() {
        // sum 0 gives 9 - 0 = 9
        assertEquals('0', engine.compute("000000000000"));
        // 9 in the twelfth position carries weight 2, sum 18
        assertEquals('0', engine.compute("000000000009"));
    }

    @Test
    @DisplayName("Should weight the base digits from the left")
    void shouldWeightFromTheLeft() {
        // weight 1 on the first digit, 2 on the twelfth
        assertEquals('8', engine.compute("100000000000"));
        assertEquals('7', engine.compute("000000000001"));
    }

    @Test
    void rejectsShortBase() {
        assertThrows(IllegalArgumentException.class, () -> engine.compute("00001234567"));
    }
}
