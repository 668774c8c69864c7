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

class Mod11WeightedChecksumEngineTest {

    private final Mod11WeightedChecksumEngine engine = new Mod11WeightedChecksumEngine(6, 7, 8, 9, 10, 5, 4, 3, 2);

    @ParameterizedTest
    @CsvSource({
            "123456789, 1",
            "987654321, 9",
            "000000000, 1",
            "111111111, 1",
            "000000006, 0"
    })
    @DisplayName("Should compute UTR check digits")
    void shouldComputeCheckDigit(String reference, char expected) {
        assertEquals(expected, engine.compute(reference));
    }

    @Test
    @DisplayName("Should map a raw result of 10 to 0")
    void shouldMapTenToZero() {
        // 6 * 2 = 12, 12 % 11 = 1, 11 - 1 = 10
        assertEquals('0', engine.compute("000000006"));
    }

    @Test
    @DisplayName("Should reject a payload that does not match the weights")
    void shouldRejectWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> engine.compute("12345678"));
    }

    @Test
    void requiresWeights() {
        assertThrows(IllegalArgumentException.class, () -> new Mod11WeightedChecksumEngine());
    }
}
