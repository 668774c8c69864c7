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

class UkVatStrategyTest {

    private final UkVatStrategy strategy = new UkVatStrategy();

    @ParameterizedTest
    @ValueSource(strings = {"GB123456789", "GB 123 4567 89", "GB123456789012", "GBGD123", "gbha567"})
    void acceptsAllVariants(String vat) {
        assertTrue(strategy.validate(vat).isValid());
    }

    @ParameterizedTest
    @CsvSource({
            "123456789, INVALID_LENGTH",
            "GB12345678A, INVALID_FORMAT",
            "XX123456789, INVALID_PREFIX",
            "GBXX123, INVALID_PREFIX"
    })
    void rejectsInvalidNumbers(String vat, ValidationErrorKind expected) {
        assertEquals(expected, strategy.validate(vat).getErrorKind().orElseThrow());
    }

    @Test
    void formatsEachVariant() {
        assertEquals("GB 123 4567 89", strategy.format("GB123456789", null));
        assertEquals("GB 123 4567 89 012", strategy.format("GB123456789012", null));
        assertEquals("GB GD123", strategy.format("GBGD123", null));
    }

    @Test
    void generatesVariantFromSegments() {
        assertEquals("GB123456789", strategy.generate(Map.of("number", "123456789")));
        assertEquals("GBGD123", strategy.generate(Map.of("unitType", "GD", "number", "123")));
        assertEquals("GB123456789012", strategy.generate(Map.of("number", "123456789", "branch", "012")));
    }
}
