/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.jp;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.model.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceRegistrationNumberStrategyTest {

    private final InvoiceRegistrationNumberStrategy strategy =
            new InvoiceRegistrationNumberStrategy(new CorporateNumberStrategy());

    @ParameterizedTest
    @ValueSource(strings = {"T7000012345678", "t7000012345678", "T8000012050002", "T7-0000-1234-5678"})
    void acceptsValidRegistrationNumbers(String number) {
        assertTrue(strategy.validate(number).isValid());
    }

    @ParameterizedTest
    @CsvSource({
            "7000012345678, INVALID_LENGTH",
            "T70000123456A8, INVALID_FORMAT",
            "X7000012345678, INVALID_PREFIX",
            "T2000012345678, INVALID_CHECK_DIGIT"
    })
    @DisplayName("Should check the T prefix before delegating the check digit")
    void shouldReportFirstFailingCheck(String number, ValidationErrorKind expected) {
        assertEquals(expected, strategy.validate(number).getErrorKind().orElseThrow());
    }

    @Test
    void generatesFromBaseOrCorporateNumber() {
        assertEquals("T7000012345678", strategy.generate(Map.of("base", "000012345678")));
        assertEquals("T7000012345678", strategy.generate(Map.of("corporateNumber", "7000012345678")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("base", "000012345678", "corporateNumber", "7000012345678")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("corporateNumber", "2000012345678")));
    }

    @Test
    void formats() {
        assertEquals("T7-0000-1234-5678", strategy.format("t7000012345678", null));
    }
}
