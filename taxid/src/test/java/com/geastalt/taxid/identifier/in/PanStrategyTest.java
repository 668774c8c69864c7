/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.model.ValidationErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PanStrategyTest {

    private final PanStrategy strategy = new PanStrategy();

    @ParameterizedTest
    @ValueSource(strings = {"AAPFU0939F", "abcpc1234d", "AAAAA0000A", "BBBTB1111Z"})
    void acceptsValidPans(String pan) {
        assertTrue(strategy.validate(pan).isValid());
    }

    @ParameterizedTest
    @CsvSource({
            "AAPFU093, INVALID_LENGTH",
            "1APFU0939F, INVALID_FORMAT",
            "AAPF10939F, INVALID_FORMAT",
            "AAPFUA939F, INVALID_FORMAT",
            "AAPFU09391, INVALID_FORMAT",
            "AAPDU0939F, INVALID_LOOKUP_CODE"
    })
    void rejectsInvalidPans(String pan, ValidationErrorKind expected) {
        assertEquals(expected, strategy.validate(pan).getErrorKind().orElseThrow());
    }

    @Test
    @DisplayName("Should resolve the entity type")
    void shouldResolveEntityType() {
        assertEquals("Firm", strategy.entityTypeOf("AAPFU0939F").orElseThrow().name());
        assertEquals("Company", strategy.parse("ABCCD1234E").orElseThrow().resolvedEntry("entityType").orElseThrow().name());
        assertEquals(10, strategy.getLookupTable().size());
    }

    @Test
    void formatsInGroups() {
        assertEquals("AAPFU 0939 F", strategy.format("aapfu0939f", null));
    }

    @Test
    @DisplayName("Should fill entity type and sequence defaults when generating")
    void shouldGenerateWithDefaults() {
        assertEquals("AAPPU0001F",
                strategy.generate(Map.of("holderSeries", "AAP", "nameInitial", "U", "checkLetter", "F")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("holderSeries", "AAP", "nameInitial", "U")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("holderSeries", "AAP", "entityType", "D", "nameInitial", "U",
                        "checkLetter", "F")));
    }
}
