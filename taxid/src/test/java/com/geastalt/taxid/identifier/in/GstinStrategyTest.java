/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.lookup.EntryClass;
import com.geastalt.taxid.model.ParsedIdentifier;
import com.geastalt.taxid.model.ValidationErrorKind;
import com.geastalt.taxid.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GstinStrategyTest {

    private final GstinStrategy strategy = new GstinStrategy(new PanStrategy());

    @ParameterizedTest
    @ValueSource(strings = {"27AAPFU0939F1ZV", "27aapfu0939f1zv", "27-AAPFU0939F-1ZV", " 27 AAPFU0939F 1ZV ",
            "22AAAAA0000A1ZC", "27ABCPC1234D1ZH", "04ABCPC1234D1ZP", "99AAPFU0939F1ZK"})
    @DisplayName("Should accept valid GSTINs regardless of case and separators")
    void shouldAcceptValidGstins(String gstin) {
        ValidationResult result = strategy.validate(gstin);

        assertTrue(result.isValid(), () -> result.getError().map(Object::toString).orElse(""));
        assertTrue(result.getError().isEmpty());
    }

    @Test
    @DisplayName("Should expose segments of a valid GSTIN")
    void shouldExposeSegments() {
        ValidationResult result = strategy.validate("27AAPFU0939F1ZV");

        assertEquals("27AAPFU0939F1ZV", result.getNormalizedValue());
        assertEquals("27", result.getSegment("stateCode"));
        assertEquals("AAPFU0939F", result.getSegment("pan"));
        assertEquals("1", result.getSegment("entityNumber"));
        assertEquals("Z", result.getSegment("defaultChar"));
        assertEquals("V", result.getSegment("checkDigit"));
    }

    @ParameterizedTest
    @CsvSource({
            "'', MISSING_VALUE",
            "'   ', MISSING_VALUE",
            "27AAPFU0939F1Z, INVALID_LENGTH",
            "27AAPFU0939F1ZVX, INVALID_LENGTH",
            "AAAAPFU0939F1ZV, INVALID_FORMAT",
            "27AAPFU0939F0ZW, INVALID_FORMAT",
            "27AAPFU0939F1Z*, INVALID_FORMAT",
            "28AAPFU0939F1ZT, INVALID_LOOKUP_CODE",
            "27ABCDE1234F1Z0, INVALID_LOOKUP_CODE",
            "27AAPFU0939F1XV, INVALID_PREFIX",
            "27AAPFU0939F1ZW, INVALID_CHECK_DIGIT"
    })
    @DisplayName("Should report the first failing check")
    void shouldReportErrorKind(String gstin, ValidationErrorKind expected) {
        ValidationResult result = strategy.validate(gstin);

        assertFalse(result.isValid());
        assertEquals(expected, result.getErrorKind().orElseThrow());
        assertTrue(result.getSegments().isEmpty());
    }

    @Test
    @DisplayName("Should name the embedded PAN when its format is wrong")
    void shouldReportEmbeddedPanFormat() {
        ValidationResult result = strategy.validate("27123456789A1Z7");

        assertEquals(ValidationErrorKind.INVALID_FORMAT, result.getErrorKind().orElseThrow());
        assertTrue(result.getError().orElseThrow().message().contains("PAN"));
    }

    @Test
    @DisplayName("Should accept both codes of the merged Dadra and Nagar Haveli and Daman and Diu")
    void shouldAcceptMergedTerritoryCodes() {
        assertTrue(strategy.validate("26AAPFU0939F1ZX").isValid());
        assertTrue(strategy.validate("25AAPFU0939F1ZZ").isValid());
        assertEquals("Dadra and Nagar Haveli and Daman and Diu",
                strategy.parse("26AAPFU0939F1ZX").orElseThrow().resolvedEntry("stateCode").orElseThrow().name());
        assertEquals("26AAPFU0939F1ZX", strategy.generate(Map.of("stateCode", "26", "pan", "AAPFU0939F")));
    }

    @Test
    @DisplayName("Should prefer a lookup error over a check digit error")
    void shouldPreferEarlierErrorKind() {
        assertEquals(ValidationErrorKind.INVALID_LOOKUP_CODE,
                strategy.validate("28AAPFU0939F1ZW").getErrorKind().orElseThrow());
    }

    @Test
    @DisplayName("Should detect any single character change")
    void shouldDetectSingleCharacterChanges() {
        String valid = "27AAPFU0939F1ZV";
        for (int i = 0; i < valid.length(); i++) {
            char c = valid.charAt(i);
            char replacement = Character.isDigit(c) ? (char) ('0' + (c - '0' + 1) % 10) : (c == 'Z' ? 'A' : (char) (c + 1));
            String mutated = valid.substring(0, i) + replacement + valid.substring(i + 1);
            assertFalse(strategy.validate(mutated).isValid(), "Mutation at position " + i + ": " + mutated);
        }
    }

    @Test
    @DisplayName("Should resolve the state and PAN entity type when parsing")
    void shouldParseWithLookups() {
        ParsedIdentifier parsed = strategy.parse("27AAPFU0939F1ZV").orElseThrow();

        assertEquals("Maharashtra", parsed.resolvedEntry("stateCode").orElseThrow().name());
        assertEquals("Firm", parsed.resolvedEntry("pan").orElseThrow().name());
        assertEquals(EntryClass.SPECIAL_JURISDICTION,
                strategy.parse("99AAPFU0939F1ZK").orElseThrow().resolvedEntry("stateCode").orElseThrow().entryClass());
        assertTrue(strategy.parse("27AAPFU0939F1ZW").isEmpty());
    }

    @Test
    void formatsWithDefaultAndCustomSeparator() {
        assertEquals("27AAPFU0939F1ZV", strategy.format("27aapfu0939f1zv", null));
        assertEquals("27AAPFU0939F1ZV", strategy.format("27-aapfu0939f-1zv", null));
        assertEquals("27-AAPFU0939F-1ZV", strategy.format("27aapfu0939f1zv", "-"));
        assertEquals("27 AAPFU0939F 1ZV", strategy.format("27AAPFU0939F1ZV", " "));
        assertEquals("not a gstin", strategy.format("not a gstin", null));
    }

    @Test
    @DisplayName("Should generate a GSTIN and compute its check character")
    void shouldGenerate() {
        assertEquals("27AAPFU0939F1ZV", strategy.generate(Map.of("stateCode", "27", "pan", "aapfu0939f")));
        assertEquals("27AAPFU0939F2ZU",
                strategy.generate(Map.of("stateCode", "27", "pan", "AAPFU0939F", "entityNumber", "2")));
    }

    @Test
    void generatedValueRoundTrips() {
        String generated = strategy.generate(Map.of("stateCode", "33", "pan", "ABCPC1234D", "entityNumber", "A"));

        ValidationResult result = strategy.validate(generated);
        assertTrue(result.isValid());
        assertEquals(generated, strategy.generate(Map.of("stateCode", "33", "pan", "ABCPC1234D", "entityNumber", "A")));
    }

    @Test
    @DisplayName("Should refuse to generate from incomplete or invalid segments")
    void shouldRejectBadGeneratorInput() {
        IdentifierGenerationException missing = assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("stateCode", "27")));
        assertTrue(missing.getMessage().contains("pan"));

        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("stateCode", "28", "pan", "AAPFU0939F")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("stateCode", "27", "pan", "AAPFU0939F", "checkDigit", "V")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("stateCode", "7", "pan", "AAPFU0939F")));
        assertThrows(IdentifierGenerationException.class,
                () -> strategy.generate(Map.of("stateCode", "27", "pan", "AAPFU0939F", "branch", "1")));
    }
}
