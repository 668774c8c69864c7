/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import com.geastalt.taxid.checksum.Mod23LetterChecksumEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaTest {

    @Test
    @DisplayName("Should extract segments in declaration order")
    void shouldExtractSegmentsInOrder() {
        Schema schema = Schema.of("NIF", new Mod23LetterChecksumEngine(),
                Segment.of("number", 0, 8, CharClass.DIGIT, SegmentRole.SEQUENCE),
                Segment.checkDigit("checkLetter", 8, CharClass.ALPHA));

        Map<String, String> segments = schema.extract("12345678Z");

        assertEquals(9, schema.length());
        assertEquals(List.of("number", "checkLetter"), List.copyOf(segments.keySet()));
        assertEquals("12345678", segments.get("number"));
        assertEquals("checkLetter", schema.checkSegment().orElseThrow().name());
        assertThrows(IllegalArgumentException.class, () -> schema.extract("1234"));
    }

    @Test
    @DisplayName("Should reject segments with gaps")
    void shouldRejectGaps() {
        assertThrows(IllegalArgumentException.class, () -> Schema.of("GAP", null,
                Segment.of("a", 0, 2, CharClass.DIGIT, SegmentRole.SEQUENCE),
                Segment.of("b", 3, 5, CharClass.DIGIT, SegmentRole.SEQUENCE)));
    }

    @Test
    @DisplayName("Should require a check segment when a checksum engine is present")
    void shouldRequireCheckSegmentForEngine() {
        assertThrows(IllegalArgumentException.class, () -> Schema.of("NOCHECK", new Mod23LetterChecksumEngine(),
                Segment.of("number", 0, 8, CharClass.DIGIT, SegmentRole.SEQUENCE)));
    }

    @Test
    void literalMustFitSegment() {
        assertThrows(IllegalArgumentException.class, () -> Segment.literal("prefix", 0, 2, "T"));
        assertThrows(IllegalArgumentException.class,
                () -> Segment.of("x", 0, 2, CharClass.DIGIT, SegmentRole.SEQUENCE).withDefault("1"));
    }

    @Test
    void errorKindsAreOrdered() {
        assertTrue(ValidationErrorKind.MISSING_VALUE.precedes(ValidationErrorKind.INVALID_LENGTH));
        assertTrue(ValidationErrorKind.INVALID_LOOKUP_CODE.precedes(ValidationErrorKind.INVALID_PREFIX));
        assertFalse(ValidationErrorKind.INVALID_CHECK_DIGIT.precedes(ValidationErrorKind.INVALID_FORMAT));
    }
}
