/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import java.util.Objects;
import java.util.Set;

/**
 * A named, fixed-position slice of an identifier.
 * Positions are 0-based, {@code end} exclusive.
 */
public record Segment(
        String name,
        int start,
        int end,
        CharClass charClass,
        SegmentRole role,
        Set<String> literals,
        String defaultValue
) {
    public Segment {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(charClass, "charClass must not be null");
        Objects.requireNonNull(role, "role must not be null");
        literals = literals == null ? Set.of() : Set.copyOf(literals);

        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid range for segment " + name + ": " + start + "-" + end);
        }
        if (charClass == CharClass.FIXED_LITERAL) {
            if (literals.isEmpty()) {
                throw new IllegalArgumentException("Fixed literal segment " + name + " needs at least one literal");
            }
            for (String literal : literals) {
                if (literal.length() != end - start) {
                    throw new IllegalArgumentException("Literal '" + literal + "' does not fit segment " + name);
                }
            }
        }
        if (defaultValue != null && defaultValue.length() != end - start) {
            throw new IllegalArgumentException("Default '" + defaultValue + "' does not fit segment " + name);
        }
    }

    public static Segment of(String name, int start, int end, CharClass charClass, SegmentRole role) {
        return new Segment(name, start, end, charClass, role, Set.of(), null);
    }

    public static Segment literal(String name, int start, int end, String... literals) {
        return new Segment(name, start, end, CharClass.FIXED_LITERAL, SegmentRole.FIXED_MARKER, Set.of(literals), null);
    }

    public static Segment checkDigit(String name, int position, CharClass charClass) {
        return new Segment(name, position, position + 1, charClass, SegmentRole.CHECK_DIGIT, Set.of(), null);
    }

    public Segment withDefault(String value) {
        return new Segment(name, start, end, charClass, role, literals, value);
    }

    public int width() {
        return end - start;
    }

    public boolean isLiteral() {
        return charClass == CharClass.FIXED_LITERAL;
    }

    public boolean isCheckDigit() {
        return role == SegmentRole.CHECK_DIGIT;
    }

    public String extract(String value) {
        return value.substring(start, end);
    }

    /**
     * Checks the character class of a segment value. Literal segments are
     * matched separately by {@link #acceptsLiteral(String)}.
     */
    public boolean matchesClass(String value) {
        return value.length() == width() && charClass.acceptsAll(value);
    }

    public boolean acceptsLiteral(String value) {
        return literals.contains(value);
    }
}
