/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Modulus-10 control for Spanish CIFs. The payload is the type letter followed
 * by seven digits. Digits at 0-based even positions are doubled and folded to
 * their digit sum, odd positions are added as-is; the control digit is
 * {@code (10 - total % 10) % 10}. Whether it is rendered as a digit or as
 * {@code CONTROL_LETTERS[control]} depends only on the type letter.
 */
public class CifChecksumEngine implements ChecksumEngine {

    public static final String CONTROL_LETTERS = "JABCDEFGHI";

    private static final int DIGITS = 7;

    private final Predicate<Character> rendersAsLetter;

    public CifChecksumEngine(Predicate<Character> rendersAsLetter) {
        this.rendersAsLetter = Objects.requireNonNull(rendersAsLetter, "rendersAsLetter must not be null");
    }

    @Override
    public String getName() {
        return "CIF_MOD10";
    }

    @Override
    public char compute(String payload) {
        if (payload == null || payload.length() != DIGITS + 1) {
            throw new IllegalArgumentException("Payload must be a type letter and " + DIGITS + " digits: " + payload);
        }
        int control = controlDigit(payload.substring(1));
        return rendersAsLetter.test(payload.charAt(0))
                ? CONTROL_LETTERS.charAt(control)
                : (char) ('0' + control);
    }

    /**
     * Computes the numeric control (0-9) for the seven body digits.
     */
    public int controlDigit(String digits) {
        if (digits.length() != DIGITS || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("CIF body must be " + DIGITS + " digits: " + digits);
        }
        int doubledSum = 0;
        int plainSum = 0;
        for (int i = 0; i < DIGITS; i++) {
            int digit = digits.charAt(i) - '0';
            if (i % 2 == 0) {
                int doubled = digit * 2;
                doubledSum += doubled / 10 + doubled % 10;
            } else {
                plainSum += digit;
            }
        }
        int unitDigit = (doubledSum + plainSum) % 10;
        return unitDigit == 0 ? 0 : 10 - unitDigit;
    }
}
