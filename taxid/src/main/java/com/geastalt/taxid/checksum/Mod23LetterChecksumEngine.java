/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

/**
 * Spanish DNI control letter: {@code LETTERS[number % 23]} over an 8-digit number.
 */
public class Mod23LetterChecksumEngine implements ChecksumEngine {

    public static final String LETTERS = "TRWAGMYFPDXBNJZSQVHLCKE";

    private static final int DIGITS = 8;

    @Override
    public String getName() {
        return "MOD23";
    }

    @Override
    public char compute(String payload) {
        if (payload == null || payload.length() != DIGITS || !payload.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Payload must be " + DIGITS + " digits: " + payload);
        }
        return LETTERS.charAt(Integer.parseInt(payload) % LETTERS.length());
    }
}
