/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

/**
 * Japanese corporate number check digit. Weights alternate 1, 2, 1, 2, ...
 * from the leftmost of the twelve base digits. The check digit is
 * {@code 9 - sum % 9}, where 9 becomes 0.
 */
public class Mod9ChecksumEngine implements ChecksumEngine {

    private static final int BASE_DIGITS = 12;

    @Override
    public String getName() {
        return "MOD9";
    }

    @Override
    public char compute(String payload) {
        if (payload == null || payload.length() != BASE_DIGITS || !payload.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Corporate number base must be " + BASE_DIGITS + " digits: " + payload);
        }
        int sum = 0;
        for (int i = 0; i < BASE_DIGITS; i++) {
            int digit = payload.charAt(i) - '0';
            sum += digit * (i % 2 == 0 ? 1 : 2);
        }
        int check = 9 - sum % 9;
        return (char) ('0' + (check == 9 ? 0 : check));
    }
}
