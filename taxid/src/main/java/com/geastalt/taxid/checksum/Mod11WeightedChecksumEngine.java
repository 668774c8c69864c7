/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

/**
 * Weighted modulus-11 check digit. The raw value {@code 11 - sum % 11} maps
 * 10 to 0 and 11 to 1 so the result is always a single digit.
 */
public class Mod11WeightedChecksumEngine implements ChecksumEngine {

    private final int[] weights;

    public Mod11WeightedChecksumEngine(int... weights) {
        if (weights.length == 0) {
            throw new IllegalArgumentException("At least one weight is required");
        }
        this.weights = weights.clone();
    }

    @Override
    public String getName() {
        return "MOD11";
    }

    @Override
    public char compute(String payload) {
        if (payload == null || payload.length() != weights.length || !payload.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("Payload must be " + weights.length + " digits: " + payload);
        }
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += (payload.charAt(i) - '0') * weights[i];
        }
        int raw = 11 - sum % 11;
        int check = switch (raw) {
            case 10 -> 0;
            case 11 -> 1;
            default -> raw;
        };
        return (char) ('0' + check);
    }
}
