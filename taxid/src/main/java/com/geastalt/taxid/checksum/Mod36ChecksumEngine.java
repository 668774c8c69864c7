/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

/**
 * Modulus-36 weighted checksum over the alphabet {@code 0-9A-Z}, as used by
 * the GSTIN. Even positions (0-based) weigh 1, odd positions weigh 2; a
 * product above 35 is folded to {@code quotient + remainder} in base 36.
 */
public class Mod36ChecksumEngine implements ChecksumEngine {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final int MODULUS = 36;

    private final int payloadLength;

    public Mod36ChecksumEngine(int payloadLength) {
        this.payloadLength = payloadLength;
    }

    @Override
    public String getName() {
        return "MOD36";
    }

    @Override
    public char compute(String payload) {
        if (payload == null || payload.length() != payloadLength) {
            throw new IllegalArgumentException("Payload must be " + payloadLength + " characters");
        }
        int sum = 0;
        for (int i = 0; i < payload.length(); i++) {
            int value = ALPHABET.indexOf(payload.charAt(i));
            if (value < 0) {
                throw new IllegalArgumentException("Character outside 0-9A-Z at position " + i + ": " + payload);
            }
            int product = value * (i % 2 == 0 ? 1 : 2);
            sum += product / MODULUS + product % MODULUS;
        }
        return ALPHABET.charAt((MODULUS - sum % MODULUS) % MODULUS);
    }
}
