/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.checksum;

/**
 * One checksum family. The payload is the identifier with its check
 * character removed, already normalized.
 */
public interface ChecksumEngine {

    String getName();

    /**
     * Computes the check character for the payload.
     *
     * @throws IllegalArgumentException if the payload has the wrong length or
     *         characters outside the engine's alphabet
     */
    char compute(String payload);

    default boolean verify(String payload, char checkCharacter) {
        return compute(payload) == checkCharacter;
    }
}
