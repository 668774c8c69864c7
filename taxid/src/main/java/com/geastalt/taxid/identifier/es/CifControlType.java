/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

/**
 * How the CIF control character is rendered for an organisation type.
 */
public enum CifControlType {
    /** Control is always a digit. */
    DIGIT,
    /** Control is always a letter from {@code JABCDEFGHI}. */
    LETTER,
    /**
     * Control may legally be either form. Only the digit form is produced and
     * accepted.
     */
    EITHER
}
