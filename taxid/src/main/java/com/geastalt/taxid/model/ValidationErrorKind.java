/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

/**
 * Validation failure causes, declared in the order they are checked.
 * When several apply, the one with the lowest ordinal is reported.
 */
public enum ValidationErrorKind {
    MISSING_VALUE,
    INVALID_LENGTH,
    INVALID_FORMAT,
    INVALID_LOOKUP_CODE,
    INVALID_PREFIX,
    INVALID_CHECK_DIGIT;

    public boolean precedes(ValidationErrorKind other) {
        return ordinal() < other.ordinal();
    }
}
