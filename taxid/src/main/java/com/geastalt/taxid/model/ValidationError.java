/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import java.util.Objects;

/**
 * The primary reason an identifier failed validation.
 */
public record ValidationError(
        ValidationErrorKind kind,
        String message
) {
    public ValidationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationError missingValue(IdentifierKind identifierKind) {
        return new ValidationError(ValidationErrorKind.MISSING_VALUE,
                identifierKind.getDisplayName() + " is required");
    }

    public static ValidationError invalidLength(IdentifierKind identifierKind, String expected, int actual) {
        return new ValidationError(ValidationErrorKind.INVALID_LENGTH,
                String.format("%s must be %s characters, got %d",
                        identifierKind.getDisplayName(), expected, actual));
    }

    public static ValidationError invalidFormat(String message) {
        return new ValidationError(ValidationErrorKind.INVALID_FORMAT, message);
    }

    public static ValidationError invalidLookupCode(String message) {
        return new ValidationError(ValidationErrorKind.INVALID_LOOKUP_CODE, message);
    }

    public static ValidationError invalidPrefix(String message) {
        return new ValidationError(ValidationErrorKind.INVALID_PREFIX, message);
    }

    public static ValidationError invalidCheckDigit(IdentifierKind identifierKind) {
        return new ValidationError(ValidationErrorKind.INVALID_CHECK_DIGIT,
                "Invalid " + identifierKind.getDisplayName() + " check digit");
    }
}
