/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.exception;

import com.geastalt.taxid.model.IdentifierKind;
import lombok.Getter;

/**
 * Base exception for tax identifier toolkit errors raised to internal callers.
 * Malformed user input never raises; it produces an invalid ValidationResult.
 */
@Getter
public class TaxIdException extends RuntimeException {

    private final IdentifierKind kind;

    public TaxIdException(IdentifierKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public TaxIdException(IdentifierKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
