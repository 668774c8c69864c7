/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.exception;

import com.geastalt.taxid.model.IdentifierKind;

/**
 * Thrown when an identifier cannot be generated from the supplied segments.
 */
public class IdentifierGenerationException extends TaxIdException {

    public IdentifierGenerationException(IdentifierKind kind, String message) {
        super(kind, String.format("Cannot generate %s: %s", kind.getDisplayName(), message));
    }

    public IdentifierGenerationException(IdentifierKind kind, String message, Throwable cause) {
        super(kind, String.format("Cannot generate %s: %s", kind.getDisplayName(), message), cause);
    }
}
