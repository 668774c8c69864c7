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
 * Thrown when a kind has no registered strategy, usually because its country
 * is disabled in configuration.
 */
public class UnsupportedIdentifierException extends TaxIdException {

    public UnsupportedIdentifierException(IdentifierKind kind) {
        super(kind, "No identifier strategy registered for " + kind
                + " (" + kind.getCountry().getDisplayName() + ")");
    }
}
