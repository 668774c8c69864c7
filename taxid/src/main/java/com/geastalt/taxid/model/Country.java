/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

/**
 * Countries whose tax identifiers are supported. Codes are ISO 3166-1 alpha-2.
 */
public enum Country {
    IN("India"),
    ES("Spain"),
    JP("Japan"),
    GB("United Kingdom");

    private final String displayName;

    Country(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
