/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.lookup;

/**
 * Classification of a lookup entry.
 */
public enum EntryClass {
    /** Ordinary state or province */
    STATE,
    /** Union territory (India) without a legislature, taxed with UTGST instead of SGST */
    UNION_TERRITORY,
    /** Union territory (India) with its own legislature, taxed with SGST like a state */
    UNION_TERRITORY_WITH_LEGISLATURE,
    /** Code that is not a physical region, e.g. GSTIN 97 and 99 */
    SPECIAL_JURISDICTION,
    /** Any other coded category (entity types, organisation types) */
    CATEGORY
}
