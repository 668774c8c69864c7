/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.lookup;

import java.util.Objects;

/**
 * One row of a static lookup table.
 */
public record LookupEntry(
        String code,
        String name,
        boolean active,
        EntryClass entryClass
) {
    public LookupEntry {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(entryClass, "entryClass must not be null");
    }

    public static LookupEntry active(String code, String name, EntryClass entryClass) {
        return new LookupEntry(code, name, true, entryClass);
    }

    public static LookupEntry inactive(String code, String name, EntryClass entryClass) {
        return new LookupEntry(code, name, false, entryClass);
    }

    public static LookupEntry category(String code, String name) {
        return new LookupEntry(code, name, true, EntryClass.CATEGORY);
    }

    public boolean isSpecialJurisdiction() {
        return entryClass == EntryClass.SPECIAL_JURISDICTION;
    }

    public boolean isUnionTerritory() {
        return entryClass == EntryClass.UNION_TERRITORY
                || entryClass == EntryClass.UNION_TERRITORY_WITH_LEGISLATURE;
    }

    /** True where the local GST component is UTGST rather than SGST. */
    public boolean leviesUtgst() {
        return entryClass == EntryClass.UNION_TERRITORY;
    }
}
