/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.lookup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable code-keyed table, built once when its owning class loads.
 * Entry order is preserved for {@link #list()}.
 */
public final class LookupTable {

    private static final LookupTable EMPTY = new LookupTable(List.of());

    private final Map<String, LookupEntry> entriesByCode;
    private final Map<String, LookupEntry> entriesByName;

    private LookupTable(List<LookupEntry> entries) {
        Map<String, LookupEntry> byCode = new LinkedHashMap<>();
        Map<String, LookupEntry> byName = new LinkedHashMap<>();
        for (LookupEntry entry : entries) {
            if (byCode.put(entry.code(), entry) != null) {
                throw new IllegalArgumentException("Duplicate lookup code: " + entry.code());
            }
            byName.putIfAbsent(entry.name().toLowerCase(Locale.ROOT), entry);
        }
        this.entriesByCode = Collections.unmodifiableMap(byCode);
        this.entriesByName = Collections.unmodifiableMap(byName);
    }

    public static LookupTable of(List<LookupEntry> entries) {
        return new LookupTable(entries);
    }

    public static LookupTable empty() {
        return EMPTY;
    }

    public Optional<LookupEntry> byCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entriesByCode.get(code.trim().toUpperCase(Locale.ROOT)));
    }

    /**
     * Case-insensitive lookup by display name.
     */
    public Optional<LookupEntry> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entriesByName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Returns the entry for the code only if it exists and is active.
     */
    public Optional<LookupEntry> activeByCode(String code) {
        return byCode(code).filter(LookupEntry::active);
    }

    public List<LookupEntry> list() {
        return List.copyOf(entriesByCode.values());
    }

    public List<LookupEntry> list(Predicate<LookupEntry> filter) {
        return entriesByCode.values().stream().filter(filter).toList();
    }

    public boolean isEmpty() {
        return entriesByCode.isEmpty();
    }

    public int size() {
        return entriesByCode.size();
    }
}
