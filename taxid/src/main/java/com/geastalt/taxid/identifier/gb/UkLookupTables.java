/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.gb;

import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.lookup.LookupTable;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * National Insurance number prefix rules.
 */
public final class UkLookupTables {

    static final Set<Character> NINO_EXCLUDED_FIRST_LETTERS = Set.of('D', 'F', 'I', 'Q', 'U', 'V');
    static final Set<Character> NINO_EXCLUDED_SECOND_LETTERS = Set.of('D', 'F', 'I', 'O', 'Q', 'U', 'V');

    /** Prefixes never allocated; listed so callers can explain a rejection. */
    public static final LookupTable NINO_EXCLUDED_PREFIXES = LookupTable.of(List.of(
            LookupEntry.category("BG", "Not allocated"),
            LookupEntry.category("GB", "Not allocated"),
            LookupEntry.category("NK", "Not allocated"),
            LookupEntry.category("KN", "Not allocated"),
            LookupEntry.category("TN", "Temporary number"),
            LookupEntry.category("NT", "Not allocated"),
            LookupEntry.category("ZZ", "Not allocated")
    ));

    private UkLookupTables() {
    }

    /**
     * Reason a two letter NINO prefix is not allocatable, if any.
     */
    public static Optional<String> ninoPrefixRejection(String prefix) {
        if (NINO_EXCLUDED_FIRST_LETTERS.contains(prefix.charAt(0))) {
            return Optional.of("first letter cannot be " + prefix.charAt(0));
        }
        if (NINO_EXCLUDED_SECOND_LETTERS.contains(prefix.charAt(1))) {
            return Optional.of("second letter cannot be " + prefix.charAt(1));
        }
        if (NINO_EXCLUDED_PREFIXES.byCode(prefix).isPresent()) {
            return Optional.of("prefix " + prefix + " is not allocated");
        }
        return Optional.empty();
    }
}
