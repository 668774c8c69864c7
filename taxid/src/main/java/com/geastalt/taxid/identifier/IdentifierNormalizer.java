/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical form shared by every identifier kind: whitespace and hyphens
 * removed, letters upper-cased. Applying it twice changes nothing.
 */
public final class IdentifierNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\-]+");

    private IdentifierNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        return SEPARATORS.matcher(raw).replaceAll("").toUpperCase(Locale.ROOT);
    }
}
