/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import com.geastalt.taxid.lookup.LookupEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A valid identifier broken into its segments, with any lookup entries
 * resolved from them (for example the state behind a GSTIN state code).
 */
public record ParsedIdentifier(
        IdentifierKind kind,
        String value,
        Map<String, String> segments,
        Map<String, LookupEntry> resolved
) {
    public ParsedIdentifier {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(value, "value must not be null");
        segments = Collections.unmodifiableMap(new LinkedHashMap<>(segments));
        resolved = Collections.unmodifiableMap(new LinkedHashMap<>(resolved));
    }

    public String segment(String name) {
        return segments.get(name);
    }

    public Optional<LookupEntry> resolvedEntry(String segmentName) {
        return Optional.ofNullable(resolved.get(segmentName));
    }
}
