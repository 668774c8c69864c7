/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier;

import com.geastalt.taxid.lookup.LookupTable;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.ParsedIdentifier;
import com.geastalt.taxid.model.ValidationResult;

import java.util.Map;
import java.util.Optional;

/**
 * Validation, parsing, formatting and generation for one identifier kind.
 * Implementations are stateless and safe to share between threads.
 */
public interface IdentifierStrategy {

    IdentifierKind getKind();

    String normalize(String raw);

    /**
     * Validates raw user input. Never throws for malformed input.
     */
    ValidationResult validate(String raw);

    Optional<ParsedIdentifier> parse(String raw);

    /**
     * Re-inserts display separators. Input that is not structurally valid is
     * returned unchanged.
     *
     * @param separator separator to use, or {@code null} for the kind's default
     */
    String format(String raw, String separator);

    /**
     * Builds a valid identifier from partial segments, computing any check digit.
     *
     * @throws com.geastalt.taxid.exception.IdentifierGenerationException if the
     *         segments cannot produce a valid identifier
     */
    String generate(Map<String, String> partialSegments);

    default LookupTable getLookupTable() {
        return LookupTable.empty();
    }
}
