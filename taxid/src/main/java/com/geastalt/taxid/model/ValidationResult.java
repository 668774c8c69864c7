/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of validating one identifier. Invalid results carry exactly one
 * {@link ValidationError} and no segments.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class ValidationResult {

    IdentifierKind kind;
    boolean valid;
    String normalizedValue;
    Map<String, String> segments;
    ValidationError error;

    public static ValidationResult valid(IdentifierKind kind, String normalizedValue, Map<String, String> segments) {
        return ValidationResult.builder()
                .kind(kind)
                .valid(true)
                .normalizedValue(normalizedValue)
                .segments(Collections.unmodifiableMap(new LinkedHashMap<>(segments)))
                .build();
    }

    public static ValidationResult invalid(IdentifierKind kind, String normalizedValue, ValidationError error) {
        return ValidationResult.builder()
                .kind(kind)
                .valid(false)
                .normalizedValue(normalizedValue)
                .segments(Map.of())
                .error(error)
                .build();
    }

    public Optional<ValidationError> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<ValidationErrorKind> getErrorKind() {
        return getError().map(ValidationError::kind);
    }

    public String getSegment(String name) {
        return segments.get(name);
    }
}
