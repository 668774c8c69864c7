/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

/**
 * Character class a segment's characters must belong to. Input is upper-cased
 * before any class check, so the alphabetic classes only accept {@code A-Z}.
 */
public enum CharClass {
    DIGIT,
    ALPHA,
    ALPHANUMERIC,
    FIXED_LITERAL;

    public boolean accepts(char c) {
        return switch (this) {
            case DIGIT -> c >= '0' && c <= '9';
            case ALPHA -> c >= 'A' && c <= 'Z';
            case ALPHANUMERIC -> (c >= '0' && c <= '9') || (c >= 'A' && c <= 'Z');
            case FIXED_LITERAL -> true;
        };
    }

    public boolean acceptsAll(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!accepts(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public String describe() {
        return switch (this) {
            case DIGIT -> "digits";
            case ALPHA -> "letters";
            case ALPHANUMERIC -> "letters or digits";
            case FIXED_LITERAL -> "a fixed value";
        };
    }
}
