/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

/**
 * Semantic role of a segment within an identifier.
 */
public enum SegmentRole {
    STATE_CODE,
    EMBEDDED_ID,
    ENTITY_TYPE,
    SEQUENCE,
    CHECK_DIGIT,
    FIXED_MARKER
}
