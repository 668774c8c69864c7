/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.gb;

import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Employer PAYE reference: three digit tax office number, {@code /}, and a
 * reference of up to ten letters or digits. Structural validation only.
 */
@Component
public class PayeStrategy extends SchemaIdentifierStrategy {

    static final int MAX_REFERENCE_LENGTH = 10;

    static final List<Schema> SCHEMAS = IntStream.rangeClosed(1, MAX_REFERENCE_LENGTH)
            .mapToObj(PayeStrategy::schemaWithReferenceLength)
            .toList();

    public PayeStrategy() {
        super(IdentifierKind.UK_PAYE, SCHEMAS);
    }

    private static Schema schemaWithReferenceLength(int referenceLength) {
        return Schema.of("UK_PAYE_" + referenceLength, null,
                Segment.of("taxOffice", 0, 3, CharClass.DIGIT, SegmentRole.SEQUENCE),
                Segment.literal("separator", 3, 4, "/"),
                Segment.of("reference", 4, 4 + referenceLength, CharClass.ALPHANUMERIC, SegmentRole.SEQUENCE));
    }
}
