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

/**
 * Companies House registration number: eight digits (England and Wales),
 * {@code SC} or {@code NI} plus six digits, or a legacy six digit number.
 */
@Component
public class UkCompanyNumberStrategy extends SchemaIdentifierStrategy {

    static final List<Schema> SCHEMAS = List.of(
            Schema.of("UK_COMPANY_NUMBER", null,
                    Segment.of("number", 0, 8, CharClass.DIGIT, SegmentRole.SEQUENCE)),
            Schema.of("UK_COMPANY_NUMBER_REGIONAL", null,
                    Segment.literal("jurisdiction", 0, 2, "SC", "NI"),
                    Segment.of("number", 2, 8, CharClass.DIGIT, SegmentRole.SEQUENCE)),
            Schema.of("UK_COMPANY_NUMBER_LEGACY", null,
                    Segment.of("number", 0, 6, CharClass.DIGIT, SegmentRole.SEQUENCE)));

    public UkCompanyNumberStrategy() {
        super(IdentifierKind.UK_COMPANY_NUMBER, SCHEMAS);
    }
}
