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
import java.util.Map;

/**
 * UK VAT registration number. Standard (9 digits), branch traders (12 digits),
 * government departments ({@code GD}) and health authorities ({@code HA}).
 * Structural validation only.
 */
@Component
public class UkVatStrategy extends SchemaIdentifierStrategy {

    private static final Segment COUNTRY = Segment.literal("countryCode", 0, 2, "GB");

    static final List<Schema> SCHEMAS = List.of(
            Schema.of("UK_VAT_STANDARD", null, COUNTRY,
                    Segment.of("number", 2, 11, CharClass.DIGIT, SegmentRole.SEQUENCE)),
            Schema.of("UK_VAT_BRANCH", null, COUNTRY,
                    Segment.of("number", 2, 11, CharClass.DIGIT, SegmentRole.SEQUENCE),
                    Segment.of("branch", 11, 14, CharClass.DIGIT, SegmentRole.SEQUENCE)),
            Schema.of("UK_VAT_GOVERNMENT", null, COUNTRY,
                    Segment.literal("unitType", 2, 4, "GD", "HA"),
                    Segment.of("number", 4, 7, CharClass.DIGIT, SegmentRole.SEQUENCE)));

    public UkVatStrategy() {
        super(IdentifierKind.UK_VAT, SCHEMAS);
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        String number = segments.get("number");
        if (segments.containsKey("unitType")) {
            return List.of(segments.get("countryCode"), segments.get("unitType") + number);
        }
        if (segments.containsKey("branch")) {
            return List.of(segments.get("countryCode"), number.substring(0, 3), number.substring(3, 7),
                    number.substring(7), segments.get("branch"));
        }
        return List.of(segments.get("countryCode"), number.substring(0, 3), number.substring(3, 7),
                number.substring(7));
    }
}
