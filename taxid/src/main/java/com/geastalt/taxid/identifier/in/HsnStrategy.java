/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import com.geastalt.taxid.model.ValidationError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Harmonized System of Nomenclature code for goods: 4, 6 or 8 digits
 * (chapter, heading, sub-heading, tariff item).
 */
@Component
public class HsnStrategy extends SchemaIdentifierStrategy {

    private static final Segment CHAPTER = Segment.of("chapter", 0, 2, CharClass.DIGIT, SegmentRole.SEQUENCE);
    private static final Segment HEADING = Segment.of("heading", 2, 4, CharClass.DIGIT, SegmentRole.SEQUENCE);
    private static final Segment SUB_HEADING = Segment.of("subHeading", 4, 6, CharClass.DIGIT, SegmentRole.SEQUENCE);
    private static final Segment TARIFF_ITEM = Segment.of("tariffItem", 6, 8, CharClass.DIGIT, SegmentRole.SEQUENCE);

    static final List<Schema> SCHEMAS = List.of(
            Schema.of("HSN-8", null, CHAPTER, HEADING, SUB_HEADING, TARIFF_ITEM),
            Schema.of("HSN-6", null, CHAPTER, HEADING, SUB_HEADING),
            Schema.of("HSN-4", null, CHAPTER, HEADING));

    public HsnStrategy() {
        super(IdentifierKind.HSN, SCHEMAS);
    }

    /** Number of digits in a valid code, or 0 if invalid. */
    public int digitsOf(String raw) {
        return validate(raw).isValid() ? normalize(raw).length() : 0;
    }

    @Override
    protected Optional<ValidationError> checkStructure(Schema schema, Map<String, String> segments) {
        if ("00".equals(segments.get("chapter"))) {
            return Optional.of(ValidationError.invalidFormat("Invalid HSN code format: chapter must be 01-99"));
        }
        return Optional.empty();
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        List<String> groups = new ArrayList<>();
        groups.add(segments.get("chapter") + segments.get("heading"));
        if (segments.containsKey("subHeading")) {
            groups.add(segments.get("subHeading"));
        }
        if (segments.containsKey("tariffItem")) {
            groups.add(segments.get("tariffItem"));
        }
        return groups;
    }
}
