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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Services Accounting Code: six digits, always starting with {@code 99}.
 */
@Component
public class SacStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("SAC", null,
            Segment.literal("section", 0, 2, "99"),
            Segment.of("heading", 2, 4, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.of("group", 4, 5, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.of("service", 5, 6, CharClass.DIGIT, SegmentRole.SEQUENCE));

    public SacStrategy() {
        super(IdentifierKind.SAC, List.of(SCHEMA));
    }

    @Override
    protected Optional<ValidationError> checkStructure(Schema schema, Map<String, String> segments) {
        if (!CharClass.DIGIT.acceptsAll(segments.get("section"))) {
            return Optional.of(ValidationError.invalidFormat("Invalid SAC code format: section must be digits"));
        }
        return Optional.empty();
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(segments.get("section") + segments.get("heading"),
                segments.get("group") + segments.get("service"));
    }
}
