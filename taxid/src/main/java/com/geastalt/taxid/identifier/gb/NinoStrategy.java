/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.gb;

import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.lookup.LookupTable;
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
 * National Insurance number: {@code AA 12 34 56 C}.
 */
@Component
public class NinoStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("UK_NINO", null,
            Segment.of("prefix", 0, 2, CharClass.ALPHA, SegmentRole.ENTITY_TYPE),
            Segment.of("number", 2, 8, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.literal("suffix", 8, 9, "A", "B", "C", "D").withDefault("A"));

    public NinoStrategy() {
        super(IdentifierKind.UK_NINO, List.of(SCHEMA));
    }

    @Override
    public LookupTable getLookupTable() {
        return UkLookupTables.NINO_EXCLUDED_PREFIXES;
    }

    @Override
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        return UkLookupTables.ninoPrefixRejection(segments.get("prefix"))
                .map(reason -> ValidationError.invalidLookupCode("Invalid National Insurance Number prefix: " + reason));
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        String number = segments.get("number");
        return List.of(segments.get("prefix"), number.substring(0, 2), number.substring(2, 4),
                number.substring(4), segments.get("suffix"));
    }
}
