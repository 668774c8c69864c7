/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
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
 * Indian PAN: {@code AAAPA1234A}. The trailing letter is a check letter whose
 * algorithm is not published, so only its format is verified.
 */
@Component
public class PanStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("PAN", null,
            Segment.of("holderSeries", 0, 3, CharClass.ALPHA, SegmentRole.SEQUENCE),
            Segment.of("entityType", 3, 4, CharClass.ALPHA, SegmentRole.ENTITY_TYPE).withDefault("P"),
            Segment.of("nameInitial", 4, 5, CharClass.ALPHA, SegmentRole.SEQUENCE),
            Segment.of("sequence", 5, 9, CharClass.DIGIT, SegmentRole.SEQUENCE).withDefault("0001"),
            Segment.checkDigit("checkLetter", 9, CharClass.ALPHA));

    public PanStrategy() {
        super(IdentifierKind.PAN, List.of(SCHEMA));
    }

    @Override
    public LookupTable getLookupTable() {
        return IndiaLookupTables.PAN_ENTITY_TYPES;
    }

    public Optional<LookupEntry> entityTypeOf(String pan) {
        return parse(pan).flatMap(parsed -> parsed.resolvedEntry("entityType"));
    }

    @Override
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        String entityType = segments.get("entityType");
        if (IndiaLookupTables.PAN_ENTITY_TYPES.byCode(entityType).isEmpty()) {
            return Optional.of(ValidationError.invalidLookupCode("Invalid PAN entity type: " + entityType));
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        return IndiaLookupTables.PAN_ENTITY_TYPES.byCode(segments.get("entityType"))
                .map(entry -> Map.of("entityType", entry))
                .orElse(Map.of());
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(
                segments.get("holderSeries") + segments.get("entityType") + segments.get("nameInitial"),
                segments.get("sequence"),
                segments.get("checkLetter"));
    }
}
