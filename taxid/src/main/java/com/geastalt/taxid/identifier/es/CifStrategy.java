/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

import com.geastalt.taxid.checksum.CifChecksumEngine;
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
 * Spanish CIF: organisation type letter, seven digits and a control character
 * that is a digit or a letter depending on the organisation type.
 */
@Component
public class CifStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("CIF", new CifChecksumEngine(SpainLookupTables::cifControlIsLetter),
            Segment.of("typeLetter", 0, 1, CharClass.ALPHA, SegmentRole.ENTITY_TYPE),
            Segment.of("number", 1, 8, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.checkDigit("control", 8, CharClass.ALPHANUMERIC));

    public CifStrategy() {
        super(IdentifierKind.CIF, List.of(SCHEMA));
    }

    @Override
    public LookupTable getLookupTable() {
        return SpainLookupTables.CIF_TYPES;
    }

    public Optional<CifControlType> controlTypeOf(String cif) {
        String normalized = normalize(cif);
        return normalized.isEmpty() ? Optional.empty() : SpainLookupTables.cifControlType(normalized.charAt(0));
    }

    @Override
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        String typeLetter = segments.get("typeLetter");
        if (SpainLookupTables.CIF_TYPES.byCode(typeLetter).isEmpty()) {
            return Optional.of(ValidationError.invalidLookupCode("Invalid CIF organisation type: " + typeLetter));
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        return SpainLookupTables.CIF_TYPES.byCode(segments.get("typeLetter"))
                .map(entry -> Map.of("typeLetter", entry))
                .orElse(Map.of());
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(segments.get("typeLetter"), segments.get("number"), segments.get("control"));
    }

    @Override
    protected String getDefaultSeparator() {
        return "-";
    }
}
