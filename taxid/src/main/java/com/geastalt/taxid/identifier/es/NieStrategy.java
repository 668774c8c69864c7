/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

import com.geastalt.taxid.checksum.Mod23LetterChecksumEngine;
import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.lookup.LookupTable;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Spanish NIE (foreigner number): X, Y or Z, seven digits and a control letter.
 * The prefix is replaced by 0, 1 or 2 before the NIF algorithm is applied.
 */
@Component
public class NieStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("NIE", new Mod23LetterChecksumEngine(),
            Segment.literal("prefix", 0, 1, "X", "Y", "Z").withDefault("X"),
            Segment.of("number", 1, 8, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.checkDigit("checkLetter", 8, CharClass.ALPHA));

    public NieStrategy() {
        super(IdentifierKind.NIE, List.of(SCHEMA));
    }

    @Override
    public LookupTable getLookupTable() {
        return SpainLookupTables.NIE_PREFIXES;
    }

    @Override
    protected String checksumPayload(Schema schema, Map<String, String> segments) {
        return SpainLookupTables.niePrefixDigit(segments.get("prefix").charAt(0)) + segments.get("number");
    }

    @Override
    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        return SpainLookupTables.NIE_PREFIXES.byCode(segments.get("prefix"))
                .map(entry -> Map.of("prefix", entry))
                .orElse(Map.of());
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(segments.get("prefix"), segments.get("number"), segments.get("checkLetter"));
    }

    @Override
    protected String getDefaultSeparator() {
        return "-";
    }
}
