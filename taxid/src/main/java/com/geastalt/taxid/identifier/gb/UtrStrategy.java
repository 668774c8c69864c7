/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.gb;

import com.geastalt.taxid.checksum.Mod11WeightedChecksumEngine;
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
 * HMRC Unique Taxpayer Reference: nine digits and a weighted mod-11 check digit.
 */
@Component
public class UtrStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("UK_UTR", new Mod11WeightedChecksumEngine(6, 7, 8, 9, 10, 5, 4, 3, 2),
            Segment.of("reference", 0, 9, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.checkDigit("checkDigit", 9, CharClass.DIGIT));

    public UtrStrategy() {
        super(IdentifierKind.UK_UTR, List.of(SCHEMA));
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        String reference = segments.get("reference");
        return List.of(reference.substring(0, 5), reference.substring(5) + segments.get("checkDigit"));
    }
}
