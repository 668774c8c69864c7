/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.jp;

import com.geastalt.taxid.checksum.Mod9ChecksumEngine;
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
 * Japanese Corporate Number (hojin bango): a leading check digit followed by a
 * twelve digit base number.
 */
@Component
public class CorporateNumberStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("JAPAN_CORPORATE_NUMBER", new Mod9ChecksumEngine(),
            Segment.checkDigit("checkDigit", 0, CharClass.DIGIT),
            Segment.of("base", 1, 13, CharClass.DIGIT, SegmentRole.SEQUENCE));

    public CorporateNumberStrategy() {
        super(IdentifierKind.JAPAN_CORPORATE_NUMBER, List.of(SCHEMA));
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        String base = segments.get("base");
        return List.of(segments.get("checkDigit"), base.substring(0, 4), base.substring(4, 8), base.substring(8));
    }

    @Override
    protected String getDefaultSeparator() {
        return "-";
    }
}
