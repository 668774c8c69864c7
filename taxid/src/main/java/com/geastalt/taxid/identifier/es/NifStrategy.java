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
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Spanish NIF (DNI number): eight digits and a mod-23 control letter.
 */
@Component
public class NifStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("NIF", new Mod23LetterChecksumEngine(),
            Segment.of("number", 0, 8, CharClass.DIGIT, SegmentRole.SEQUENCE),
            Segment.checkDigit("checkLetter", 8, CharClass.ALPHA));

    public NifStrategy() {
        super(IdentifierKind.NIF, List.of(SCHEMA));
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(segments.get("number"), segments.get("checkLetter"));
    }

    @Override
    protected String getDefaultSeparator() {
        return "-";
    }
}
