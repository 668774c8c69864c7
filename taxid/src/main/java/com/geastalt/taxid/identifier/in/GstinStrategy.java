/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.checksum.Mod36ChecksumEngine;
import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.lookup.LookupTable;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import com.geastalt.taxid.model.ValidationError;
import com.geastalt.taxid.model.ValidationErrorKind;
import com.geastalt.taxid.model.ValidationResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * GST Identification Number: state code, embedded PAN, entity number, the
 * literal {@code Z} and a mod-36 check character.
 *
 * <p>Example: {@code 27AAPFU0939F1ZV} (Maharashtra).</p>
 */
@Component
public class GstinStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("GSTIN", new Mod36ChecksumEngine(14),
            Segment.of("stateCode", 0, 2, CharClass.DIGIT, SegmentRole.STATE_CODE),
            Segment.of("pan", 2, 12, CharClass.ALPHANUMERIC, SegmentRole.EMBEDDED_ID),
            Segment.of("entityNumber", 12, 13, CharClass.ALPHANUMERIC, SegmentRole.SEQUENCE).withDefault("1"),
            Segment.literal("defaultChar", 13, 14, "Z"),
            Segment.checkDigit("checkDigit", 14, CharClass.ALPHANUMERIC));

    private final PanStrategy panStrategy;

    public GstinStrategy(PanStrategy panStrategy) {
        super(IdentifierKind.GSTIN, List.of(SCHEMA));
        this.panStrategy = panStrategy;
    }

    @Override
    public LookupTable getLookupTable() {
        return IndiaLookupTables.STATE_CODES;
    }

    /**
     * State code of a valid GSTIN, resolved against the state table.
     */
    public Optional<LookupEntry> stateOf(String gstin) {
        return parse(gstin).flatMap(parsed -> parsed.resolvedEntry("stateCode"));
    }

    @Override
    protected Optional<ValidationError> checkStructure(Schema schema, Map<String, String> segments) {
        if ("0".equals(segments.get("entityNumber"))) {
            return Optional.of(ValidationError.invalidFormat("Invalid GSTIN format: entityNumber must be 1-9 or A-Z"));
        }
        ValidationResult pan = panStrategy.validate(segments.get("pan"));
        if (pan.getErrorKind().filter(kind -> kind == ValidationErrorKind.INVALID_FORMAT).isPresent()) {
            return Optional.of(ValidationError.invalidFormat(
                    "Invalid PAN embedded in GSTIN: " + pan.getError().get().message()));
        }
        return Optional.empty();
    }

    @Override
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        String stateCode = segments.get("stateCode");
        if (IndiaLookupTables.STATE_CODES.activeByCode(stateCode).isEmpty()) {
            return Optional.of(ValidationError.invalidLookupCode("Invalid GSTIN state code: " + stateCode));
        }
        ValidationResult pan = panStrategy.validate(segments.get("pan"));
        if (pan.getErrorKind().filter(kind -> kind == ValidationErrorKind.INVALID_LOOKUP_CODE).isPresent()) {
            return pan.getError();
        }
        return Optional.empty();
    }

    @Override
    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        Map<String, LookupEntry> resolved = new LinkedHashMap<>();
        IndiaLookupTables.STATE_CODES.byCode(segments.get("stateCode"))
                .ifPresent(entry -> resolved.put("stateCode", entry));
        panStrategy.entityTypeOf(segments.get("pan"))
                .ifPresent(entry -> resolved.put("pan", entry));
        return resolved;
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(
                segments.get("stateCode"),
                segments.get("pan"),
                segments.get("entityNumber") + segments.get("defaultChar") + segments.get("checkDigit"));
    }

    /** Without an explicit separator a GSTIN formats as its compact canonical form. */
    @Override
    protected String getDefaultSeparator() {
        return "";
    }
}
