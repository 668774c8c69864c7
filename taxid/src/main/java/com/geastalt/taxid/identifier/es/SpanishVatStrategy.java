/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.ParsedIdentifier;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import com.geastalt.taxid.model.ValidationError;
import com.geastalt.taxid.model.ValidationErrorKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Spanish VAT number: {@code ES} followed by a NIF, NIE or CIF. The national
 * identifier is validated by the strategy its first character selects.
 */
@Component
public class SpanishVatStrategy extends SchemaIdentifierStrategy {

    /** Generator key naming the national identifier kind to build (NIF, NIE or CIF). */
    public static final String NATIONAL_ID_KIND = "nationalIdKind";

    static final Schema SCHEMA = Schema.of("SPANISH_VAT", null,
            Segment.literal("countryCode", 0, 2, "ES"),
            Segment.of("nationalId", 2, 11, CharClass.ALPHANUMERIC, SegmentRole.EMBEDDED_ID));

    private final NifStrategy nifStrategy;
    private final NieStrategy nieStrategy;
    private final CifStrategy cifStrategy;

    public SpanishVatStrategy(NifStrategy nifStrategy, NieStrategy nieStrategy, CifStrategy cifStrategy) {
        super(IdentifierKind.SPANISH_VAT, List.of(SCHEMA));
        this.nifStrategy = nifStrategy;
        this.nieStrategy = nieStrategy;
        this.cifStrategy = cifStrategy;
    }

    /**
     * The national identifier kind embedded in a VAT number, chosen by the
     * first character after {@code ES}.
     */
    public Optional<IdentifierKind> nationalIdKindOf(String vatNumber) {
        String normalized = normalize(vatNumber);
        if (normalized.length() != SCHEMA.length()) {
            return Optional.empty();
        }
        return Optional.of(delegateFor(normalized.substring(2)).getKind());
    }

    /**
     * Accepts either the {@code nationalId} segment directly, or
     * {@link #NATIONAL_ID_KIND} plus the segments of that kind.
     */
    @Override
    public String generate(Map<String, String> partialSegments) {
        if (partialSegments == null || !partialSegments.containsKey(NATIONAL_ID_KIND)) {
            return super.generate(partialSegments);
        }

        Map<String, String> nationalSegments = new LinkedHashMap<>(partialSegments);
        String kindName = nationalSegments.remove(NATIONAL_ID_KIND);
        SchemaIdentifierStrategy delegate = delegateNamed(kindName);
        String nationalId;
        try {
            nationalId = delegate.generate(nationalSegments);
        } catch (IdentifierGenerationException e) {
            throw new IdentifierGenerationException(getKind(), e.getMessage(), e);
        }
        return super.generate(Map.of("nationalId", nationalId));
    }

    @Override
    protected Optional<ValidationError> checkStructure(Schema schema, Map<String, String> segments) {
        return delegatedError(segments, ValidationErrorKind.INVALID_FORMAT);
    }

    @Override
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        return delegatedError(segments, ValidationErrorKind.INVALID_LOOKUP_CODE);
    }

    @Override
    protected Optional<ValidationError> checkDigit(Schema schema, Map<String, String> segments) {
        return delegatedError(segments, ValidationErrorKind.INVALID_CHECK_DIGIT);
    }

    @Override
    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        return delegateFor(segments.get("nationalId")).parse(segments.get("nationalId"))
                .map(ParsedIdentifier::resolved)
                .orElse(Map.of());
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(segments.get("countryCode"), segments.get("nationalId"));
    }

    private Optional<ValidationError> delegatedError(Map<String, String> segments, ValidationErrorKind stage) {
        String nationalId = segments.get("nationalId");
        return delegateFor(nationalId).validate(nationalId).getError()
                .filter(error -> error.kind() == stage);
    }

    private SchemaIdentifierStrategy delegateFor(String nationalId) {
        char first = nationalId.charAt(0);
        if (first >= '0' && first <= '9') {
            return nifStrategy;
        }
        if (first == 'X' || first == 'Y' || first == 'Z') {
            return nieStrategy;
        }
        return cifStrategy;
    }

    private SchemaIdentifierStrategy delegateNamed(String kindName) {
        String name = kindName == null ? "" : kindName.trim().toUpperCase(Locale.ROOT);
        switch (name) {
            case "NIF":
                return nifStrategy;
            case "NIE":
                return nieStrategy;
            case "CIF":
                return cifStrategy;
            default:
                throw new IdentifierGenerationException(getKind(),
                        "unknown national identifier kind '" + kindName + "', expected NIF, NIE or CIF");
        }
    }
}
