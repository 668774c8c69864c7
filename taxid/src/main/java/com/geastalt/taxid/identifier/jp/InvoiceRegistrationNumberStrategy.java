/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.jp;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.identifier.SchemaIdentifierStrategy;
import com.geastalt.taxid.model.CharClass;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.SegmentRole;
import com.geastalt.taxid.model.ValidationError;
import com.geastalt.taxid.model.ValidationErrorKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Qualified Invoice Issuer registration number: {@code T} followed by the
 * issuer's 13 digit corporate number.
 */
@Component
public class InvoiceRegistrationNumberStrategy extends SchemaIdentifierStrategy {

    static final Schema SCHEMA = Schema.of("JAPAN_INVOICE_REGISTRATION_NUMBER", null,
            Segment.literal("prefix", 0, 1, "T"),
            Segment.of("corporateNumber", 1, 14, CharClass.DIGIT, SegmentRole.EMBEDDED_ID));

    private final CorporateNumberStrategy corporateNumberStrategy;

    public InvoiceRegistrationNumberStrategy(CorporateNumberStrategy corporateNumberStrategy) {
        super(IdentifierKind.JAPAN_INVOICE_REGISTRATION_NUMBER, List.of(SCHEMA));
        this.corporateNumberStrategy = corporateNumberStrategy;
    }

    /**
     * Accepts either {@code corporateNumber} or the corporate number's
     * {@code base} segment, in which case its check digit is computed.
     */
    @Override
    public String generate(Map<String, String> partialSegments) {
        if (partialSegments == null || !partialSegments.containsKey("base")) {
            return super.generate(partialSegments);
        }
        if (partialSegments.containsKey("corporateNumber")) {
            throw new IdentifierGenerationException(getKind(), "supply either 'base' or 'corporateNumber', not both");
        }
        String corporateNumber;
        try {
            corporateNumber = corporateNumberStrategy.generate(Map.of("base", partialSegments.get("base")));
        } catch (IdentifierGenerationException e) {
            throw new IdentifierGenerationException(getKind(), e.getMessage(), e);
        }
        return super.generate(Map.of("corporateNumber", corporateNumber));
    }

    @Override
    protected Optional<ValidationError> checkDigit(Schema schema, Map<String, String> segments) {
        boolean checkDigitFails = corporateNumberStrategy.validate(segments.get("corporateNumber"))
                .getErrorKind()
                .filter(kind -> kind == ValidationErrorKind.INVALID_CHECK_DIGIT)
                .isPresent();
        return checkDigitFails ? Optional.of(ValidationError.invalidCheckDigit(getKind())) : Optional.empty();
    }

    @Override
    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        String corporateNumber = segments.get("corporateNumber");
        return List.of(segments.get("prefix") + corporateNumber.charAt(0), corporateNumber.substring(1, 5),
                corporateNumber.substring(5, 9), corporateNumber.substring(9));
    }

    @Override
    protected String getDefaultSeparator() {
        return "-";
    }
}
