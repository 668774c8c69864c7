/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.service;

import com.geastalt.taxid.config.TaxIdConfig;
import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.exception.UnsupportedIdentifierException;
import com.geastalt.taxid.gst.GstRateSplit;
import com.geastalt.taxid.gst.GstTransaction;
import com.geastalt.taxid.gst.GstTransactionRules;
import com.geastalt.taxid.gst.HsnRequirement;
import com.geastalt.taxid.gst.TransactionType;
import com.geastalt.taxid.identifier.IdentifierRegistry;
import com.geastalt.taxid.identifier.IdentifierStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.ParsedIdentifier;
import com.geastalt.taxid.model.ValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Entry point for validating, parsing, formatting and generating tax
 * identifiers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaxIdentifierService {

    private final IdentifierRegistry registry;
    private final GstTransactionRules gstRules;
    private final TaxIdConfig config;

    public ValidationResult validate(IdentifierKind kind, String raw) {
        ValidationResult result = registry.require(kind).validate(raw);
        if (log.isDebugEnabled()) {
            log.debug("Validated {} '{}': valid={}{}", kind, config.maskForLog(result.getNormalizedValue()),
                    result.isValid(), result.getError().map(error -> ", " + error.kind()).orElse(""));
        }
        return result;
    }

    public boolean isValid(IdentifierKind kind, String raw) {
        return validate(kind, raw).isValid();
    }

    public List<ValidationResult> validateMany(IdentifierKind kind, List<String> raws) {
        IdentifierStrategy strategy = registry.require(kind);
        List<ValidationResult> results = raws.stream().map(strategy::validate).toList();
        log.debug("Validated {} {} values, {} valid", results.size(), kind,
                results.stream().filter(ValidationResult::isValid).count());
        return results;
    }

    public Optional<ParsedIdentifier> parse(IdentifierKind kind, String raw) {
        return registry.require(kind).parse(raw);
    }

    public String format(IdentifierKind kind, String raw) {
        return format(kind, raw, null);
    }

    public String format(IdentifierKind kind, String raw, String separator) {
        return registry.require(kind).format(raw, separator);
    }

    /**
     * @throws IdentifierGenerationException if the segments cannot form a valid identifier
     */
    public String generate(IdentifierKind kind, Map<String, String> partialSegments) {
        IdentifierStrategy strategy = registry.require(kind);
        try {
            String generated = strategy.generate(partialSegments);
            log.debug("Generated {} '{}'", kind, config.maskForLog(generated));
            return generated;
        } catch (IdentifierGenerationException e) {
            log.warn("Generation of {} failed for segments {}: {}", kind,
                    partialSegments == null ? "{}" : partialSegments.keySet(), e.getMessage());
            throw e;
        }
    }

    public Optional<LookupEntry> byCode(IdentifierKind kind, String code) {
        return registry.require(kind).getLookupTable().byCode(code);
    }

    public Optional<LookupEntry> byName(IdentifierKind kind, String name) {
        return registry.require(kind).getLookupTable().byName(name);
    }

    public List<LookupEntry> list(IdentifierKind kind) {
        return registry.require(kind).getLookupTable().list();
    }

    public List<LookupEntry> list(IdentifierKind kind, Predicate<LookupEntry> filter) {
        return registry.require(kind).getLookupTable().list(filter);
    }

    public Optional<GstTransaction> determineTransactionType(String supplierGstin, String recipientGstin) {
        registry.require(IdentifierKind.GSTIN);
        Optional<GstTransaction> transaction = gstRules.determineTransactionType(supplierGstin, recipientGstin);
        transaction.ifPresent(t -> log.debug("GST transaction {} -> {}: {}",
                t.supplierState().code(), t.recipientState().code(), t.type()));
        return transaction;
    }

    public GstRateSplit splitRate(BigDecimal totalRate, TransactionType type) {
        return splitRate(totalRate, type, false);
    }

    public GstRateSplit splitRate(BigDecimal totalRate, TransactionType type, boolean unionTerritory) {
        registry.require(IdentifierKind.GSTIN);
        return gstRules.splitRate(totalRate, type, unionTerritory);
    }

    public HsnRequirement hsnRequirement(BigDecimal annualTurnover) {
        if (!registry.isSupported(IdentifierKind.HSN)) {
            throw new UnsupportedIdentifierException(IdentifierKind.HSN);
        }
        return gstRules.hsnRequirement(annualTurnover);
    }
}
