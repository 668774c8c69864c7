/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.gst;

import com.geastalt.taxid.config.TaxIdConfig;
import com.geastalt.taxid.identifier.in.GstinStrategy;
import com.geastalt.taxid.lookup.LookupEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cross-field GST rules: place-of-supply classification, rate split and the
 * turnover-gated HSN requirement.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GstTransactionRules {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final GstinStrategy gstinStrategy;
    private final TaxIdConfig config;

    /**
     * Classifies a supply by comparing the state codes of both GSTINs.
     *
     * @return empty if either GSTIN is invalid
     */
    public Optional<GstTransaction> determineTransactionType(String supplierGstin, String recipientGstin) {
        Optional<LookupEntry> supplier = gstinStrategy.stateOf(supplierGstin);
        Optional<LookupEntry> recipient = gstinStrategy.stateOf(recipientGstin);
        if (supplier.isEmpty() || recipient.isEmpty()) {
            log.debug("Cannot classify transaction: supplier valid={}, recipient valid={}",
                    supplier.isPresent(), recipient.isPresent());
            return Optional.empty();
        }

        if (supplier.get().code().equals(recipient.get().code())) {
            TaxComponent local = recipient.get().leviesUtgst() ? TaxComponent.UTGST : TaxComponent.SGST;
            return Optional.of(new GstTransaction(TransactionType.INTRA_STATE,
                    List.of(TaxComponent.CGST, local), supplier.get(), recipient.get()));
        }
        return Optional.of(new GstTransaction(TransactionType.INTER_STATE,
                List.of(TaxComponent.IGST), supplier.get(), recipient.get()));
    }

    public GstRateSplit splitRate(BigDecimal totalRate, TransactionType type) {
        return splitRate(totalRate, type, false);
    }

    /**
     * Splits a total rate: halves for intra-state supplies (CGST plus SGST, or
     * UTGST in a union territory), the whole rate as IGST otherwise.
     */
    public GstRateSplit splitRate(BigDecimal totalRate, TransactionType type, boolean unionTerritory) {
        Objects.requireNonNull(totalRate, "totalRate must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (totalRate.signum() < 0) {
            throw new IllegalArgumentException("GST rate must not be negative: " + totalRate);
        }

        if (type == TransactionType.INTER_STATE) {
            return new GstRateSplit(null, null, null, totalRate);
        }
        BigDecimal half = totalRate.divide(TWO);
        return unionTerritory
                ? new GstRateSplit(half, null, half, null)
                : new GstRateSplit(half, half, null, null);
    }

    public GstRateSplit splitRate(BigDecimal totalRate, GstTransaction transaction) {
        return splitRate(totalRate, transaction.type(), transaction.components().contains(TaxComponent.UTGST));
    }

    /**
     * HSN digits required for a given annual aggregate turnover in rupees.
     */
    public HsnRequirement hsnRequirement(BigDecimal annualTurnover) {
        Objects.requireNonNull(annualTurnover, "annualTurnover must not be null");
        TaxIdConfig.Hsn thresholds = config.getHsn();
        if (annualTurnover.compareTo(thresholds.getSixDigitTurnoverThreshold()) > 0) {
            return HsnRequirement.digits(6);
        }
        if (annualTurnover.compareTo(thresholds.getFourDigitTurnoverThreshold()) > 0) {
            return HsnRequirement.digits(4);
        }
        return HsnRequirement.OPTIONAL;
    }
}
