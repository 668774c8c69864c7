/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.gst;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A GST rate broken into its components. Absent components are {@code null}.
 */
public record GstRateSplit(
        BigDecimal cgst,
        BigDecimal sgst,
        BigDecimal utgst,
        BigDecimal igst
) {

    public Optional<BigDecimal> getCgst() {
        return Optional.ofNullable(cgst);
    }

    public Optional<BigDecimal> getSgst() {
        return Optional.ofNullable(sgst);
    }

    public Optional<BigDecimal> getUtgst() {
        return Optional.ofNullable(utgst);
    }

    public Optional<BigDecimal> getIgst() {
        return Optional.ofNullable(igst);
    }

    public BigDecimal total() {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal part : new BigDecimal[]{cgst, sgst, utgst, igst}) {
            if (part != null) {
                total = total.add(part);
            }
        }
        return total;
    }
}
