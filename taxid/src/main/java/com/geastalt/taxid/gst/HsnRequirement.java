/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.gst;

/**
 * Minimum HSN digits required on an invoice for a given turnover.
 */
public record HsnRequirement(boolean required, int minimumDigits) {

    public static final HsnRequirement OPTIONAL = new HsnRequirement(false, 0);

    public static HsnRequirement digits(int minimumDigits) {
        return new HsnRequirement(true, minimumDigits);
    }

    public boolean isSatisfiedBy(int digits) {
        return !required || digits >= minimumDigits;
    }
}
