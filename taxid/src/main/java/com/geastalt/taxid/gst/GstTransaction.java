/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.gst;

import com.geastalt.taxid.lookup.LookupEntry;

import java.util.List;

/**
 * Transaction classification derived from supplier and recipient GSTINs.
 */
public record GstTransaction(
        TransactionType type,
        List<TaxComponent> components,
        LookupEntry supplierState,
        LookupEntry recipientState
) {
    public GstTransaction {
        components = List.copyOf(components);
    }

    public boolean isIntraState() {
        return type == TransactionType.INTRA_STATE;
    }
}
