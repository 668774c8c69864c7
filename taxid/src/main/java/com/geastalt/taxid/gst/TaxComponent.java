/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.gst;

/**
 * GST levies. UTGST replaces SGST when supply and recipient are in the same
 * union territory.
 */
public enum TaxComponent {
    CGST,
    SGST,
    UTGST,
    IGST
}
