/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.in;

import com.geastalt.taxid.lookup.EntryClass;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.lookup.LookupTable;

import java.util.List;

/**
 * GST state codes and PAN entity types.
 */
public final class IndiaLookupTables {

    /**
     * GST state codes 01-38. Both 25 and 26 are live for the merged Dadra and
     * Nagar Haveli and Daman and Diu. 28 belonged to Andhra Pradesh before
     * bifurcation and is kept as an inactive entry. Delhi, Puducherry and
     * Jammu and Kashmir have legislatures and levy SGST. 97 and 99 are not
     * physical states.
     */
    public static final LookupTable STATE_CODES = LookupTable.of(List.of(
            LookupEntry.active("01", "Jammu and Kashmir", EntryClass.UNION_TERRITORY_WITH_LEGISLATURE),
            LookupEntry.active("02", "Himachal Pradesh", EntryClass.STATE),
            LookupEntry.active("03", "Punjab", EntryClass.STATE),
            LookupEntry.active("04", "Chandigarh", EntryClass.UNION_TERRITORY),
            LookupEntry.active("05", "Uttarakhand", EntryClass.STATE),
            LookupEntry.active("06", "Haryana", EntryClass.STATE),
            LookupEntry.active("07", "Delhi", EntryClass.UNION_TERRITORY_WITH_LEGISLATURE),
            LookupEntry.active("08", "Rajasthan", EntryClass.STATE),
            LookupEntry.active("09", "Uttar Pradesh", EntryClass.STATE),
            LookupEntry.active("10", "Bihar", EntryClass.STATE),
            LookupEntry.active("11", "Sikkim", EntryClass.STATE),
            LookupEntry.active("12", "Arunachal Pradesh", EntryClass.STATE),
            LookupEntry.active("13", "Nagaland", EntryClass.STATE),
            LookupEntry.active("14", "Manipur", EntryClass.STATE),
            LookupEntry.active("15", "Mizoram", EntryClass.STATE),
            LookupEntry.active("16", "Tripura", EntryClass.STATE),
            LookupEntry.active("17", "Meghalaya", EntryClass.STATE),
            LookupEntry.active("18", "Assam", EntryClass.STATE),
            LookupEntry.active("19", "West Bengal", EntryClass.STATE),
            LookupEntry.active("20", "Jharkhand", EntryClass.STATE),
            LookupEntry.active("21", "Odisha", EntryClass.STATE),
            LookupEntry.active("22", "Chhattisgarh", EntryClass.STATE),
            LookupEntry.active("23", "Madhya Pradesh", EntryClass.STATE),
            LookupEntry.active("24", "Gujarat", EntryClass.STATE),
            LookupEntry.active("25", "Dadra and Nagar Haveli and Daman and Diu", EntryClass.UNION_TERRITORY),
            LookupEntry.active("26", "Dadra and Nagar Haveli and Daman and Diu", EntryClass.UNION_TERRITORY),
            LookupEntry.active("27", "Maharashtra", EntryClass.STATE),
            LookupEntry.inactive("28", "Andhra Pradesh (before bifurcation)", EntryClass.STATE),
            LookupEntry.active("29", "Karnataka", EntryClass.STATE),
            LookupEntry.active("30", "Goa", EntryClass.STATE),
            LookupEntry.active("31", "Lakshadweep", EntryClass.UNION_TERRITORY),
            LookupEntry.active("32", "Kerala", EntryClass.STATE),
            LookupEntry.active("33", "Tamil Nadu", EntryClass.STATE),
            LookupEntry.active("34", "Puducherry", EntryClass.UNION_TERRITORY_WITH_LEGISLATURE),
            LookupEntry.active("35", "Andaman and Nicobar Islands", EntryClass.UNION_TERRITORY),
            LookupEntry.active("36", "Telangana", EntryClass.STATE),
            LookupEntry.active("37", "Andhra Pradesh", EntryClass.STATE),
            LookupEntry.active("38", "Ladakh", EntryClass.UNION_TERRITORY),
            LookupEntry.active("97", "Other Territory", EntryClass.SPECIAL_JURISDICTION),
            LookupEntry.active("99", "Centre Jurisdiction", EntryClass.SPECIAL_JURISDICTION)
    ));

    /** Fourth character of a PAN. */
    public static final LookupTable PAN_ENTITY_TYPES = LookupTable.of(List.of(
            LookupEntry.category("A", "Association of Persons (AOP)"),
            LookupEntry.category("B", "Body of Individuals (BOI)"),
            LookupEntry.category("C", "Company"),
            LookupEntry.category("F", "Firm"),
            LookupEntry.category("G", "Government"),
            LookupEntry.category("H", "HUF (Hindu Undivided Family)"),
            LookupEntry.category("J", "Artificial Juridical Person"),
            LookupEntry.category("L", "Local Authority"),
            LookupEntry.category("P", "Person"),
            LookupEntry.category("T", "Trust")
    ));

    private IndiaLookupTables() {
    }
}
