/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

/**
 * Kinds of national tax identifiers. Each kind belongs to exactly one country.
 */
public enum IdentifierKind {
    /** Goods and Services Tax Identification Number, 15 characters */
    GSTIN(Country.IN, "GSTIN"),
    /** Permanent Account Number, 10 characters */
    PAN(Country.IN, "PAN"),
    /** Harmonized System of Nomenclature goods code, 4, 6 or 8 digits */
    HSN(Country.IN, "HSN code"),
    /** Service Accounting Code, 6 digits starting with 99 */
    SAC(Country.IN, "SAC code"),
    NIF(Country.ES, "NIF"),
    NIE(Country.ES, "NIE"),
    CIF(Country.ES, "CIF"),
    SPANISH_VAT(Country.ES, "Spanish VAT number"),
    JAPAN_CORPORATE_NUMBER(Country.JP, "Corporate Number"),
    JAPAN_INVOICE_REGISTRATION_NUMBER(Country.JP, "Invoice Registration Number"),
    UK_VAT(Country.GB, "UK VAT number"),
    UK_COMPANY_NUMBER(Country.GB, "Company Number"),
    UK_UTR(Country.GB, "UTR"),
    UK_NINO(Country.GB, "National Insurance Number"),
    UK_PAYE(Country.GB, "PAYE reference");

    private final Country country;
    private final String displayName;

    IdentifierKind(Country country, String displayName) {
        this.country = country;
        this.displayName = displayName;
    }

    public Country getCountry() {
        return country;
    }

    public String getDisplayName() {
        return displayName;
    }
}
