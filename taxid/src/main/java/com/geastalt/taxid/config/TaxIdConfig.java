/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.config;

import com.geastalt.taxid.model.Country;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;

/**
 * Configuration for the tax identifier toolkit.
 */
@Configuration
@ConfigurationProperties(prefix = "taxid")
@Getter
@Setter
public class TaxIdConfig {

    private Set<Country> enabledCountries = EnumSet.allOf(Country.class);
    private Logging logging = new Logging();
    private Hsn hsn = new Hsn();

    public boolean isEnabled(Country country) {
        return enabledCountries != null && enabledCountries.contains(country);
    }

    /**
     * Masks an identifier for log output when masking is enabled, keeping the
     * first and last two characters.
     */
    public String maskForLog(String value) {
        if (value == null) {
            return "null";
        }
        if (!logging.isMaskValues()) {
            return value;
        }
        if (value.length() <= 4) {
            return "*".repeat(value.length());
        }
        return value.substring(0, 2) + "*".repeat(value.length() - 4) + value.substring(value.length() - 2);
    }

    @Getter
    @Setter
    public static class Logging {
        private boolean maskValues = true;
    }

    /**
     * Annual turnover thresholds (INR) above which HSN/SAC codes become
     * mandatory on invoices.
     */
    @Getter
    @Setter
    public static class Hsn {
        private BigDecimal fourDigitTurnoverThreshold = new BigDecimal("5000000");
        private BigDecimal sixDigitTurnoverThreshold = new BigDecimal("50000000");
    }
}
