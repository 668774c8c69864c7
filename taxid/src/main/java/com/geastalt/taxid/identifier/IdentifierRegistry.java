/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier;

import com.geastalt.taxid.config.TaxIdConfig;
import com.geastalt.taxid.exception.UnsupportedIdentifierException;
import com.geastalt.taxid.model.IdentifierKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
public class IdentifierRegistry {

    private final Map<IdentifierKind, IdentifierStrategy> strategiesByKind;

    public IdentifierRegistry(List<IdentifierStrategy> strategies, TaxIdConfig config) {
        Map<IdentifierKind, IdentifierStrategy> byKind = new EnumMap<>(IdentifierKind.class);
        for (IdentifierStrategy strategy : strategies) {
            if (!config.isEnabled(strategy.getKind().getCountry())) {
                log.debug("Skipping {} strategy, country {} is disabled",
                        strategy.getKind(), strategy.getKind().getCountry());
                continue;
            }
            IdentifierStrategy previous = byKind.put(strategy.getKind(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate identifier strategy for " + strategy.getKind()
                        + ": " + previous.getClass().getSimpleName() + " and " + strategy.getClass().getSimpleName());
            }
        }
        this.strategiesByKind = Collections.unmodifiableMap(byKind);
        log.info("Registered identifier strategies: {}", strategiesByKind.keySet());
    }

    public Optional<IdentifierStrategy> getStrategy(IdentifierKind kind) {
        return Optional.ofNullable(strategiesByKind.get(kind));
    }

    public IdentifierStrategy require(IdentifierKind kind) {
        return getStrategy(kind).orElseThrow(() -> new UnsupportedIdentifierException(kind));
    }

    public boolean isSupported(IdentifierKind kind) {
        return strategiesByKind.containsKey(kind);
    }

    public Set<IdentifierKind> getSupportedKinds() {
        return strategiesByKind.keySet();
    }
}
