/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier.es;

import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.lookup.LookupTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CIF organisation types and NIE prefixes.
 */
public final class SpainLookupTables {

    public static final LookupTable CIF_TYPES = LookupTable.of(List.of(
            LookupEntry.category("A", "Sociedad Anónima"),
            LookupEntry.category("B", "Sociedad de Responsabilidad Limitada"),
            LookupEntry.category("C", "Sociedad Colectiva"),
            LookupEntry.category("D", "Sociedad Comanditaria"),
            LookupEntry.category("E", "Comunidad de Bienes"),
            LookupEntry.category("F", "Sociedad Cooperativa"),
            LookupEntry.category("G", "Asociación o Fundación"),
            LookupEntry.category("H", "Comunidad de Propietarios"),
            LookupEntry.category("J", "Sociedad Civil"),
            LookupEntry.category("N", "Entidad Extranjera"),
            LookupEntry.category("P", "Corporación Local"),
            LookupEntry.category("Q", "Organismo Público"),
            LookupEntry.category("R", "Congregación o Institución Religiosa"),
            LookupEntry.category("S", "Órgano de la Administración del Estado"),
            LookupEntry.category("U", "Unión Temporal de Empresas"),
            LookupEntry.category("V", "Otros Tipos"),
            LookupEntry.category("W", "Establecimiento Permanente de Entidad No Residente")
    ));

    public static final LookupTable NIE_PREFIXES = LookupTable.of(List.of(
            LookupEntry.category("X", "NIE issued before July 2008"),
            LookupEntry.category("Y", "NIE issued from July 2008"),
            LookupEntry.category("Z", "NIE issued after the Y series")
    ));

    private static final Map<Character, CifControlType> CIF_CONTROL_TYPES = Map.ofEntries(
            Map.entry('A', CifControlType.DIGIT),
            Map.entry('B', CifControlType.DIGIT),
            Map.entry('E', CifControlType.DIGIT),
            Map.entry('H', CifControlType.DIGIT),
            Map.entry('N', CifControlType.LETTER),
            Map.entry('P', CifControlType.LETTER),
            Map.entry('Q', CifControlType.LETTER),
            Map.entry('R', CifControlType.LETTER),
            Map.entry('S', CifControlType.LETTER),
            Map.entry('W', CifControlType.LETTER),
            Map.entry('C', CifControlType.EITHER),
            Map.entry('D', CifControlType.EITHER),
            Map.entry('F', CifControlType.EITHER),
            Map.entry('G', CifControlType.EITHER),
            Map.entry('J', CifControlType.EITHER),
            Map.entry('U', CifControlType.EITHER),
            Map.entry('V', CifControlType.EITHER)
    );

    private static final Map<Character, Character> NIE_PREFIX_DIGITS = Map.of('X', '0', 'Y', '1', 'Z', '2');

    private SpainLookupTables() {
    }

    public static Optional<CifControlType> cifControlType(char typeLetter) {
        return Optional.ofNullable(CIF_CONTROL_TYPES.get(typeLetter));
    }

    public static boolean cifControlIsLetter(char typeLetter) {
        return CIF_CONTROL_TYPES.get(typeLetter) == CifControlType.LETTER;
    }

    /**
     * @throws IllegalArgumentException if the letter is not an NIE prefix
     */
    public static char niePrefixDigit(char prefix) {
        Character digit = NIE_PREFIX_DIGITS.get(prefix);
        if (digit == null) {
            throw new IllegalArgumentException("Not an NIE prefix: " + prefix);
        }
        return digit;
    }
}
