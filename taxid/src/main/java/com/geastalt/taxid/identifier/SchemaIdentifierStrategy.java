/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.identifier;

import com.geastalt.taxid.exception.IdentifierGenerationException;
import com.geastalt.taxid.lookup.LookupEntry;
import com.geastalt.taxid.model.IdentifierKind;
import com.geastalt.taxid.model.ParsedIdentifier;
import com.geastalt.taxid.model.Schema;
import com.geastalt.taxid.model.Segment;
import com.geastalt.taxid.model.ValidationError;
import com.geastalt.taxid.model.ValidationResult;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Base strategy driven by one or more fixed-length {@link Schema}s. A value is
 * matched against every schema of its length; the first that validates wins,
 * otherwise the error of the schema that got furthest is reported.
 *
 * <p>Checks run in a fixed order: missing value, length, character classes
 * (plus {@link #checkStructure}), lookups ({@link #checkLookups}), fixed
 * literals, then the check digit ({@link #checkDigit}).
 */
public abstract class SchemaIdentifierStrategy implements IdentifierStrategy {

    private final IdentifierKind kind;
    private final List<Schema> schemas;

    protected SchemaIdentifierStrategy(IdentifierKind kind, List<Schema> schemas) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (schemas == null || schemas.isEmpty()) {
            throw new IllegalArgumentException("At least one schema is required for " + kind);
        }
        this.schemas = List.copyOf(schemas);
    }

    @Override
    public IdentifierKind getKind() {
        return kind;
    }

    public List<Schema> getSchemas() {
        return schemas;
    }

    @Override
    public String normalize(String raw) {
        return IdentifierNormalizer.normalize(raw);
    }

    @Override
    public ValidationResult validate(String raw) {
        String normalized = normalize(raw);
        if (normalized.isEmpty()) {
            return ValidationResult.invalid(kind, normalized, ValidationError.missingValue(kind));
        }

        List<Schema> candidates = schemasOfLength(normalized.length());
        if (candidates.isEmpty()) {
            return ValidationResult.invalid(kind, normalized,
                    ValidationError.invalidLength(kind, describeLengths(), normalized.length()));
        }

        ValidationError furthest = null;
        for (Schema schema : candidates) {
            Map<String, String> segments = schema.extract(normalized);
            Optional<ValidationError> error = validateSegments(schema, segments);
            if (error.isEmpty()) {
                return ValidationResult.valid(kind, normalized, describeSegments(schema, segments));
            }
            if (furthest == null || furthest.kind().precedes(error.get().kind())) {
                furthest = error.get();
            }
        }
        return ValidationResult.invalid(kind, normalized, furthest);
    }

    @Override
    public Optional<ParsedIdentifier> parse(String raw) {
        ValidationResult result = validate(raw);
        if (!result.isValid()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedIdentifier(kind, result.getNormalizedValue(),
                result.getSegments(), resolveLookups(result.getSegments())));
    }

    @Override
    public String format(String raw, String separator) {
        String normalized = normalize(raw);
        Optional<Schema> schema = validateStructure(normalized);
        if (schema.isEmpty()) {
            return raw;
        }
        String effectiveSeparator = separator == null ? getDefaultSeparator() : separator;
        return String.join(effectiveSeparator, formatGroups(schema.get(), schema.get().extract(normalized)));
    }

    @Override
    public String generate(Map<String, String> partialSegments) {
        Map<String, String> supplied = new LinkedHashMap<>();
        if (partialSegments != null) {
            partialSegments.forEach((name, value) -> {
                if (value != null) {
                    supplied.put(name, normalize(value));
                }
            });
        }

        Set<String> reasons = new LinkedHashSet<>();
        for (Schema schema : schemas) {
            Assembly assembly = assemble(schema, supplied);
            if (assembly.rejection() != null) {
                reasons.add(assembly.rejection());
                continue;
            }
            ValidationResult result = validate(assembly.value());
            if (result.isValid()) {
                return result.getNormalizedValue();
            }
            result.getError().ifPresent(error -> reasons.add(error.message()));
        }
        throw new IdentifierGenerationException(kind, String.join("; ", reasons));
    }

    /**
     * Returns the schema a normalized value structurally conforms to (length,
     * character classes and fixed literals), ignoring lookups and check digits.
     */
    public Optional<Schema> validateStructure(String normalized) {
        return schemasOfLength(normalized.length()).stream()
                .filter(schema -> schema.segments().stream().allMatch(segment -> {
                    String value = segment.extract(normalized);
                    return segment.isLiteral() ? segment.acceptsLiteral(value) : segment.matchesClass(value);
                }))
                .findFirst();
    }

    /**
     * Splits a structurally valid value into named segments; empty otherwise.
     */
    public Map<String, String> extractSegments(String raw) {
        String normalized = normalize(raw);
        return validateStructure(normalized)
                .map(schema -> schema.extract(normalized))
                .orElse(Map.of());
    }

    /**
     * Computes the check character for the given segment values.
     *
     * @throws IllegalStateException if the schema carries no checksum engine
     */
    public char computeCheck(Schema schema, Map<String, String> segments) {
        return schema.checksum()
                .orElseThrow(() -> new IllegalStateException("Schema " + schema.name() + " has no checksum"))
                .compute(checksumPayload(schema, segments));
    }

    protected Optional<ValidationError> validateSegments(Schema schema, Map<String, String> segments) {
        for (Segment segment : schema.segments()) {
            if (!segment.isLiteral() && !segment.matchesClass(segments.get(segment.name()))) {
                return Optional.of(ValidationError.invalidFormat(String.format("Invalid %s format: %s must be %s",
                        kind.getDisplayName(), segment.name(), segment.charClass().describe())));
            }
        }

        Optional<ValidationError> error = checkStructure(schema, segments);
        if (error.isPresent()) {
            return error;
        }

        error = checkLookups(schema, segments);
        if (error.isPresent()) {
            return error;
        }

        for (Segment segment : schema.segments()) {
            if (segment.isLiteral() && !segment.acceptsLiteral(segments.get(segment.name()))) {
                return Optional.of(ValidationError.invalidPrefix(String.format("%s must have %s at position %d",
                        kind.getDisplayName(), describeLiterals(segment), segment.start() + 1)));
            }
        }

        return checkDigit(schema, segments);
    }

    /**
     * Additional grammar rules beyond character classes. Failures must be
     * {@code INVALID_FORMAT}.
     */
    protected Optional<ValidationError> checkStructure(Schema schema, Map<String, String> segments) {
        return Optional.empty();
    }

    /**
     * Cross-field checks against lookup tables. Failures must be
     * {@code INVALID_LOOKUP_CODE}.
     */
    protected Optional<ValidationError> checkLookups(Schema schema, Map<String, String> segments) {
        return Optional.empty();
    }

    protected Optional<ValidationError> checkDigit(Schema schema, Map<String, String> segments) {
        Optional<Segment> checkSegment = schema.checkSegment();
        if (schema.checksum().isEmpty() || checkSegment.isEmpty()) {
            return Optional.empty();
        }
        char expected = computeCheck(schema, segments);
        char actual = segments.get(checkSegment.get().name()).charAt(0);
        return expected == actual
                ? Optional.empty()
                : Optional.of(ValidationError.invalidCheckDigit(kind));
    }

    /**
     * The characters fed to the checksum engine: every segment except the
     * check digit, in order.
     */
    protected String checksumPayload(Schema schema, Map<String, String> segments) {
        StringBuilder payload = new StringBuilder(schema.length());
        for (Segment segment : schema.segments()) {
            if (!segment.isCheckDigit()) {
                payload.append(segments.get(segment.name()));
            }
        }
        return payload.toString();
    }

    protected Map<String, String> describeSegments(Schema schema, Map<String, String> segments) {
        return segments;
    }

    protected Map<String, LookupEntry> resolveLookups(Map<String, String> segments) {
        return Map.of();
    }

    protected List<String> formatGroups(Schema schema, Map<String, String> segments) {
        return List.of(String.join("", segments.values()));
    }

    protected String getDefaultSeparator() {
        return " ";
    }

    private List<Schema> schemasOfLength(int length) {
        return schemas.stream().filter(schema -> schema.length() == length).toList();
    }

    private String describeLengths() {
        Set<Integer> lengths = schemas.stream().map(Schema::length).collect(Collectors.toCollection(TreeSet::new));
        if (lengths.size() == 1) {
            return String.valueOf(lengths.iterator().next());
        }
        List<String> values = lengths.stream().map(String::valueOf).toList();
        return String.join(", ", values.subList(0, values.size() - 1)) + " or " + values.get(values.size() - 1);
    }

    private static String describeLiterals(Segment segment) {
        return segment.literals().stream().sorted().map(l -> "'" + l + "'").collect(Collectors.joining(" or "));
    }

    private Assembly assemble(Schema schema, Map<String, String> supplied) {
        for (String name : supplied.keySet()) {
            if (!schema.hasSegment(name)) {
                return Assembly.rejected("unknown segment '" + name + "'");
            }
        }

        Segment computed = schema.checksum().isPresent() ? schema.checkSegment().orElse(null) : null;
        Map<String, String> values = new LinkedHashMap<>();
        for (Segment segment : schema.segments()) {
            String value = supplied.get(segment.name());
            if (computed != null && computed.name().equals(segment.name())) {
                if (value != null) {
                    return Assembly.rejected("check digit '" + segment.name() + "' is computed and must not be supplied");
                }
                values.put(segment.name(), "0");
                continue;
            }
            if (value == null) {
                value = segment.defaultValue();
            }
            if (value == null && segment.isLiteral() && segment.literals().size() == 1) {
                value = segment.literals().iterator().next();
            }
            if (value == null) {
                return Assembly.rejected("missing segment '" + segment.name() + "'");
            }
            if (value.length() != segment.width()) {
                return Assembly.rejected("segment '" + segment.name() + "' has invalid length " + value.length());
            }
            if (segment.isLiteral() ? !segment.acceptsLiteral(value) : !segment.charClass().acceptsAll(value)) {
                return Assembly.rejected("segment '" + segment.name() + "' must be "
                        + (segment.isLiteral() ? describeLiterals(segment) : segment.charClass().describe()));
            }
            values.put(segment.name(), value);
        }
        if (computed != null) {
            values.put(computed.name(), String.valueOf(computeCheck(schema, values)));
        }
        return Assembly.accepted(String.join("", values.values()));
    }

    private record Assembly(String value, String rejection) {

        static Assembly accepted(String value) {
            return new Assembly(value, null);
        }

        static Assembly rejected(String reason) {
            return new Assembly(null, reason);
        }
    }
}
