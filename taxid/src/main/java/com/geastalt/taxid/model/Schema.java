/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.taxid.model;

import com.geastalt.taxid.checksum.ChecksumEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed-length layout of one identifier shape: contiguous segments covering
 * every position, plus the checksum engine (if any) that governs the
 * check-digit segment.
 */
public record Schema(
        String name,
        int length,
        List<Segment> segments,
        ChecksumEngine checksumEngine
) {
    public Schema {
        Objects.requireNonNull(name, "name must not be null");
        segments = List.copyOf(segments);

        int expectedStart = 0;
        for (Segment segment : segments) {
            if (segment.start() != expectedStart) {
                throw new IllegalArgumentException("Schema " + name + " has a gap or overlap at position "
                        + expectedStart + " (segment " + segment.name() + ")");
            }
            expectedStart = segment.end();
        }
        if (expectedStart != length) {
            throw new IllegalArgumentException("Schema " + name + " segments cover " + expectedStart
                    + " characters but length is " + length);
        }
        long checkSegments = segments.stream().filter(Segment::isCheckDigit).count();
        if (checkSegments > 1) {
            throw new IllegalArgumentException("Schema " + name + " has more than one check digit segment");
        }
        if (checksumEngine != null && checkSegments == 0) {
            throw new IllegalArgumentException("Schema " + name + " has a checksum engine but no check digit segment");
        }
    }

    public static Schema of(String name, ChecksumEngine checksumEngine, Segment... segments) {
        int length = segments.length == 0 ? 0 : segments[segments.length - 1].end();
        return new Schema(name, length, List.of(segments), checksumEngine);
    }

    public Optional<ChecksumEngine> checksum() {
        return Optional.ofNullable(checksumEngine);
    }

    public Optional<Segment> checkSegment() {
        return segments.stream().filter(Segment::isCheckDigit).findFirst();
    }

    public Optional<Segment> segment(String segmentName) {
        return segments.stream().filter(s -> s.name().equals(segmentName)).findFirst();
    }

    public boolean hasSegment(String segmentName) {
        return segment(segmentName).isPresent();
    }

    /**
     * Splits a value of this schema's length into its named segments, in order.
     */
    public Map<String, String> extract(String value) {
        if (value.length() != length) {
            throw new IllegalArgumentException("Value length " + value.length() + " does not match schema "
                    + name + " length " + length);
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (Segment segment : segments) {
            values.put(segment.name(), segment.extract(value));
        }
        return Collections.unmodifiableMap(values);
    }
}
