/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

/**
 * Half-open time range {@code [start, end)} in milliseconds.
 *
 * @param start inclusive start
 * @param end   exclusive end
 */
public record TimeRange(long start, long end) {

    public TimeRange {
        if (end <= start) {
            throw new IllegalArgumentException("invalid time range [" + start + ", " + end + ")");
        }
    }

    /**
     * Returns the range of width {@code width} containing {@code timestamp}. Ranges are aligned to multiples of
     * the width, so two timestamps share a range exactly when {@code floorDiv(t, width)} is equal.
     *
     * @param timestamp the timestamp
     * @param width     range width, positive
     * @return the range containing the timestamp
     * @throws IllegalArgumentException if the range end does not fit into a long
     */
    public static TimeRange forTimestamp(long timestamp, long width) {
        if (width <= 0) {
            throw new IllegalArgumentException("range width must be positive, got " + width);
        }
        try {
            long start = Math.multiplyExact(Math.floorDiv(timestamp, width), width);
            return new TimeRange(start, Math.addExact(start, width));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("timestamp " + timestamp + " is out of bounds for a range width of " + width, e);
        }
    }

    public long width() {
        return end - start;
    }

    public boolean contains(long timestamp) {
        return timestamp >= start && timestamp < end;
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
