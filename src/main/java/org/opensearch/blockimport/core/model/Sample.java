/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

/**
 * A single float sample of a series.
 *
 * @param timestamp sample timestamp in milliseconds
 * @param value     sample value, NaN payloads are kept as-is
 */
public record Sample(long timestamp, double value) {

    /**
     * Compares values by their raw bits so that staleness markers and other NaNs compare equal to themselves.
     *
     * @param other the sample to compare with
     * @return true if both timestamp and raw value bits match
     */
    public boolean sameAs(Sample other) {
        return timestamp == other.timestamp && Double.doubleToRawLongBits(value) == Double.doubleToRawLongBits(other.value);
    }
}
