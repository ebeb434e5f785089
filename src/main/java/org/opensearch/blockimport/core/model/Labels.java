/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

import org.apache.lucene.util.BytesRef;

import java.util.Map;

/**
 * An immutable, name-sorted set of label pairs identifying one series.
 */
public interface Labels extends Comparable<Labels> {

    /**
     * Space separated {@code name:value} pairs, sorted by name.
     *
     * @return the key-value string
     */
    String toKeyValueString();

    /**
     * One {@code name:value} term per label, used for the inverted index of a block.
     *
     * @return the terms, sorted by label name
     */
    BytesRef[] toKeyValueBytesRefs();

    /**
     * Returns the labels as an ordered map.
     *
     * @return a map view sorted by label name
     */
    Map<String, String> toMapView();

    boolean isEmpty();

    /**
     * Returns the value of the label, or the empty string when absent.
     *
     * @param name label name
     * @return the label value
     */
    String get(String name);

    boolean has(String name);

    /**
     * Hash of the encoded labels that is stable across processes. Used as the series reference.
     *
     * @return the 64-bit hash
     */
    long stableHash();

    /**
     * Returns the canonical encoded form of the labels.
     *
     * @return the encoded bytes, must not be modified
     */
    byte[] getRawBytes();

    /**
     * Returns the metric name, or the empty string if the set has no {@value LabelConstants#METRIC_NAME_LABEL} label.
     *
     * @return the metric name
     */
    default String metricName() {
        return get(LabelConstants.METRIC_NAME_LABEL);
    }
}
