/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

/**
 * An exemplar attached to a series, e.g. a trace id observed together with a histogram bucket.
 *
 * @param labels    exemplar labels such as {@code trace_id}
 * @param value     observed value
 * @param timestamp time of the observation in milliseconds, used to route the exemplar to a block
 */
public record Exemplar(Labels labels, double value, long timestamp) {

    public Exemplar {
        if (labels == null) {
            throw new IllegalArgumentException("exemplar labels must not be null");
        }
    }
}
