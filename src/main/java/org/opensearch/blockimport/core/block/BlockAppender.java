/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.Labels;

/**
 * Append session of a {@link BlockWriter}. Samples become part of the block on {@link #commit()}.
 */
public interface BlockAppender {

    /**
     * Adds a sample.
     *
     * @param reference series reference returned by an earlier append of the same series, or 0
     * @param labels    series labels
     * @param timestamp sample timestamp in milliseconds
     * @param value     sample value
     * @return the series reference to pass on the next append of this series
     * @throws org.opensearch.blockimport.exceptions.SampleAppendException if the sample is rejected
     */
    long append(long reference, Labels labels, long timestamp, double value);

    /**
     * Adds an exemplar to a series.
     *
     * @param reference series reference, or 0
     * @param labels    series labels
     * @param exemplar  the exemplar
     * @return the series reference
     */
    long appendExemplar(long reference, Labels labels, Exemplar exemplar);

    /**
     * Makes all samples appended since the last commit or rollback part of the block.
     */
    void commit();

    /**
     * Discards all samples appended since the last commit or rollback.
     */
    void rollback();
}
