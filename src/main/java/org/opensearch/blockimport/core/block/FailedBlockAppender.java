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
import org.opensearch.blockimport.exceptions.BlockWriterCreationException;

/**
 * Appender standing in for a writer that could not be created. Every operation fails with the creation error as
 * its cause, so the failure surfaces again on commit and flush.
 */
final class FailedBlockAppender implements BlockAppender {
    private final TimeRange range;
    private final Exception cause;

    FailedBlockAppender(TimeRange range, Exception cause) {
        this.range = range;
        this.cause = cause;
    }

    BlockWriterCreationException failure() {
        return new BlockWriterCreationException("failed to create block writer for range {}", cause, range);
    }

    @Override
    public long append(long reference, Labels labels, long timestamp, double value) {
        throw failure();
    }

    @Override
    public long appendExemplar(long reference, Labels labels, Exemplar exemplar) {
        throw failure();
    }

    @Override
    public void commit() {
        throw failure();
    }

    @Override
    public void rollback() {
        throw failure();
    }
}
