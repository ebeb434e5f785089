/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import java.io.IOException;

/**
 * Creates the single-block writer of a time range.
 */
@FunctionalInterface
public interface BlockWriterFactory {

    /**
     * Creates a writer for the samples of {@code range}.
     *
     * @param range the time range
     * @return a new writer, exclusively owned by the caller
     * @throws IOException if the writer's storage cannot be allocated
     */
    BlockWriter create(TimeRange range) throws IOException;
}
