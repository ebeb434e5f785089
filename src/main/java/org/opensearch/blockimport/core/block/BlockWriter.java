/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Accumulates samples and writes them as one or more immutable blocks.
 * <p>
 * Lifecycle: obtain appenders, commit, {@link #flush()} once, then {@link #close()} exactly once, on error paths too.
 */
public interface BlockWriter extends Closeable {

    /**
     * Opens an append session.
     *
     * @return the appender
     */
    BlockAppender appender();

    /**
     * Writes the committed samples as blocks.
     *
     * @return the ids of the written blocks
     * @throws IOException on filesystem failures
     */
    List<BlockId> flush() throws IOException;

    /**
     * Releases in-memory state and scratch storage. Written blocks are kept.
     */
    @Override
    void close() throws IOException;
}
