/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.importer;

import org.opensearch.blockimport.core.block.BlockId;

import java.util.List;

/**
 * Receives progress notifications from a {@link BlockImporter} run. Callbacks run on the importing thread.
 */
public interface ImportListener {

    ImportListener NOOP = new ImportListener() {
    };

    default void onImportStarted() {}

    /**
     * Called once the input is exhausted, before the appended samples are committed.
     *
     * @param inputSamples number of samples read from the input and accepted for append. Repeated identical
     *                     samples are counted each time although only one is stored
     */
    default void onInputConsumed(long inputSamples) {}

    default void onBlocksFlushed(List<BlockId> blockIds) {}
}
