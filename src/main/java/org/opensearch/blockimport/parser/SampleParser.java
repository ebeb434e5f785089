/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.parser;

import java.io.Closeable;
import java.io.IOException;

/**
 * Streaming source of parsed entries.
 */
public interface SampleParser extends Closeable {

    /**
     * Returns the next entry.
     *
     * @return the entry, or null once the input is exhausted
     * @throws org.opensearch.blockimport.exceptions.SampleParseException if the next entry is malformed
     * @throws IOException if the input cannot be read
     */
    ParsedEntry next() throws IOException;
}
