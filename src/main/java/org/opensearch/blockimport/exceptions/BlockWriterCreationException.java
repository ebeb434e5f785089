/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when the builder for a time range could not be created.
 */
public class BlockWriterCreationException extends BlockImportException {

    public BlockWriterCreationException(String msg, Object... args) {
        super(msg, args);
    }

    public BlockWriterCreationException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
