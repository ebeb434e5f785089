/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a block could not be written to its final location.
 */
public class BlockFlushException extends BlockImportException {

    public BlockFlushException(String msg, Object... args) {
        super(msg, args);
    }

    public BlockFlushException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
