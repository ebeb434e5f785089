/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a block builder is flushed without any committed sample.
 */
public class EmptyBlockException extends BlockImportException {

    public EmptyBlockException(String msg, Object... args) {
        super(msg, args);
    }

    public EmptyBlockException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
