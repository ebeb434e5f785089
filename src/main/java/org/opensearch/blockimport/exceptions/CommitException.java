/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when appended samples could not be committed.
 */
public class CommitException extends BlockImportException {

    public CommitException(String msg, Object... args) {
        super(msg, args);
    }

    public CommitException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
