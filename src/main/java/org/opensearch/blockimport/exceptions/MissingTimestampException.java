/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a series entry carries no timestamp. Timestamps are never synthesized.
 */
public class MissingTimestampException extends BlockImportException {

    public MissingTimestampException(String msg, Object... args) {
        super(msg, args);
    }

    public MissingTimestampException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
