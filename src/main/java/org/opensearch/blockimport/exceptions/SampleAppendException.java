/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a block builder rejects a sample or exemplar.
 */
public class SampleAppendException extends BlockImportException {

    public SampleAppendException(String msg, Object... args) {
        super(msg, args);
    }

    public SampleAppendException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
