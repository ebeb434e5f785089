/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a sample repeats an accepted timestamp with a different value.
 */
public class DuplicateSampleException extends SampleAppendException {

    public DuplicateSampleException(String msg, Object... args) {
        super(msg, args);
    }

    public DuplicateSampleException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
