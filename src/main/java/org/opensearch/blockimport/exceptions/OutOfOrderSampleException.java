/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when a sample is older than the newest sample already accepted for its series.
 */
public class OutOfOrderSampleException extends SampleAppendException {

    public OutOfOrderSampleException(String msg, Object... args) {
        super(msg, args);
    }

    public OutOfOrderSampleException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
