/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

import org.opensearch.OpenSearchException;

/**
 * Base class of all failures raised while importing samples into blocks.
 */
public class BlockImportException extends OpenSearchException {

    public BlockImportException(String msg, Object... args) {
        super(msg, args);
    }

    public BlockImportException(String msg, Throwable cause, Object... args) {
        super(msg, cause, args);
    }
}
