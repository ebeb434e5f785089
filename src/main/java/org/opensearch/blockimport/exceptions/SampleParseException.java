/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.exceptions;

/**
 * Thrown when the input contains a malformed entry.
 */
public class SampleParseException extends BlockImportException {

    private final int lineNumber;

    public SampleParseException(int lineNumber, String msg, Object... args) {
        super("line " + lineNumber + ": " + msg, args);
        this.lineNumber = lineNumber;
    }

    public SampleParseException(int lineNumber, String msg, Throwable cause, Object... args) {
        super("line " + lineNumber + ": " + msg, cause, args);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based input line of the malformed entry.
     *
     * @return the line number
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
