/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.parser;

/**
 * Kinds of entries produced by a {@link SampleParser}.
 */
public enum EntryType {
    /** A sample of a series. */
    SERIES,
    /** {@code # TYPE} metadata. */
    TYPE,
    /** {@code # HELP} metadata. */
    HELP,
    /** {@code # UNIT} metadata. */
    UNIT,
    /** Any other comment line. */
    COMMENT
}
