/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.chunk;

/**
 * Chunk encodings. The ordinal is persisted, append new values only.
 */
public enum Encoding {
    /** Zig-zag delta-of-delta timestamps and XOR'ed value bits, both as variable length longs. */
    DELTA_XOR;
}
