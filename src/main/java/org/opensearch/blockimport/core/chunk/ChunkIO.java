/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.chunk;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.util.BytesRef;

/**
 * Serialization of chunks stored in block indexes.
 */
public class ChunkIO {
    /** Version 1 of chunk serialization format: [byte 1: version][byte 2: encoding][bytes 3-n: chunk data] */
    public static final int VERSION_1 = 1;

    private static final int VERSION_1_METADATA_SIZE = 2;

    private ChunkIO() {
        // Utility class
    }

    /**
     * Serialize a chunk for storage in a binary doc value.
     *
     * @param chunk the chunk to serialize
     * @return the serialized chunk
     */
    public static BytesRef serializeChunk(DeltaChunk chunk) {
        byte[] data = chunk.bytes();
        byte[] serialized = new byte[data.length + VERSION_1_METADATA_SIZE];
        serialized[0] = (byte) VERSION_1;
        serialized[1] = (byte) chunk.encoding().ordinal();
        System.arraycopy(data, 0, serialized, VERSION_1_METADATA_SIZE, data.length);
        return new BytesRef(serialized);
    }

    /**
     * Opens an iterator over a serialized chunk.
     *
     * @param serialized bytes written by {@link #serializeChunk(DeltaChunk)}
     * @return an iterator over the chunk's samples
     * @throws IllegalStateException if the version or encoding is unknown
     */
    public static ChunkIterator iterator(BytesRef serialized) {
        if (serialized.length < VERSION_1_METADATA_SIZE) {
            throw new IllegalStateException("Serialized chunk is too short: " + serialized.length + " bytes");
        }
        ByteArrayDataInput in = new ByteArrayDataInput(serialized.bytes, serialized.offset, serialized.length);
        int version = in.readByte();
        if (version != VERSION_1) {
            throw new IllegalStateException("Unsupported chunk version: " + version);
        }
        int encoding = in.readByte();
        if (encoding < 0 || encoding >= Encoding.values().length) {
            throw new IllegalStateException("Unsupported chunk encoding: " + encoding);
        }
        return new ChunkIterator(
            serialized.bytes,
            serialized.offset + VERSION_1_METADATA_SIZE,
            serialized.length - VERSION_1_METADATA_SIZE
        );
    }
}
