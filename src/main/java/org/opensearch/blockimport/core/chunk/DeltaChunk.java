/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.chunk;

import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.DataOutput;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * An append-only chunk of samples for one series.
 * <p>
 * Layout: {@code [vint sample count]} then, for the first sample, the zig-zag timestamp and the raw 8 value bytes.
 * The second sample stores its timestamp delta, later samples the delta of deltas. Every value after the first
 * is stored as the XOR of its bits with the previous value's bits. Regularly scraped series compress to a byte
 * or two per timestamp.
 * <p>
 * Not thread safe, callers hold the series lock.
 */
public class DeltaChunk {
    private final ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    private int numSamples;
    private long minTimestamp = Long.MAX_VALUE;
    private long maxTimestamp = Long.MIN_VALUE;
    private long timeDelta;
    private long lastValueBits;

    /**
     * Appends a sample. Timestamps must be strictly increasing.
     *
     * @param timestamp sample timestamp
     * @param value     sample value
     */
    public void append(long timestamp, double value) {
        if (numSamples > 0 && timestamp <= maxTimestamp) {
            throw new IllegalArgumentException("timestamp " + timestamp + " is not after the last timestamp " + maxTimestamp);
        }
        long valueBits = Double.doubleToRawLongBits(value);
        DataOutput data = out;
        try {
            if (numSamples == 0) {
                data.writeZLong(timestamp);
                data.writeLong(valueBits);
            } else {
                long delta = timestamp - maxTimestamp;
                data.writeZLong(numSamples == 1 ? delta : delta - timeDelta);
                data.writeZLong(valueBits ^ lastValueBits);
                timeDelta = delta;
            }
        } catch (IOException e) {
            // heap buffers do not fail
            throw new UncheckedIOException("failed to encode sample at " + timestamp, e);
        }
        if (numSamples == 0) {
            minTimestamp = timestamp;
        }
        maxTimestamp = timestamp;
        lastValueBits = valueBits;
        numSamples++;
    }

    public int numSamples() {
        return numSamples;
    }

    public long getMinTimestamp() {
        return minTimestamp;
    }

    public long getMaxTimestamp() {
        return maxTimestamp;
    }

    public Encoding encoding() {
        return Encoding.DELTA_XOR;
    }

    /**
     * Returns a copy of the encoded chunk, sample count included.
     *
     * @return the encoded bytes
     */
    public byte[] bytes() {
        ByteBuffersDataOutput encoded = new ByteBuffersDataOutput(out.size() + 5);
        DataOutput header = encoded;
        try {
            header.writeVInt(numSamples);
            out.copyTo(encoded);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to copy chunk", e);
        }
        return encoded.toArrayCopy();
    }

    /**
     * Returns an iterator over a snapshot of the samples appended so far.
     *
     * @return the iterator
     */
    public ChunkIterator iterator() {
        byte[] bytes = bytes();
        return new ChunkIterator(bytes, 0, bytes.length);
    }
}
