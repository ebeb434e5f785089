/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.chunk;

import org.apache.lucene.store.ByteArrayDataInput;
import org.apache.lucene.store.DataInput;
import org.opensearch.blockimport.core.model.Sample;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the samples of a {@link Encoding#DELTA_XOR} chunk in timestamp order.
 */
public class ChunkIterator {
    private final DataInput in;
    private final int totalSamples;
    private int read;
    private long timestamp;
    private long timeDelta;
    private long valueBits;

    ChunkIterator(byte[] bytes, int offset, int length) {
        this.in = new ByteArrayDataInput(bytes, offset, length);
        try {
            this.totalSamples = in.readVInt();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read chunk header", e);
        }
    }

    /**
     * Advances to the next sample.
     *
     * @return false once all samples have been read
     */
    public boolean next() {
        if (read == totalSamples) {
            return false;
        }
        try {
            if (read == 0) {
                timestamp = in.readZLong();
                valueBits = in.readLong();
            } else {
                if (read == 1) {
                    timeDelta = in.readZLong();
                } else {
                    timeDelta += in.readZLong();
                }
                timestamp += timeDelta;
                valueBits ^= in.readZLong();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to decode sample " + read + " of " + totalSamples, e);
        }
        read++;
        return true;
    }

    /**
     * Returns the sample the iterator is positioned on.
     *
     * @return the current sample
     */
    public Sample at() {
        if (read == 0) {
            throw new IllegalStateException("next() has not been called");
        }
        return new Sample(timestamp, Double.longBitsToDouble(valueBits));
    }

    public int totalSamples() {
        return totalSamples;
    }

    /**
     * Drains the remaining samples into a list.
     *
     * @return the remaining samples
     */
    public List<Sample> decodeSamples() {
        List<Sample> samples = new ArrayList<>(totalSamples - read);
        while (next()) {
            samples.add(at());
        }
        return samples;
    }
}
