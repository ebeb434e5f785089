/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.chunk;

import org.apache.lucene.util.BytesRef;
import org.opensearch.blockimport.core.model.Sample;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.List;

public class DeltaChunkTests extends OpenSearchTestCase {

    public void testEmptyChunk() {
        DeltaChunk chunk = new DeltaChunk();
        assertEquals(0, chunk.numSamples());
        ChunkIterator it = chunk.iterator();
        assertEquals(0, it.totalSamples());
        assertFalse(it.next());
        expectThrows(IllegalStateException.class, it::at);
    }

    public void testRegularIntervals() {
        DeltaChunk chunk = new DeltaChunk();
        List<Sample> expected = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            Sample sample = new Sample(1_700_000_000_000L + i * 15_000L, i % 7 == 0 ? 1.0 : i * 0.5);
            chunk.append(sample.timestamp(), sample.value());
            expected.add(sample);
        }

        assertEquals(120, chunk.numSamples());
        assertEquals(1_700_000_000_000L, chunk.getMinTimestamp());
        assertEquals(1_700_000_000_000L + 119 * 15_000L, chunk.getMaxTimestamp());
        assertEquals(expected, chunk.iterator().decodeSamples());
    }

    public void testConstantSeriesCompresses() {
        DeltaChunk chunk = new DeltaChunk();
        for (int i = 0; i < 120; i++) {
            chunk.append(1_700_000_000_000L + i * 15_000L, 42.0);
        }
        // one byte for the delta of delta and one for the zero xor
        assertTrue("got " + chunk.bytes().length + " bytes", chunk.bytes().length < 120 * 3);
    }

    public void testSpecialValuesKeepTheirBits() {
        DeltaChunk chunk = new DeltaChunk();
        double[] values = { Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY, -0.0, 0.0, Double.MIN_VALUE };
        for (int i = 0; i < values.length; i++) {
            chunk.append(i, values[i]);
        }
        List<Sample> decoded = chunk.iterator().decodeSamples();
        for (int i = 0; i < values.length; i++) {
            assertEquals(Double.doubleToRawLongBits(values[i]), Double.doubleToRawLongBits(decoded.get(i).value()));
        }
    }

    public void testRejectsNonIncreasingTimestamps() {
        DeltaChunk chunk = new DeltaChunk();
        chunk.append(100, 1);
        expectThrows(IllegalArgumentException.class, () -> chunk.append(100, 2));
        expectThrows(IllegalArgumentException.class, () -> chunk.append(99, 2));
        assertEquals(1, chunk.numSamples());
    }

    public void testRandomSamples() {
        DeltaChunk chunk = new DeltaChunk();
        List<Sample> expected = new ArrayList<>();
        long timestamp = randomLongBetween(-1_000_000_000L, 1_000_000_000L);
        int count = randomIntBetween(1, 500);
        for (int i = 0; i < count; i++) {
            timestamp += randomLongBetween(1, 100_000);
            double value = randomBoolean() ? randomDouble() * randomIntBetween(-1000, 1000) : randomIntBetween(0, 10);
            chunk.append(timestamp, value);
            expected.add(new Sample(timestamp, value));
        }
        assertEquals(expected, chunk.iterator().decodeSamples());
    }

    public void testIteratorIsASnapshot() {
        DeltaChunk chunk = new DeltaChunk();
        chunk.append(1, 1);
        ChunkIterator it = chunk.iterator();
        chunk.append(2, 2);
        assertEquals(1, it.totalSamples());
        assertTrue(it.next());
        assertEquals(new Sample(1, 1), it.at());
        assertFalse(it.next());
    }

    public void testSerializedChunk() {
        DeltaChunk chunk = new DeltaChunk();
        chunk.append(1000, 1.5);
        chunk.append(2000, 2.5);
        chunk.append(3500, 2.5);

        BytesRef serialized = ChunkIO.serializeChunk(chunk);
        assertEquals(ChunkIO.VERSION_1, serialized.bytes[serialized.offset]);
        assertEquals(Encoding.DELTA_XOR.ordinal(), serialized.bytes[serialized.offset + 1]);
        assertEquals(
            List.of(new Sample(1000, 1.5), new Sample(2000, 2.5), new Sample(3500, 2.5)),
            ChunkIO.iterator(serialized).decodeSamples()
        );
    }

    public void testSerializedChunkValidation() {
        DeltaChunk chunk = new DeltaChunk();
        chunk.append(1, 1);
        byte[] bytes = BytesRef.deepCopyOf(ChunkIO.serializeChunk(chunk)).bytes;

        expectThrows(IllegalStateException.class, () -> ChunkIO.iterator(new BytesRef(new byte[] { 1 })));
        byte[] wrongVersion = bytes.clone();
        wrongVersion[0] = 9;
        expectThrows(IllegalStateException.class, () -> ChunkIO.iterator(new BytesRef(wrongVersion)));
        byte[] wrongEncoding = bytes.clone();
        wrongEncoding[1] = 42;
        expectThrows(IllegalStateException.class, () -> ChunkIO.iterator(new BytesRef(wrongEncoding)));
    }
}
