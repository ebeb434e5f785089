/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.head;

import org.opensearch.blockimport.core.chunk.DeltaChunk;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.core.model.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory series of a head: its labels and the chunks holding its committed samples.
 * <p>
 * Mutations and reads of the chunk list must hold the series lock.
 */
public class MemSeries {
    private final long reference;
    private final Labels labels;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<DeltaChunk> chunks = new ArrayList<>();
    private Sample lastSample;
    private long lastExemplarTimestamp = Long.MIN_VALUE;
    private long numSamples;

    public MemSeries(long reference, Labels labels) {
        this.reference = reference;
        this.labels = labels;
    }

    public long getReference() {
        return reference;
    }

    public Labels getLabels() {
        return labels;
    }

    public void lock() {
        lock.lock();
    }

    public void unlock() {
        lock.unlock();
    }

    /**
     * Returns the newest committed sample, or null if none.
     *
     * @return the last sample
     */
    public Sample getLastSample() {
        return lastSample;
    }

    public long getNumSamples() {
        return numSamples;
    }

    /**
     * Appends a committed sample, cutting a new chunk once the head chunk is full.
     *
     * @param timestamp       sample timestamp, must be after {@link #getLastSample()}
     * @param value           sample value
     * @param samplesPerChunk chunk capacity
     */
    public void append(long timestamp, double value, int samplesPerChunk) {
        DeltaChunk head = chunks.isEmpty() ? null : chunks.get(chunks.size() - 1);
        if (head == null || head.numSamples() >= samplesPerChunk) {
            head = new DeltaChunk();
            chunks.add(head);
        }
        head.append(timestamp, value);
        lastSample = new Sample(timestamp, value);
        numSamples++;
    }

    /**
     * Returns the chunks of the series, oldest first.
     *
     * @return an unmodifiable view of the chunks
     */
    public List<DeltaChunk> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    long getLastExemplarTimestamp() {
        return lastExemplarTimestamp;
    }

    void setLastExemplarTimestamp(long timestamp) {
        this.lastExemplarTimestamp = timestamp;
    }

    @Override
    public String toString() {
        return "MemSeries{ref=" + reference + ", labels=" + labels + ", samples=" + numSamples + "}";
    }
}
