/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.head;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.blockimport.BlockImportSettings;
import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.exceptions.SampleAppendException;
import org.opensearch.common.settings.Settings;

import java.io.Closeable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory accumulation buffer for the samples of one block.
 * <p>
 * Samples enter through {@link HeadAppender}s and only become part of the head on commit. The head tracks the
 * committed time bounds and counts that end up in the block metadata. Series structures are safe for concurrent
 * appenders; each appender itself is used by one thread.
 */
public class Head implements Closeable {
    private static final Logger log = LogManager.getLogger(Head.class);

    private final int samplesPerChunk;
    private final int maxExemplars;
    private final ConcurrentHashMap<Labels, MemSeries> seriesByLabels = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, MemSeries> seriesByReference = new ConcurrentHashMap<>();
    private final Deque<StoredExemplar> exemplars = new ArrayDeque<>();
    private final AtomicLong minTime = new AtomicLong(Long.MAX_VALUE);
    private final AtomicLong maxTime = new AtomicLong(Long.MIN_VALUE);
    private final AtomicLong numSamples = new AtomicLong();
    private volatile boolean sealed;
    private volatile boolean closed;

    /**
     * Creates a head configured from the importer settings.
     *
     * @param settings settings providing chunk and exemplar limits
     */
    public Head(Settings settings) {
        this(BlockImportSettings.SAMPLES_PER_CHUNK.get(settings), BlockImportSettings.MAX_EXEMPLARS.get(settings));
    }

    public Head(int samplesPerChunk, int maxExemplars) {
        if (samplesPerChunk <= 0) {
            throw new IllegalArgumentException("samplesPerChunk must be positive");
        }
        this.samplesPerChunk = samplesPerChunk;
        this.maxExemplars = maxExemplars;
    }

    /**
     * Creates a new appender. Appenders are independent, each one buffers its own uncommitted samples.
     *
     * @return a new HeadAppender instance
     */
    public HeadAppender newAppender() {
        ensureWritable();
        return new HeadAppender(this);
    }

    /**
     * Resolves the series for an append. A known reference is used as-is when its labels match, otherwise the
     * series is looked up or created by its labels.
     *
     * @param reference series reference returned by an earlier append, or 0
     * @param labels    series labels, may be null only when {@code reference} is known
     * @return the series
     */
    MemSeries getOrCreateSeries(long reference, Labels labels) {
        if (reference != 0) {
            MemSeries series = seriesByReference.get(reference);
            if (series != null && (labels == null || series.getLabels().equals(labels))) {
                return series;
            }
        }
        if (labels == null || labels.isEmpty()) {
            throw new SampleAppendException("empty labels for series reference {}", reference);
        }
        MemSeries existing = seriesByLabels.get(labels);
        if (existing != null) {
            return existing;
        }
        return seriesByLabels.computeIfAbsent(labels, l -> {
            // the stable hash is the preferred reference, probe forward on the rare collision
            long ref = l.stableHash();
            MemSeries created = new MemSeries(ref, l);
            while (ref == 0 || seriesByReference.putIfAbsent(ref, created) != null) {
                ref++;
                created = new MemSeries(ref, l);
            }
            return created;
        });
    }

    /**
     * Records the bounds of a committed sample.
     */
    void sampleCommitted(long timestamp) {
        minTime.accumulateAndGet(timestamp, Math::min);
        maxTime.accumulateAndGet(timestamp, Math::max);
        numSamples.incrementAndGet();
    }

    void exemplarCommitted(MemSeries series, Exemplar exemplar) {
        if (maxExemplars == 0) {
            return;
        }
        synchronized (exemplars) {
            if (exemplars.size() == maxExemplars) {
                exemplars.pollFirst();
            }
            exemplars.addLast(new StoredExemplar(series.getReference(), exemplar));
        }
    }

    /**
     * Returns the retained exemplars of a series, oldest first.
     *
     * @param labels the series labels
     * @return the exemplars, empty if the series is unknown
     */
    public List<Exemplar> getExemplars(Labels labels) {
        MemSeries series = seriesByLabels.get(labels);
        List<Exemplar> result = new ArrayList<>();
        if (series == null) {
            return result;
        }
        synchronized (exemplars) {
            for (StoredExemplar stored : exemplars) {
                if (stored.seriesReference() == series.getReference()) {
                    result.add(stored.exemplar());
                }
            }
        }
        return result;
    }

    int getSamplesPerChunk() {
        return samplesPerChunk;
    }

    /**
     * Returns the series holding at least one committed sample, sorted by labels.
     *
     * @return the series
     */
    public List<MemSeries> getSeriesSortedByLabels() {
        List<MemSeries> result = new ArrayList<>();
        for (MemSeries series : seriesByLabels.values()) {
            if (series.getNumSamples() > 0) {
                result.add(series);
            }
        }
        result.sort(Comparator.comparing(MemSeries::getLabels));
        return result;
    }

    /**
     * Returns the number of series with at least one committed sample.
     *
     * @return the series count
     */
    public long getNumSeries() {
        return seriesByLabels.values().stream().filter(s -> s.getNumSamples() > 0).count();
    }

    public long getNumSamples() {
        return numSamples.get();
    }

    /**
     * Returns the smallest committed timestamp, {@link Long#MAX_VALUE} while empty.
     *
     * @return the minimum timestamp
     */
    public long getMinTime() {
        return minTime.get();
    }

    /**
     * Returns the largest committed timestamp, {@link Long#MIN_VALUE} while empty.
     *
     * @return the maximum timestamp
     */
    public long getMaxTime() {
        return maxTime.get();
    }

    /**
     * Rejects further appends and commits. Called before the head is written out.
     */
    public void seal() {
        sealed = true;
    }

    void ensureWritable() {
        if (closed) {
            throw new IllegalStateException("head is closed");
        }
        if (sealed) {
            throw new IllegalStateException("head is sealed, no further samples are accepted");
        }
    }

    /**
     * Drops all series and exemplars.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Closing head with {} series and {} samples", seriesByLabels.size(), numSamples.get());
        seriesByLabels.clear();
        seriesByReference.clear();
        synchronized (exemplars) {
            exemplars.clear();
        }
    }

    private record StoredExemplar(long seriesReference, Exemplar exemplar) {
    }
}
