/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.head;

import org.opensearch.blockimport.core.block.BlockAppender;
import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.core.model.Sample;
import org.opensearch.blockimport.exceptions.CommitException;
import org.opensearch.blockimport.exceptions.DuplicateSampleException;
import org.opensearch.blockimport.exceptions.OutOfOrderSampleException;
import org.opensearch.blockimport.exceptions.SampleAppendException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Buffers samples for a {@link Head} until they are committed or rolled back.
 * <p>
 * Samples are validated on append against the newest committed or pending sample of their series, so a
 * commit from a single appender never rejects anything. Not thread safe.
 */
public class HeadAppender implements BlockAppender {
    /** Maximum combined length of exemplar label names and values, in code points. */
    static final int MAX_EXEMPLAR_LABELS_LENGTH = 128;

    private final Head head;
    private final List<PendingSample> pendingSamples = new ArrayList<>();
    private final List<PendingExemplar> pendingExemplars = new ArrayList<>();
    private final Map<MemSeries, Sample> lastPendingSamples = new HashMap<>();
    private final Map<MemSeries, Long> lastPendingExemplarTimestamps = new HashMap<>();

    HeadAppender(Head head) {
        this.head = head;
    }

    @Override
    public long append(long reference, Labels labels, long timestamp, double value) {
        head.ensureWritable();
        MemSeries series = head.getOrCreateSeries(reference, labels);
        Sample last = lastPendingSamples.get(series);
        if (last == null) {
            series.lock();
            try {
                last = series.getLastSample();
            } finally {
                series.unlock();
            }
        }

        Sample sample = new Sample(timestamp, value);
        if (last != null) {
            if (timestamp < last.timestamp()) {
                throw new OutOfOrderSampleException(
                    "out of order sample for series {}: timestamp {} is before {}",
                    series.getLabels(),
                    timestamp,
                    last.timestamp()
                );
            }
            if (timestamp == last.timestamp()) {
                if (sample.sameAs(last)) {
                    return series.getReference();
                }
                throw new DuplicateSampleException(
                    "duplicate sample for series {} at timestamp {} with a different value: {} != {}",
                    series.getLabels(),
                    timestamp,
                    value,
                    last.value()
                );
            }
        }
        pendingSamples.add(new PendingSample(series, sample));
        lastPendingSamples.put(series, sample);
        return series.getReference();
    }

    @Override
    public long appendExemplar(long reference, Labels labels, Exemplar exemplar) {
        head.ensureWritable();
        MemSeries series = head.getOrCreateSeries(reference, labels);
        validateExemplarLabels(exemplar.labels());

        Long lastTimestamp = lastPendingExemplarTimestamps.get(series);
        if (lastTimestamp == null) {
            series.lock();
            try {
                lastTimestamp = series.getLastExemplarTimestamp();
            } finally {
                series.unlock();
            }
        }
        if (exemplar.timestamp() < lastTimestamp) {
            throw new OutOfOrderSampleException(
                "out of order exemplar for series {}: timestamp {} is before {}",
                series.getLabels(),
                exemplar.timestamp(),
                lastTimestamp
            );
        }
        pendingExemplars.add(new PendingExemplar(series, exemplar));
        lastPendingExemplarTimestamps.put(series, exemplar.timestamp());
        return series.getReference();
    }

    private static void validateExemplarLabels(Labels labels) {
        int length = 0;
        for (Map.Entry<String, String> label : labels.toMapView().entrySet()) {
            length += label.getKey().codePointCount(0, label.getKey().length());
            length += label.getValue().codePointCount(0, label.getValue().length());
        }
        if (length > MAX_EXEMPLAR_LABELS_LENGTH) {
            throw new SampleAppendException("exemplar labels are {} characters long, the limit is {}", length, MAX_EXEMPLAR_LABELS_LENGTH);
        }
    }

    /**
     * Applies the pending samples and exemplars in append order. Samples that another appender's commit made
     * out of order are skipped and reported once all others have been applied.
     */
    @Override
    public void commit() {
        head.ensureWritable();
        int rejected = 0;
        try {
            for (PendingSample pending : pendingSamples) {
                MemSeries series = pending.series();
                Sample sample = pending.sample();
                series.lock();
                try {
                    Sample last = series.getLastSample();
                    if (last != null && sample.timestamp() <= last.timestamp()) {
                        if (sample.sameAs(last) == false) {
                            rejected++;
                        }
                        continue;
                    }
                    series.append(sample.timestamp(), sample.value(), head.getSamplesPerChunk());
                } finally {
                    series.unlock();
                }
                head.sampleCommitted(sample.timestamp());
            }
            for (PendingExemplar pending : pendingExemplars) {
                MemSeries series = pending.series();
                series.lock();
                try {
                    if (pending.exemplar().timestamp() >= series.getLastExemplarTimestamp()) {
                        series.setLastExemplarTimestamp(pending.exemplar().timestamp());
                        head.exemplarCommitted(series, pending.exemplar());
                    }
                } finally {
                    series.unlock();
                }
            }
        } finally {
            clear();
        }
        if (rejected > 0) {
            throw new CommitException("{} samples were out of order by the time they were committed", rejected);
        }
    }

    @Override
    public void rollback() {
        clear();
    }

    /**
     * Returns the number of samples waiting for commit.
     *
     * @return the pending sample count
     */
    public int getPendingSampleCount() {
        return pendingSamples.size();
    }

    private void clear() {
        pendingSamples.clear();
        pendingExemplars.clear();
        lastPendingSamples.clear();
        lastPendingExemplarTimestamps.clear();
    }

    private record PendingSample(MemSeries series, Sample sample) {
    }

    private record PendingExemplar(MemSeries series, Exemplar exemplar) {
    }
}
