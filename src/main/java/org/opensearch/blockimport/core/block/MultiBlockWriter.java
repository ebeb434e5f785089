/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.blockimport.BlockImportSettings;
import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.exceptions.SampleAppendException;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.util.io.IOUtils;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Routes samples to one single-block writer per time range and drives all of them as one writer.
 * <p>
 * Ranges are aligned to multiples of the block duration. The writer of a range is created on the first sample
 * that falls into it and kept until {@link #close()}, so the block duration bounds how many writers are open at
 * once. If a writer cannot be created, its range is registered with an appender that fails every operation with
 * the creation error, which surfaces the failure again on commit and flush.
 * <p>
 * Commit, rollback and close run on every writer and report all failures together: the first one is thrown with
 * the others attached as suppressed exceptions. Flush stops at the first failing writer; blocks flushed before it
 * stay on disk.
 * <p>
 * Not thread safe.
 */
public class MultiBlockWriter implements BlockWriter {
    private static final Logger log = LogManager.getLogger(MultiBlockWriter.class);

    private final long blockDuration;
    private final BlockWriterFactory writerFactory;
    // insertion ordered, flush and close follow creation order
    private final Map<TimeRange, Bucket> buckets = new LinkedHashMap<>();
    private final BlockAppender appender = new MultiBlockAppender();
    private boolean closed;

    /**
     * Creates a writer whose ranges are {@link BlockImportSettings#BLOCK_DURATION} wide, writing a
     * {@link HeadBlockWriter} per range.
     *
     * @param settings importer settings
     */
    public MultiBlockWriter(Settings settings) {
        this(BlockImportSettings.BLOCK_DURATION.get(settings).millis(), range -> new HeadBlockWriter(settings, range));
    }

    /**
     * Creates a writer.
     *
     * @param blockDuration width of the time range of each block in milliseconds
     * @param writerFactory creates the writer of a range
     */
    public MultiBlockWriter(long blockDuration, BlockWriterFactory writerFactory) {
        if (blockDuration <= 0) {
            throw new IllegalArgumentException("block duration must be positive, got " + blockDuration);
        }
        this.blockDuration = blockDuration;
        this.writerFactory = writerFactory;
    }

    /**
     * Returns the appender routing to the per-range writers. The same instance is returned on every call.
     */
    @Override
    public BlockAppender appender() {
        return appender;
    }

    /**
     * Flushes every writer in creation order and returns the ids of all written blocks.
     *
     * @return the block ids, one per range
     * @throws IOException if a writer fails to flush, remaining writers are not flushed
     */
    @Override
    public List<BlockId> flush() throws IOException {
        List<BlockId> ids = new ArrayList<>();
        for (Bucket bucket : buckets.values()) {
            ids.addAll(bucket.flush());
        }
        log.info("Flushed {} blocks: {}", ids.size(), ids);
        return ids;
    }

    /**
     * Closes every created writer exactly once.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        List<BlockWriter> writers = new ArrayList<>(buckets.size());
        for (Bucket bucket : buckets.values()) {
            if (bucket.writer() != null) {
                writers.add(bucket.writer());
            }
        }
        IOUtils.close(writers);
    }

    /**
     * Returns the ranges touched so far, in creation order.
     *
     * @return the ranges
     */
    public List<TimeRange> getRanges() {
        return Collections.unmodifiableList(new ArrayList<>(buckets.keySet()));
    }

    private Bucket getOrCreate(long timestamp) {
        TimeRange range = rangeForTimestamp(timestamp);
        Bucket bucket = buckets.get(range);
        if (bucket != null) {
            return bucket;
        }

        BlockWriter writer = null;
        try {
            writer = writerFactory.create(range);
            bucket = new Bucket(range, writer, writer.appender());
            log.debug("Created block writer for range {}", range);
        } catch (IOException | RuntimeException e) {
            if (writer != null) {
                IOUtils.closeWhileHandlingException(writer);
            }
            log.warn("Failed to create block writer for range {}", range, e);
            bucket = new Bucket(range, null, new FailedBlockAppender(range, e));
        }
        buckets.put(range, bucket);
        return bucket;
    }

    private TimeRange rangeForTimestamp(long timestamp) {
        try {
            return TimeRange.forTimestamp(timestamp, blockDuration);
        } catch (IllegalArgumentException e) {
            throw new SampleAppendException("cannot assign timestamp {} to a block", e, timestamp);
        }
    }

    /**
     * Runs {@code operation} on every appender and throws the first failure with the others suppressed.
     */
    private void forEachAppender(Consumer<BlockAppender> operation) {
        RuntimeException firstFailure = null;
        for (Bucket bucket : buckets.values()) {
            try {
                operation.accept(bucket.appender());
            } catch (RuntimeException e) {
                if (firstFailure == null) {
                    firstFailure = e;
                } else {
                    firstFailure.addSuppressed(e);
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    /**
     * A range with its writer and that writer's appender. A failed range has no writer.
     */
    private record Bucket(TimeRange range, BlockWriter writer, BlockAppender appender) {

        List<BlockId> flush() throws IOException {
            if (appender instanceof FailedBlockAppender failed) {
                throw failed.failure();
            }
            return writer.flush();
        }
    }

    private class MultiBlockAppender implements BlockAppender {

        @Override
        public long append(long reference, Labels labels, long timestamp, double value) {
            return getOrCreate(timestamp).appender().append(reference, labels, timestamp, value);
        }

        /**
         * Routes the exemplar to the writer of its range. Exemplars never open a range, one whose range has no
         * writer yet is dropped.
         */
        @Override
        public long appendExemplar(long reference, Labels labels, Exemplar exemplar) {
            Bucket bucket = buckets.get(rangeForTimestamp(exemplar.timestamp()));
            if (bucket == null) {
                log.debug("Dropping exemplar of series {} at {}, no samples in its range", labels, exemplar.timestamp());
                return reference;
            }
            return bucket.appender().appendExemplar(reference, labels, exemplar);
        }

        @Override
        public void commit() {
            forEachAppender(BlockAppender::commit);
        }

        @Override
        public void rollback() {
            forEachAppender(BlockAppender::rollback);
        }
    }
}
