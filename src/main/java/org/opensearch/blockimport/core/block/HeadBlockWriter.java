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
import org.opensearch.blockimport.core.chunk.DeltaChunk;
import org.opensearch.blockimport.core.head.Head;
import org.opensearch.blockimport.core.head.MemSeries;
import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.exceptions.BlockCloseException;
import org.opensearch.blockimport.exceptions.BlockFlushException;
import org.opensearch.blockimport.exceptions.EmptyBlockException;
import org.opensearch.common.logging.Loggers;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.util.io.IOUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Writes all committed samples of one {@link Head} as a single block.
 * <p>
 * The block is assembled in a scratch directory inside the output directory and moved to
 * {@code <output>/<block id>} with one atomic rename, so a block directory under its final name is always
 * complete. The scratch directory lives on the same filesystem as the output for the rename to be atomic.
 */
public class HeadBlockWriter implements BlockWriter {
    private final Logger log;
    private final Path outputDir;
    private final Path scratchDir;
    private final Labels externalLabels;
    private final String source;
    private final Head head;
    private boolean flushed;
    private boolean closed;

    /**
     * Creates a writer configured from the importer settings.
     *
     * @param settings importer settings
     * @throws IOException if the scratch directory cannot be created
     */
    public HeadBlockWriter(Settings settings) throws IOException {
        this(settings, null);
    }

    /**
     * Creates a writer for the samples of one time range.
     *
     * @param settings importer settings
     * @param range    the time range the writer is created for, only used for logging; may be null
     * @throws IOException if the scratch directory cannot be created
     */
    public HeadBlockWriter(Settings settings, TimeRange range) throws IOException {
        this(
            BlockImportSettings.outputDir(settings),
            BlockImportSettings.externalLabels(settings),
            BlockImportSettings.SOURCE.get(settings),
            new Head(settings),
            range
        );
    }

    /**
     * Creates a writer.
     *
     * @param outputDir      directory the block is written to
     * @param externalLabels labels recorded in the block metadata
     * @param source         source tag recorded in the block metadata
     * @param head           the head accumulating samples, owned and closed by this writer
     * @param range          the time range the writer is created for, only used for logging; may be null
     * @throws IOException if the scratch directory cannot be created
     */
    public HeadBlockWriter(Path outputDir, Labels externalLabels, String source, Head head, TimeRange range) throws IOException {
        this.log = range == null ? LogManager.getLogger(HeadBlockWriter.class) : Loggers.getLogger(HeadBlockWriter.class, range.toString());
        this.outputDir = outputDir;
        this.externalLabels = externalLabels == null ? ByteLabels.emptyLabels() : externalLabels;
        this.source = source;
        this.head = head;
        try {
            Files.createDirectories(outputDir);
            this.scratchDir = Files.createTempDirectory(outputDir, BlockFormat.SCRATCH_DIR_PREFIX);
        } catch (IOException e) {
            head.close();
            throw e;
        }
        log.debug("Created block writer with scratch dir {}", scratchDir);
    }

    @Override
    public BlockAppender appender() {
        return head.newAppender();
    }

    /**
     * Writes the committed samples as one block spanning {@code [min timestamp, max timestamp + 1)}.
     *
     * @return the id of the written block
     * @throws EmptyBlockException if no sample was committed
     * @throws BlockFlushException if the block could not be written, nothing is left under the block's final name
     */
    @Override
    public List<BlockId> flush() {
        if (closed) {
            throw new IllegalStateException("block writer is closed");
        }
        if (flushed) {
            throw new IllegalStateException("block writer was already flushed");
        }
        flushed = true;
        head.seal();

        long numSamples = head.getNumSamples();
        if (numSamples == 0) {
            throw new EmptyBlockException("no series appended; aborting");
        }
        List<MemSeries> series = head.getSeriesSortedByLabels();
        long minTime = head.getMinTime();
        long maxTime = head.getMaxTime() == Long.MAX_VALUE ? Long.MAX_VALUE : head.getMaxTime() + 1;

        BlockId id = BlockId.generate();
        Path staging = scratchDir.resolve(id + BlockFormat.TMP_FOR_CREATION_SUFFIX);
        Path target = outputDir.resolve(id.toString());
        log.info("Flushing block {}: {} series, {} samples, range [{}, {})", id, series.size(), numSamples, minTime, maxTime);

        try {
            Files.createDirectories(staging);
            long numChunks;
            try (BlockIndexWriter indexWriter = new BlockIndexWriter(staging.resolve(BlockFormat.INDEX_DIRNAME))) {
                for (MemSeries memSeries : series) {
                    memSeries.lock();
                    try {
                        for (DeltaChunk chunk : memSeries.getChunks()) {
                            indexWriter.addChunk(memSeries.getLabels(), chunk);
                        }
                    } finally {
                        memSeries.unlock();
                    }
                }
                indexWriter.commit();
                numChunks = indexWriter.getNumChunks();
            }

            BlockMetadata.Stats stats = new BlockMetadata.Stats(numSamples, series.size(), numChunks);
            new BlockMetadata(id, minTime, maxTime, stats, ByteLabels.emptyLabels(), "").writeToDir(staging);

            BlockMetadata amended = BlockMetadata.readFromDir(staging).withThanosMetadata(source, externalLabels);
            amended.writeToDir(staging);

            Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
            IOUtils.fsync(outputDir, true);
        } catch (IOException | RuntimeException e) {
            try {
                IOUtils.rm(staging);
            } catch (IOException cleanupFailure) {
                e.addSuppressed(cleanupFailure);
            }
            throw new BlockFlushException("failed to write block {} to {}", e, id, outputDir);
        }

        log.info("Wrote block {} to {}", id, target);
        return List.of(id);
    }

    /**
     * Removes the scratch directory and releases the head.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            IOUtils.rm(scratchDir);
        } catch (IOException e) {
            throw new BlockCloseException("failed to remove scratch directory {}", e, scratchDir);
        } finally {
            head.close();
        }
    }

    public Head getHead() {
        return head;
    }

    public Path getScratchDir() {
        return scratchDir;
    }
}
