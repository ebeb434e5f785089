/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.importer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opensearch.blockimport.core.block.BlockAppender;
import org.opensearch.blockimport.core.block.BlockId;
import org.opensearch.blockimport.core.block.BlockWriter;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.exceptions.BlockImportException;
import org.opensearch.blockimport.exceptions.CommitException;
import org.opensearch.blockimport.exceptions.MissingTimestampException;
import org.opensearch.blockimport.exceptions.SampleAppendException;
import org.opensearch.blockimport.parser.EntryType;
import org.opensearch.blockimport.parser.ParsedEntry;
import org.opensearch.blockimport.parser.SampleParser;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Feeds every sample of a {@link SampleParser} into a {@link BlockWriter} and flushes the result into blocks.
 * <p>
 * The writer is closed exactly once whatever the outcome. A failure while closing is attached as a suppressed
 * exception to an earlier failure, or thrown if the import itself succeeded. Any failure before the flush leaves
 * no block behind.
 */
public class BlockImporter {
    private static final Logger log = LogManager.getLogger(BlockImporter.class);

    private final ImportListener listener;

    public BlockImporter() {
        this(ImportListener.NOOP);
    }

    public BlockImporter(ImportListener listener) {
        this.listener = listener;
    }

    /**
     * Imports all samples of {@code parser} into {@code writer} and closes the writer.
     *
     * @param parser the input, not closed by this method
     * @param writer the target, always closed by this method
     * @return ids of the written blocks
     * @throws IOException if reading the input or writing a block fails
     * @throws MissingTimestampException if a sample has no timestamp
     * @throws SampleAppendException if a sample is rejected
     * @throws CommitException if the appended samples cannot be committed
     */
    public List<BlockId> importSamples(SampleParser parser, BlockWriter writer) throws IOException {
        try (writer) {
            log.info("started importing input data");
            listener.onImportStarted();

            BlockAppender appender = writer.appender();
            Map<Labels, Long> refs = new HashMap<>();
            long inputSamples = 0;
            long droppedExemplars = 0;
            ParsedEntry entry;
            while ((entry = parser.next()) != null) {
                if (entry.type() != EntryType.SERIES) {
                    continue;
                }
                Labels labels = entry.labels();
                if (entry.timestamp().isPresent() == false) {
                    throw new MissingTimestampException("expected timestamp for series {}, got none", labels);
                }
                long timestamp = entry.timestamp().getAsLong();
                long ref = refs.getOrDefault(labels, 0L);
                try {
                    ref = appender.append(ref, labels, timestamp, entry.value());
                } catch (BlockImportException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new SampleAppendException("failed to add sample of series {} at {}", e, labels, timestamp);
                }
                refs.put(labels, ref);
                inputSamples++;

                if (entry.exemplar() != null) {
                    try {
                        appender.appendExemplar(ref, labels, entry.exemplar());
                    } catch (SampleAppendException e) {
                        // rejected exemplars are skipped
                        droppedExemplars++;
                        log.debug("dropping exemplar of series {} at {}", labels, entry.exemplar().timestamp(), e);
                    }
                }
            }
            if (droppedExemplars > 0) {
                log.warn("dropped {} invalid exemplars", droppedExemplars);
            }

            log.info("no more input data, committing appenders and flushing block(s)");
            listener.onInputConsumed(inputSamples);
            try {
                appender.commit();
            } catch (CommitException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new CommitException("failed to commit {} input samples", e, inputSamples);
            }

            List<BlockId> ids = writer.flush();
            log.info("blocks flushed: {} series, {} input samples, ids {}", refs.size(), inputSamples, ids);
            listener.onBlocksFlushed(ids);
            return ids;
        }
    }
}
