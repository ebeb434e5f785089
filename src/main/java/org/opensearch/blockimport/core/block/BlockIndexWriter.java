/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.core.WhitespaceAnalyzer;
import org.apache.lucene.document.BinaryDocValuesField;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SerialMergeScheduler;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.opensearch.blockimport.core.chunk.ChunkIO;
import org.opensearch.blockimport.core.chunk.DeltaChunk;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.common.util.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the chunks of a block into a Lucene index, one document per chunk.
 * <p>
 * Documents are sorted by labels hash and then by minimum timestamp, so the chunks of a series are adjacent and in
 * time order. The index is committed once on {@link #commit()}; closing without commit leaves no usable index.
 */
public class BlockIndexWriter implements Closeable {
    private final Analyzer analyzer;
    private final Directory directory;
    private final IndexWriter indexWriter;
    private long numChunks;

    /**
     * Create a new index in the given directory.
     *
     * @param dir directory of the index, created if missing
     * @throws IOException if the index cannot be created
     */
    public BlockIndexWriter(Path dir) throws IOException {
        Files.createDirectories(dir);
        directory = FSDirectory.open(dir);
        analyzer = new WhitespaceAnalyzer();
        try {
            IndexWriterConfig iwc = new IndexWriterConfig(analyzer);
            // blocks are written once, merges run inline and leave no threads behind
            iwc.setMergeScheduler(new SerialMergeScheduler());
            iwc.setOpenMode(IndexWriterConfig.OpenMode.CREATE);

            SortField primarySortField = new SortField(BlockFormat.IndexSchema.LABELS_HASH, SortField.Type.LONG, false);
            SortField secondarySortField = new SortField(BlockFormat.IndexSchema.MIN_TIMESTAMP, SortField.Type.LONG, false);
            iwc.setIndexSort(new Sort(primarySortField, secondarySortField));

            indexWriter = new IndexWriter(directory, iwc);
        } catch (IOException | RuntimeException e) {
            IOUtils.closeWhileHandlingException(analyzer, directory);
            throw e;
        }
    }

    /**
     * Add a chunk of a series to the index.
     *
     * @param labels the labels of the series
     * @param chunk  the chunk to add
     * @throws IOException if there is an error adding the chunk
     */
    public void addChunk(Labels labels, DeltaChunk chunk) throws IOException {
        Document doc = new Document();
        doc.add(new NumericDocValuesField(BlockFormat.IndexSchema.LABELS_HASH, labels.stableHash()));

        // inverted index on name:value terms for label matchers
        for (BytesRef labelRef : labels.toKeyValueBytesRefs()) {
            doc.add(new StringField(BlockFormat.IndexSchema.LABELS, labelRef, Field.Store.NO));
        }
        doc.add(new BinaryDocValuesField(BlockFormat.IndexSchema.LABELS, new BytesRef(labels.getRawBytes())));

        doc.add(new BinaryDocValuesField(BlockFormat.IndexSchema.CHUNK, ChunkIO.serializeChunk(chunk)));
        doc.add(new NumericDocValuesField(BlockFormat.IndexSchema.MIN_TIMESTAMP, chunk.getMinTimestamp()));
        doc.add(new NumericDocValuesField(BlockFormat.IndexSchema.MAX_TIMESTAMP, chunk.getMaxTimestamp()));

        indexWriter.addDocument(doc);
        numChunks++;
    }

    /**
     * Merges the index into one segment and commits it.
     *
     * @throws IOException if the commit fails
     */
    public void commit() throws IOException {
        indexWriter.forceMerge(1);
        indexWriter.commit();
    }

    public long getNumChunks() {
        return numChunks;
    }

    @Override
    public void close() throws IOException {
        IOUtils.close(indexWriter, analyzer, directory);
    }
}
