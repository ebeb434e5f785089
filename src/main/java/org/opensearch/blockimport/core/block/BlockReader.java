/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.apache.lucene.index.BinaryDocValues;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.LeafReader;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.MatchAllDocsQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreMode;
import org.apache.lucene.search.Scorer;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.Weight;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.util.BytesRef;
import org.opensearch.blockimport.core.chunk.ChunkIO;
import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.LabelConstants;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.core.model.Sample;
import org.opensearch.common.util.io.IOUtils;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read access to a finished block.
 */
public class BlockReader implements Closeable {
    private final BlockMetadata metadata;
    private final Directory directory;
    private final DirectoryReader reader;

    /**
     * Opens the block stored in {@code blockDir}.
     *
     * @param blockDir the block directory, named by the block id
     * @throws IOException if the metadata or the index cannot be read
     */
    public BlockReader(Path blockDir) throws IOException {
        this.metadata = BlockMetadata.readFromDir(blockDir);
        this.directory = FSDirectory.open(blockDir.resolve(BlockFormat.INDEX_DIRNAME));
        try {
            this.reader = DirectoryReader.open(directory);
        } catch (IOException | RuntimeException e) {
            IOUtils.closeWhileHandlingException(directory);
            throw e;
        }
    }

    public BlockMetadata getMetadata() {
        return metadata;
    }

    /**
     * Returns the number of chunks stored in the block.
     *
     * @return the chunk count
     */
    public int getNumChunks() {
        return reader.numDocs();
    }

    /**
     * Decodes all series of the block.
     *
     * @return samples per series, sorted by labels
     * @throws IOException if the index cannot be read
     */
    public Map<Labels, List<Sample>> readAllSeries() throws IOException {
        return readSeries(new MatchAllDocsQuery());
    }

    /**
     * Decodes the series having the given label.
     *
     * @param name  label name
     * @param value label value
     * @return samples per matching series, sorted by labels
     * @throws IOException if the index cannot be read
     */
    public Map<Labels, List<Sample>> readSeries(String name, String value) throws IOException {
        Term term = new Term(BlockFormat.IndexSchema.LABELS, name + LabelConstants.LABEL_DELIMITER + value);
        return readSeries(new TermQuery(term));
    }

    private Map<Labels, List<Sample>> readSeries(Query query) throws IOException {
        IndexSearcher searcher = new IndexSearcher(reader);
        Weight weight = searcher.createWeight(searcher.rewrite(query), ScoreMode.COMPLETE_NO_SCORES, 1.0f);
        Map<Labels, List<Sample>> result = new TreeMap<>();
        // documents are sorted by series and min timestamp, chunks come in time order
        for (LeafReaderContext context : reader.leaves()) {
            Scorer scorer = weight.scorer(context);
            if (scorer == null) {
                continue;
            }
            LeafReader leaf = context.reader();
            BinaryDocValues labelValues = leaf.getBinaryDocValues(BlockFormat.IndexSchema.LABELS);
            BinaryDocValues chunkValues = leaf.getBinaryDocValues(BlockFormat.IndexSchema.CHUNK);
            DocIdSetIterator docs = scorer.iterator();
            for (int doc = docs.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = docs.nextDoc()) {
                if (labelValues.advanceExact(doc) == false || chunkValues.advanceExact(doc) == false) {
                    throw new IOException("chunk document " + doc + " in block " + metadata.id() + " is missing labels or data");
                }
                BytesRef labelBytes = labelValues.binaryValue();
                Labels labels = ByteLabels.fromRawBytes(BytesRef.deepCopyOf(labelBytes).bytes);
                List<Sample> samples = result.computeIfAbsent(labels, l -> new ArrayList<>());
                samples.addAll(ChunkIO.iterator(chunkValues.binaryValue()).decodeSamples());
            }
        }
        return result;
    }

    @Override
    public void close() throws IOException {
        IOUtils.close(reader, directory);
    }
}
