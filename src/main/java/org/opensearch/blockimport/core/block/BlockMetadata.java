/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.common.util.io.IOUtils;
import org.opensearch.common.xcontent.XContentFactory;
import org.opensearch.core.common.bytes.BytesReference;
import org.opensearch.core.xcontent.DeprecationHandler;
import org.opensearch.core.xcontent.MediaTypeRegistry;
import org.opensearch.core.xcontent.NamedXContentRegistry;
import org.opensearch.core.xcontent.XContentBuilder;
import org.opensearch.core.xcontent.XContentParser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Self-describing metadata of a block, stored as {@value BlockFormat#META_FILENAME} in the block directory.
 * <p>
 * The layout follows the Prometheus block meta file with the Thanos extension that carries the external labels
 * and the source that produced the block.
 *
 * @param id             block id, also the directory name
 * @param minTime        inclusive minimum sample timestamp
 * @param maxTime        exclusive maximum sample timestamp
 * @param stats          sample, series and chunk counts
 * @param externalLabels labels applied to every series of the block
 * @param source         tag naming the producer of the block
 */
public record BlockMetadata(BlockId id, long minTime, long maxTime, Stats stats, Labels externalLabels, String source) {
    public static final int VERSION = 1;
    public static final int COMPACTION_LEVEL = 1;
    private static final String TMP_SUFFIX = ".tmp";

    /**
     * Counts of a block.
     *
     * @param numSamples samples in the block
     * @param numSeries  series in the block
     * @param numChunks  chunks in the block
     */
    public record Stats(long numSamples, long numSeries, long numChunks) {
    }

    /**
     * Returns a copy tagged with the given source and external labels.
     *
     * @param newSource         the producer tag
     * @param newExternalLabels labels applied to the whole block
     * @return the amended metadata
     */
    public BlockMetadata withThanosMetadata(String newSource, Labels newExternalLabels) {
        return new BlockMetadata(id, minTime, maxTime, stats, newExternalLabels, newSource);
    }

    public String marshal() throws IOException {
        try (XContentBuilder builder = XContentFactory.jsonBuilder()) {
            builder.prettyPrint();
            builder.startObject();
            builder.field("ulid", id.toString());
            builder.field("minTime", minTime);
            builder.field("maxTime", maxTime);
            builder.startObject("stats");
            builder.field("numSamples", stats.numSamples());
            builder.field("numSeries", stats.numSeries());
            builder.field("numChunks", stats.numChunks());
            builder.endObject();
            builder.startObject("compaction");
            builder.field("level", COMPACTION_LEVEL);
            builder.array("sources", id.toString());
            builder.endObject();
            builder.field("version", VERSION);
            builder.startObject("thanos");
            builder.startObject("labels");
            for (Map.Entry<String, String> label : externalLabels.toMapView().entrySet()) {
                builder.field(label.getKey(), label.getValue());
            }
            builder.endObject();
            builder.startObject("downsample");
            builder.field("resolution", 0);
            builder.endObject();
            builder.field("source", source);
            builder.endObject();
            builder.endObject();
            return BytesReference.bytes(builder).utf8ToString();
        }
    }

    @SuppressWarnings("unchecked")
    static BlockMetadata fromMap(Map<String, Object> map) {
        int version = ((Number) map.get("version")).intValue();
        if (version != VERSION) {
            throw new IllegalStateException("unsupported block meta version: " + version);
        }
        BlockId id = BlockId.parse((String) map.get("ulid"));
        Map<String, Object> stats = (Map<String, Object>) map.get("stats");
        Map<String, Object> thanos = (Map<String, Object>) map.getOrDefault("thanos", Map.of());
        Map<String, String> labels = (Map<String, String>) thanos.getOrDefault("labels", Map.of());
        return new BlockMetadata(
            id,
            ((Number) map.get("minTime")).longValue(),
            ((Number) map.get("maxTime")).longValue(),
            new Stats(
                ((Number) stats.get("numSamples")).longValue(),
                ((Number) stats.get("numSeries")).longValue(),
                ((Number) stats.get("numChunks")).longValue()
            ),
            ByteLabels.fromMap(labels),
            (String) thanos.getOrDefault("source", "")
        );
    }

    /**
     * Reads the metadata file of a block directory.
     *
     * @param blockDir the block directory
     * @return the metadata
     * @throws IOException if the file cannot be read or parsed
     */
    public static BlockMetadata readFromDir(Path blockDir) throws IOException {
        Path file = blockDir.resolve(BlockFormat.META_FILENAME);
        try (
            InputStream in = Files.newInputStream(file);
            XContentParser parser = MediaTypeRegistry.JSON.xContent()
                .createParser(NamedXContentRegistry.EMPTY, DeprecationHandler.THROW_UNSUPPORTED_OPERATION, in)
        ) {
            return fromMap(parser.map());
        } catch (RuntimeException e) {
            throw new IOException("Failed to parse block metadata " + file, e);
        }
    }

    /**
     * Writes the metadata file of a block directory through a temporary file and an atomic rename, so readers
     * never observe a partially written file.
     *
     * @param blockDir the block directory
     * @throws IOException if the file cannot be written
     */
    public void writeToDir(Path blockDir) throws IOException {
        Path file = blockDir.resolve(BlockFormat.META_FILENAME);
        Path tmp = blockDir.resolve(BlockFormat.META_FILENAME + TMP_SUFFIX);
        Files.writeString(tmp, marshal());
        IOUtils.fsync(tmp, false);
        Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE);
        IOUtils.fsync(blockDir, true);
    }
}
