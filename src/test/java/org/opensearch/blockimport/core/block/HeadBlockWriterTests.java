/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.opensearch.blockimport.BlockImportSettings;
import org.opensearch.blockimport.core.head.Head;
import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.core.model.Sample;
import org.opensearch.blockimport.exceptions.BlockFlushException;
import org.opensearch.blockimport.exceptions.EmptyBlockException;
import org.opensearch.common.settings.Settings;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public class HeadBlockWriterTests extends OpenSearchTestCase {

    private Path outputDir;
    private Settings settings;

    @Override
    public void setUp() throws Exception {
        super.setUp();
        outputDir = createTempDir();
        settings = Settings.builder()
            .put(BlockImportSettings.OUTPUT_DIR.getKey(), outputDir.toString())
            .put(BlockImportSettings.SAMPLES_PER_CHUNK.getKey(), 4)
            .put(BlockImportSettings.EXTERNAL_LABELS.getKey() + "cluster", "eu-1")
            .put(BlockImportSettings.SOURCE.getKey(), "test")
            .build();
    }

    public void testFlushWritesBlock() throws Exception {
        Labels cpu = ByteLabels.fromStrings("__name__", "cpu", "host", "a");
        Labels mem = ByteLabels.fromStrings("__name__", "mem", "host", "a");

        List<BlockId> ids;
        try (HeadBlockWriter writer = new HeadBlockWriter(settings)) {
            BlockAppender appender = writer.appender();
            for (int i = 0; i < 10; i++) {
                appender.append(0, cpu, 1000 + i * 100L, i);
            }
            appender.append(0, mem, 1500, 42);
            appender.commit();
            ids = writer.flush();
        }

        assertEquals(1, ids.size());
        BlockId id = ids.get(0);
        Path blockDir = outputDir.resolve(id.toString());
        assertTrue(Files.isDirectory(blockDir));
        assertEquals(List.of(blockDir), listOutput());

        try (BlockReader reader = new BlockReader(blockDir)) {
            BlockMetadata metadata = reader.getMetadata();
            assertEquals(id, metadata.id());
            assertEquals(1000, metadata.minTime());
            assertEquals(1901, metadata.maxTime());
            assertEquals(new BlockMetadata.Stats(11, 2, 4), metadata.stats());
            assertEquals("eu-1", metadata.externalLabels().get("cluster"));
            assertEquals("test", metadata.source());
            assertEquals(4, reader.getNumChunks());

            Map<Labels, List<Sample>> series = reader.readAllSeries();
            assertEquals(2, series.size());
            assertEquals(10, series.get(cpu).size());
            assertEquals(new Sample(1900, 9), series.get(cpu).get(9));
            assertEquals(List.of(new Sample(1500, 42)), series.get(mem));

            assertEquals(Map.of(mem, List.of(new Sample(1500, 42))), reader.readSeries("__name__", "mem"));
            assertTrue(reader.readSeries("host", "b").isEmpty());
        }
    }

    public void testEmptyHeadFails() throws Exception {
        try (HeadBlockWriter writer = new HeadBlockWriter(settings)) {
            BlockAppender appender = writer.appender();
            appender.commit();
            EmptyBlockException e = expectThrows(EmptyBlockException.class, writer::flush);
            assertEquals("no series appended; aborting", e.getMessage());
        }
        assertTrue(listOutput().isEmpty());
    }

    public void testUncommittedSamplesAreNotWritten() throws Exception {
        try (HeadBlockWriter writer = new HeadBlockWriter(settings)) {
            writer.appender().append(0, ByteLabels.fromStrings("__name__", "up"), 1000, 1);
            expectThrows(EmptyBlockException.class, writer::flush);
        }
    }

    public void testFlushOnlyOnce() throws Exception {
        try (HeadBlockWriter writer = new HeadBlockWriter(settings)) {
            BlockAppender appender = writer.appender();
            appender.append(0, ByteLabels.fromStrings("__name__", "up"), 1000, 1);
            appender.commit();
            writer.flush();
            expectThrows(IllegalStateException.class, writer::flush);
            expectThrows(IllegalStateException.class, () -> appender.append(0, ByteLabels.fromStrings("__name__", "up"), 2000, 1));
        }
    }

    public void testCloseRemovesScratchDirectory() throws Exception {
        HeadBlockWriter writer = new HeadBlockWriter(settings, TimeRange.forTimestamp(0, 1000));
        Path scratch = writer.getScratchDir();
        assertTrue(Files.isDirectory(scratch));
        assertTrue(scratch.getFileName().toString().startsWith(BlockFormat.SCRATCH_DIR_PREFIX));

        writer.close();
        assertFalse(Files.exists(scratch));
        expectThrows(IllegalStateException.class, writer::flush);
        expectThrows(IllegalStateException.class, () -> writer.getHead().newAppender());
    }

    public void testFailedFlushLeavesNoBlock() throws Exception {
        Labels up = ByteLabels.fromStrings("__name__", "up");
        try (HeadBlockWriter writer = new HeadBlockWriter(outputDir, ByteLabels.emptyLabels(), "test", new Head(4, 0), null)) {
            BlockAppender appender = writer.appender();
            appender.append(0, up, 1000, 1);
            appender.commit();
            // the staging directory cannot be created once the scratch directory is gone
            Files.delete(writer.getScratchDir());
            Files.writeString(writer.getScratchDir(), "not a directory");

            expectThrows(BlockFlushException.class, writer::flush);
            Files.delete(writer.getScratchDir());
        }
        assertTrue(listOutput().isEmpty());
    }

    private List<Path> listOutput() throws IOException {
        try (Stream<Path> files = Files.list(outputDir)) {
            return files.toList();
        }
    }
}
