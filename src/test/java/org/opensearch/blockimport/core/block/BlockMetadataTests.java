/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class BlockMetadataTests extends OpenSearchTestCase {

    private BlockMetadata newMetadata() {
        return new BlockMetadata(
            BlockId.generate(),
            1000,
            7201000,
            new BlockMetadata.Stats(300, 3, 6),
            ByteLabels.fromStrings("cluster", "eu-1", "replica", "a"),
            "importer"
        );
    }

    public void testWriteAndRead() throws Exception {
        Path dir = createTempDir();
        BlockMetadata metadata = newMetadata();
        metadata.writeToDir(dir);

        assertTrue(Files.exists(dir.resolve(BlockFormat.META_FILENAME)));
        assertFalse(Files.exists(dir.resolve(BlockFormat.META_FILENAME + ".tmp")));
        assertEquals(metadata, BlockMetadata.readFromDir(dir));
    }

    public void testMarshalLayout() throws Exception {
        BlockMetadata metadata = newMetadata();
        String json = metadata.marshal();

        assertTrue(json, json.contains("\"ulid\" : \"" + metadata.id() + "\""));
        assertTrue(json, json.contains("\"minTime\" : 1000"));
        assertTrue(json, json.contains("\"maxTime\" : 7201000"));
        assertTrue(json, json.contains("\"numSamples\" : 300"));
        assertTrue(json, json.contains("\"version\" : 1"));
        assertTrue(json, json.contains("\"cluster\" : \"eu-1\""));
        assertTrue(json, json.contains("\"source\" : \"importer\""));
    }

    public void testWithThanosMetadata() {
        BlockMetadata plain = new BlockMetadata(BlockId.generate(), 0, 1, new BlockMetadata.Stats(1, 1, 1), ByteLabels.emptyLabels(), "");
        BlockMetadata amended = plain.withThanosMetadata("src", ByteLabels.fromStrings("a", "b"));

        assertEquals(plain.id(), amended.id());
        assertEquals(plain.stats(), amended.stats());
        assertEquals("src", amended.source());
        assertEquals("b", amended.externalLabels().get("a"));
    }

    public void testUnsupportedVersion() throws Exception {
        Path dir = createTempDir();
        newMetadata().writeToDir(dir);
        Path file = dir.resolve(BlockFormat.META_FILENAME);
        Files.writeString(file, Files.readString(file).replace("\"version\" : 1", "\"version\" : 7"));

        expectThrows(IOException.class, () -> BlockMetadata.readFromDir(dir));
    }
}
