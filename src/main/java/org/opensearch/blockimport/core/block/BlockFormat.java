/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

/**
 * Names of the files and index fields that make up a block directory.
 */
public final class BlockFormat {

    private BlockFormat() {
        // Utility class
    }

    /** Metadata file in the block directory. */
    public static final String META_FILENAME = "meta.json";

    /** Lucene index holding the chunks of the block. */
    public static final String INDEX_DIRNAME = "index";

    /** Suffix of a block directory that is still being written. */
    public static final String TMP_FOR_CREATION_SUFFIX = ".tmp-for-creation";

    /** Prefix of the scratch directory of a block builder inside the output directory. */
    public static final String SCRATCH_DIR_PREFIX = ".tmp-head-";

    /**
     * Fields of the block index, one document per chunk.
     */
    public static final class IndexSchema {

        private IndexSchema() {
            // Utility class
        }

        /**
         * Labels of the series, indexed as {@code name:value} terms and stored as raw label bytes in doc values
         */
        public static final String LABELS = "labels";

        /**
         * Stable hash of the labels, primary index sort
         */
        public static final String LABELS_HASH = "labels_hash";

        /**
         * Serialized chunk
         */
        public static final String CHUNK = "chunk";

        /**
         * Minimum timestamp of all samples in the chunk, secondary index sort
         */
        public static final String MIN_TIMESTAMP = "min_timestamp";

        /**
         * Maximum timestamp of all samples in the chunk
         */
        public static final String MAX_TIMESTAMP = "max_timestamp";
    }
}
