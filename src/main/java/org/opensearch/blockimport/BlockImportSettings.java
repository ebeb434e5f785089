/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport;

import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.common.settings.Setting;
import org.opensearch.common.settings.Settings;
import org.opensearch.common.unit.TimeValue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Settings recognized by the block importer.
 */
public final class BlockImportSettings {

    /**
     * Base directory the finished blocks are written to, one sub directory per block. Required.
     */
    public static final Setting<String> OUTPUT_DIR = Setting.simpleString(
        "block_import.output.dir",
        new Setting.Validator<String>() {
            @Override
            public void validate(String value) {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("block_import.output.dir must be set");
                }
            }
        },
        Setting.Property.NodeScope
    );

    /**
     * Width of the time range covered by one block. Samples are routed to the block whose range contains them.
     */
    public static final Setting<TimeValue> BLOCK_DURATION = new Setting<>(
        "block_import.block.duration",
        "2h",
        (s) -> TimeValue.parseTimeValue(s, "block_import.block.duration"),
        new Setting.Validator<TimeValue>() {
            @Override
            public void validate(TimeValue blockDuration) {
                if (blockDuration.millis() <= 0) {
                    throw new IllegalArgumentException("block_import.block.duration must be positive");
                }
            }
        },
        Setting.Property.NodeScope
    );

    /**
     * Labels stamped on every produced block, e.g. {@code block_import.external_labels.cluster: eu-1}.
     */
    public static final Setting<Settings> EXTERNAL_LABELS = Setting.groupSetting("block_import.external_labels.", Setting.Property.NodeScope);

    /**
     * Source tag written to the metadata of every produced block.
     */
    public static final Setting<String> SOURCE = Setting.simpleString(
        "block_import.source",
        "opensearch-block-import",
        Setting.Property.NodeScope
    );

    /**
     * Maximum number of samples in a chunk before a new one is cut.
     */
    public static final Setting<Integer> SAMPLES_PER_CHUNK = Setting.intSetting(
        "block_import.chunk.samples_per_chunk",
        120,
        4,
        Setting.Property.NodeScope
    );

    /**
     * Number of exemplars a head keeps in memory. The oldest ones are evicted first.
     */
    public static final Setting<Integer> MAX_EXEMPLARS = Setting.intSetting(
        "block_import.head.max_exemplars",
        100_000,
        0,
        Setting.Property.NodeScope
    );

    private BlockImportSettings() {
        // constants only
    }

    /**
     * Returns all settings of the importer.
     *
     * @return the settings
     */
    public static List<Setting<?>> getSettings() {
        return List.of(OUTPUT_DIR, BLOCK_DURATION, EXTERNAL_LABELS, SOURCE, SAMPLES_PER_CHUNK, MAX_EXEMPLARS);
    }

    public static Path outputDir(Settings settings) {
        return Path.of(OUTPUT_DIR.get(settings));
    }

    /**
     * Builds the external label set from the {@link #EXTERNAL_LABELS} group.
     *
     * @param settings the importer settings
     * @return the labels, empty when none are configured
     */
    public static Labels externalLabels(Settings settings) {
        Settings group = EXTERNAL_LABELS.get(settings);
        Map<String, String> labels = new TreeMap<>();
        for (String name : group.keySet()) {
            labels.put(name, group.get(name));
        }
        return ByteLabels.fromMap(labels);
    }
}
