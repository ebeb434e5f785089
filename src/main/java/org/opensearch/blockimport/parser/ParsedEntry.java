/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.parser;

import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.Labels;

import java.util.OptionalLong;

/**
 * One entry of the input.
 *
 * @param type       entry kind
 * @param labels     series labels including the metric name, only set for {@link EntryType#SERIES}
 * @param value      sample value, only meaningful for {@link EntryType#SERIES}
 * @param timestamp  sample timestamp in milliseconds, empty when the input has none
 * @param exemplar   exemplar attached to the sample, or null
 * @param metricName metric the metadata applies to, only set for {@link EntryType#TYPE}, {@link EntryType#HELP} and
 *                   {@link EntryType#UNIT}
 * @param text       metadata or comment text
 */
public record ParsedEntry(
    EntryType type,
    Labels labels,
    double value,
    OptionalLong timestamp,
    Exemplar exemplar,
    String metricName,
    String text
) {

    public static ParsedEntry series(Labels labels, double value, OptionalLong timestamp, Exemplar exemplar) {
        return new ParsedEntry(EntryType.SERIES, labels, value, timestamp, exemplar, null, null);
    }

    public static ParsedEntry metadata(EntryType type, String metricName, String text) {
        return new ParsedEntry(type, null, Double.NaN, OptionalLong.empty(), null, metricName, text);
    }

    public static ParsedEntry comment(String text) {
        return new ParsedEntry(EntryType.COMMENT, null, Double.NaN, OptionalLong.empty(), null, null, text);
    }
}
