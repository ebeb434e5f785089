/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

/**
 * Constants shared by label encodings and their string forms.
 */
public final class LabelConstants {

    /** Label holding the metric name. */
    public static final String METRIC_NAME_LABEL = "__name__";

    /** Separator between a label name and its value in index terms. */
    public static final char LABEL_DELIMITER = ':';

    /** Separator between pairs in {@link Labels#toKeyValueString()}. */
    public static final char SPACE_SEPARATOR = ' ';

    public static final String EMPTY_STRING = "";

    private LabelConstants() {
        // constants only
    }
}
