/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

import org.apache.lucene.util.BytesRef;
import org.opensearch.common.hash.MurmurHash3;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.opensearch.blockimport.core.model.LabelConstants.EMPTY_STRING;
import static org.opensearch.blockimport.core.model.LabelConstants.LABEL_DELIMITER;
import static org.opensearch.blockimport.core.model.LabelConstants.METRIC_NAME_LABEL;
import static org.opensearch.blockimport.core.model.LabelConstants.SPACE_SEPARATOR;

/**
 * Labels stored as one flat byte array of name-sorted pairs.
 *
 * <h2>Encoding Format</h2>
 * <pre>
 * [name1_len][name1_bytes][value1_len][value1_bytes][name2_len][name2_bytes]...
 * </pre>
 * Lengths below 255 take one byte. Longer strings are written as the marker byte 255 followed by the
 * length in 3 little-endian bytes, which caps a single name or value at 16MB.
 * <p>
 * The encoding is canonical: two label sets are equal exactly when their bytes are equal, which is what
 * makes {@link #stableHash()} usable as a series reference inside a block.
 */
public final class ByteLabels implements Labels {
    private static final int LONG_LENGTH_MARKER = 255;
    private static final int MAX_STRING_LENGTH = 0xFFFFFF;

    private static final ByteLabels EMPTY = new ByteLabels(new byte[0]);

    private final byte[] data;

    private long hash = Long.MIN_VALUE;

    private ByteLabels(byte[] data) {
        this.data = data;
    }

    /**
     * Creates labels from alternating name and value strings, e.g. {@code "__name__", "up", "job", "node"}.
     * Pairs with an empty value are dropped.
     *
     * @param labels names at even indices, values at odd indices
     * @return the encoded labels
     * @throws IllegalArgumentException on an odd number of strings or a repeated name
     */
    public static ByteLabels fromStrings(String... labels) {
        if (labels.length % 2 != 0) {
            throw new IllegalArgumentException(
                "Labels must be in pairs (key-value). Received " + labels.length + " labels: " + Arrays.toString(labels)
            );
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        for (int i = 0; i < labels.length; i += 2) {
            if (sorted.put(labels[i], labels[i + 1]) != null) {
                throw new IllegalArgumentException("Duplicate label name [" + labels[i] + "]");
            }
        }
        return encodeLabels(sorted);
    }

    /**
     * Creates labels from a map of names to values. Entries with an empty value are dropped.
     *
     * @param labelMap label names to values
     * @return the encoded labels
     */
    public static ByteLabels fromMap(Map<String, String> labelMap) {
        return encodeLabels(new TreeMap<>(labelMap));
    }

    /**
     * Wraps bytes previously obtained from {@link #getRawBytes()}.
     *
     * @param data encoded labels
     * @return labels backed by {@code data}
     */
    public static ByteLabels fromRawBytes(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        return data.length == 0 ? EMPTY : new ByteLabels(data);
    }

    public static ByteLabels emptyLabels() {
        return EMPTY;
    }

    private static ByteLabels encodeLabels(TreeMap<String, String> labels) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isEmpty()) {
                throw new IllegalArgumentException("Label name must not be empty");
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                continue;
            }
            appendEncodedString(out, entry.getKey());
            appendEncodedString(out, entry.getValue());
        }
        return out.size() == 0 ? EMPTY : new ByteLabels(out.toByteArray());
    }

    private static void appendEncodedString(ByteArrayOutputStream out, String str) {
        byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
        int length = bytes.length;
        if (length < LONG_LENGTH_MARKER) {
            out.write(length);
        } else if (length <= MAX_STRING_LENGTH) {
            out.write(LONG_LENGTH_MARKER);
            out.write(length & 0xFF);
            out.write((length >> 8) & 0xFF);
            out.write((length >> 16) & 0xFF);
        } else {
            throw new IllegalArgumentException("String too long: " + length);
        }
        out.write(bytes, 0, length);
    }

    /**
     * Locates the string that starts at {@code pos}.
     */
    private StringPosition stringAt(int pos) {
        if (pos >= data.length) {
            throw new IllegalArgumentException("Index out of bounds");
        }
        int first = data[pos] & 0xFF;
        int length;
        int start;
        if (first == LONG_LENGTH_MARKER) {
            if (pos + 4 > data.length) {
                throw new IllegalArgumentException("Incomplete length encoding");
            }
            length = (data[pos + 1] & 0xFF) | ((data[pos + 2] & 0xFF) << 8) | ((data[pos + 3] & 0xFF) << 16);
            start = pos + 4;
        } else {
            length = first;
            start = pos + 1;
        }
        if (start + length > data.length) {
            throw new IllegalArgumentException("String extends beyond data bounds");
        }
        return new StringPosition(start, length);
    }

    private String decode(StringPosition position) {
        return new String(data, position.start(), position.length(), StandardCharsets.UTF_8);
    }

    private static int compareBytes(byte[] a, int aPos, int aLen, byte[] b, int bPos, int bLen) {
        return Arrays.compareUnsigned(a, aPos, aPos + aLen, b, bPos, bPos + bLen);
    }

    /**
     * Finds the value position of {@code name}, or null when the name is absent.
     */
    private StringPosition findValue(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        byte[] nameBytes = name.getBytes(StandardCharsets.UTF_8);
        int pos = 0;
        while (pos < data.length) {
            StringPosition namePos = stringAt(pos);
            StringPosition valuePos = stringAt(namePos.end());
            pos = valuePos.end();

            int cmp = compareBytes(data, namePos.start(), namePos.length(), nameBytes, 0, nameBytes.length);
            if (cmp == 0) {
                return valuePos;
            } else if (cmp > 0) {
                break; // names are sorted
            }
        }
        return null;
    }

    @Override
    public String toKeyValueString() {
        if (data.length == 0) return EMPTY_STRING;

        StringBuilder sb = new StringBuilder();
        int pos = 0;
        while (pos < data.length) {
            if (pos > 0) sb.append(SPACE_SEPARATOR);
            StringPosition name = stringAt(pos);
            StringPosition value = stringAt(name.end());
            pos = value.end();
            sb.append(decode(name)).append(LABEL_DELIMITER).append(decode(value));
        }
        return sb.toString();
    }

    @Override
    public BytesRef[] toKeyValueBytesRefs() {
        int count = 0;
        for (int pos = 0; pos < data.length; count++) {
            pos = stringAt(stringAt(pos).end()).end();
        }

        BytesRef[] result = new BytesRef[count];
        int pos = 0;
        for (int i = 0; i < count; i++) {
            StringPosition name = stringAt(pos);
            StringPosition value = stringAt(name.end());
            pos = value.end();

            byte[] combined = new byte[name.length() + 1 + value.length()];
            System.arraycopy(data, name.start(), combined, 0, name.length());
            combined[name.length()] = (byte) LABEL_DELIMITER;
            System.arraycopy(data, value.start(), combined, name.length() + 1, value.length());
            result[i] = new BytesRef(combined);
        }
        return result;
    }

    @Override
    public Map<String, String> toMapView() {
        LinkedHashMap<String, String> result = new LinkedHashMap<>();
        int pos = 0;
        while (pos < data.length) {
            StringPosition name = stringAt(pos);
            StringPosition value = stringAt(name.end());
            pos = value.end();
            result.put(decode(name), decode(value));
        }
        return Collections.unmodifiableMap(result);
    }

    @Override
    public boolean isEmpty() {
        return data.length == 0;
    }

    @Override
    public String get(String name) {
        StringPosition value = findValue(name);
        return value == null ? EMPTY_STRING : decode(value);
    }

    @Override
    public boolean has(String name) {
        return findValue(name) != null;
    }

    @Override
    public long stableHash() {
        if (hash != Long.MIN_VALUE) return hash;
        hash = MurmurHash3.hash128(data, 0, data.length, 0, new MurmurHash3.Hash128()).h1;
        return hash;
    }

    @Override
    public byte[] getRawBytes() {
        return data;
    }

    /**
     * Orders label sets pair by pair, comparing names first and then values.
     */
    @Override
    public int compareTo(Labels o) {
        byte[] other = o.getRawBytes();
        ByteLabels that = o instanceof ByteLabels b ? b : fromRawBytes(other);
        int pos = 0;
        int otherPos = 0;
        while (pos < data.length && otherPos < other.length) {
            StringPosition name = stringAt(pos);
            StringPosition otherName = that.stringAt(otherPos);
            int cmp = compareBytes(data, name.start(), name.length(), other, otherName.start(), otherName.length());
            if (cmp != 0) {
                return cmp;
            }
            StringPosition value = stringAt(name.end());
            StringPosition otherValue = that.stringAt(otherName.end());
            cmp = compareBytes(data, value.start(), value.length(), other, otherValue.start(), otherValue.length());
            if (cmp != 0) {
                return cmp;
            }
            pos = value.end();
            otherPos = otherValue.end();
        }
        return Boolean.compare(pos < data.length, otherPos < other.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteLabels)) return false;
        return Arrays.equals(this.data, ((ByteLabels) o).data);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(stableHash());
    }

    /**
     * Renders the labels the way the text exposition format writes them, e.g. {@code up{job="node"}}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Map<String, String> labels = toMapView();
        String metricName = labels.get(METRIC_NAME_LABEL);
        if (metricName != null) {
            sb.append(metricName);
        }
        sb.append('{');
        boolean first = true;
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (entry.getKey().equals(METRIC_NAME_LABEL)) {
                continue;
            }
            if (!first) sb.append(", ");
            first = false;
            sb.append(entry.getKey()).append("=\"");
            escapeValue(sb, entry.getValue());
            sb.append('"');
        }
        return sb.append('}').toString();
    }

    private static void escapeValue(StringBuilder sb, String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                default -> sb.append(c);
            }
        }
    }

    /**
     * Start offset and byte length of one encoded string.
     */
    private record StringPosition(int start, int length) {
        int end() {
            return start + length;
        }
    }
}
