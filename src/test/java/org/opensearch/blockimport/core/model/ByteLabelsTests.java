/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.model;

import org.apache.lucene.util.BytesRef;
import org.opensearch.test.OpenSearchTestCase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ByteLabelsTests extends OpenSearchTestCase {

    public void testFromStringsSortsByName() {
        ByteLabels labels = ByteLabels.fromStrings("job", "node", "__name__", "up", "instance", "host-1");

        assertEquals(List.of("__name__", "instance", "job"), new ArrayList<>(labels.toMapView().keySet()));
        assertEquals("__name__:up instance:host-1 job:node", labels.toKeyValueString());
        assertEquals("up", labels.metricName());
        assertEquals("node", labels.get("job"));
        assertTrue(labels.has("instance"));
        assertFalse(labels.has("zone"));
        assertEquals("", labels.get("zone"));
    }

    public void testEqualityIgnoresInputOrder() {
        ByteLabels a = ByteLabels.fromStrings("a", "1", "b", "2");
        ByteLabels b = ByteLabels.fromStrings("b", "2", "a", "1");
        Map<String, String> map = new LinkedHashMap<>();
        map.put("b", "2");
        map.put("a", "1");

        assertEquals(a, b);
        assertEquals(a, ByteLabels.fromMap(map));
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.stableHash(), b.stableHash());
        assertEquals(0, a.compareTo(b));
    }

    public void testEmptyValuesAreDropped() {
        ByteLabels labels = ByteLabels.fromStrings("a", "1", "b", "");
        assertEquals(ByteLabels.fromStrings("a", "1"), labels);
        assertTrue(ByteLabels.fromStrings("a", "").isEmpty());
        assertSame(ByteLabels.emptyLabels(), ByteLabels.fromStrings());
    }

    public void testInvalidInput() {
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromStrings("a"));
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromStrings("a", "1", "a", "2"));
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromStrings("", "1"));
        expectThrows(IllegalArgumentException.class, () -> ByteLabels.fromRawBytes(null));
    }

    public void testRawBytesRoundTrip() {
        ByteLabels labels = ByteLabels.fromStrings("__name__", "cpu", "mode", "idle", "value", "x".repeat(300));
        ByteLabels copy = ByteLabels.fromRawBytes(labels.getRawBytes().clone());

        assertEquals(labels, copy);
        assertEquals("x".repeat(300), copy.get("value"));
    }

    public void testCompareToOrdersPairwise() {
        ByteLabels a = ByteLabels.fromStrings("__name__", "a");
        ByteLabels ab = ByteLabels.fromStrings("__name__", "a", "job", "x");
        ByteLabels b = ByteLabels.fromStrings("__name__", "b");

        List<ByteLabels> sorted = new ArrayList<>(List.of(b, ab, a));
        Collections.sort(sorted);
        assertEquals(List.of(a, ab, b), sorted);
        assertTrue(ByteLabels.emptyLabels().compareTo(a) < 0);
    }

    public void testKeyValueBytesRefs() {
        BytesRef[] terms = ByteLabels.fromStrings("b", "2", "a", "1").toKeyValueBytesRefs();
        assertEquals(2, terms.length);
        assertEquals("a:1", terms[0].utf8ToString());
        assertEquals("b:2", terms[1].utf8ToString());
    }

    public void testToStringEscapesValues() {
        ByteLabels labels = ByteLabels.fromStrings("__name__", "up", "path", "C:\\tmp", "msg", "say \"hi\"\nbye");
        assertEquals("up{msg=\"say \\\"hi\\\"\\nbye\", path=\"C:\\\\tmp\"}", labels.toString());
    }

    public void testRandomLabelsRoundTripThroughMap() {
        Map<String, String> map = new LinkedHashMap<>();
        int count = randomIntBetween(1, 20);
        for (int i = 0; i < count; i++) {
            map.put("l" + i + "_" + randomAlphaOfLength(4), randomUnicodeOfLengthBetween(1, 40));
        }
        ByteLabels labels = ByteLabels.fromMap(map);
        assertEquals(map.size(), labels.toMapView().size());
        for (Map.Entry<String, String> entry : map.entrySet()) {
            assertEquals(entry.getValue(), labels.get(entry.getKey()));
        }
    }
}
