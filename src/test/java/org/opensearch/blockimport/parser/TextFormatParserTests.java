/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.parser;

import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.exceptions.SampleParseException;
import org.opensearch.test.OpenSearchTestCase;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

public class TextFormatParserTests extends OpenSearchTestCase {

    private static List<ParsedEntry> parseAll(String input) throws IOException {
        List<ParsedEntry> entries = new ArrayList<>();
        try (TextFormatParser parser = new TextFormatParser(new StringReader(input))) {
            ParsedEntry entry;
            while ((entry = parser.next()) != null) {
                entries.add(entry);
            }
            assertNull(parser.next());
        }
        return entries;
    }

    private static ParsedEntry parseOne(String line) throws IOException {
        List<ParsedEntry> entries = parseAll(line);
        assertEquals(1, entries.size());
        return entries.get(0);
    }

    public void testExpositionFormat() throws Exception {
        String input = """
            # HELP http_requests_total The total number of HTTP requests.
            # TYPE http_requests_total counter
            http_requests_total{method="post",code="200"} 1027 1395066363000
            http_requests_total{method="post",code="400"}    3 1395066363000

            # a free comment
            metric_without_labels 12.47 1395066363001
            """;
        List<ParsedEntry> entries = parseAll(input);
        assertEquals(6, entries.size());

        assertEquals(EntryType.HELP, entries.get(0).type());
        assertEquals("http_requests_total", entries.get(0).metricName());
        assertEquals("The total number of HTTP requests.", entries.get(0).text());
        assertEquals(EntryType.TYPE, entries.get(1).type());
        assertEquals("counter", entries.get(1).text());

        ParsedEntry first = entries.get(2);
        assertEquals(EntryType.SERIES, first.type());
        assertEquals(ByteLabels.fromStrings("__name__", "http_requests_total", "method", "post", "code", "200"), first.labels());
        assertEquals(1027.0, first.value(), 0.0);
        assertEquals(OptionalLong.of(1395066363000L), first.timestamp());
        assertNull(first.exemplar());

        assertEquals(3.0, entries.get(3).value(), 0.0);
        assertEquals(EntryType.COMMENT, entries.get(4).type());
        assertEquals(ByteLabels.fromStrings("__name__", "metric_without_labels"), entries.get(5).labels());
        assertEquals(12.47, entries.get(5).value(), 0.0);
    }

    public void testMissingTimestampIsEmpty() throws Exception {
        ParsedEntry entry = parseOne("up 1");
        assertEquals(OptionalLong.empty(), entry.timestamp());
    }

    public void testSpecialValues() throws Exception {
        assertTrue(Double.isNaN(parseOne("m NaN 1").value()));
        assertEquals(Double.POSITIVE_INFINITY, parseOne("m +Inf 1").value(), 0.0);
        assertEquals(Double.POSITIVE_INFINITY, parseOne("m Inf 1").value(), 0.0);
        assertEquals(Double.NEGATIVE_INFINITY, parseOne("m -Inf 1").value(), 0.0);
        assertEquals(-1.5e-3, parseOne("m -1.5e-3 1").value(), 0.0);
        assertEquals(-5, parseOne("m 1 -5").timestamp().getAsLong());
    }

    public void testLabelEscapesAndTrailingComma() throws Exception {
        ParsedEntry entry = parseOne("msdos_file_access_time_seconds{path=\"C:\\\\DIR\\\\FILE.TXT\",error=\"Cannot find file:\\n\\\"FILE.TXT\\\"\",} 1.458255915e9 5");
        assertEquals("C:\\DIR\\FILE.TXT", entry.labels().get("path"));
        assertEquals("Cannot find file:\n\"FILE.TXT\"", entry.labels().get("error"));
        assertEquals(1.458255915e9, entry.value(), 0.0);
    }

    public void testEmptyLabelValueIsDropped() throws Exception {
        ParsedEntry entry = parseOne("m{a=\"\",b=\"x\"} 1 1");
        assertEquals(ByteLabels.fromStrings("__name__", "m", "b", "x"), entry.labels());
    }

    public void testExemplar() throws Exception {
        ParsedEntry withTimestamp = parseOne("foo_bucket{le=\"0.1\"} 8 1000 # {trace_id=\"KOO5S4vxi0o\"} 0.067 999");
        assertNotNull(withTimestamp.exemplar());
        assertEquals(ByteLabels.fromStrings("trace_id", "KOO5S4vxi0o"), withTimestamp.exemplar().labels());
        assertEquals(0.067, withTimestamp.exemplar().value(), 0.0);
        assertEquals(999, withTimestamp.exemplar().timestamp());

        ParsedEntry inherited = parseOne("foo_bucket{le=\"0.1\"} 8 1000 # {trace_id=\"a\"} 0.5");
        assertEquals(1000, inherited.exemplar().timestamp());
    }

    public void testEofMarkerEndsInput() throws Exception {
        List<ParsedEntry> entries = parseAll("a 1 1\n# EOF\nb 2 2\n");
        assertEquals(1, entries.size());
    }

    public void testLineNumberCountsBlankLines() throws Exception {
        try (TextFormatParser parser = new TextFormatParser(new StringReader("a 1 1\n\n\nb 2 2\n"))) {
            parser.next();
            assertEquals(1, parser.getLineNumber());
            parser.next();
            assertEquals(4, parser.getLineNumber());
        }
    }

    public void testMalformedLines() {
        assertParseError("1metric 1 1", 1);
        assertParseError("m{a=\"1\" 1 1", 1);
        assertParseError("m{a=1} 1 1", 1);
        assertParseError("m{a=\"1\",a=\"2\"} 1 1", 1);
        assertParseError("m{a=\"\\x\"} 1 1", 1);
        assertParseError("m", 1);
        assertParseError("m abc 1", 1);
        assertParseError("m 1 1.5", 1);
        assertParseError("m 1 1 extra", 1);
        assertParseError("m 1 # {a=\"b\"} 1", 1);
        assertParseError("m 1 99999999999999999999", 1);
        assertParseError("# TYPE m bogus", 1);
        assertParseError("# HELP 0bad text", 1);
        assertParseError("ok 1 1\n\nbad{ 1 1", 3);
    }

    private void assertParseError(String input, int line) {
        SampleParseException e = expectThrows(SampleParseException.class, () -> parseAll(input));
        assertEquals(input, line, e.getLineNumber());
        assertTrue(e.getMessage(), e.getMessage().startsWith("line " + line + ": "));
    }
}
