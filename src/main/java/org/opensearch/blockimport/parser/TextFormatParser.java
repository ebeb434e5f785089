/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.parser;

import org.opensearch.blockimport.core.model.ByteLabels;
import org.opensearch.blockimport.core.model.Exemplar;
import org.opensearch.blockimport.core.model.LabelConstants;
import org.opensearch.blockimport.core.model.Labels;
import org.opensearch.blockimport.exceptions.SampleParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses the Prometheus text exposition format, one entry per line:
 * <pre>
 * # HELP http_requests_total Total requests.
 * # TYPE http_requests_total counter
 * http_requests_total{method="post",code="200"} 1027 1395066363000
 * </pre>
 * Timestamps are integer milliseconds. A sample may carry an OpenMetrics style exemplar,
 * {@code # {trace_id="abc"} 0.67 1395066363000}, whose timestamp defaults to the sample's. Parsing stops at
 * {@code # EOF}.
 */
public class TextFormatParser implements SampleParser {
    private static final String EOF_MARKER = "# EOF";
    private static final Set<String> METRIC_TYPES = Set.of(
        "counter",
        "gauge",
        "histogram",
        "gaugehistogram",
        "summary",
        "info",
        "stateset",
        "untyped",
        "unknown"
    );
    private static final Pattern FLOAT = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private final BufferedReader reader;
    private int lineNumber;
    private boolean done;

    public TextFormatParser(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }

    @Override
    public ParsedEntry next() throws IOException {
        while (done == false) {
            String line = reader.readLine();
            if (line == null || line.equals(EOF_MARKER)) {
                done = true;
                break;
            }
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            return line.charAt(0) == '#' ? parseComment(line) : new LineCursor(line).parseSeries();
        }
        return null;
    }

    /**
     * Returns the number of the last line read.
     *
     * @return the 1-based line number
     */
    public int getLineNumber() {
        return lineNumber;
    }

    private ParsedEntry parseComment(String line) {
        String body = line.substring(1).stripLeading();
        String[] parts = body.split("[ \\t]+", 3);
        EntryType type = switch (parts[0]) {
            case "HELP" -> EntryType.HELP;
            case "TYPE" -> EntryType.TYPE;
            case "UNIT" -> EntryType.UNIT;
            default -> EntryType.COMMENT;
        };
        if (type == EntryType.COMMENT || parts.length < 2) {
            return ParsedEntry.comment(body);
        }
        String metricName = parts[1];
        if (isValidMetricName(metricName) == false) {
            throw new SampleParseException(lineNumber, "invalid metric name [{}] in {} line", metricName, parts[0]);
        }
        String text = parts.length == 3 ? parts[2] : "";
        if (type == EntryType.TYPE && METRIC_TYPES.contains(text) == false) {
            throw new SampleParseException(lineNumber, "invalid metric type [{}]", text);
        }
        return ParsedEntry.metadata(type, metricName, type == EntryType.HELP ? unescapeHelp(text) : text);
    }

    private static String unescapeHelp(String text) {
        return text.replace("\\n", "\n").replace("\\\\", "\\");
    }

    private static boolean isValidMetricName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = c == '_' || c == ':' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (i > 0 && c >= '0' && c <= '9');
            if (valid == false) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    /**
     * Position within one series line.
     */
    private class LineCursor {
        private final String line;
        private int pos;

        LineCursor(String line) {
            this.line = line;
        }

        ParsedEntry parseSeries() {
            String metricName = readName(true);
            List<String> labels = new ArrayList<>();
            labels.add(LabelConstants.METRIC_NAME_LABEL);
            labels.add(metricName);
            if (peek() == '{') {
                readLabels(labels);
            }
            Labels seriesLabels = toLabels(labels);

            requireWhitespace("value");
            double value = parseValue(readToken());
            OptionalLong timestamp = OptionalLong.empty();
            skipWhitespace();
            if (atEnd() == false && peek() != '#') {
                timestamp = OptionalLong.of(parseTimestamp(readToken()));
                skipWhitespace();
            }

            Exemplar exemplar = null;
            if (atEnd() == false && peek() == '#') {
                exemplar = readExemplar(timestamp);
            }
            skipWhitespace();
            if (atEnd() == false) {
                throw error("unexpected trailing content [{}]", line.substring(pos));
            }
            return ParsedEntry.series(seriesLabels, value, timestamp, exemplar);
        }

        private Exemplar readExemplar(OptionalLong sampleTimestamp) {
            pos++;
            skipWhitespace();
            if (peek() != '{') {
                throw error("expected exemplar labels after '#'");
            }
            List<String> labels = new ArrayList<>();
            readLabels(labels);
            requireWhitespace("exemplar value");
            double value = parseValue(readToken());
            skipWhitespace();
            long timestamp;
            if (atEnd() == false) {
                timestamp = parseTimestamp(readToken());
            } else if (sampleTimestamp.isPresent()) {
                timestamp = sampleTimestamp.getAsLong();
            } else {
                throw error("exemplar without timestamp on a sample without timestamp");
            }
            return new Exemplar(toLabels(labels), value, timestamp);
        }

        private void readLabels(List<String> labels) {
            pos++; // '{'
            while (true) {
                skipWhitespace();
                if (peek() == '}') {
                    pos++;
                    return;
                }
                String name = readName(false);
                skipWhitespace();
                expect('=');
                skipWhitespace();
                labels.add(name);
                labels.add(readQuoted());
                skipWhitespace();
                char c = peek();
                if (c == ',') {
                    pos++;
                } else if (c != '}') {
                    throw error("expected ',' or '}' after label [{}]", name);
                }
            }
        }

        private String readName(boolean metricName) {
            int start = pos;
            while (atEnd() == false) {
                char c = line.charAt(pos);
                boolean valid = c == '_'
                    || (c >= 'a' && c <= 'z')
                    || (c >= 'A' && c <= 'Z')
                    || (pos > start && c >= '0' && c <= '9')
                    || (metricName && c == ':');
                if (valid == false) {
                    break;
                }
                pos++;
            }
            if (pos == start) {
                throw error(metricName ? "expected metric name" : "expected label name");
            }
            return line.substring(start, pos);
        }

        private String readQuoted() {
            expect('"');
            StringBuilder sb = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    throw error("unterminated label value");
                }
                char c = line.charAt(pos++);
                if (c == '"') {
                    return sb.toString();
                }
                if (c == '\\') {
                    if (atEnd()) {
                        throw error("unterminated escape sequence");
                    }
                    char escaped = line.charAt(pos++);
                    switch (escaped) {
                        case '\\' -> sb.append('\\');
                        case '"' -> sb.append('"');
                        case 'n' -> sb.append('\n');
                        default -> throw error("invalid escape sequence [\\\\{}]", escaped);
                    }
                } else {
                    sb.append(c);
                }
            }
        }

        private String readToken() {
            int start = pos;
            while (atEnd() == false && line.charAt(pos) != ' ' && line.charAt(pos) != '\t') {
                pos++;
            }
            if (pos == start) {
                throw error("expected a value");
            }
            return line.substring(start, pos);
        }

        private double parseValue(String token) {
            switch (token) {
                case "NaN":
                    return Double.NaN;
                case "+Inf":
                case "Inf":
                    return Double.POSITIVE_INFINITY;
                case "-Inf":
                    return Double.NEGATIVE_INFINITY;
                default:
                    if (FLOAT.matcher(token).matches() == false) {
                        throw error("invalid value [{}]", token);
                    }
                    return Double.parseDouble(token);
            }
        }

        private long parseTimestamp(String token) {
            if (INTEGER.matcher(token).matches() == false) {
                throw error("invalid timestamp [{}], expected integer milliseconds", token);
            }
            try {
                return Long.parseLong(token);
            } catch (NumberFormatException e) {
                throw new SampleParseException(lineNumber, "timestamp [{}] out of range", e, token);
            }
        }

        private Labels toLabels(List<String> pairs) {
            try {
                return ByteLabels.fromStrings(pairs.toArray(new String[0]));
            } catch (IllegalArgumentException e) {
                throw new SampleParseException(lineNumber, "invalid label set: {}", e, e.getMessage());
            }
        }

        private void expect(char expected) {
            if (peek() != expected) {
                throw error("expected '{}'", expected);
            }
            pos++;
        }

        private void requireWhitespace(String what) {
            if (atEnd() || (line.charAt(pos) != ' ' && line.charAt(pos) != '\t')) {
                throw error("expected whitespace before {}", what);
            }
            skipWhitespace();
        }

        private void skipWhitespace() {
            while (atEnd() == false && (line.charAt(pos) == ' ' || line.charAt(pos) == '\t')) {
                pos++;
            }
        }

        private char peek() {
            return atEnd() ? '\0' : line.charAt(pos);
        }

        private boolean atEnd() {
            return pos >= line.length();
        }

        private SampleParseException error(String msg, Object... args) {
            return new SampleParseException(lineNumber, msg, args);
        }
    }
}
