/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import org.opensearch.common.unit.TimeValue;
import org.opensearch.test.OpenSearchTestCase;

public class TimeRangeTests extends OpenSearchTestCase {

    private static final long HOUR = TimeValue.timeValueHours(1).millis();

    public void testAlignedToWidth() {
        assertEquals(new TimeRange(0, HOUR), TimeRange.forTimestamp(0, HOUR));
        assertEquals(new TimeRange(0, HOUR), TimeRange.forTimestamp(HOUR - 1, HOUR));
        assertEquals(new TimeRange(HOUR, 2 * HOUR), TimeRange.forTimestamp(HOUR, HOUR));
        assertEquals(new TimeRange(3 * HOUR, 4 * HOUR), TimeRange.forTimestamp(3 * HOUR + 1234, HOUR));
    }

    public void testNegativeTimestampsRoundDown() {
        assertEquals(new TimeRange(-HOUR, 0), TimeRange.forTimestamp(-1, HOUR));
        assertEquals(new TimeRange(-HOUR, 0), TimeRange.forTimestamp(-HOUR, HOUR));
        assertEquals(new TimeRange(-2 * HOUR, -HOUR), TimeRange.forTimestamp(-HOUR - 1, HOUR));
    }

    public void testRandomTimestampsFallIntoTheirRange() {
        for (int i = 0; i < 1000; i++) {
            long width = randomLongBetween(1, 10 * HOUR);
            long timestamp = randomLongBetween(-1_000_000_000_000_000L, 1_000_000_000_000_000L);
            TimeRange range = TimeRange.forTimestamp(timestamp, width);

            assertTrue(range + " should contain " + timestamp, range.contains(timestamp));
            assertEquals(width, range.width());
            assertEquals(0, Math.floorMod(range.start(), width));
            assertEquals(range, TimeRange.forTimestamp(range.start(), width));
            assertEquals(range, TimeRange.forTimestamp(range.end() - 1, width));
        }
    }

    public void testOverflow() {
        expectThrows(IllegalArgumentException.class, () -> TimeRange.forTimestamp(Long.MAX_VALUE, HOUR));
        expectThrows(IllegalArgumentException.class, () -> TimeRange.forTimestamp(Long.MIN_VALUE, HOUR));
        expectThrows(IllegalArgumentException.class, () -> TimeRange.forTimestamp(1, 0));
        expectThrows(IllegalArgumentException.class, () -> new TimeRange(5, 5));
    }

    public void testToString() {
        assertEquals("[0,7200000)", TimeRange.forTimestamp(100, 2 * HOUR).toString());
    }
}
