/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */
package org.opensearch.blockimport.core.block;

import java.security.SecureRandom;
import java.time.Instant;

/**
 * Block identifier in ULID form: 48 bits of creation time in milliseconds followed by 80 random bits, written as
 * 26 Crockford base32 characters. String order equals creation order.
 * <p>
 * Ids generated within the same millisecond increment the random part of the previous id so they stay sorted.
 */
public final class BlockId implements Comparable<BlockId> {
    private static final char[] ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();
    private static final int LENGTH = 26;
    private static final long MAX_TIME = (1L << 48) - 1;
    private static final SecureRandom RANDOM = new SecureRandom();

    private static BlockId last;

    private final long msb;
    private final long lsb;

    private BlockId(long msb, long lsb) {
        this.msb = msb;
        this.lsb = lsb;
    }

    /**
     * Generates a new id for the current time.
     *
     * @return the id
     */
    public static BlockId generate() {
        return generate(System.currentTimeMillis());
    }

    /**
     * Generates a new id for the given creation time.
     *
     * @param timeMillis creation time, between 0 and 2^48-1
     * @return the id
     */
    public static synchronized BlockId generate(long timeMillis) {
        if (timeMillis < 0 || timeMillis > MAX_TIME) {
            throw new IllegalArgumentException("time " + timeMillis + " cannot be encoded in a block id");
        }
        BlockId id;
        if (last != null && last.timestamp() == timeMillis) {
            // 80-bit increment of the random part, carrying into the upper 16 bits
            long lsb = last.lsb + 1;
            long randomHigh = (last.msb & 0xFFFF) + (lsb == 0 ? 1 : 0);
            if (randomHigh > 0xFFFF) {
                throw new IllegalStateException("block id entropy exhausted for time " + timeMillis);
            }
            id = new BlockId((timeMillis << 16) | randomHigh, lsb);
        } else {
            id = new BlockId((timeMillis << 16) | (RANDOM.nextInt() & 0xFFFF), RANDOM.nextLong());
        }
        last = id;
        return id;
    }

    /**
     * Parses the 26 character form.
     *
     * @param value the string form
     * @return the id
     * @throws IllegalArgumentException if the value is not a valid id
     */
    public static BlockId parse(String value) {
        if (value == null || value.length() != LENGTH) {
            throw new IllegalArgumentException("invalid block id [" + value + "], expected " + LENGTH + " characters");
        }
        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < LENGTH; i++) {
            int v = decode(value.charAt(i));
            if (v < 0 || (i == 0 && v > 7)) {
                throw new IllegalArgumentException("invalid block id [" + value + "]");
            }
            msb = (msb << 5) | (lsb >>> 59);
            lsb = (lsb << 5) | v;
        }
        return new BlockId(msb, lsb);
    }

    /**
     * Returns true if {@code value} is the string form of an id.
     *
     * @param value a candidate, e.g. a directory name
     * @return true for a valid id
     */
    public static boolean isValid(String value) {
        try {
            parse(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static int decode(char c) {
        char upper = Character.toUpperCase(c);
        for (int i = 0; i < ALPHABET.length; i++) {
            if (ALPHABET[i] == upper) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns the creation time embedded in the id.
     *
     * @return milliseconds since the epoch
     */
    public long timestamp() {
        return msb >>> 16;
    }

    public Instant creationTime() {
        return Instant.ofEpochMilli(timestamp());
    }

    @Override
    public int compareTo(BlockId o) {
        int cmp = Long.compareUnsigned(msb, o.msb);
        return cmp != 0 ? cmp : Long.compareUnsigned(lsb, o.lsb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlockId)) return false;
        BlockId other = (BlockId) o;
        return msb == other.msb && lsb == other.lsb;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(msb) * 31 + Long.hashCode(lsb);
    }

    @Override
    public String toString() {
        char[] chars = new char[LENGTH];
        // 128 bits left padded to 130, 5 bits per character
        for (int i = 0; i < LENGTH; i++) {
            int shift = 125 - 5 * i;
            int v;
            if (shift >= 64) {
                v = (int) (msb >>> (shift - 64)) & 31;
            } else if (shift + 5 <= 64) {
                v = (int) (lsb >>> shift) & 31;
            } else {
                v = (int) ((lsb >>> shift) | (msb << (64 - shift))) & 31;
            }
            chars[i] = ALPHABET[v];
        }
        return new String(chars);
    }
}
