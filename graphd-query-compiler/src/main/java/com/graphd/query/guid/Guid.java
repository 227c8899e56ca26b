package com.graphd.query.guid;

import java.util.Locale;

/**
 * A 128-bit primitive identifier.
 *
 * <p>GUIDs order as unsigned numbers, high word first. The all-zero GUID
 * is the null GUID; it can appear inside a {@link GuidSet} as a regular
 * element and is passed through lineage lookups unchanged.</p>
 *
 * @param high the upper 64 bits
 * @param low the lower 64 bits
 */
public record Guid(long high, long low) implements Comparable<Guid> {

    /** The null GUID. */
    public static final Guid NULL = new Guid(0L, 0L);

    /**
     * Is this the null GUID?
     *
     * @return true if both words are zero
     */
    public boolean isNull() {
        return high == 0L && low == 0L;
    }

    /**
     * Parse the 32-digit hexadecimal form.
     *
     * @param text the text
     * @return the GUID
     * @throws IllegalArgumentException if the text is not 32 hex digits
     */
    public static Guid fromString(final String text) {
        if (text == null || text.length() != 32) {
            throw new IllegalArgumentException("not a GUID: " + text);
        }
        try {
            return new Guid(Long.parseUnsignedLong(text.substring(0, 16), 16),
                Long.parseUnsignedLong(text.substring(16), 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a GUID: " + text, e);
        }
    }

    @Override
    public int compareTo(final Guid other) {
        int cmp = Long.compareUnsigned(high, other.high);
        return cmp != 0 ? cmp : Long.compareUnsigned(low, other.low);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%016x%016x", high, low);
    }
}
