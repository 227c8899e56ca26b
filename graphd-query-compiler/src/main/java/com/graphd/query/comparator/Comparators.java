package com.graphd.query.comparator;

import java.util.List;
import java.util.Locale;

/**
 * The registry of value comparators.
 *
 * <p>Names have the syntax {@code [locale ";"] name} and are matched
 * case-insensitively against each comparator's name and aliases.</p>
 */
public final class Comparators {

    /** Placeholder used until a comparator is chosen. */
    public static final ValueComparator UNSPECIFIED =
        new TextComparator("unspecified");

    /** Text order: case-insensitive, digit runs compared as numbers. */
    public static final ValueComparator DEFAULT = new TextComparator("default");

    /** Byte order. */
    public static final ValueComparator OCTET = new OctetComparator();

    /** Case-insensitive byte order. */
    public static final ValueComparator CASE = new CaseInsensitiveComparator();

    /** Decimal numbers. */
    public static final ValueComparator NUMBER = new NumberComparator();

    /** Dates and times. */
    public static final ValueComparator DATETIME = new DatetimeComparator();

    /** Registry, in lookup order. */
    private static final List<ValueComparator> ALL =
        List.of(UNSPECIFIED, DEFAULT, OCTET, CASE, NUMBER, DATETIME);

    /** Private constructor to prevent instantiation. */
    private Comparators() {
        // Utility class
    }

    /**
     * Look up a comparator by name.
     *
     * @param text null or a name, optionally with a locale prefix
     * @return the comparator; {@link #DEFAULT} for null; null if no
     *     comparator has that name
     */
    public static ValueComparator fromString(final String text) {
        if (text == null) {
            return DEFAULT;
        }
        int semi = text.indexOf(';');
        String name = (semi < 0 ? text : text.substring(semi + 1))
            .toLowerCase(Locale.ROOT);
        for (ValueComparator cmp : ALL) {
            if (cmp.name().equals(name)) {
                return cmp;
            }
            for (String alias : cmp.aliases()) {
                if (alias.equals(name)) {
                    return cmp;
                }
            }
        }
        return null;
    }

    /**
     * Render a comparator's name.
     *
     * @param cmp null or a comparator
     * @return its name, or {@code "unspecified"} for null
     */
    public static String toString(final ValueComparator cmp) {
        return cmp == null ? "unspecified" : cmp.name();
    }

    /**
     * Is this comparator a stand-in that may be replaced?
     *
     * @param cmp null or a comparator
     * @return true for null, {@link #UNSPECIFIED} and {@link #DEFAULT}
     */
    public static boolean isDefaultable(final ValueComparator cmp) {
        return cmp == null || cmp == UNSPECIFIED || cmp == DEFAULT;
    }

    /**
     * Compare two strings ignoring ASCII case; null sorts last.
     *
     * @param a null or a string
     * @param b null or a string
     * @return negative, zero or positive
     */
    static int compareIgnoreCase(final String a, final String b) {
        if (a == null || b == null) {
            return nullOrder(a, b);
        }
        int n = Math.min(a.length(), b.length());
        for (int i = 0; i < n; i++) {
            char ac = Character.toLowerCase(a.charAt(i));
            char bc = Character.toLowerCase(b.charAt(i));
            if (ac != bc) {
                return ac < bc ? -1 : 1;
            }
        }
        return Integer.compare(a.length(), b.length());
    }

    /**
     * Ordering of null against null or non-null: null is greatest.
     *
     * @param a null or a string
     * @param b null or a string
     * @return the order; meaningful only if one is null
     */
    static int nullOrder(final String a, final String b) {
        if (a == null) {
            return b == null ? 0 : 1;
        }
        return -1;
    }
}
