package com.graphd.query.comparator;

/**
 * The default order for human-readable text: case-insensitive, with
 * runs of digits compared by numeric value, so that {@code "a9"} sorts
 * before {@code "a10"}.
 */
final class TextComparator implements ValueComparator {

    /** Name of this instance ("default" or "unspecified"). */
    private final String name;

    TextComparator(final String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int sortCompare(final String a, final String b) {
        if (a == null || b == null) {
            return Comparators.nullOrder(a, b);
        }
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ac = a.charAt(i);
            char bc = b.charAt(j);
            if (isDigit(ac) && isDigit(bc)) {
                int ie = digitRunEnd(a, i);
                int je = digitRunEnd(b, j);
                int cmp = compareDigitRuns(a, i, ie, b, j, je);
                if (cmp != 0) {
                    return cmp;
                }
                i = ie;
                j = je;
                continue;
            }
            ac = Character.toLowerCase(ac);
            bc = Character.toLowerCase(bc);
            if (ac != bc) {
                return ac < bc ? -1 : 1;
            }
            i++;
            j++;
        }
        if (i < a.length()) {
            return 1;
        }
        return j < b.length() ? -1 : 0;
    }

    @Override
    public boolean supportsGlob() {
        return true;
    }

    @Override
    public boolean glob(final String pattern, final String value) {
        return WordGlob.match(pattern, value, false);
    }

    private static boolean isDigit(final char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static int digitRunEnd(final String s, final int start) {
        int i = start;
        while (i < s.length() && isDigit(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static int compareDigitRuns(final String a, final int as,
            final int ae, final String b, final int bs, final int be) {
        int i = as;
        int j = bs;
        while (i < ae - 1 && a.charAt(i) == '0') {
            i++;
        }
        while (j < be - 1 && b.charAt(j) == '0') {
            j++;
        }
        if (ae - i != be - j) {
            return ae - i < be - j ? -1 : 1;
        }
        for (; i < ae; i++, j++) {
            if (a.charAt(i) != b.charAt(j)) {
                return a.charAt(i) < b.charAt(j) ? -1 : 1;
            }
        }
        return 0;
    }
}
