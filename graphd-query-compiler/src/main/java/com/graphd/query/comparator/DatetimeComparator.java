package com.graphd.query.comparator;

/**
 * Dates as {@code YYYY-MM-DD...} text. Two dates before the common era
 * ({@code -0005} vs {@code -0006}) compare in reverse.
 */
final class DatetimeComparator implements ValueComparator {

    @Override
    public String name() {
        return "datetime";
    }

    @Override
    public int sortCompare(final String a, final String b) {
        if (a != null && b != null && a.startsWith("-") && b.startsWith("-")) {
            return Comparators.compareIgnoreCase(b.substring(1), a.substring(1));
        }
        return Comparators.compareIgnoreCase(a, b);
    }

    @Override
    public boolean supportsGlob() {
        return true;
    }

    /**
     * Delimited match: {@code *} skips to the next occurrence of the
     * character that follows it in the pattern; a trailing {@code *}
     * matches the rest. Suffixes of the value are allowed.
     */
    @Override
    public boolean glob(final String pattern, final String value) {
        int c = 0;
        for (int p = 0; p < pattern.length(); p++) {
            if (pattern.charAt(p) == '*') {
                if (p == pattern.length() - 1) {
                    return true;
                }
                // A leading '-' is the sign of a year, not a delimiter.
                if (c == 0 && !value.isEmpty() && value.charAt(0) == '-') {
                    c++;
                }
                char delim = pattern.charAt(p + 1);
                while (c < value.length() && value.charAt(c) != delim) {
                    c++;
                }
            } else {
                if (c >= value.length() || pattern.charAt(p) != value.charAt(c)) {
                    return false;
                }
                c++;
            }
        }
        return true;
    }
}
