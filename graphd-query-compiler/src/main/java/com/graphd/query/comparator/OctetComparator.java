package com.graphd.query.comparator;

import java.util.List;

/**
 * Byte-by-byte order; the glob is case-sensitive.
 */
final class OctetComparator implements ValueComparator {

    @Override
    public String name() {
        return "octet";
    }

    @Override
    public List<String> aliases() {
        return List.of("case-sensitive");
    }

    @Override
    public int sortCompare(final String a, final String b) {
        if (a == null || b == null) {
            return Comparators.nullOrder(a, b);
        }
        int cmp = a.compareTo(b);
        return Integer.signum(cmp);
    }

    @Override
    public boolean supportsGlob() {
        return true;
    }

    @Override
    public boolean glob(final String pattern, final String value) {
        return WordGlob.match(pattern, value, true);
    }
}
