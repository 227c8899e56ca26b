package com.graphd.query.comparator;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Operator;
import com.graphd.query.constraint.StringConstraint;

import java.math.BigDecimal;
import java.util.List;

/**
 * Decimal numbers in numeric order. Values that aren't numbers sort
 * after all numbers, case-insensitively among themselves.
 */
final class NumberComparator implements ValueComparator {

    @Override
    public String name() {
        return "number";
    }

    @Override
    public List<String> aliases() {
        return List.of("numeric");
    }

    @Override
    public void checkSyntax(final StringConstraint strcon)
            throws SemanticException {
        if (strcon.getOperator() == Operator.MATCH) {
            throw SemanticException.semantics(
                "cannot use ~= with comparator=\"number\"");
        }
    }

    @Override
    public int sortCompare(final String a, final String b) {
        if (a == null || b == null) {
            return Comparators.nullOrder(a, b);
        }
        BigDecimal an = decode(a);
        BigDecimal bn = decode(b);
        if (an != null && bn != null) {
            return an.compareTo(bn);
        }
        if (an != null) {
            return -1;
        }
        if (bn != null) {
            return 1;
        }
        return Comparators.compareIgnoreCase(a, b);
    }

    @Override
    public String lowestString() {
        return "-inf";
    }

    @Override
    public String highestString() {
        return "inf";
    }

    private static BigDecimal decode(final String s) {
        String text = s.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.charAt(0) == '+') {
            text = text.substring(1);
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
