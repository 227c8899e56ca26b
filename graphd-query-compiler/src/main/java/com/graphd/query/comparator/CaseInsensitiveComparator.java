package com.graphd.query.comparator;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Operator;
import com.graphd.query.constraint.StringConstraint;

import java.util.List;

/**
 * Case-insensitive byte order, without {@code ~=}.
 */
final class CaseInsensitiveComparator implements ValueComparator {

    @Override
    public String name() {
        return "case-insensitive";
    }

    @Override
    public List<String> aliases() {
        return List.of("case");
    }

    @Override
    public void checkSyntax(final StringConstraint strcon)
            throws SemanticException {
        if (strcon.getOperator() == Operator.MATCH) {
            throw SemanticException.syntax(
                "cannot use ~= with comparator=\"case\"");
        }
    }

    @Override
    public int sortCompare(final String a, final String b) {
        return Comparators.compareIgnoreCase(a, b);
    }
}
