package com.graphd.query.constraint;

import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.guid.GuidSet;
import com.graphd.query.pattern.Pattern;
import java.util.List;

/**
 * One parsed fragment of a constraint, such as {@code name="x"},
 * {@code pagesize=10} or a nested subconstraint.
 *
 * <p>The parser appends clauses to a {@link Constraint} in source order;
 * {@link ClauseMerger#mergeAll} folds them into the constraint's fields
 * and reports conflicting duplicates.</p>
 */
public interface ConstraintClause {

    /** The three tri-state flags a clause can set. */
    enum FlagKind {
        /** {@code anchor=}. */
        ANCHOR("anchor"),
        /** {@code archival=}. */
        ARCHIVAL("archival"),
        /** {@code live=}. */
        LIVE("live");

        private final String keyword;

        FlagKind(final String keyword) {
            this.keyword = keyword;
        }

        /**
         * Get the keyword.
         *
         * @return the name used in requests and messages
         */
        public String keyword() {
            return keyword;
        }
    }

    /** Numeric paging parameters. */
    enum LimitKind {
        /** {@code pagesize=}. */
        PAGESIZE,
        /** {@code resultpagesize=}. */
        RESULTPAGESIZE,
        /** {@code countlimit=}. */
        COUNTLIMIT,
        /** {@code start=}. */
        START
    }

    /** Which GUID restriction a GUID clause narrows. */
    enum GuidTarget {
        /** The primitive's own GUID. */
        GUID,
        /** One of the four linkages. */
        LINKAGE,
        /** {@code next=}. */
        NEXT,
        /** {@code previous=}. */
        PREVIOUS
    }

    /** Which string queue a string clause joins. */
    enum StringField {
        /** {@code name=}. */
        NAME,
        /** {@code type=}. */
        TYPE,
        /** {@code value=}. */
        VALUE
    }

    /** Which pattern slot a pattern clause fills. */
    enum PatternKind {
        /** {@code result=}. */
        RESULT,
        /** {@code sort=}. */
        SORT
    }

    /**
     * {@code anchor=}, {@code archival=} or {@code live=}.
     *
     * @param kind which flag
     * @param value its value
     */
    record FlagClause(FlagKind kind, Flag value) implements ConstraintClause {
    }

    /**
     * {@code $name=pattern}.
     *
     * @param name the variable name, with its {@code $}
     * @param pattern the right-hand side
     */
    record AssignmentClause(String name, Pattern pattern)
            implements ConstraintClause {
    }

    /**
     * {@code comparator=} or {@code value-comparator=}.
     *
     * @param valueComparator true for {@code value-comparator=}
     * @param comparator the comparator
     */
    record ComparatorClause(boolean valueComparator,
            ValueComparator comparator) implements ConstraintClause {
    }

    /**
     * {@code sortcomparator=(...)}.
     *
     * @param comparators one comparator per sort element, in order
     */
    record SortComparatorClause(List<ValueComparator> comparators)
            implements ConstraintClause {
    }

    /**
     * {@code count op n}.
     *
     * @param op the operator
     * @param value the bound
     */
    record CountClause(Operator op, long value) implements ConstraintClause {
    }

    /**
     * A paging parameter.
     *
     * @param kind which parameter
     * @param value its value
     */
    record LimitClause(LimitKind kind, long value)
            implements ConstraintClause {
    }

    /**
     * {@code cursor="..."}.
     *
     * @param cursor the cursor text
     */
    record CursorClause(String cursor) implements ConstraintClause {
    }

    /** {@code false}: the constraint matches nothing. */
    record FalseClause() implements ConstraintClause {
    }

    /**
     * A GUID restriction.
     *
     * @param target what the set restricts
     * @param linkage the linkage, for {@link GuidTarget#LINKAGE} only
     * @param op EQ, NE or MATCH
     * @param set the GUIDs; taken over by the merge
     */
    record GuidClause(GuidTarget target, Linkage linkage, Operator op,
            GuidSet set) implements ConstraintClause {
    }

    /**
     * How the constraint connects to its parent.
     *
     * @param linkage the connection
     */
    record LinkageClause(ConstraintLinkage linkage)
            implements ConstraintClause {
    }

    /**
     * {@code <-}, {@code ->}, {@code node} or {@code any}.
     *
     * @param meta the primitive kind
     */
    record MetaClause(Meta meta) implements ConstraintClause {
    }

    /**
     * {@code name=}, {@code type=} or {@code value=}.
     *
     * @param field which queue
     * @param constraint the condition
     */
    record StringClause(StringField field, StringConstraint constraint)
            implements ConstraintClause {
    }

    /**
     * {@code newest op n} or {@code oldest op n}.
     *
     * @param newest true for {@code newest}
     * @param op the operator
     * @param generation the bound
     */
    record GenerationClause(boolean newest, Operator op, long generation)
            implements ConstraintClause {
    }

    /**
     * {@code timestamp op t}.
     *
     * @param op the operator
     * @param timestamp the bound
     */
    record TimestampClause(Operator op, long timestamp)
            implements ConstraintClause {
    }

    /**
     * {@code valuetype=} or {@code datatype=}.
     *
     * @param valueType the numeric type code
     */
    record ValueTypeClause(int valueType) implements ConstraintClause {
    }

    /**
     * {@code unique=(...)} or {@code key=(...)}.
     *
     * @param key true for {@code key=}
     * @param mask {@link com.graphd.query.pattern.PatternType#bit()} of
     *     each named field
     */
    record UniqueClause(boolean key, long mask) implements ConstraintClause {
    }

    /**
     * {@code result=} or {@code sort=}.
     *
     * @param kind which slot
     * @param pattern the pattern
     */
    record PatternClause(PatternKind kind, Pattern pattern)
            implements ConstraintClause {
    }

    /**
     * Several clauses parsed as one unit.
     *
     * @param clauses the clauses, merged in order
     */
    record SequenceClause(List<ConstraintClause> clauses)
            implements ConstraintClause {
    }

    /**
     * A nested constraint.
     *
     * @param sub the subconstraint, with its own unmerged clauses
     */
    record SubconstraintClause(Constraint sub) implements ConstraintClause {
    }

    /**
     * An alternation; each branch carries its own unmerged clauses.
     *
     * @param or the alternation
     */
    record OrClause(ConstraintOr or) implements ConstraintClause {
    }
}
