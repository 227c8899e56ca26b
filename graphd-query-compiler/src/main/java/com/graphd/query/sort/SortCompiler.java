package com.graphd.query.sort;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes and validates {@code sort=} patterns.
 */
public final class SortCompiler {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SortCompiler.class);

    /** Private constructor to prevent instantiation. */
    private SortCompiler() {
        // Utility class
    }

    /**
     * Make a constraint's sort total by ending it with {@code guid}.
     *
     * <p>{@code value} becomes {@code (value guid)}, {@code ()} becomes
     * {@code (guid)}, and anything after the first {@code guid} is
     * dropped since GUIDs are unique.</p>
     *
     * @param con the constraint
     */
    public static void compile(final Constraint con) {
        Pattern head = con.getSort();
        if (!con.isSortValid() || head == null) {
            return;
        }
        if (head.getType() != PatternType.LIST
                && head.getType() != PatternType.GUID) {
            head = Pattern.wrap(head);
            con.setSort(head);
        }
        if (head.getType() == PatternType.LIST) {
            int guid = -1;
            for (int i = 0; i < head.size(); i++) {
                if (head.getChildren().get(i).getType() == PatternType.GUID) {
                    guid = i;
                    break;
                }
            }
            if (guid >= 0) {
                head.truncateAfter(guid);
            } else {
                Pattern.alloc(head, PatternType.GUID);
            }
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("compiled sort of {}: {}", con, head.dump());
        }
    }

    /**
     * Reject sorts by values that do not vary per primitive.
     *
     * <p>Malformed sorts are reported even if the sort is no longer in
     * use.</p>
     *
     * @param con the root of the tree to check
     * @throws SemanticException {@code SEMANTICS cannot sort by ...}
     */
    public static void check(final Constraint con) throws SemanticException {
        for (Constraint sub : con.getSubs()) {
            check(sub);
        }
        checkPattern(con.getSort(), false);
    }

    private static void checkPattern(final Pattern pat, final boolean inPick)
            throws SemanticException {
        if (pat == null) {
            return;
        }
        PatternType type = pat.getType();
        if (type.isSetValue() || (!inPick
                && (type == PatternType.LITERAL || type == PatternType.NONE))) {
            throw SemanticException.semantics("cannot sort by %s",
                pat.dump());
        }
        if (type.isCompound()) {
            for (Pattern sub : pat.getChildren()) {
                checkPattern(sub, inPick || type == PatternType.PICK);
            }
        }
    }

    /**
     * The scan direction implied by a sort alone: a leading GUID or
     * timestamp is the iterator's natural order.
     *
     * @param pat null or a sort pattern
     * @return FORWARD, BACKWARD, or ANY
     */
    public static IteratorDirection iteratorDirection(final Pattern pat) {
        if (pat == null) {
            return IteratorDirection.ANY;
        }
        Pattern head = pat;
        if (head.getType() == PatternType.LIST) {
            if (head.size() == 0) {
                return IteratorDirection.FORWARD;
            }
            head = head.first();
        }
        if (head.getType() == PatternType.TIMESTAMP
                || head.getType() == PatternType.GUID) {
            return head.isSortForward()
                ? IteratorDirection.FORWARD : IteratorDirection.BACKWARD;
        }
        return IteratorDirection.ANY;
    }
}
