package com.graphd.query.sort;

import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.PatternFrame;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The constraint and per-primitive pattern that a sort is actually
 * ordered by.
 *
 * <p>A constraint sorted by a variable is really sorted by whatever
 * the subconstraint that assigns the variable produces. The sort root
 * names that subconstraint and its value, so that an executor can
 * produce candidates in that order and a cursor can record it as an
 * ordering path such as {@code /0/2.1}: subconstraint indices from the
 * request root, then the pattern frame that holds the value.</p>
 */
public final class SortRoot {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SortRoot.class);

    /** The constraint that produces the sort value. */
    private final Constraint constraint;

    /** The value, detached, with accumulated sign and comparator. */
    private final Pattern pattern;

    /** Cached ordering path. */
    private String ordering;

    /**
     * Create a sort root.
     *
     * @param constraint the constraint that produces the value
     * @param pattern the value
     */
    public SortRoot(final Constraint constraint, final Pattern pattern) {
        this.constraint = constraint;
        this.pattern = pattern;
    }

    /**
     * Get the constraint that produces the sort value.
     *
     * @return the constraint
     */
    public Constraint getConstraint() {
        return constraint;
    }

    /**
     * Get the sort value.
     *
     * @return the pattern
     */
    public Pattern getPattern() {
        return pattern;
    }

    /**
     * The ordering path of this sort root, computed on first use.
     *
     * @return the path, or null if the value is not part of any of the
     *     constraint's pattern frames
     */
    public String ordering() {
        if (ordering == null) {
            Constraint top = constraint;
            while (top.getParent() != null) {
                top = top.getParent();
            }
            int frame = frameIndex();
            if (frame < 0) {
                LOGGER.warn("cannot find sort pattern {} in {}",
                    pattern.dump(), constraint);
                return null;
            }
            ordering = constraintPath(top, constraint) + "." + frame;
        }
        return ordering;
    }

    private int frameIndex() {
        List<PatternFrame> frames = constraint.getFrames();
        for (int i = 0; i < frames.size(); i++) {
            Pattern one = frames.get(i).getOne();
            if (one == null) {
                continue;
            }
            if (one.getType() != PatternType.LIST) {
                if (Pattern.equalValue(one, pattern)) {
                    return i;
                }
                continue;
            }
            for (Pattern p : one.getChildren()) {
                if (Pattern.equalValue(p, pattern)) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String constraintPath(final Constraint root,
            final Constraint con) {
        if (con == root) {
            return "";
        }
        Constraint par = con.getParent();
        String prefix = par == root ? "" : constraintPath(root, par);
        return prefix + "/" + par.getSubs().indexOf(con);
    }

    /**
     * Was an iterator with the given ordering built from this sort root?
     *
     * @param sr null or a sort root
     * @param ordering null or an ordering path
     * @return true if {@code sr} has computed that same ordering
     */
    public static boolean hasOrdering(final SortRoot sr,
            final String ordering) {
        if (sr == null || ordering == null || sr.ordering == null) {
            return false;
        }
        return sr.ordering.equalsIgnoreCase(ordering);
    }

    /**
     * Are two sort roots the same value in the same constraint?
     *
     * @param a null or a sort root
     * @param b null or a sort root
     * @return true if they are equal
     */
    public static boolean equal(final SortRoot a, final SortRoot b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        return a.constraint == b.constraint
            && Pattern.equal(a.constraint, a.pattern, b.constraint, b.pattern);
    }

    /**
     * Parse an ordering path back into a sort root.
     *
     * @param root the request's root constraint
     * @param text the path, for example {@code /1/0.2}
     * @return the sort root
     * @throws SemanticException {@code SYNTAX} if the text is not a
     *     path; {@code SEMANTICS} if it does not address a sortable
     *     value
     */
    public static SortRoot fromString(final Constraint root,
            final String text) throws SemanticException {
        Constraint con = root;
        int s = 0;
        int e = text.length();

        while (s < e) {
            while (s < e && text.charAt(s) == '/') {
                s++;
            }
            if (s >= e) {
                throw badOrdering(text);
            }
            if (!isDigit(text.charAt(s))) {
                break;
            }
            int start = s;
            while (s < e && isDigit(text.charAt(s))) {
                s++;
            }
            int n = parseIndex(text, start, s);
            if (n >= con.getSubs().size()) {
                throw badOrdering(text);
            }
            con = con.getSubs().get(n);
        }

        while (s < e && text.charAt(s) == '.') {
            s++;
        }
        if (s >= e || !isDigit(text.charAt(s))) {
            throw badOrdering(text);
        }
        int start = s;
        while (s < e && isDigit(text.charAt(s))) {
            s++;
        }
        if (s != e) {
            throw badOrdering(text);
        }
        int n = parseIndex(text, start, s);

        if (n >= con.getFrames().size()) {
            throw SemanticException.semantics(
                "ordering \"%s\" names pattern frame %d of %d", text, n,
                con.getFrames().size());
        }
        Pattern one = con.getFrames().get(n).getOne();
        if (one == null || one.getType() != PatternType.LIST
                || one.size() == 0) {
            throw SemanticException.semantics(
                "ordering \"%s\" does not name a per-primitive value", text);
        }
        SortRoot sr = new SortRoot(con, Pattern.dup(null, one.first()));
        LOGGER.trace("ordering {} -> {}", text, sr);
        return sr;
    }

    private static boolean isDigit(final char c) {
        return c >= '0' && c <= '9';
    }

    private static int parseIndex(final String text, final int s, final int e)
            throws SemanticException {
        try {
            return Integer.parseInt(text.substring(s, e));
        } catch (NumberFormatException ex) {
            throw new SemanticException(SemanticException.Category.SYNTAX,
                "bad sort root ordering \"" + text + "\"", ex);
        }
    }

    private static SemanticException badOrdering(final String text) {
        return SemanticException.syntax("bad sort root ordering \"%s\"",
            text);
    }

    @Override
    public String toString() {
        return "sortroot{" + constraint + ": " + pattern.dump() + "}";
    }
}
