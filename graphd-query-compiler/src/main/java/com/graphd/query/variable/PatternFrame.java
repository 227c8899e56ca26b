package com.graphd.query.variable;

import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;

/**
 * One compiled result slot of a constraint.
 *
 * <p>The {@code set} pattern is evaluated once for the whole matching
 * set; its first nested list, {@code one}, is evaluated once per
 * matching primitive and sits at position {@code oneOffset} in
 * {@code set}.</p>
 */
public final class PatternFrame {

    /** Pattern evaluated once per constraint, or null. */
    private Pattern set;

    /** Pattern evaluated once per primitive, or null. */
    private Pattern one;

    /** Position of {@link #one} among the children of {@link #set}. */
    private int oneOffset;

    /**
     * Create a frame.
     *
     * @param set null or the per-set pattern
     * @param one null or the per-primitive list
     * @param oneOffset position of {@code one} in {@code set}
     */
    public PatternFrame(final Pattern set, final Pattern one,
            final int oneOffset) {
        this.set = set;
        this.one = one;
        this.oneOffset = oneOffset;
    }

    /**
     * Split an assignment or result pattern into a frame.
     *
     * @param pat null or the pattern
     * @return the frame
     */
    public static PatternFrame of(final Pattern pat) {
        Pattern set = pat;
        if (set != null && set.getType() == PatternType.UNSPECIFIED) {
            set = null;
        }
        if (pat == null || pat.getType() != PatternType.LIST) {
            return new PatternFrame(set, null, 0);
        }
        int offset = 0;
        for (Pattern child : pat.getChildren()) {
            if (child.getType() == PatternType.LIST) {
                return new PatternFrame(set, child, offset);
            }
            offset++;
        }
        return new PatternFrame(set, null, offset);
    }

    /**
     * Get the per-set pattern.
     *
     * @return null or the pattern
     */
    public Pattern getSet() {
        return set;
    }

    /**
     * Set the per-set pattern.
     *
     * @param set null or the pattern
     */
    public void setSet(final Pattern set) {
        this.set = set;
    }

    /**
     * Get the per-primitive list.
     *
     * @return null or the list
     */
    public Pattern getOne() {
        return one;
    }

    /**
     * Set the per-primitive list.
     *
     * @param one null or the list
     */
    public void setOne(final Pattern one) {
        this.one = one;
    }

    /**
     * Get the position of the per-primitive list in the set pattern.
     *
     * @return the offset
     */
    public int getOneOffset() {
        return oneOffset;
    }

    /**
     * Set the position of the per-primitive list in the set pattern.
     *
     * @param oneOffset the offset
     */
    public void setOneOffset(final int oneOffset) {
        this.oneOffset = oneOffset;
    }

    @Override
    public String toString() {
        if (set == null) {
            return one == null ? "{pf:null/null}"
                : "pf_one{" + one.dump() + ", offset=" + oneOffset + "}";
        }
        if (one == null) {
            return "pf_set{" + set.dump() + "}";
        }
        return "pf{" + set.dump() + "[one: " + oneOffset + "]}";
    }
}
