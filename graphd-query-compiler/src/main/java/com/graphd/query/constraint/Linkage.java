package com.graphd.query.constraint;

import com.graphd.query.pattern.PatternType;

/**
 * One of the four GUID-valued pointers a primitive carries.
 *
 * <p>Declared in storage order; {@link #ordinal()} is the linkage index
 * used for per-linkage arrays on a constraint.</p>
 */
public enum Linkage {
    /** The type of the primitive. */
    TYPEGUID("typeguid", PatternType.TYPEGUID),
    /** The right end of a link. */
    RIGHT("right", PatternType.RIGHT),
    /** The left end of a link. */
    LEFT("left", PatternType.LEFT),
    /** The scope. */
    SCOPE("scope", PatternType.SCOPE);

    /** Name used in requests and messages. */
    private final String keyword;

    /** Pattern type that returns this linkage. */
    private final PatternType patternType;

    Linkage(final String keyword, final PatternType patternType) {
        this.keyword = keyword;
        this.patternType = patternType;
    }

    /**
     * Get the linkage name.
     *
     * @return e.g. {@code "typeguid"}
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Get the pattern type returning this linkage.
     *
     * @return the pattern type
     */
    public PatternType patternType() {
        return patternType;
    }

    /**
     * Bit for this linkage in a linkage pattern, using
     * {@link PatternType#bit()} of the matching pattern type.
     *
     * @return the bit
     */
    public long bit() {
        return patternType.bit();
    }

    @Override
    public String toString() {
        return keyword;
    }
}
