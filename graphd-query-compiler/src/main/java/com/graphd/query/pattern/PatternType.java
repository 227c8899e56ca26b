package com.graphd.query.pattern;

/**
 * The kind of a {@link Pattern} node.
 *
 * <p>Leaf kinds name a field of the matching primitive (guid, name,
 * value, ...), a per-constraint summary (count, cursor, ...), a literal
 * string or a variable. {@link #LIST} and {@link #PICK} are compound.</p>
 */
public enum PatternType {
    /** Not yet assigned. */
    UNSPECIFIED("unspecified"),
    /** The archival bit. */
    ARCHIVAL("archival"),
    /** The datatype name (obsolete spelling of valuetype). */
    DATATYPE("datatype"),
    /** How many times the primitive has been versioned. */
    GENERATION("generation"),
    /** The primitive's GUID. */
    GUID("guid"),
    /** The type GUID linkage. */
    TYPEGUID("typeguid"),
    /** The right linkage. */
    RIGHT("right"),
    /** The left linkage. */
    LEFT("left"),
    /** The scope linkage. */
    SCOPE("scope"),
    /** A literal string. */
    LITERAL("literal"),
    /** The live bit. */
    LIVE("live"),
    /** The meta type (node, link to, link from). */
    META("meta"),
    /** The name. */
    NAME("name"),
    /** The GUID of the next version. */
    NEXT("next"),
    /** The GUID of the previous version. */
    PREVIOUS("previous"),
    /** The timestamp. */
    TIMESTAMP("timestamp"),
    /** The type name. */
    TYPE("type"),
    /** The value. */
    VALUE("value"),
    /** A variable reference. */
    VARIABLE("variable"),
    /** An ordered list of patterns. */
    LIST("list"),
    /** The number of matches. */
    COUNT("count"),
    /** A cursor for resuming the query. */
    CURSOR("cursor"),
    /** The results of nested constraints. */
    CONTENTS("contents"),
    /** The optimizer's cost estimate. */
    ESTIMATE("estimate"),
    /** The value type as a number. */
    VALUETYPE("valuetype"),
    /** The iterator state. */
    ITERATOR("iterator"),
    /** Why the query timed out. */
    TIMEOUT("timeout"),
    /** Rough guess at the result count. */
    ESTIMATE_COUNT("estimate-count"),
    /** One alternative per or-branch. */
    PICK("pick"),
    /** Nothing at all. */
    NONE("none");

    /** The keyword used in request text. */
    private final String keyword;

    PatternType(final String keyword) {
        this.keyword = keyword;
    }

    /**
     * Get the keyword used for this type in request text.
     *
     * @return the keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Is this a list or a pick?
     *
     * @return true for compound types
     */
    public boolean isCompound() {
        return this == LIST || this == PICK;
    }

    /**
     * Is this a value computed once per constraint rather than once per
     * matching primitive?
     *
     * @return true for count, cursor, estimate, iterator, timeout and
     *     estimate-count
     */
    public boolean isSetValue() {
        return this == COUNT || this == CURSOR || this == ESTIMATE
            || this == ITERATOR || this == TIMEOUT || this == ESTIMATE_COUNT;
    }

    /**
     * Is this a value read from the matching primitive itself?
     * A variable is not; its value is whatever it is assigned.
     *
     * @return true for per-primitive field types
     */
    public boolean isPrimitiveValue() {
        return this != UNSPECIFIED && this != LITERAL && this != NONE
            && this != VARIABLE && !isCompound() && !isSetValue();
    }

    /**
     * Bit for this type in a spectrum bitmask.
     *
     * @return {@code 1L << ordinal()}
     */
    public long bit() {
        return 1L << ordinal();
    }

    /**
     * Look up a type by its request keyword.
     *
     * @param keyword the keyword, case-insensitive
     * @return the type, or null if there is none
     */
    public static PatternType fromKeyword(final String keyword) {
        for (PatternType type : values()) {
            if (type.keyword.equalsIgnoreCase(keyword)) {
                return type;
            }
        }
        return null;
    }
}
