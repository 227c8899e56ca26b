package com.graphd.query.pattern;

/**
 * The result templates used when a constraint has no {@code result=}.
 *
 * <p>The templates are built once, lazily, and never handed out
 * directly: later compilation phases annotate result patterns in place
 * (sample and collect marks), so each caller gets its own copy.</p>
 */
public final class DefaultPatterns {

    /** Lock for lazy initialization. */
    private static final Object INIT_LOCK = new Object();

    /** {@code ((meta guid type ... contents))}. */
    private static volatile Pattern readTemplate;

    /** {@code (guid contents)}. */
    private static volatile Pattern writeTemplate;

    /** Private constructor to prevent instantiation. */
    private DefaultPatterns() {
        // Utility class
    }

    /**
     * The default result of a read request:
     * {@code ((meta guid type name datatype value scope live archival
     * timestamp right left contents))}.
     *
     * @return a fresh copy of the read default
     */
    public static Pattern readDefault() {
        if (readTemplate == null) {
            synchronized (INIT_LOCK) {
                if (readTemplate == null) {
                    readTemplate = buildReadDefault();
                }
            }
        }
        return Pattern.dup(null, readTemplate);
    }

    /**
     * The default result of a write request: {@code (guid contents)}.
     *
     * @return a fresh copy of the write default
     */
    public static Pattern writeDefault() {
        if (writeTemplate == null) {
            synchronized (INIT_LOCK) {
                if (writeTemplate == null) {
                    writeTemplate = buildWriteDefault();
                }
            }
        }
        return Pattern.dup(null, writeTemplate);
    }

    /**
     * The empty result {@code ()}, used for subconstraints whose contents
     * are never returned.
     *
     * @return a new empty list
     */
    public static Pattern empty() {
        return Pattern.alloc(null, PatternType.LIST);
    }

    private static Pattern buildReadDefault() {
        Pattern outer = Pattern.alloc(null, PatternType.LIST);
        Pattern inner = Pattern.alloc(outer, PatternType.LIST);
        Pattern.alloc(inner, PatternType.META).setLinkOnly(true);
        Pattern.alloc(inner, PatternType.GUID);
        Pattern.alloc(inner, PatternType.TYPE);
        Pattern.alloc(inner, PatternType.NAME);
        Pattern.alloc(inner, PatternType.DATATYPE);
        Pattern.alloc(inner, PatternType.VALUE);
        Pattern.alloc(inner, PatternType.SCOPE);
        Pattern.alloc(inner, PatternType.LIVE);
        Pattern.alloc(inner, PatternType.ARCHIVAL);
        Pattern.alloc(inner, PatternType.TIMESTAMP);
        Pattern.alloc(inner, PatternType.RIGHT).setLinkOnly(true);
        Pattern.alloc(inner, PatternType.LEFT).setLinkOnly(true);
        Pattern.alloc(inner, PatternType.CONTENTS).setContentsOnly(true);
        return outer;
    }

    private static Pattern buildWriteDefault() {
        Pattern list = Pattern.alloc(null, PatternType.LIST);
        Pattern.alloc(list, PatternType.GUID);
        Pattern.alloc(list, PatternType.CONTENTS).setContentsOnly(true);
        return list;
    }
}
