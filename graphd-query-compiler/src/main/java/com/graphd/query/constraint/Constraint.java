package com.graphd.query.constraint;

import com.graphd.query.comparator.Comparators;
import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.guid.GuidConstraint;
import com.graphd.query.guid.GuidSet;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.sort.SortRoot;
import com.graphd.query.variable.Assignment;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.PatternFrame;
import com.graphd.query.variable.VariableDeclaration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a query: a filter on primitives, the subconstraints that
 * must match relative to each matching primitive, and the template of
 * what to return.
 *
 * <p>A constraint is built from parsed {@link ConstraintClause clauses}
 * and then mutated in place by every compilation phase. The
 * {@link #isFalse() false} flag, once set, is never cleared.</p>
 *
 * <p>Or-branches are constraints too. A branch's {@link #getOr()} names
 * the alternation it belongs to; its subconstraints also appear in the
 * prototype's {@link #getSubs()} list, with the branch as their
 * parent.</p>
 */
public final class Constraint {

    /** Lowest timestamp. */
    public static final long TIMESTAMP_MIN = 0L;

    /** Highest timestamp. */
    public static final long TIMESTAMP_MAX = Long.MAX_VALUE;

    /** Value type "not specified". */
    public static final int VALUETYPE_UNSPECIFIED = 0;

    /** Containing constraint; for a branch, the prototype's parent. */
    private Constraint parent;

    /** Subconstraints, in request order. */
    private final List<Constraint> subs = new ArrayList<>();

    /** Unmerged parser output. */
    private final List<ConstraintClause> clauses = new ArrayList<>();

    /** Alternations contained in this constraint. */
    private final List<ConstraintOr> ors = new ArrayList<>();

    /** The alternation this constraint is a branch of, or null. */
    private ConstraintOr or;

    /** Depth-first number of this branch; 0 outside alternations. */
    private int orIndex;

    /** Request-wide number, assigned by semantic checking. */
    private int id;

    /** Connection to the parent. */
    private ConstraintLinkage linkage = ConstraintLinkage.NONE;

    /** {@code type=} clauses. */
    private final List<StringConstraint> typeQueue = new ArrayList<>();

    /** {@code name=} clauses. */
    private final List<StringConstraint> nameQueue = new ArrayList<>();

    /** {@code value=} clauses. */
    private final List<StringConstraint> valueQueue = new ArrayList<>();

    /** {@code comparator=}. */
    private ValueComparator comparator = Comparators.UNSPECIFIED;

    /** {@code value-comparator=}. */
    private ValueComparator valueComparator;

    /** Is there a timestamp range? */
    private boolean timestampValid;

    /** Timestamp lower bound, inclusive. */
    private long timestampMin;

    /** Timestamp upper bound, inclusive. */
    private long timestampMax;

    /** {@code newest=}. */
    private final GenerationalConstraint newest = new GenerationalConstraint();

    /** {@code oldest=}. */
    private final GenerationalConstraint oldest = new GenerationalConstraint();

    /** Node, link to, link from. */
    private Meta meta = Meta.UNSPECIFIED;

    /** {@code guid=}. */
    private final GuidConstraint guid = new GuidConstraint();

    /** Per-linkage GUID constraints, indexed by {@link Linkage#ordinal()}. */
    private final GuidConstraint[] linkcon = new GuidConstraint[] {
        new GuidConstraint(), new GuidConstraint(), new GuidConstraint(),
        new GuidConstraint()
    };

    /** {@code next=}. */
    private final GuidConstraint versionNext = new GuidConstraint();

    /** {@code previous=}. */
    private final GuidConstraint versionPrevious = new GuidConstraint();

    /** {@code anchor=}. */
    private Flag anchor = Flag.UNSPECIFIED;

    /** {@code archival=}. */
    private Flag archival = Flag.UNSPECIFIED;

    /** {@code live=}. */
    private Flag live = Flag.UNSPECIFIED;

    /** {@code count=}. */
    private final CountConstraint count = new CountConstraint();

    /** {@code valuetype=}. */
    private int valueType = VALUETYPE_UNSPECIFIED;

    /** Statically known to match nothing. */
    private boolean falseFlag;

    /** Why the constraint is false, if there is a message for it. */
    private String error;

    /** Iterate in ascending id order. */
    private boolean forward = true;

    /** Does anything return {@code contents}? */
    private boolean usesContents;

    /** {@code unique=}, as a bitmask of {@link PatternType#bit()}. */
    private long unique;

    /** {@code key=}, as a bitmask of {@link PatternType#bit()}. */
    private long key;

    /** {@code result=}. */
    private Pattern result;

    /** {@code sort=}. */
    private Pattern sort;

    /** Is the sort still needed? */
    private boolean sortValid = true;

    /** Where the sort's values come from. */
    private SortRoot sortRoot;

    /** {@code sortcomparator=}, one per sort element. */
    private final List<ValueComparator> sortComparators = new ArrayList<>();

    /** {@code pagesize=}. */
    private long pageSize;

    /** Was a page size given? */
    private boolean pageSizeValid;

    /** {@code resultpagesize=} as written. */
    private long resultPageSizeParsed;

    /** Was a result page size given? */
    private boolean resultPageSizeParsedValid;

    /** Effective result page size. */
    private long resultPageSize;

    /** Is there an effective result page size? */
    private boolean resultPageSizeValid;

    /** {@code countlimit=}. */
    private long countLimit;

    /** Was a count limit given? */
    private boolean countLimitValid;

    /** {@code start=}. */
    private long start;

    /** {@code cursor=}, or null. */
    private String cursor;

    /** Can a cursor be returned for this constraint? */
    private boolean cursorUsable;

    /** Can the query be resumed after a soft timeout? */
    private boolean resumable;

    /** {@code $var=...} assignments. */
    private final List<Assignment> assignments = new ArrayList<>();

    /** Variable declarations by name. */
    private final Map<String, VariableDeclaration> declarations =
        new LinkedHashMap<>();

    /** Number of local value slots. */
    private int localCount;

    /** Compiled result frames. */
    private final List<PatternFrame> frames = new ArrayList<>();

    /** Index of the temporary frame, or -1. */
    private int frameTemporary = -1;

    /** Frames for assignments and the result, without the temporary. */
    private int declaredFrameCount;

    /** Does any frame return {@code count}? */
    private boolean wantCount;

    /** Does any frame return {@code cursor}? */
    private boolean wantCursor;

    /** Does any frame need per-primitive data? */
    private boolean wantData;

    /** Lowest local id this constraint can match. */
    private long low;

    /** Local id just past the highest this constraint can match. */
    private long high = Long.MAX_VALUE;

    /** Upper bound on the number of matching primitives. */
    private long setSize = Long.MAX_VALUE;

    /**
     * Append a subconstraint.
     *
     * @param sub the subconstraint; its parent becomes this constraint
     */
    public void addSub(final Constraint sub) {
        sub.parent = this;
        subs.add(sub);
    }

    /**
     * Queue a parsed clause for merging.
     *
     * @param clause the clause
     * @return this constraint
     */
    public Constraint addClause(final ConstraintClause clause) {
        clauses.add(clause);
        return this;
    }

    /**
     * Mark the constraint as matching nothing.
     */
    public void markFalse() {
        falseFlag = true;
    }

    /**
     * Mark the constraint as matching nothing, with a message.
     *
     * @param message the error text, with its category keyword
     */
    public void markFalse(final String message) {
        falseFlag = true;
        error = message;
    }

    /**
     * The linkages that are fixed for this constraint's primitives: its
     * own "my" linkage, linkages with an {@code =} GUID set, and the
     * "I am" linkages of its subconstraints.
     *
     * @return bitmask of {@link Linkage#bit()}
     */
    public long linkagePattern() {
        long pattern = 0L;
        if (linkage.isMy()) {
            pattern |= linkage.linkage().bit();
        }
        for (Linkage l : Linkage.values()) {
            if (linkcon[l.ordinal()].isIncludeValid()) {
                pattern |= l.bit();
            }
        }
        for (Constraint sub : subs) {
            if (sub.linkage.isIAm()) {
                pattern |= sub.linkage.linkage().bit();
            }
        }
        return pattern;
    }

    /**
     * Does the result, the sort or an assignment mention a pattern type?
     *
     * @param type the type
     * @return true if it occurs
     */
    public boolean usesPattern(final PatternType type) {
        if (Pattern.lookup(result, type) != null) {
            return true;
        }
        if (sort != null && sortValid && Pattern.lookup(sort, type) != null) {
            return true;
        }
        for (Assignment a : assignments) {
            if (Pattern.lookup(a.getResult(), type) != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * May the parent match without any primitive matching this
     * constraint?
     *
     * @return true if the count allows zero
     */
    public boolean isOptional() {
        return count.getMin() == 0
            && (!count.isMaxValid() || count.getMax() > 0);
    }

    /**
     * Must at least one primitive match this constraint for its parent
     * to match?
     *
     * @return true if the count minimum is positive
     */
    public boolean isMandatory() {
        return count.getMin() > 0;
    }

    /**
     * The constraint whose alternations this branch belongs to, climbing
     * through nested alternations; the constraint itself outside any.
     *
     * @return the outermost prototype
     */
    public Constraint prototypeRoot() {
        Constraint con = this;
        while (con.or != null) {
            con = con.or.getPrototype();
        }
        return con;
    }

    /**
     * Find a constraint by its request-wide number.
     *
     * @param root the tree to search
     * @param id the number
     * @return the constraint, or null
     */
    public static Constraint byId(final Constraint root, final int id) {
        if (root.id == id) {
            return root;
        }
        for (Constraint sub : root.subs) {
            Constraint found = byId(sub, id);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static boolean hasSingleGuid(final Constraint con) {
        GuidSet in = con.guid.getInclude();
        return con.guid.isIncludeValid() && in.size() == 1
            && !in.get(0).isNull();
    }

    /**
     * Structural equality for plan caching. Equal constraints are
     * equivalent queries; the converse does not hold.
     *
     * @param a null or a constraint
     * @param b null or a constraint
     * @return true if definitely equal
     */
    public static boolean structurallyEquals(final Constraint a,
            final Constraint b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        if (a.subs.size() != b.subs.size()
                || !a.linkage.equals(b.linkage)
                || a.valueType != b.valueType
                || a.archival != b.archival
                || a.live != b.live
                || a.key != b.key
                || a.unique != b.unique
                || a.resultPageSizeValid != b.resultPageSizeValid
                || (a.resultPageSizeValid
                    && a.resultPageSize != b.resultPageSize)
                || a.countLimitValid != b.countLimitValid
                || (a.countLimitValid && a.countLimit != b.countLimit)
                || a.pageSizeValid != b.pageSizeValid
                || (a.pageSizeValid && a.pageSize != b.pageSize)
                || a.start != b.start) {
            return false;
        }

        // Parents count only if they are a single GUID literal.
        boolean aParent = a.parent != null && hasSingleGuid(a.parent);
        boolean bParent = b.parent != null && hasSingleGuid(b.parent);
        if (aParent != bParent || (aParent
                && !GuidConstraint.equal(a.parent.guid, b.parent.guid))) {
            return false;
        }

        if (!StringConstraint.queueEqual(a.typeQueue, b.typeQueue)
                || !StringConstraint.queueEqual(a.nameQueue, b.nameQueue)
                || !StringConstraint.queueEqual(a.valueQueue, b.valueQueue)
                || !GenerationalConstraint.equal(a.newest, b.newest)
                || !GenerationalConstraint.equal(a.oldest, b.oldest)
                || !GuidConstraint.equal(a.guid, b.guid)
                || !GuidConstraint.equal(a.versionNext, b.versionNext)
                || !GuidConstraint.equal(a.versionPrevious,
                    b.versionPrevious)) {
            return false;
        }
        for (int i = 0; i < a.linkcon.length; i++) {
            if (!GuidConstraint.equal(a.linkcon[i], b.linkcon[i])) {
                return false;
            }
        }
        if (a.timestampValid != b.timestampValid
                || (a.timestampValid && (a.timestampMin != b.timestampMin
                    || a.timestampMax != b.timestampMax))) {
            return false;
        }
        if (!CountConstraint.equal(a.count, b.count)
                || !Pattern.equal(a, a.result, b, b.result)
                || !Pattern.equal(a, a.sortValid ? a.sort : null,
                    b, b.sortValid ? b.sort : null)
                || !Objects.equals(a.cursor, b.cursor)
                || !Assignments.equal(a, b)) {
            return false;
        }

        int n = Math.min(a.ors.size(), b.ors.size());
        for (int i = 0; i < n; i++) {
            ConstraintOr ao = a.ors.get(i);
            ConstraintOr bo = b.ors.get(i);
            if (!structurallyEquals(ao.getHead(), bo.getHead())
                    || !structurallyEquals(ao.getTail(), bo.getTail())) {
                return false;
            }
        }
        for (int i = 0; i < a.subs.size(); i++) {
            if (!structurallyEquals(a.subs.get(i), b.subs.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Hash consistent with {@link #structurallyEquals}.
     *
     * @param con a constraint
     * @return the hash
     */
    public static int structuralHash(final Constraint con) {
        int h = Objects.hash(con.subs.size(), con.linkage, con.valueType,
            con.archival, con.live, con.key, con.unique, con.pageSizeValid,
            con.pageSizeValid ? con.pageSize : 0L, con.start);
        h = 31 * h + StringConstraint.queueHash(con.typeQueue);
        h = 31 * h + StringConstraint.queueHash(con.nameQueue);
        h = 31 * h + StringConstraint.queueHash(con.valueQueue);
        h = 31 * h + GenerationalConstraint.hash(con.newest);
        h = 31 * h + GenerationalConstraint.hash(con.oldest);
        if (con.parent != null && hasSingleGuid(con.parent)) {
            h = 31 * h + GuidConstraint.hash(con.parent.guid);
        }
        h = 31 * h + GuidConstraint.hash(con.guid);
        h = 31 * h + GuidConstraint.hash(con.versionNext);
        h = 31 * h + GuidConstraint.hash(con.versionPrevious);
        for (GuidConstraint gc : con.linkcon) {
            h = 31 * h + GuidConstraint.hash(gc);
        }
        h = 31 * h + (con.timestampValid ? 1 : 0);
        if (con.timestampValid) {
            h = 31 * h + Long.hashCode(con.timestampMax);
            h = 31 * h + Long.hashCode(con.timestampMin);
        }
        h = 31 * h + CountConstraint.hash(con.count);
        h = 31 * h + Pattern.hash(con.result);
        // An invalid sort does not take part in equality either.
        h = 31 * h + Pattern.hash(con.sortValid ? con.sort : null);
        h = 31 * h + Objects.hashCode(con.cursor);
        h = 31 * h + Assignments.hash(con);
        for (Constraint sub : con.subs) {
            h = 31 * h + structuralHash(sub);
        }
        return h;
    }

    /**
     * Is the constraint known to match nothing?
     *
     * @return true once marked false
     */
    public boolean isFalse() {
        return falseFlag;
    }

    /**
     * Get the GUID restriction on one linkage.
     *
     * @param linkage the linkage
     * @return its restriction
     */
    public GuidConstraint getLinkcon(final Linkage linkage) {
        return linkcon[linkage.ordinal()];
    }

    /**
     * Narrow the timestamp range by one parsed clause.
     *
     * @param op the clause operator
     * @param ts the clause timestamp
     * @return false if the range became empty
     */
    public boolean mergeTimestamp(final Operator op, final long ts) {
        if (!timestampValid) {
            timestampValid = true;
            timestampMin = TIMESTAMP_MIN;
            timestampMax = TIMESTAMP_MAX;
        }
        switch (op) {
            case LT:
                if (ts == TIMESTAMP_MIN) {
                    return false;
                }
                if (timestampMax >= ts) {
                    timestampMax = ts - 1;
                }
                break;
            case LE:
                if (timestampMax > ts) {
                    timestampMax = ts;
                }
                break;
            case EQ:
                if (timestampMin < ts) {
                    timestampMin = ts;
                }
                if (timestampMax > ts) {
                    timestampMax = ts;
                }
                break;
            case NE:
                if (timestampMin == ts) {
                    timestampMin++;
                }
                if (timestampMax == ts) {
                    timestampMax--;
                }
                break;
            case GE:
                if (timestampMin < ts) {
                    timestampMin = ts;
                }
                break;
            case GT:
                if (ts >= TIMESTAMP_MAX) {
                    return false;
                }
                if (timestampMin <= ts) {
                    timestampMin = ts + 1;
                }
                break;
            default:
                throw new IllegalArgumentException(
                    "unexpected timestamp operator " + op);
        }
        return timestampMax >= timestampMin;
    }

    /**
     * Take over another constraint's timestamp range, valid or not.
     *
     * @param other the constraint to copy from
     */
    public void copyTimestamp(final Constraint other) {
        timestampValid = other.timestampValid;
        timestampMin = other.timestampMin;
        timestampMax = other.timestampMax;
    }

    /**
     * Set the page size.
     *
     * @param pageSize the page size
     */
    public void setPageSize(final long pageSize) {
        this.pageSize = pageSize;
        this.pageSizeValid = true;
    }

    /**
     * Set the result page size as written.
     *
     * @param resultPageSizeParsed the result page size
     */
    public void setResultPageSizeParsed(final long resultPageSizeParsed) {
        this.resultPageSizeParsed = resultPageSizeParsed;
        this.resultPageSizeParsedValid = true;
    }

    /**
     * Set the effective result page size.
     *
     * @param resultPageSize the result page size
     */
    public void setResultPageSize(final long resultPageSize) {
        this.resultPageSize = resultPageSize;
        this.resultPageSizeValid = true;
    }

    /**
     * Make the effective result page size the one written in the
     * request, valid or not.
     */
    public void resetResultPageSize() {
        this.resultPageSize = resultPageSizeParsed;
        this.resultPageSizeValid = resultPageSizeParsedValid;
    }

    /**
     * Set the count limit.
     *
     * @param countLimit the count limit
     */
    public void setCountLimit(final long countLimit) {
        this.countLimit = countLimit;
        this.countLimitValid = true;
    }

    /**
     * Get the parent.
     *
     * @return the containing constraint, or null at the root
     */
    public Constraint getParent() {
        return parent;
    }

    /**
     * Set the parent.
     *
     * @param parent the containing constraint, or null at the root
     */
    public void setParent(final Constraint parent) {
        this.parent = parent;
    }

    /**
     * Get the subs.
     *
     * @return the live list of subconstraints
     */
    public List<Constraint> getSubs() {
        return subs;
    }

    /**
     * Get the clauses.
     *
     * @return the live list of clauses not yet merged
     */
    public List<ConstraintClause> getClauses() {
        return clauses;
    }

    /**
     * Get the ors.
     *
     * @return the live list of alternations
     */
    public List<ConstraintOr> getOrs() {
        return ors;
    }

    /**
     * Get the or.
     *
     * @return the alternation this is a branch of, or null
     */
    public ConstraintOr getOr() {
        return or;
    }

    /**
     * Set the or.
     *
     * @param or the alternation this is a branch of, or null
     */
    public void setOr(final ConstraintOr or) {
        this.or = or;
    }

    /**
     * Get the or index.
     *
     * @return the or-index; 0 outside alternations
     */
    public int getOrIndex() {
        return orIndex;
    }

    /**
     * Set the or index.
     *
     * @param orIndex the or-index; 0 outside alternations
     */
    public void setOrIndex(final int orIndex) {
        this.orIndex = orIndex;
    }

    /**
     * Get the id.
     *
     * @return the request-wide number
     */
    public int getId() {
        return id;
    }

    /**
     * Set the id.
     *
     * @param id the request-wide number
     */
    public void setId(final int id) {
        this.id = id;
    }

    /**
     * Get the linkage.
     *
     * @return the connection to the parent
     */
    public ConstraintLinkage getLinkage() {
        return linkage;
    }

    /**
     * Set the linkage.
     *
     * @param linkage the connection to the parent
     */
    public void setLinkage(final ConstraintLinkage linkage) {
        this.linkage = linkage;
    }

    /**
     * Get the type queue.
     *
     * @return the live list of {@code type=} clauses
     */
    public List<StringConstraint> getTypeQueue() {
        return typeQueue;
    }

    /**
     * Get the name queue.
     *
     * @return the live list of {@code name=} clauses
     */
    public List<StringConstraint> getNameQueue() {
        return nameQueue;
    }

    /**
     * Get the value queue.
     *
     * @return the live list of {@code value=} clauses
     */
    public List<StringConstraint> getValueQueue() {
        return valueQueue;
    }

    /**
     * Get the comparator.
     *
     * @return the comparator
     */
    public ValueComparator getComparator() {
        return comparator;
    }

    /**
     * Set the comparator.
     *
     * @param comparator the comparator
     */
    public void setComparator(final ValueComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * Get the value comparator.
     *
     * @return the value comparator, or null
     */
    public ValueComparator getValueComparator() {
        return valueComparator;
    }

    /**
     * Set the value comparator.
     *
     * @param valueComparator the value comparator, or null
     */
    public void setValueComparator(final ValueComparator valueComparator) {
        this.valueComparator = valueComparator;
    }

    /**
     * Get the timestamp valid flag.
     *
     * @return true if there is a timestamp range
     */
    public boolean isTimestampValid() {
        return timestampValid;
    }

    /**
     * Get the timestamp min.
     *
     * @return the lowest matching timestamp
     */
    public long getTimestampMin() {
        return timestampMin;
    }

    /**
     * Get the timestamp max.
     *
     * @return the highest matching timestamp
     */
    public long getTimestampMax() {
        return timestampMax;
    }

    /**
     * Get the newest.
     *
     * @return the {@code newest=} bounds
     */
    public GenerationalConstraint getNewest() {
        return newest;
    }

    /**
     * Get the oldest.
     *
     * @return the {@code oldest=} bounds
     */
    public GenerationalConstraint getOldest() {
        return oldest;
    }

    /**
     * Get the meta.
     *
     * @return the meta restriction
     */
    public Meta getMeta() {
        return meta;
    }

    /**
     * Set the meta.
     *
     * @param meta the meta restriction
     */
    public void setMeta(final Meta meta) {
        this.meta = meta;
    }

    /**
     * Get the guid.
     *
     * @return the {@code guid=} restriction
     */
    public GuidConstraint getGuid() {
        return guid;
    }

    /**
     * Get the version next.
     *
     * @return the {@code next=} restriction
     */
    public GuidConstraint getVersionNext() {
        return versionNext;
    }

    /**
     * Get the version previous.
     *
     * @return the {@code previous=} restriction
     */
    public GuidConstraint getVersionPrevious() {
        return versionPrevious;
    }

    /**
     * Get the anchor.
     *
     * @return the {@code anchor=} flag
     */
    public Flag getAnchor() {
        return anchor;
    }

    /**
     * Set the anchor.
     *
     * @param anchor the {@code anchor=} flag
     */
    public void setAnchor(final Flag anchor) {
        this.anchor = anchor;
    }

    /**
     * Get the archival.
     *
     * @return the {@code archival=} flag
     */
    public Flag getArchival() {
        return archival;
    }

    /**
     * Set the archival.
     *
     * @param archival the {@code archival=} flag
     */
    public void setArchival(final Flag archival) {
        this.archival = archival;
    }

    /**
     * Get the live.
     *
     * @return the {@code live=} flag
     */
    public Flag getLive() {
        return live;
    }

    /**
     * Set the live.
     *
     * @param live the {@code live=} flag
     */
    public void setLive(final Flag live) {
        this.live = live;
    }

    /**
     * Get the count.
     *
     * @return the {@code count=} bounds
     */
    public CountConstraint getCount() {
        return count;
    }

    /**
     * Get the value type.
     *
     * @return the value type, or {@link #VALUETYPE_UNSPECIFIED}
     */
    public int getValueType() {
        return valueType;
    }

    /**
     * Set the value type.
     *
     * @param valueType the value type, or {@link #VALUETYPE_UNSPECIFIED}
     */
    public void setValueType(final int valueType) {
        this.valueType = valueType;
    }

    /**
     * Get the error.
     *
     * @return the error text, or null
     */
    public String getError() {
        return error;
    }

    /**
     * Get the forward flag.
     *
     * @return true to iterate in ascending id order
     */
    public boolean isForward() {
        return forward;
    }

    /**
     * Set the forward.
     *
     * @param forward true to iterate in ascending id order
     */
    public void setForward(final boolean forward) {
        this.forward = forward;
    }

    /**
     * Get the uses contents flag.
     *
     * @return true if {@code contents} is returned
     */
    public boolean isUsesContents() {
        return usesContents;
    }

    /**
     * Set the uses contents.
     *
     * @param usesContents true if {@code contents} is returned
     */
    public void setUsesContents(final boolean usesContents) {
        this.usesContents = usesContents;
    }

    /**
     * Get the unique.
     *
     * @return a {@link PatternType#bit()} mask
     */
    public long getUnique() {
        return unique;
    }

    /**
     * Set the unique.
     *
     * @param unique a {@link PatternType#bit()} mask
     */
    public void setUnique(final long unique) {
        this.unique = unique;
    }

    /**
     * Get the key.
     *
     * @return a {@link PatternType#bit()} mask
     */
    public long getKey() {
        return key;
    }

    /**
     * Set the key.
     *
     * @param key a {@link PatternType#bit()} mask
     */
    public void setKey(final long key) {
        this.key = key;
    }

    /**
     * Get the result.
     *
     * @return the result pattern, or null
     */
    public Pattern getResult() {
        return result;
    }

    /**
     * Set the result.
     *
     * @param result the result pattern, or null
     */
    public void setResult(final Pattern result) {
        this.result = result;
    }

    /**
     * Get the sort.
     *
     * @return the sort pattern, or null
     */
    public Pattern getSort() {
        return sort;
    }

    /**
     * Set the sort.
     *
     * @param sort the sort pattern, or null
     */
    public void setSort(final Pattern sort) {
        this.sort = sort;
    }

    /**
     * Get the sort valid flag.
     *
     * @return true if the sort is still needed
     */
    public boolean isSortValid() {
        return sortValid;
    }

    /**
     * Set the sort valid.
     *
     * @param sortValid true if the sort is still needed
     */
    public void setSortValid(final boolean sortValid) {
        this.sortValid = sortValid;
    }

    /**
     * Get the sort root.
     *
     * @return the sort root, or null
     */
    public SortRoot getSortRoot() {
        return sortRoot;
    }

    /**
     * Set the sort root.
     *
     * @param sortRoot the sort root, or null
     */
    public void setSortRoot(final SortRoot sortRoot) {
        this.sortRoot = sortRoot;
    }

    /**
     * Get the sort comparators.
     *
     * @return the live list of sort comparators
     */
    public List<ValueComparator> getSortComparators() {
        return sortComparators;
    }

    /**
     * Get the page size.
     *
     * @return the page size
     */
    public long getPageSize() {
        return pageSize;
    }

    /**
     * Get the page size valid flag.
     *
     * @return true if a page size was given
     */
    public boolean isPageSizeValid() {
        return pageSizeValid;
    }

    /**
     * Get the result page size parsed.
     *
     * @return the result page size as written
     */
    public long getResultPageSizeParsed() {
        return resultPageSizeParsed;
    }

    /**
     * Get the result page size parsed valid flag.
     *
     * @return true if a result page size was given
     */
    public boolean isResultPageSizeParsedValid() {
        return resultPageSizeParsedValid;
    }

    /**
     * Get the result page size.
     *
     * @return the effective result page size
     */
    public long getResultPageSize() {
        return resultPageSize;
    }

    /**
     * Get the result page size valid flag.
     *
     * @return true if there is an effective result page size
     */
    public boolean isResultPageSizeValid() {
        return resultPageSizeValid;
    }

    /**
     * Get the count limit.
     *
     * @return the count limit
     */
    public long getCountLimit() {
        return countLimit;
    }

    /**
     * Get the count limit valid flag.
     *
     * @return true if a count limit was given
     */
    public boolean isCountLimitValid() {
        return countLimitValid;
    }

    /**
     * Get the start.
     *
     * @return the number of leading matches to skip
     */
    public long getStart() {
        return start;
    }

    /**
     * Set the start.
     *
     * @param start the number of leading matches to skip
     */
    public void setStart(final long start) {
        this.start = start;
    }

    /**
     * Get the cursor.
     *
     * @return the cursor, or null
     */
    public String getCursor() {
        return cursor;
    }

    /**
     * Set the cursor.
     *
     * @param cursor the cursor, or null
     */
    public void setCursor(final String cursor) {
        this.cursor = cursor;
    }

    /**
     * Get the cursor usable flag.
     *
     * @return true if a cursor can be returned
     */
    public boolean isCursorUsable() {
        return cursorUsable;
    }

    /**
     * Set the cursor usable.
     *
     * @param cursorUsable true if a cursor can be returned
     */
    public void setCursorUsable(final boolean cursorUsable) {
        this.cursorUsable = cursorUsable;
    }

    /**
     * Get the resumable flag.
     *
     * @return true if the query can resume after a soft timeout
     */
    public boolean isResumable() {
        return resumable;
    }

    /**
     * Set the resumable.
     *
     * @param resumable true if the query can resume after a soft timeout
     */
    public void setResumable(final boolean resumable) {
        this.resumable = resumable;
    }

    /**
     * Get the assignments.
     *
     * @return the live list of assignments
     */
    public List<Assignment> getAssignments() {
        return assignments;
    }

    /**
     * Get the declarations.
     *
     * @return the live declaration table, by name
     */
    public Map<String, VariableDeclaration> getDeclarations() {
        return declarations;
    }

    /**
     * Get the local count.
     *
     * @return the number of local value slots
     */
    public int getLocalCount() {
        return localCount;
    }

    /**
     * Set the local count.
     *
     * @param localCount the number of local value slots
     */
    public void setLocalCount(final int localCount) {
        this.localCount = localCount;
    }

    /**
     * Get the frames.
     *
     * @return the live list of pattern frames
     */
    public List<PatternFrame> getFrames() {
        return frames;
    }

    /**
     * Get the frame temporary.
     *
     * @return the index of the temporary frame, or -1
     */
    public int getFrameTemporary() {
        return frameTemporary;
    }

    /**
     * Set the frame temporary.
     *
     * @param frameTemporary the index of the temporary frame, or -1
     */
    public void setFrameTemporary(final int frameTemporary) {
        this.frameTemporary = frameTemporary;
    }

    /**
     * Get the declared frame count.
     *
     * @return the number of frames without the temporary
     */
    public int getDeclaredFrameCount() {
        return declaredFrameCount;
    }

    /**
     * Set the declared frame count.
     *
     * @param declaredFrameCount the number of frames without the temporary
     */
    public void setDeclaredFrameCount(final int declaredFrameCount) {
        this.declaredFrameCount = declaredFrameCount;
    }

    /**
     * Get the want count flag.
     *
     * @return true if a frame returns {@code count}
     */
    public boolean isWantCount() {
        return wantCount;
    }

    /**
     * Set the want count.
     *
     * @param wantCount true if a frame returns {@code count}
     */
    public void setWantCount(final boolean wantCount) {
        this.wantCount = wantCount;
    }

    /**
     * Get the want cursor flag.
     *
     * @return true if a frame returns {@code cursor}
     */
    public boolean isWantCursor() {
        return wantCursor;
    }

    /**
     * Set the want cursor.
     *
     * @param wantCursor true if a frame returns {@code cursor}
     */
    public void setWantCursor(final boolean wantCursor) {
        this.wantCursor = wantCursor;
    }

    /**
     * Get the want data flag.
     *
     * @return true if a frame needs per-primitive data
     */
    public boolean isWantData() {
        return wantData;
    }

    /**
     * Set the want data.
     *
     * @param wantData true if a frame needs per-primitive data
     */
    public void setWantData(final boolean wantData) {
        this.wantData = wantData;
    }

    /**
     * Get the low.
     *
     * @return the lowest local id that can match
     */
    public long getLow() {
        return low;
    }

    /**
     * Set the low.
     *
     * @param low the lowest local id that can match
     */
    public void setLow(final long low) {
        this.low = low;
    }

    /**
     * Get the high.
     *
     * @return the local id just past the highest that can match
     */
    public long getHigh() {
        return high;
    }

    /**
     * Set the high.
     *
     * @param high the local id just past the highest that can match
     */
    public void setHigh(final long high) {
        this.high = high;
    }

    /**
     * Get the set size.
     *
     * @return the upper bound on the number of matches
     */
    public long getSetSize() {
        return setSize;
    }

    /**
     * Set the set size.
     *
     * @param setSize the upper bound on the number of matches
     */
    public void setSetSize(final long setSize) {
        this.setSize = setSize;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(linkage.toString());
        sb.append('(');
        String sep = "";
        if (falseFlag) {
            sb.append("false");
            sep = " ";
        }
        if (meta != Meta.UNSPECIFIED) {
            sb.append(sep).append(meta.name().toLowerCase(Locale.ROOT));
            sep = " ";
        }
        if (guid.isSet()) {
            sb.append(sep).append("guid").append(guid);
            sep = " ";
        }
        for (Linkage l : Linkage.values()) {
            if (linkcon[l.ordinal()].isSet()) {
                sb.append(sep).append(l.keyword()).append(linkcon[l.ordinal()]);
                sep = " ";
            }
        }
        for (StringConstraint s : typeQueue) {
            sb.append(sep).append("type").append(s);
            sep = " ";
        }
        for (StringConstraint s : nameQueue) {
            sb.append(sep).append("name").append(s);
            sep = " ";
        }
        for (StringConstraint s : valueQueue) {
            sb.append(sep).append("value").append(s);
            sep = " ";
        }
        for (Assignment a : assignments) {
            sb.append(sep).append(a);
            sep = " ";
        }
        if (result != null) {
            sb.append(sep).append("result=").append(result);
            sep = " ";
        }
        if (sort != null && sortValid) {
            sb.append(sep).append("sort=").append(sort);
            sep = " ";
        }
        for (Constraint sub : subs) {
            if (sub.parent == this) {
                sb.append(sep).append(sub);
                sep = " ";
            }
        }
        for (ConstraintOr cor : ors) {
            sb.append(sep).append(cor.getHead());
            if (cor.getTail() != null) {
                sb.append(cor.isShortCircuit() ? " || " : " | ")
                    .append(cor.getTail());
            }
            sep = " ";
        }
        sb.append(')');
        return sb.toString();
    }
}
