package com.graphd.query.guid;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.GenerationalConstraint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A disjunction of GUIDs, possibly including "null".
 *
 * <p>An empty set is short for "only null": {@link #containsNull()} is
 * true whenever the set has no elements, whatever the explicit null
 * flag says. Adding a GUID to an empty set replaces that implicit null
 * with the GUID; add null explicitly to keep it.</p>
 *
 * <p>Sets can be chained through {@link #getNext()}. A chain is a
 * conjunction whose intersection could not be computed yet (a
 * {@code guid~=} list meets another before lineages are resolved).</p>
 */
public final class GuidSet {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        GuidSet.class);

    /** Text of the error attached when versioning leaves nothing. */
    public static final String NO_GUIDS_IN_RANGE =
        "SEMANTICS no GUIDs in the request range of versions";

    /** The elements, in insertion order. */
    private final List<Guid> guids = new ArrayList<>();

    /** Explicit null membership. */
    private boolean nullFlag;

    /** Next set of a deferred intersection, or null. */
    private GuidSet next;

    /**
     * Creates an empty set.
     */
    public GuidSet() {
        // Empty set: matches only null.
    }

    /**
     * Creates a set holding the given GUIDs, in order. A null element
     * sets the null flag.
     *
     * @param elements the elements
     * @return the set
     */
    public static GuidSet of(final Guid... elements) {
        GuidSet gs = new GuidSet();
        for (Guid g : elements) {
            gs.add(g);
        }
        return gs;
    }

    /**
     * Add a GUID.
     *
     * @param guid the GUID, or null to add null
     */
    public void add(final Guid guid) {
        if (guid == null) {
            nullFlag = true;
            return;
        }
        if (guids.isEmpty()) {
            guids.add(guid);
            return;
        }
        if (find(guid) < guids.size()) {
            return;
        }
        guids.add(guid);
    }

    /**
     * Remove a GUID.
     *
     * @param guid the GUID, or null to clear the null flag
     * @return true if something was removed
     */
    public boolean delete(final Guid guid) {
        if (guid == null) {
            boolean had = nullFlag;
            nullFlag = false;
            return had;
        }
        int i = find(guid);
        if (i >= guids.size()) {
            return false;
        }
        guids.remove(i);
        return true;
    }

    /**
     * Position of a GUID.
     *
     * @param guid the GUID, or null
     * @return its index, or {@link #size()} if it is not in the set; null
     *     lives at 0 if the set contains null
     */
    public int find(final Guid guid) {
        if (guid == null) {
            return containsNull() ? 0 : guids.size();
        }
        int i = 0;
        while (i < guids.size() && !guids.get(i).equals(guid)) {
            i++;
        }
        return i;
    }

    /**
     * Is a GUID in the set?
     *
     * @param guid the GUID, or null
     * @return true if it is a member
     */
    public boolean match(final Guid guid) {
        if (guid == null) {
            return containsNull();
        }
        return !guids.isEmpty() && find(guid) < guids.size();
    }

    /**
     * Does the set match null?
     *
     * @return true if the null flag is set or the set is empty
     */
    public boolean containsNull() {
        return nullFlag || guids.isEmpty();
    }

    /**
     * Number of GUID elements, not counting null.
     *
     * @return the element count
     */
    public int size() {
        return guids.size();
    }

    /**
     * Element at an index.
     *
     * @param i the index
     * @return the GUID
     */
    public Guid get(final int i) {
        return guids.get(i);
    }

    /**
     * The elements.
     *
     * @return an unmodifiable view of the elements
     */
    public List<Guid> getGuids() {
        return Collections.unmodifiableList(guids);
    }

    /**
     * Get the explicit null flag.
     *
     * @return the flag
     */
    public boolean isNullFlag() {
        return nullFlag;
    }

    /**
     * Get the next set of a deferred intersection.
     *
     * @return the next set, or null
     */
    public GuidSet getNext() {
        return next;
    }

    /**
     * Take over the contents of another set, chain included. The other
     * set must not be used afterwards.
     *
     * @param src the set to take over
     */
    public void moveFrom(final GuidSet src) {
        if (src == this) {
            return;
        }
        guids.clear();
        guids.addAll(src.guids);
        nullFlag = src.nullFlag;
        next = src.next;
    }

    /**
     * Copy this link of a chain, without the sets chained behind it.
     *
     * @return the copy
     */
    public GuidSet copyLink() {
        GuidSet copy = new GuidSet();
        copy.guids.addAll(guids);
        copy.nullFlag = nullFlag;
        return copy;
    }

    private void setElements(final List<Guid> elements) {
        guids.clear();
        guids.addAll(elements);
    }

    /**
     * Intersect {@code in} into this set.
     *
     * <p>The set keeps its order. With {@code postpone}, the intersection
     * is not computed; {@code in} is chained behind this set instead.</p>
     *
     * @param con constraint marked false if nothing is left
     * @param postpone chain instead of computing
     * @param in the set to intersect with; taken over
     */
    public void intersect(final Constraint con, final boolean postpone,
            final GuidSet in) {
        if (in.guids.isEmpty()) {
            if (!guids.isEmpty()) {
                if (!nullFlag) {
                    markFalse(con, "intersect non-null with null");
                }
                guids.clear();
            }
            return;
        }
        if (guids.isEmpty()) {
            if (!in.containsNull()) {
                markFalse(con, "intersect null with non-null");
            }
            return;
        }
        if (postpone) {
            GuidSet chained = new GuidSet();
            chained.moveFrom(in);
            chained.next = next;
            next = chained;
            return;
        }

        Set<Guid> filter = new HashSet<>(in.guids);
        List<Guid> kept = new ArrayList<>();
        for (Guid g : guids) {
            if (filter.contains(g)) {
                kept.add(g);
            }
        }
        setElements(kept);
        nullFlag &= in.containsNull();
        if (guids.isEmpty() && !nullFlag) {
            markFalse(con, "nothing left after proper intersect");
        }
    }

    /**
     * Keep only those elements whose lineage original is in {@code fil}.
     *
     * @param oracle the lineage lookup
     * @param con constraint marked false if nothing is left
     * @param fil originals of the allowed GUIDs
     * @throws StorageException on store failure
     */
    public void filterMatch(final StorageOracle oracle, final Constraint con,
            final GuidSet fil) throws StorageException {
        if (guids.isEmpty()) {
            nullFlag = true;
        }
        if (nullFlag) {
            if (!fil.guids.isEmpty() && !fil.nullFlag) {
                markFalse(con, "=/~ against a null");
            }
            return;
        }
        if (fil.guids.isEmpty()) {
            markFalse(con, "=/~ null against a non-null");
            return;
        }

        List<Guid> kept = new ArrayList<>();
        for (Guid g : guids) {
            if (g.isNull()) {
                kept.add(g);
                continue;
            }
            Guid original = oracle.nthGeneration(g, null, false, 0)
                .orElse(g);
            if (fil.find(original) < fil.size()) {
                kept.add(g);
            }
        }
        setElements(kept);
        if (guids.isEmpty()) {
            markFalse(con, "=/~ no overlap");
        }
    }

    /**
     * Remove the elements of {@code in} from this set.
     *
     * @param in the set to subtract
     * @return false if the result matches nothing, true otherwise
     */
    public boolean subtract(final GuidSet in) {
        if (guids.isEmpty()) {
            nullFlag = true;
        }
        if (in.guids.isEmpty()) {
            nullFlag = false;
            return !guids.isEmpty();
        }
        if (guids.isEmpty()) {
            return !in.nullFlag;
        }
        if (in.nullFlag) {
            nullFlag = false;
        }
        for (Guid g : in.guids) {
            delete(g);
        }
        return !guids.isEmpty() || nullFlag;
    }

    /**
     * Add the elements of {@code in} to this set.
     *
     * @param in the set to merge; taken over
     */
    public void union(final GuidSet in) {
        nullFlag |= in.nullFlag || in.guids.isEmpty();
        if (in.guids.isEmpty()) {
            return;
        }
        if (guids.isEmpty()) {
            moveFrom(in);
            nullFlag = true;
            return;
        }
        for (Guid g : in.guids) {
            add(g);
        }
    }

    /**
     * Add a run of generations of a GUID's lineage, counted from the
     * original.
     *
     * @param oracle the lineage lookup
     * @param asOf null or the version horizon
     * @param guid any member of the lineage, or null to add null
     * @param first first generation to add
     * @param count number of generations to add
     * @throws StorageException on store failure, or if a generation
     *     inside the lineage cannot be found
     */
    public void addGenerations(final StorageOracle oracle, final Long asOf,
            final Guid guid, final long first, final long count)
            throws StorageException {
        if (guid == null) {
            nullFlag = true;
            return;
        }
        for (long i = first; i < first + count; i++) {
            Optional<Guid> g = oracle.nthGeneration(guid, asOf, false, i);
            if (g.isEmpty()) {
                throw new StorageException("no generation " + i + " of "
                    + guid);
            }
            add(g.get());
        }
    }

    /**
     * Replace each GUID with the generations its constraint asks for.
     *
     * <p>For the constraint's own {@code guid~=} set, the newest and
     * oldest bounds of the constraint select the generations; for
     * linkage sets, every generation of the lineage is kept. If nothing
     * is left, the constraint is marked false.</p>
     *
     * @param oracle the lineage lookup
     * @param asOf null or the version horizon
     * @param con the constraint the set belongs to
     * @param isGuid true for the constraint's own GUID set
     * @throws StorageException on store failure
     */
    public void convertGenerations(final StorageOracle oracle,
            final Long asOf, final Constraint con, final boolean isGuid)
            throws StorageException {
        if (guids.isEmpty()) {
            return;
        }
        GenerationalConstraint newest = con.getNewest();
        GenerationalConstraint oldest = con.getOldest();

        if (isGuid && !oldest.isValid()
                && (!newest.isValid() || newest.getMin() == newest.getMax())) {
            List<Guid> out = new ArrayList<>();
            for (Guid g : guids) {
                if (g.isNull()) {
                    out.add(g);
                    continue;
                }
                oracle.nthGeneration(g, asOf, true, newest.getMin())
                    .ifPresent(out::add);
            }
            setElements(out);
            if (guids.isEmpty() && !nullFlag) {
                markNoneInRange(con);
            }
            return;
        }

        List<Guid> out = new ArrayList<>();
        for (Guid guid : guids) {
            Optional<LineageInfo> info =
                oracle.lineageLastGeneration(guid, asOf);
            if (info.isEmpty()) {
                continue;
            }
            long n = Math.max(1L, info.get().generationCount());
            long genMin = 0;
            long genMax = Long.MAX_VALUE;
            if (isGuid) {
                if (newest.isValid()) {
                    genMax = newest.getMin() > n - 1
                        ? -1 : n - (1 + newest.getMin());
                    genMin = newest.getMax() > n - 1
                        ? -1 : n - (1 + newest.getMax());
                }
                if (oldest.isValid()) {
                    genMin = Math.max(genMin, oldest.getMin());
                    genMax = Math.min(genMax, oldest.getMax());
                }
            }
            genMin = Math.max(genMin, 0);
            genMax = Math.min(genMax, n - 1);
            for (long gen = genMin; gen <= genMax; gen++) {
                if (gen == 0 && n == 1) {
                    out.add(guid);
                    continue;
                }
                Optional<Guid> g = oracle.nthGeneration(guid, asOf, false,
                    gen);
                if (g.isPresent()) {
                    out.add(g.get());
                } else if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("no generation {} of {}", gen, guid);
                }
            }
        }
        setElements(out);
        if (guids.isEmpty() && !nullFlag) {
            markNoneInRange(con);
        }
    }

    /**
     * Replace every GUID with the original of its lineage, so that
     * {@code ~=} sets can be intersected as plain sets.
     *
     * @param oracle the lineage lookup
     * @throws StorageException on store failure
     */
    public void normalizeMatch(final StorageOracle oracle)
            throws StorageException {
        for (int i = 0; i < guids.size(); i++) {
            Guid g = guids.get(i);
            if (g.isNull()) {
                continue;
            }
            Optional<Guid> original = oracle.nthGeneration(g, null, false, 0);
            if (original.isPresent()) {
                guids.set(i, original.get());
            }
        }
    }

    private static void markFalse(final Constraint con, final String why) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("FALSE: {}", why);
        }
        con.markFalse();
    }

    private static void markNoneInRange(final Constraint con) {
        LOGGER.debug("FALSE: no GUIDs in requested range");
        con.markFalse(NO_GUIDS_IN_RANGE);
    }

    /**
     * Are two chains of sets equal? Sets with the same GUIDs in a
     * different order compare unequal.
     *
     * @param a a set
     * @param b another set
     * @return true if equal
     */
    public static boolean equal(final GuidSet a, final GuidSet b) {
        if (a.containsNull() != b.containsNull()) {
            return false;
        }
        GuidSet x = a;
        GuidSet y = b;
        while (x != null && y != null) {
            if (!x.guids.equals(y.guids) || x.nullFlag != y.nullFlag) {
                return false;
            }
            x = x.next;
            y = y.next;
        }
        return x == null && y == null;
    }

    /**
     * Hash consistent with {@link #equal}.
     *
     * @param gs a set
     * @return the hash
     */
    public static int hash(final GuidSet gs) {
        int h = 1;
        for (GuidSet s = gs; s != null; s = s.next) {
            h = 31 * h + s.guids.hashCode();
            h = 31 * h + (s.nullFlag ? 1 : 0);
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (GuidSet s = this; s != null; s = s.next) {
            if (s != this) {
                sb.append(" & ");
            }
            sb.append('(');
            String sep = "";
            if (s.nullFlag || s.guids.isEmpty()) {
                sb.append("null");
                sep = " ";
            }
            for (Guid g : s.guids) {
                sb.append(sep).append(g);
                sep = " ";
            }
            sb.append(')');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof GuidSet && equal(this, (GuidSet) o);
    }

    @Override
    public int hashCode() {
        return hash(this);
    }
}
