package com.graphd.query.variable;

import com.graphd.query.constraint.Constraint;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out a constraint's compiled result slots.
 *
 * <p>Frames are ordered: one per assignment, then one for the result,
 * then at most one temporary frame holding sampled and sort values
 * that no declared frame returns per primitive.</p>
 */
public final class PatternFrames {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        PatternFrames.class);

    /** Private constructor to prevent instantiation. */
    private PatternFrames() {
        // Utility class
    }

    /**
     * Build the frames of one constraint and point every sample at the
     * slot its value is harvested into.
     *
     * @param con the constraint
     */
    public static void create(final Constraint con) {
        List<PatternFrame> frames = con.getFrames();
        frames.clear();
        con.setFrameTemporary(-1);
        con.setWantCount(false);
        con.setWantCursor(false);
        con.setWantData(false);

        for (Assignment a : con.getAssignments()) {
            frames.add(PatternFrame.of(a.getResult()));
        }
        if (con.getResult() != null) {
            frames.add(PatternFrame.of(con.getResult()));
        }
        con.setDeclaredFrameCount(frames.size());

        if (con.getSort() != null && con.isSortValid()) {
            locateSamples(con, con.getSort(), true);
        }

        // The temporary frame, once created, is visited too.
        for (int i = 0; i < frames.size(); i++) {
            if (frames.get(i).getSet() != null) {
                locateSamples(con, frames.get(i).getSet(), false);
            }
        }

        for (PatternFrame pf : frames) {
            if (pf.getOne() != null && pf.getSet() != null) {
                con.setWantData(true);
            }
            if (Pattern.lookup(pf.getSet(), PatternType.CURSOR) != null) {
                con.setWantCursor(true);
            }
            if (Pattern.lookup(pf.getSet(), PatternType.COUNT) != null) {
                con.setWantCount(true);
            }
            Pattern one = pf.getOne();
            if (one != null && one.size() > 0) {
                boolean allSortOnly = true;
                for (Pattern p : one.getChildren()) {
                    allSortOnly &= p.isSortOnly();
                }
                if (allSortOnly) {
                    one.setSortOnly(true);
                }
            }
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}: {} frame(s) {}", con, frames.size(), frames);
        }
    }

    private static void locateSamples(final Constraint con,
            final Pattern pat, final boolean sortOnly) {
        if (pat.getType() != PatternType.LIST) {
            if (Pattern.isPrimitiveDependent(con, pat)) {
                locateSample(con, pat, sortOnly);
            }
            return;
        }
        for (Pattern p : pat.getChildren()) {
            if (p.getType() != PatternType.LIST
                    && Pattern.isPrimitiveDependent(con, p)) {
                locateSample(con, p, sortOnly);
            }
        }
    }

    /*  Point sample at an equal element of some per-primitive list, or
     *  add a copy of it to the temporary frame. An element used for more
     *  than sorting loses its sort-only mark.
     */
    private static void locateSample(final Constraint con,
            final Pattern sample, final boolean sortOnly) {
        List<PatternFrame> frames = con.getFrames();
        for (int i = 0; i < frames.size(); i++) {
            Pattern one = frames.get(i).getOne();
            if (one == null) {
                continue;
            }
            List<Pattern> elements = one.getChildren();
            for (int j = 0; j < elements.size(); j++) {
                Pattern p = elements.get(j);
                if (Pattern.equalValue(p, sample)) {
                    sample.setResultOffset(i);
                    sample.setElementOffset(j);
                    p.setSortOnly(p.isSortOnly() && sortOnly);
                    return;
                }
            }
        }

        if (con.getFrameTemporary() == -1) {
            con.setFrameTemporary(frames.size());
            frames.add(new PatternFrame(null, null, 0));
        }
        PatternFrame pf = frames.get(con.getFrameTemporary());
        if (pf.getOne() == null) {
            // Sorted constraints collect the temporaries, then sort them.
            Pattern parent = null;
            if (con.getSort() != null && con.isSortValid()) {
                parent = Pattern.alloc(null, PatternType.LIST);
                pf.setSet(parent);
            }
            pf.setOne(Pattern.alloc(parent, PatternType.LIST));
            pf.setOneOffset(0);
        }

        Pattern copy = Pattern.dup(pf.getOne(), sample);
        copy.setSortOnly(sortOnly);
        sample.setResultOffset(con.getFrameTemporary());
        sample.setElementOffset(pf.getOne().size() - 1);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("sample {} added at result={} elem={}", copy.dump(),
                sample.getResultOffset(), sample.getElementOffset());
        }
    }

    /**
     * Does any frame of the constraint evaluate per-primitive values?
     *
     * @param con the constraint
     * @return true if some frame has a per-primitive list
     */
    public static boolean usesPerPrimitiveData(final Constraint con) {
        for (PatternFrame pf : con.getFrames()) {
            if (pf.getOne() != null) {
                return true;
            }
        }
        return false;
    }
}
