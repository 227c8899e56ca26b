package com.graphd.query.semantic;

import com.graphd.query.CompilerConfig;
import com.graphd.query.QueryRequest;
import com.graphd.query.RequestKind;
import com.graphd.query.SemanticException;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.constraint.CursorMarker;
import com.graphd.query.constraint.Linkage;
import com.graphd.query.constraint.OrBranches;
import com.graphd.query.pattern.DefaultPatterns;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.sort.SortCompiler;
import com.graphd.query.variable.Assignment;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.VariableAnalysis;
import com.graphd.query.variable.VariableDeclaration;
import com.graphd.query.variable.Variables;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates a completed constraint tree and fills in the defaults that
 * depend on the request: result patterns, page sizes and ids.
 *
 * <p>Constraints are checked parent first. The first problem found
 * aborts the check.</p>
 */
public final class SemanticChecker {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        SemanticChecker.class);

    /** Private constructor to prevent instantiation. */
    private SemanticChecker() {
        // Utility class
    }

    /**
     * Check a request's constraint tree; for reads, then run variable
     * analysis over it.
     *
     * @param request the request
     * @throws SemanticException on the first problem found
     */
    public static void complete(final QueryRequest request)
            throws SemanticException {
        Constraint root = request.root();
        completeSubtree(request, root);
        if (root.getParent() == null && request.kind().isRead()) {
            VariableAnalysis.analyze(root);
        }
    }

    /**
     * Check one constraint, then its subconstraints.
     *
     * @param request the request
     * @param con the constraint
     * @throws SemanticException on the first problem found
     */
    public static void completeSubtree(final QueryRequest request,
            final Constraint con) throws SemanticException {
        if (con.getParent() == null) {
            con.setId(1);
        }
        if (con.getUnique() != 0 && request.kind() != RequestKind.WRITE) {
            throw SemanticException.syntax(
                "\"unique=\" only works with \"write\"");
        }
        if (con.getKey() != 0 && request.kind() != RequestKind.WRITE) {
            throw SemanticException.syntax(
                "\"key=\" only works with \"write\"");
        }

        OrBranches.index(con, 0);

        checkDeclarations(con);
        checkAssignments(con);

        if (request.softTimeout()
                && (spectrum(con) & (PatternType.TIMEOUT.bit()
                    | PatternType.CURSOR.bit())) != 0) {
            con.setResumable(true);
        }

        if (con.getParent() != null && !con.getLinkage().isSet()) {
            throw SemanticException.semantics(
                "don't know how to connect these nested constraints");
        }
        if (con.getLinkage().isMy() && con.getParent() == null) {
            String str = con.getLinkage().linkage().keyword();
            throw SemanticException.semantics("can't use (<-%s ..) on the "
                + "outermost constraint - do you mean %s=GUID?", str, str);
        }

        if (con.getUnique() != 0) {
            checkUnique(con, con.getUnique());
        }
        if (con.getKey() != 0) {
            checkKey(con, con.getKey());
        }
        if (con.getKey() != 0 && con.getGuid().isMatchValid()) {
            throw SemanticException.semantics(
                "cannot mix key and ~= constraints");
        }

        if (con.getResult() == null) {
            con.setResult(request.kind() == RequestKind.WRITE
                ? DefaultPatterns.writeDefault()
                : DefaultPatterns.readDefault());
        }
        con.setUsesContents(con.usesPattern(PatternType.CONTENTS));

        applyPageSizes(con, request.config());

        SortCompiler.compile(con);
        CursorMarker.markUsable(con);

        con.setId(con.getParent() != null ? con.getParent().getId() : 1);
        for (Constraint sub : con.getSubs()) {
            // Nobody reads the contents, so don't compute them.
            if (!con.isUsesContents()) {
                sub.setResult(DefaultPatterns.empty());
            }
            completeSubtree(request, sub);
            con.setId(sub.getId() + 1);
        }

        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("checked: {}", con);
        }
    }

    /*  A variable used here must be assigned here, in a branch, or
     *  below.
     */
    private static void checkDeclarations(final Constraint con)
            throws SemanticException {
        for (VariableDeclaration vdecl : con.getDeclarations().values()) {
            if (Assignments.byDeclaration(con, vdecl) != null) {
                continue;
            }
            if (!Variables.isAssignedInOrBelow(con, vdecl.getName())) {
                throw SemanticException.syntax("variable %s is returned, "
                    + "but not set in the constraint or any subconstraint",
                    vdecl.getName());
            }
        }
    }

    private static void checkAssignments(final Constraint con)
            throws SemanticException {
        List<Assignment> assignments = con.getAssignments();
        for (int i = 0; i < assignments.size(); i++) {
            Assignment a = assignments.get(i);
            if (a.getDeclaration().getConstraint() != con) {
                continue;
            }
            String name = a.getDeclaration().getName();

            Constraint sup = con;
            while (sup != null
                    && !Variables.isUsed(sup.prototypeRoot(), name)) {
                sup = sup.getParent();
            }
            if (sup == null) {
                throw SemanticException.syntax("variable %s is assigned, "
                    + "but not returned in this or any containing "
                    + "constraint", name);
            }

            for (int j = i + 1; j < assignments.size(); j++) {
                if (assignments.get(j).getDeclaration()
                        == a.getDeclaration()) {
                    throw SemanticException.syntax(
                        "variable %s is assigned to twice", name);
                }
            }
            for (Constraint c = con.getParent(); c != null;
                    c = c.getParent()) {
                if (Assignments.byName(c, name) != null) {
                    throw SemanticException.syntax("variable %s is "
                        + "assigned to twice in nested constraints", name);
                }
            }
        }

        for (Assignment a : assignments) {
            if (Assignments.isRecursive(con, a)) {
                throw SemanticException.syntax(
                    "circular assignment of %s to itself",
                    a.getDeclaration().getName());
            }
        }
    }

    private static long spectrum(final Constraint con) {
        long used = Pattern.spectrum(con.getResult());
        for (Assignment a : con.getAssignments()) {
            used |= Pattern.spectrum(a.getResult());
        }
        return used;
    }

    /*  unique= needs the values it is unique over. A typeguid can come
     *  from type= as well.
     */
    private static void checkUnique(final Constraint con, final long mask)
            throws SemanticException {
        long pattern = con.linkagePattern();
        for (Linkage linkage : Linkage.values()) {
            if ((mask & linkage.bit()) == 0 || (pattern & linkage.bit()) != 0
                    || hasTypeFor(con, linkage)) {
                continue;
            }
            throw SemanticException.semantics("request for %s uniqueness "
                + "without specifying a %s?", linkage.keyword(),
                linkage.keyword());
        }
        if ((mask & (PatternType.DATATYPE.bit()
                | PatternType.VALUETYPE.bit())) != 0
                && con.getValueType() == Constraint.VALUETYPE_UNSPECIFIED) {
            throw SemanticException.semantics("request for data- or "
                + "valuetype uniqueness without specifying a data- or "
                + "valuetype?");
        }
        if ((mask & PatternType.TIMESTAMP.bit()) != 0
                && !con.isTimestampValid()) {
            throw SemanticException.semantics("request for timestamp "
                + "uniqueness without specifying a timestamp?");
        }
        if ((mask & PatternType.NAME.bit()) != 0
                && con.getNameQueue().isEmpty()) {
            throw SemanticException.semantics("request for name "
                + "uniqueness without specifying a name?");
        }
        if ((mask & PatternType.VALUE.bit()) != 0
                && con.getValueQueue().isEmpty()) {
            throw SemanticException.semantics("request for value "
                + "uniqueness without specifying a value?");
        }
    }

    private static void checkKey(final Constraint con, final long mask)
            throws SemanticException {
        long pattern = con.linkagePattern();
        for (Linkage linkage : Linkage.values()) {
            if ((mask & linkage.bit()) == 0 || (pattern & linkage.bit()) != 0
                    || hasTypeFor(con, linkage)) {
                continue;
            }
            throw SemanticException.semantics("%s is used as a key without "
                + "specifying a %s linkage for the constraint.",
                linkage.keyword(), linkage.keyword());
        }
        if ((mask & (PatternType.DATATYPE.bit()
                | PatternType.VALUETYPE.bit())) != 0
                && con.getValueType() == Constraint.VALUETYPE_UNSPECIFIED) {
            throw keyMissing("data- or valuetype");
        }
        if ((mask & PatternType.TIMESTAMP.bit()) != 0
                && !con.isTimestampValid()) {
            throw keyMissing("timestamp");
        }
        if ((mask & PatternType.NAME.bit()) != 0
                && con.getNameQueue().isEmpty()) {
            throw keyMissing("name");
        }
        if ((mask & PatternType.VALUE.bit()) != 0
                && con.getValueQueue().isEmpty()) {
            throw keyMissing("value");
        }
    }

    private static boolean hasTypeFor(final Constraint con,
            final Linkage linkage) {
        return linkage == Linkage.TYPEGUID && !con.getTypeQueue().isEmpty();
    }

    private static SemanticException keyMissing(final String what) {
        return SemanticException.semantics("%s is used as a key without "
            + "specifying a %s in the constraint", what, what);
    }

    /*  A constraint its parent points to ("I am") matches at most one
     *  primitive per parent, so all of its page sizes shrink to 1.
     *  Otherwise countlimit and resultpagesize default to the pagesize,
     *  and result page sizes to the configured default and maximum.
     */
    private static void applyPageSizes(final Constraint con,
            final CompilerConfig config) {
        boolean single = con.getLinkage().isIAm();
        if (single && (!con.isPageSizeValid() || con.getPageSize() > 1)) {
            con.setPageSize(1);
        }

        if (con.isPageSizeValid()) {
            if (!con.isCountLimitValid()) {
                con.setCountLimit(con.getStart() + con.getPageSize());
            }
            if (!con.isResultPageSizeParsedValid()) {
                con.setResultPageSizeParsed(con.getPageSize());
            }
        }

        if (!con.isResultPageSizeParsedValid()) {
            con.setResultPageSizeParsed(config.resultPageSizeDefault());
        }
        if (con.getResultPageSizeParsed() > config.resultPageSizeMax()) {
            con.setResultPageSizeParsed(config.resultPageSizeMax());
        }
        if (!con.isResultPageSizeValid()) {
            con.setResultPageSize(config.resultPageSizeDefault());
        }
        if (con.getResultPageSize() > config.resultPageSizeMax()) {
            con.setResultPageSize(config.resultPageSizeMax());
        }

        if (single) {
            if (con.isCountLimitValid() && con.getCountLimit() > 1) {
                con.setCountLimit(1);
            }
            if (con.getResultPageSizeParsed() > 1) {
                con.setResultPageSizeParsed(1);
            }
            if (con.getResultPageSize() > 1) {
                con.setResultPageSize(1);
            }
            LOGGER.debug("{}: at most one match per parent; page sizes "
                + "clamped to 1", con);
        }
    }
}
