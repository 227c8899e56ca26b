package com.graphd.query.constraint;

import com.graphd.query.SemanticException;
import com.graphd.query.comparator.Comparators;
import com.graphd.query.pattern.Pattern;
import com.graphd.query.pattern.PatternType;
import com.graphd.query.variable.Assignment;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.VariableDeclaration;
import com.graphd.query.variable.VariableDeclarations;
import com.graphd.query.variable.Variables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alternations: default inheritance from the prototype, or-indexing, and
 * promotion of branch variables into the prototype root.
 *
 * <p>A variable {@code $v} set inside branch number {@code i} becomes
 * {@code $v [or#i]} in the prototype root, and {@code $v} there is
 * assigned a {@code pick} over all such branch versions.</p>
 */
public final class OrBranches {

    /** Logger instance. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        OrBranches.class);

    /** Private constructor to prevent instantiation. */
    private OrBranches() {
        // Utility class
    }

    /**
     * Check a parsed branch against its prototype and copy the
     * prototype's settings into whatever the branch leaves unset, then
     * do the same for the branch's own alternations.
     *
     * @param proto the prototype
     * @param branch one side of an alternation of {@code proto}
     * @throws SemanticException if the branch sets something only the
     *     prototype may set
     */
    public static void completeParse(final Constraint proto,
            final Constraint branch) throws SemanticException {
        LOGGER.trace("complete or-branch {} of {}", branch, proto);

        branch.setParent(proto.getParent());

        if (branch.getResult() != null) {
            throw SemanticException.semantics(
                "can't change result=... in an or-branch");
        }
        if (branch.getLinkage().isSet()) {
            throw SemanticException.semantics(
                "can't change linkage in an or-branch");
        }
        if (branch.getSort() != null && branch.isSortValid()) {
            throw SemanticException.semantics(
                "can't change sort order in an or-branch");
        }
        if (!branch.getSortComparators().isEmpty()) {
            throw SemanticException.semantics(
                "can't change comparator list in an or-branch");
        }
        if (branch.isPageSizeValid()) {
            throw SemanticException.semantics(
                "can't change pagesize in an or-branch");
        }
        if (branch.isResultPageSizeParsedValid()) {
            throw SemanticException.semantics(
                "can't change resultpagesize in an or-branch");
        }
        if (branch.isCountLimitValid()) {
            throw SemanticException.semantics(
                "can't change countlimit in an or-branch");
        }
        if (branch.getCursor() != null) {
            throw SemanticException.semantics(
                "can't use a cursor in an or-branch");
        }

        if (proto.getLinkage().isSet()) {
            branch.setLinkage(proto.getLinkage());
        }
        branch.setForward(proto.isForward());
        if (proto.isFalse()) {
            branch.markFalse();
        }
        if (branch.getLive() == Flag.UNSPECIFIED) {
            branch.setLive(proto.getLive());
        }
        if (branch.getArchival() == Flag.UNSPECIFIED) {
            branch.setArchival(proto.getArchival());
        }
        if (!branch.getNewest().isValid()) {
            branch.getNewest().copyFrom(proto.getNewest());
        }
        if (!branch.getOldest().isValid()) {
            branch.getOldest().copyFrom(proto.getOldest());
        }
        if (!branch.isTimestampValid()) {
            branch.copyTimestamp(proto);
        }
        if (branch.getMeta() == Meta.UNSPECIFIED) {
            branch.setMeta(proto.getMeta());
        }
        if (branch.getValueType() == Constraint.VALUETYPE_UNSPECIFIED) {
            branch.setValueType(proto.getValueType());
        }
        if (Comparators.isDefaultable(branch.getComparator())) {
            branch.setComparator(proto.getComparator());
        }
        if (Comparators.isDefaultable(branch.getValueComparator())) {
            branch.setValueComparator(proto.getValueComparator());
        }

        for (ConstraintOr cor : branch.getOrs()) {
            completeParse(branch, cor.getHead());
            if (cor.getTail() != null) {
                completeParse(branch, cor.getTail());
            }
        }
    }

    /**
     * Number a constraint and its nested branches depth-first.
     *
     * @param con the constraint
     * @param n the number for {@code con}
     * @return the next unused number
     */
    public static int index(final Constraint con, final int n) {
        int next = n;
        con.setOrIndex(next++);
        for (ConstraintOr cor : con.getOrs()) {
            next = index(cor.getHead(), next);
            if (cor.getTail() != null) {
                next = index(cor.getTail(), next);
            }
        }
        return next;
    }

    /** Result of promoting a branch variable into its prototype root. */
    public static final class Promotion {

        /** The branch-indexed declaration in the root. */
        private final VariableDeclaration indexed;

        /** The root's plain declaration, if this promotion created it. */
        private final VariableDeclaration created;

        Promotion(final VariableDeclaration indexed,
                final VariableDeclaration created) {
            this.indexed = indexed;
            this.created = created;
        }

        /**
         * Get the branch-indexed declaration.
         *
         * @return {@code $v [or#i]} in the prototype root
         */
        public VariableDeclaration getIndexed() {
            return indexed;
        }

        /**
         * Get the newly created root declaration.
         *
         * @return {@code $v} in the prototype root, or null if it already
         *     existed
         */
        public VariableDeclaration getCreated() {
            return created;
        }
    }

    /**
     * Declare a branch variable in the prototype root.
     *
     * <p>Declares {@code $v} and {@code $v [or#i]} in the root and adds
     * {@code $v [or#i]}, tagged with or-index {@code i}, as an arm of the
     * root's {@code pick} assignment to {@code $v}.</p>
     *
     * @param orcon a branch, with a nonzero or-index
     * @param name the variable name
     * @return the declarations involved
     */
    public static Promotion declare(final Constraint orcon,
            final String name) {
        Constraint arch = orcon.prototypeRoot();
        if (orcon.getOrIndex() == 0 || arch.getOrIndex() != 0) {
            throw new IllegalStateException(
                "or-declare outside an indexed branch: " + orcon);
        }
        return promote(arch, orcon.getOrIndex(), name, null);
    }

    /**
     * Move a declaration made in a branch into the branch's prototype
     * root, renaming its uses in the branch to the indexed name.
     *
     * @param arch the prototype root
     * @param old a declaration owned by a branch of {@code arch}
     * @return the declarations involved
     */
    public static Promotion compileDeclaration(final Constraint arch,
            final VariableDeclaration old) {
        Constraint con = old.getConstraint();
        if (con.getOrIndex() == 0 || arch.getOrIndex() != 0) {
            throw new IllegalStateException(
                "or-compile outside an indexed branch: " + con);
        }
        return promote(arch, con.getOrIndex(), old.getName(), old);
    }

    private static Promotion promote(final Constraint arch, final int orIndex,
            final String name, final VariableDeclaration old) {
        VariableDeclaration created = null;
        VariableDeclaration archDecl = VariableDeclarations.lookup(arch, name);
        if (archDecl == null) {
            archDecl = VariableDeclarations.addOrLookup(arch, name);
            created = archDecl;
        }
        VariableDeclaration indexed = VariableDeclarations.addOrLookup(arch,
            name + " [or#" + orIndex + "]");
        if (old != null) {
            Variables.rename(old.getConstraint(), old, indexed);
        }

        Assignment archA = Assignments.byDeclaration(arch, archDecl);
        if (archA == null) {
            archA = Assignments.allocDeclaration(arch, archDecl);
        }
        if (archA.getResult() == null) {
            archA.setResult(Pattern.alloc(null, PatternType.PICK));
        }
        if (archA.getResult().getType() != PatternType.PICK) {
            Pattern pick = Pattern.alloc(null, PatternType.PICK);
            pick.append(archA.getResult());
            archA.setResult(pick);
        }
        Pattern.allocVariable(archA.getResult(), indexed).setOrIndex(orIndex);

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("promote {} from or#{} into {}: {}", name, orIndex,
                arch, archA);
        }
        return new Promotion(indexed, created);
    }

    /**
     * Move a branch's assignments into its prototype root.
     *
     * @param arch the prototype root
     * @param con null or a constraint; nothing happens unless it is a
     *     branch
     */
    public static void moveAssignments(final Constraint arch,
            final Constraint con) {
        if (con == null || con.getOr() == null) {
            return;
        }
        arch.getAssignments().addAll(con.getAssignments());
        con.getAssignments().clear();
    }
}
