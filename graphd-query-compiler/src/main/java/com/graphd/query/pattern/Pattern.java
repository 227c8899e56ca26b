package com.graphd.query.pattern;

import com.graphd.query.comparator.ValueComparator;
import com.graphd.query.constraint.Constraint;
import com.graphd.query.variable.Assignment;
import com.graphd.query.variable.Assignments;
import com.graphd.query.variable.VariableDeclaration;
import com.graphd.query.variable.VariableDeclarations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node in a result, sort or assignment value template.
 *
 * <p>Patterns describe where a value comes from, not what it is: the
 * pattern {@code name} turns into {@code "bob"} for a primitive named
 * bob. A pattern is either a leaf (a primitive field, a per-constraint
 * summary such as {@code count}, a literal, a variable) or a compound
 * {@link PatternType#LIST list} or {@link PatternType#PICK pick} of
 * child patterns.</p>
 *
 * <h2>Flags:</h2>
 * <ul>
 *   <li>{@code sortForward} - for sort patterns, unset reverses the
 *       sense of the sort</li>
 *   <li>{@code sample} - the first (or first sorted) value is copied into
 *       the result</li>
 *   <li>{@code collect} - a sequence of per-primitive clones takes this
 *       pattern's position</li>
 *   <li>{@code orIndex} - the value is non-null only if that or-branch
 *       matched; 0 means unconditional</li>
 * </ul>
 *
 * <p>Variables are referenced, never copied: duplicating a pattern tree
 * shares the {@link VariableDeclaration} and bumps its link count.</p>
 */
public final class Pattern {

    /** Which kind of node this is. */
    private PatternType type;

    /** Parent node, or null at the top of a tree. */
    private Pattern parent;

    /** Children of a list or pick; empty for leaves. */
    private final List<Pattern> children = new ArrayList<>();

    /** Text of a literal. */
    private String literal;

    /** Declaration referenced by a variable. */
    private VariableDeclaration declaration;

    /** Printed only if the primitive is a link. */
    private boolean linkOnly;

    /** Printed only if the primitive has contents. */
    private boolean contentsOnly;

    /** For sort patterns: false reverses the sense of the sort. */
    private boolean sortForward = true;

    /** Needed only while the constraint is sorted. */
    private boolean sortOnly;

    /** The value is sampled. */
    private boolean sample;

    /** The value is collected once per matching primitive. */
    private boolean collect;

    /** Or-branch this value depends on; 0 if unconditional. */
    private int orIndex;

    /** Comparator for this element of a sort. */
    private ValueComparator comparator;

    /** Pattern frame holding a located sample. */
    private int resultOffset;

    /** Element within the frame's per-primitive list. */
    private int elementOffset;

    private Pattern(final PatternType type) {
        this.type = type;
    }

    /**
     * Create a pattern and append it to a compound parent.
     *
     * @param parent null or the list or pick to append to
     * @param type the type of the new pattern
     * @return the new pattern
     */
    public static Pattern alloc(final Pattern parent, final PatternType type) {
        Pattern pat = new Pattern(type);
        if (parent != null) {
            parent.append(pat);
        }
        return pat;
    }

    /**
     * Create a literal string pattern.
     *
     * @param parent null or the compound to append to
     * @param text the literal's text
     * @return the new pattern
     */
    public static Pattern allocString(final Pattern parent,
            final String text) {
        Pattern pat = alloc(parent, PatternType.LITERAL);
        pat.literal = text;
        return pat;
    }

    /**
     * Create a variable reference.
     *
     * @param parent null or the compound to append to
     * @param declaration the referenced declaration
     * @return the new pattern
     */
    public static Pattern allocVariable(final Pattern parent,
            final VariableDeclaration declaration) {
        Pattern pat = alloc(parent, PatternType.VARIABLE);
        pat.declaration = Objects.requireNonNull(declaration, "declaration");
        return pat;
    }

    /**
     * Convenience for building a flat list of leaf types.
     *
     * @param types the element types
     * @return a new list pattern
     */
    public static Pattern list(final PatternType... types) {
        Pattern list = alloc(null, PatternType.LIST);
        for (PatternType t : types) {
            alloc(list, t);
        }
        return list;
    }

    /**
     * Wrap a pattern into a new one-element list.
     *
     * @param child the pattern to wrap; it is detached from its parent
     * @return the new list
     */
    public static Pattern wrap(final Pattern child) {
        Pattern list = alloc(null, PatternType.LIST);
        if (child.parent != null) {
            child.parent.children.remove(child);
        }
        list.append(child);
        return list;
    }

    /**
     * Deep-copy a pattern tree.
     *
     * <p>Variables in the copy reference the same declarations as the
     * source; their link counts are incremented.</p>
     *
     * @param parent null or a compound to append the copy to
     * @param source the pattern to copy
     * @return the copy
     */
    public static Pattern dup(final Pattern parent, final Pattern source) {
        Pattern pat = new Pattern(source.type);
        pat.copyFieldsFrom(source);
        for (Pattern child : source.children) {
            dup(pat, child);
        }
        if (parent != null) {
            parent.append(pat);
        }
        if (pat.type == PatternType.VARIABLE) {
            pat.declaration.incrementLinkCount();
        }
        return pat;
    }

    /**
     * Overwrite this node with a deep copy of another, keeping this
     * node's position in its own tree.
     *
     * @param from the pattern to copy
     */
    public void dupInPlace(final Pattern from) {
        copyFieldsFrom(from);
        children.clear();
        if (from.type.isCompound()) {
            for (Pattern child : from.children) {
                Pattern copy = new Pattern(child.type);
                copy.dupInPlace(child);
                copy.parent = this;
                children.add(copy);
            }
        }
    }

    private void copyFieldsFrom(final Pattern source) {
        type = source.type;
        literal = source.literal;
        declaration = source.declaration;
        linkOnly = source.linkOnly;
        contentsOnly = source.contentsOnly;
        sortForward = source.sortForward;
        sortOnly = source.sortOnly;
        sample = source.sample;
        collect = source.collect;
        orIndex = source.orIndex;
        comparator = source.comparator;
        resultOffset = source.resultOffset;
        elementOffset = source.elementOffset;
    }

    /**
     * Copy this node's fields into a new detached node that shares this
     * node's children without adopting them.
     *
     * @return the copy
     */
    Pattern shallowCopy() {
        Pattern copy = new Pattern(type);
        copy.copyFieldsFrom(this);
        copy.children.addAll(children);
        return copy;
    }

    /**
     * Append a child to this list or pick.
     *
     * @param child the child; its parent becomes this pattern
     */
    public void append(final Pattern child) {
        if (!type.isCompound()) {
            throw new IllegalStateException(
                "cannot append to a " + type.keyword() + " pattern");
        }
        child.parent = this;
        children.add(child);
    }

    /**
     * Drop every child after the given index.
     *
     * @param index index of the last child to keep
     */
    public void truncateAfter(final int index) {
        while (children.size() > index + 1) {
            children.remove(children.size() - 1).parent = null;
        }
    }

    /**
     * Index of a direct child, by identity.
     *
     * @param child the child
     * @return its index, or -1
     */
    public int indexOf(final Pattern child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The sibling following this node in its parent.
     *
     * @return the next sibling, or null
     */
    public Pattern nextSibling() {
        if (parent == null) {
            return null;
        }
        int i = parent.indexOf(this);
        return i + 1 < parent.children.size()
            ? parent.children.get(i + 1) : null;
    }

    /**
     * Next node in a pre-order walk of the tree containing this node.
     *
     * @return the next node, or null at the end
     */
    public Pattern preorderNext() {
        if (type.isCompound() && !children.isEmpty()) {
            return children.get(0);
        }
        Pattern pat = this;
        do {
            Pattern next = pat.nextSibling();
            if (next != null) {
                return next;
            }
        } while ((pat = pat.parent) != null);
        return null;
    }

    /**
     * Maximum nesting of compound patterns below this node, where a pick
     * counts as one level and a list as none of its own.
     *
     * @param pat null or a pattern
     * @return the depth
     */
    public static int depth(final Pattern pat) {
        if (pat == null || !pat.type.isCompound()) {
            return 0;
        }
        int depth = pat.type == PatternType.PICK ? 1 : 0;
        int best = depth;
        for (Pattern child : pat.children) {
            if (child.type.isCompound()) {
                best = Math.max(best, depth + depth(child));
            }
        }
        return best;
    }

    /**
     * Bitmask of every type occurring in the pattern.
     *
     * @param pat null or a pattern
     * @return OR of {@link PatternType#bit()} over the tree
     */
    public static long spectrum(final Pattern pat) {
        if (pat == null) {
            return 0L;
        }
        long res = pat.type.bit();
        for (Pattern child : pat.children) {
            res |= spectrum(child);
        }
        return res;
    }

    /**
     * Find the first node of a type, in pre-order.
     *
     * @param pat null or a pattern
     * @param type the type to look for
     * @return the node, or null
     */
    public static Pattern lookup(final Pattern pat, final PatternType type) {
        if (pat == null) {
            return null;
        }
        if (pat.type == type) {
            return pat;
        }
        for (Pattern child : pat.children) {
            Pattern found = lookup(child, type);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * The first non-list leaf of a pattern, reached by descending into the
     * first child of lists. Every list with {@code sortForward} unset that
     * is crossed on the way flips the sign of the result.
     *
     * @param pat null or a pattern
     * @return a detached copy of the head with the accumulated sign, or
     *     null if there is no head
     */
    public static Pattern head(final Pattern pat) {
        if (pat == null) {
            return null;
        }
        if (pat.type != PatternType.LIST) {
            return pat.shallowCopy();
        }
        for (Pattern child : pat.children) {
            Pattern out = head(child);
            if (out != null) {
                if (!pat.sortForward) {
                    out.sortForward = !out.sortForward;
                }
                return out;
            }
        }
        return null;
    }

    /**
     * Does the value depend on the whole matching set (count, cursor,
     * ...) rather than on individual primitives?
     *
     * @param con the constraint the pattern is evaluated in
     * @param pat the pattern
     * @return true if set-dependent
     */
    public static boolean isSetDependent(final Constraint con,
            final Pattern pat) {
        if (pat.type.isSetValue()) {
            return true;
        }
        if (pat.type.isPrimitiveValue()) {
            return false;
        }
        switch (pat.type) {
            case PICK:
            case LIST:
                for (Pattern child : pat.children) {
                    if (isSetDependent(con, child)) {
                        return true;
                    }
                }
                return false;
            case VARIABLE:
                Assignment a = Assignments.byDeclaration(con, pat.declaration);
                return a != null && isSetDependent(con, a.getResult());
            default:
                return false;
        }
    }

    /**
     * Does the value change with the order in which primitives are
     * visited?
     *
     * @param con the constraint the pattern is evaluated in
     * @param pat the pattern
     * @return true if sort-dependent
     */
    public static boolean isSortDependent(final Constraint con,
            final Pattern pat) {
        if (pat.type.isPrimitiveValue()) {
            return true;
        }
        switch (pat.type) {
            case PICK:
            case LIST:
                for (Pattern child : pat.children) {
                    if (isSortDependent(con, child)) {
                        return true;
                    }
                }
                return false;
            case VARIABLE:
                // Assigned below us, so it varies with the primitive.
                Assignment a = Assignments.byDeclaration(con, pat.declaration);
                return a == null || isSortDependent(con, a.getResult());
            default:
                return false;
        }
    }

    /**
     * Does the value depend on the individual matching primitive?
     *
     * <p>A variable without a local assignment gets its value from a
     * subconstraint and is treated as primitive-dependent.</p>
     *
     * @param con the constraint the pattern is evaluated in
     * @param pat the pattern
     * @return true if primitive-dependent
     */
    public static boolean isPrimitiveDependent(final Constraint con,
            final Pattern pat) {
        if (pat.type.isSetValue()) {
            return false;
        }
        if (pat.type.isPrimitiveValue()) {
            return true;
        }
        switch (pat.type) {
            case PICK:
                // The or-distribution itself varies per primitive.
                return true;
            case LIST:
                for (Pattern child : pat.children) {
                    if (isPrimitiveDependent(con, child)) {
                        return true;
                    }
                }
                return false;
            case VARIABLE:
                Assignment a = Assignments.byDeclaration(con, pat.declaration);
                return a == null || isPrimitiveDependent(con, a.getResult());
            default:
                return false;
        }
    }

    /**
     * Point every reference to {@code source} at {@code dest}.
     *
     * @param pat null or a pattern tree
     * @param source the old declaration
     * @param dest the new declaration
     */
    public static void variableRename(final Pattern pat,
            final VariableDeclaration source, final VariableDeclaration dest) {
        if (pat == null) {
            return;
        }
        if (pat.type == PatternType.VARIABLE && pat.declaration == source) {
            pat.declaration = dest;
        } else if (pat.type.isCompound()) {
            for (Pattern child : pat.children) {
                variableRename(child, source, dest);
            }
        }
    }

    /**
     * Do two patterns evaluate to the same value in the same context?
     * Variables must reference the identical declaration.
     *
     * @param a null or a pattern
     * @param b null or a pattern
     * @return true if the values are the same
     */
    public static boolean equalValue(final Pattern a, final Pattern b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        if (a.type != b.type) {
            return false;
        }
        switch (a.type) {
            case NONE:
                return true;
            case LITERAL:
                return Objects.equals(a.literal, b.literal);
            case VARIABLE:
                return a.declaration == b.declaration;
            case PICK:
            case LIST:
                if (a.children.size() != b.children.size()) {
                    return false;
                }
                for (int i = 0; i < a.children.size(); i++) {
                    Pattern ac = a.children.get(i);
                    Pattern bc = b.children.get(i);
                    if (!equalValue(ac, bc)) {
                        return false;
                    }
                    if (a.type == PatternType.PICK
                            && ac.orIndex != bc.orIndex) {
                        return false;
                    }
                }
                return true;
            default:
                return true;
        }
    }

    /**
     * Structural equality of patterns evaluated in two constraints, used
     * for plan caching. Never reports a false positive.
     *
     * @param aCon the constraint {@code a} belongs to
     * @param a null or a pattern
     * @param bCon the constraint {@code b} belongs to
     * @param b null or a pattern
     * @return true if the patterns are definitely equal
     */
    public static boolean equal(final Constraint aCon, final Pattern a,
            final Constraint bCon, final Pattern b) {
        if (a == null || b == null) {
            return a == null && b == null;
        }
        if (a.type != b.type || a.sortForward != b.sortForward) {
            return false;
        }
        switch (a.type) {
            case NONE:
                return true;
            case LITERAL:
                return Objects.equals(a.literal, b.literal);
            case VARIABLE:
                return VariableDeclarations.equal(aCon, a.declaration,
                    bCon, b.declaration);
            case PICK:
            case LIST:
                if (a.children.size() != b.children.size()) {
                    return false;
                }
                for (int i = 0; i < a.children.size(); i++) {
                    if (!equal(aCon, a.children.get(i),
                            bCon, b.children.get(i))) {
                        return false;
                    }
                }
                return true;
            default:
                return true;
        }
    }

    /**
     * Hash consistent with {@link #equal}.
     *
     * @param pat null or a pattern
     * @return the hash
     */
    public static int hash(final Pattern pat) {
        if (pat == null) {
            return 0;
        }
        int h = 31 * pat.type.ordinal() + (pat.sortForward ? 1 : 0);
        switch (pat.type) {
            case LITERAL:
                h = 31 * h + Objects.hashCode(pat.literal);
                break;
            case VARIABLE:
                h = 31 * h + pat.declaration.getName().hashCode();
                break;
            case LIST:
            case PICK:
                for (Pattern child : pat.children) {
                    h = 31 * h + hash(child);
                }
                break;
            default:
                break;
        }
        return h;
    }

    /**
     * Render the pattern the way it is written in a request.
     *
     * @param pat null or a pattern
     * @return the text
     */
    public static String toString(final Pattern pat) {
        return pat == null ? "null" : pat.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb, false);
        return sb.toString();
    }

    /**
     * Like {@link #toString()}, with the sample ({@code ^}), collect
     * ({@code [...]}) and or-index ({@code {n}}) annotations.
     *
     * @return the annotated text
     */
    public String dump() {
        StringBuilder sb = new StringBuilder();
        render(sb, true);
        return sb.toString();
    }

    private void render(final StringBuilder sb, final boolean detail) {
        if (!sortForward) {
            sb.append('-');
        }
        if (detail) {
            if (sample) {
                sb.append('^');
            }
            if (collect) {
                sb.append('[');
            }
            if (orIndex != 0) {
                sb.append('{').append(orIndex).append('}');
            }
        }
        switch (type) {
            case VARIABLE:
                sb.append(declaration.getName());
                break;
            case NONE:
                sb.append("\"\"");
                break;
            case LITERAL:
                sb.append('"').append(literal).append('"');
                break;
            case LIST:
            case PICK:
                sb.append(type == PatternType.PICK ? '<' : '(');
                String sep = "";
                for (Pattern child : children) {
                    sb.append(sep);
                    child.render(sb, detail);
                    if (type == PatternType.PICK) {
                        sb.append('@').append(child.orIndex);
                    }
                    sep = ", ";
                }
                sb.append(type == PatternType.PICK ? '>' : ')');
                break;
            default:
                sb.append(type.keyword());
                break;
        }
        if (detail && collect) {
            sb.append(']');
        }
    }

    /**
     * Get the type.
     *
     * @return the type
     */
    public PatternType getType() {
        return type;
    }

    /**
     * Change the type of this node in place.
     *
     * @param type the new type
     */
    public void setType(final PatternType type) {
        this.type = type;
    }

    /**
     * Get the parent.
     *
     * @return the parent, or null at the top of a tree
     */
    public Pattern getParent() {
        return parent;
    }

    /**
     * Get the children of a compound.
     *
     * @return an unmodifiable view of the children
     */
    public List<Pattern> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Number of children.
     *
     * @return the child count
     */
    public int size() {
        return children.size();
    }

    /**
     * First child of a compound.
     *
     * @return the first child, or null
     */
    public Pattern first() {
        return children.isEmpty() ? null : children.get(0);
    }

    /**
     * Last child of a compound.
     *
     * @return the last child, or null
     */
    public Pattern last() {
        return children.isEmpty() ? null : children.get(children.size() - 1);
    }

    /**
     * Get the literal text.
     *
     * @return the text of a literal, or null
     */
    public String getLiteral() {
        return literal;
    }

    /**
     * Get the referenced declaration.
     *
     * @return the declaration of a variable, or null
     */
    public VariableDeclaration getDeclaration() {
        return declaration;
    }

    /**
     * Point this variable at another declaration.
     *
     * @param declaration the declaration
     */
    public void setDeclaration(final VariableDeclaration declaration) {
        this.declaration = declaration;
    }

    /**
     * Printed only for links?
     *
     * @return the flag
     */
    public boolean isLinkOnly() {
        return linkOnly;
    }

    /**
     * Set the link-only flag.
     *
     * @param linkOnly the flag
     */
    public void setLinkOnly(final boolean linkOnly) {
        this.linkOnly = linkOnly;
    }

    /**
     * Printed only if there are contents?
     *
     * @return the flag
     */
    public boolean isContentsOnly() {
        return contentsOnly;
    }

    /**
     * Set the contents-only flag.
     *
     * @param contentsOnly the flag
     */
    public void setContentsOnly(final boolean contentsOnly) {
        this.contentsOnly = contentsOnly;
    }

    /**
     * Does this sort element sort ascending?
     *
     * @return false for a reversed sort
     */
    public boolean isSortForward() {
        return sortForward;
    }

    /**
     * Set the sort direction.
     *
     * @param sortForward false to reverse
     */
    public void setSortForward(final boolean sortForward) {
        this.sortForward = sortForward;
    }

    /**
     * Needed only while sorting?
     *
     * @return the flag
     */
    public boolean isSortOnly() {
        return sortOnly;
    }

    /**
     * Set the sort-only flag.
     *
     * @param sortOnly the flag
     */
    public void setSortOnly(final boolean sortOnly) {
        this.sortOnly = sortOnly;
    }

    /**
     * Is the value sampled?
     *
     * @return the flag
     */
    public boolean isSample() {
        return sample;
    }

    /**
     * Set the sample flag.
     *
     * @param sample the flag
     */
    public void setSample(final boolean sample) {
        this.sample = sample;
    }

    /**
     * Is the value collected?
     *
     * @return the flag
     */
    public boolean isCollect() {
        return collect;
    }

    /**
     * Set the collect flag.
     *
     * @param collect the flag
     */
    public void setCollect(final boolean collect) {
        this.collect = collect;
    }

    /**
     * Get the or-index.
     *
     * @return 0 if unconditional, else the or-branch number
     */
    public int getOrIndex() {
        return orIndex;
    }

    /**
     * Set the or-index.
     *
     * @param orIndex the or-branch number
     */
    public void setOrIndex(final int orIndex) {
        this.orIndex = orIndex;
    }

    /**
     * Get the comparator for this sort element.
     *
     * @return the comparator, or null
     */
    public ValueComparator getComparator() {
        return comparator;
    }

    /**
     * Set the comparator for this sort element.
     *
     * @param comparator the comparator
     */
    public void setComparator(final ValueComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * Get the index of the pattern frame holding this sample.
     *
     * @return the frame index
     */
    public int getResultOffset() {
        return resultOffset;
    }

    /**
     * Set the index of the pattern frame holding this sample.
     *
     * @param resultOffset the frame index
     */
    public void setResultOffset(final int resultOffset) {
        this.resultOffset = resultOffset;
    }

    /**
     * Get the element index within the frame's per-primitive list.
     *
     * @return the element index
     */
    public int getElementOffset() {
        return elementOffset;
    }

    /**
     * Set the element index within the frame's per-primitive list.
     *
     * @param elementOffset the element index
     */
    public void setElementOffset(final int elementOffset) {
        this.elementOffset = elementOffset;
    }
}
