package org.pragmatica.rewrite.traversal;

import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Path from the root to the tree currently visited.
 *
 * <p>A cursor is an immutable, parent-linked value: descending into a child produces a new
 * cursor and leaves the parent untouched, so ancestor state stays consistent on every exit
 * path of a traversal, including exceptional ones. Visitors read the cursor; only the
 * traversal engine extends it.
 *
 * <p>Cursorless traversals thread the {@linkplain #detached() detached} cursor, which
 * refuses ancestor queries.
 */
public final class Cursor {
    private static final Cursor ROOT = new Cursor(null, null, true);
    private static final Cursor DETACHED = new Cursor(null, null, false);

    private final Cursor parent;
    private final Tree value;
    private final boolean attached;

    private Cursor(Cursor parent, Tree value, boolean attached) {
        this.parent = parent;
        this.value = value;
        this.attached = attached;
    }

    /**
     * Cursor above the root of a traversal.
     */
    public static Cursor root() {
        return ROOT;
    }

    public static Cursor detached() {
        return DETACHED;
    }

    public boolean isAttached() {
        return attached;
    }

    public boolean isRoot() {
        return attached && value == null;
    }

    Cursor extend(Tree tree) {
        return attached ? new Cursor(this, tree, true) : this;
    }

    /**
     * The tree this cursor points at.
     */
    public Tree tree() {
        requireAttached();
        if (value == null) {
            throw new IllegalStateException("Root cursor does not point at a tree");
        }
        return value;
    }

    public Optional<Cursor> parent() {
        requireAttached();
        return parent == null || parent.value == null ? Optional.empty() : Optional.of(parent);
    }

    public Optional<Tree> parentTree() {
        return parent().map(Cursor::tree);
    }

    /**
     * Nearest node of the given kind, starting with the tree this cursor points at.
     */
    public Optional<Tree.Node> firstEnclosing(Kind kind) {
        requireAttached();
        for (var current = this; current != null && current.value != null; current = current.parent) {
            if (current.value.kind() == kind && current.value instanceof Tree.Node node) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public Tree.Node firstEnclosingOrThrow(Kind kind) {
        return firstEnclosing(kind).orElseThrow(
            () -> new IllegalStateException("No enclosing " + kind + " for " + tree().kind()));
    }

    /**
     * Nearest strict ancestor of the given kind.
     */
    public Optional<Tree.Node> firstAncestor(Kind kind) {
        return parent().flatMap(p -> p.firstEnclosing(kind));
    }

    /**
     * Whether the current tree is a class declared directly in the compilation unit.
     */
    public boolean isTopLevelClass() {
        return tree().kind() == Kind.CLASS_DECLARATION && firstAncestor(Kind.CLASS_DECLARATION).isEmpty();
    }

    /**
     * Trees from the root down to the current one.
     */
    public List<Tree> path() {
        requireAttached();
        var result = new ArrayList<Tree>();
        for (var current = this; current != null && current.value != null; current = current.parent) {
            result.add(current.value);
        }
        Collections.reverse(result);
        return result;
    }

    public int depth() {
        return path().size();
    }

    private void requireAttached() {
        if (!attached) {
            throw new IllegalStateException("Cursor is not tracked in this traversal; the visitor must opt in to "
                                            + "cursored traversal to query ancestors");
        }
    }

    @Override
    public String toString() {
        if (!attached) {
            return "Cursor(detached)";
        }
        return path().stream()
                     .map(t -> t.kind().name())
                     .reduce((a, b) -> a + " > " + b)
                     .map(p -> "Cursor(" + p + ")")
                     .orElse("Cursor(root)");
    }
}
