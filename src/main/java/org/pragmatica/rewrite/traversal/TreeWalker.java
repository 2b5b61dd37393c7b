package org.pragmatica.rewrite.traversal;

import org.pragmatica.rewrite.tree.Tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pre-order, depth-first traversal primitives shared by all visitors.
 */
public final class TreeWalker {
    private TreeWalker() {}

    /**
     * A visited tree together with the cursor pointing at it.
     */
    public record Visit(Tree tree, Cursor cursor) {}

    /**
     * Cursor a traversal starts from.
     */
    public static Cursor start(boolean cursored) {
        return cursored ? Cursor.root() : Cursor.detached();
    }

    /**
     * Cursor for a child about to be visited. Detached cursors are passed through unchanged.
     */
    public static Cursor descend(Cursor parent, Tree child) {
        return parent.extend(child);
    }

    /**
     * Rebuild a node from visited children. A child mapped to {@code null} is removed.
     * When every child comes back as the same instance the node itself is returned, so
     * untouched subtrees stay shared.
     */
    public static Tree.Node rebuild(Tree.Node node, UnaryOperator<Tree> visitChild) {
        var children = node.children();
        ArrayList<Tree> rebuilt = null;
        for (int i = 0; i < children.size(); i++) {
            var child = children.get(i);
            var visited = visitChild.apply(child);
            if (visited != child && rebuilt == null) {
                rebuilt = new ArrayList<>(children.subList(0, i));
            }
            if (rebuilt != null && visited != null) {
                rebuilt.add(visited);
            }
        }
        return rebuilt == null ? node : node.withChildren(rebuilt);
    }

    /**
     * Fold visited children left to right, starting from the identity value.
     */
    public static <R> R reduce(Tree.Node node, R identity, Function<Tree, R> visitChild, BinaryOperator<R> reducer) {
        var result = identity;
        for (var child : node.children()) {
            result = reducer.apply(result, visitChild.apply(child));
        }
        return result;
    }

    /**
     * Lazy pre-order sequence of every tree under (and including) the root. Nothing is
     * visited until the stream is consumed; each call starts a fresh walk.
     */
    public static Stream<Visit> preOrder(Tree root, boolean cursored) {
        var iterator = new PreOrderIterator(root, start(cursored));
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private static final class PreOrderIterator implements Iterator<Visit> {
        private final Deque<Visit> pending = new ArrayDeque<>();

        PreOrderIterator(Tree root, Cursor start) {
            pending.push(new Visit(root, descend(start, root)));
        }

        @Override
        public boolean hasNext() {
            return !pending.isEmpty();
        }

        @Override
        public Visit next() {
            if (pending.isEmpty()) {
                throw new NoSuchElementException();
            }
            var visit = pending.pop();
            if (visit.tree() instanceof Tree.Node node) {
                var children = node.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    var child = children.get(i);
                    pending.push(new Visit(child, descend(visit.cursor(), child)));
                }
            }
            return visit;
        }
    }
}
