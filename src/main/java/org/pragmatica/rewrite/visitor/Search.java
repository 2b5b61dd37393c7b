package org.pragmatica.rewrite.visitor;

import org.pragmatica.rewrite.tree.Tree;

import java.util.stream.Stream;

/**
 * Entry points for read-only traversals. Searching never modifies the tree, so running the
 * same search twice over one tree yields equal results.
 */
public final class Search {
    private Search() {}

    public static <R> R search(Tree tree, SearchVisitor<R> visitor) {
        return visitor.visit(tree);
    }

    /**
     * Lazy matches in pre-order. The stream is finite; each call starts a new walk.
     */
    public static Stream<Match> find(Tree tree, FindVisitor visitor) {
        return visitor.stream(tree);
    }
}
