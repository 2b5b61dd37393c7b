package org.pragmatica.rewrite.visitor;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.traversal.TreeWalker;
import org.pragmatica.rewrite.tree.Tree;

/**
 * Read-only visitor that folds per-tree results into one value.
 *
 * <p>Unhandled kinds and tokens contribute {@link #defaultValue()}; a handler that
 * produces its own result should still combine it with {@code super}'s to keep
 * searching below the node.
 *
 * @param <R> accumulated result
 */
public abstract class SearchVisitor<R> extends TreeVisitor<R> {

    /**
     * Result for trees that contribute nothing.
     */
    public abstract R defaultValue();

    /**
     * Combine the result accumulated so far with the result of the next tree in pre-order.
     */
    public abstract R reduce(R accumulated, R next);

    @Override
    protected R visitChildren(Tree.Node node, Cursor cursor) {
        return TreeWalker.reduce(node, defaultValue(), child -> visit(child, cursor), this::reduce);
    }

    @Override
    protected R visitToken(Tree.Token token, Cursor cursor) {
        return defaultValue();
    }
}
