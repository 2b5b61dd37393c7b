package org.pragmatica.rewrite.visitor;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.traversal.TreeWalker;
import org.pragmatica.rewrite.tree.Tree;

/**
 * Visitor producing a replacement for each visited tree.
 *
 * <p>Returning the argument unchanged leaves the tree as is; returning {@code null} for a
 * child removes it from its parent. Parents are rebuilt along the path from a replaced
 * tree to the root and keep their identity, while untouched siblings are shared with the
 * original tree. A replacement whose kind the parent does not accept fails immediately.
 *
 * <p>A visitor that cannot transform a node safely should return it unchanged.
 */
public abstract class RefactorVisitor extends TreeVisitor<Tree> {

    @Override
    protected Tree visitChildren(Tree.Node node, Cursor cursor) {
        return TreeWalker.rebuild(node, child -> visit(child, cursor));
    }

    @Override
    protected Tree visitToken(Tree.Token token, Cursor cursor) {
        return token;
    }

    /**
     * Visit a root node. The result must be a node of the same kind.
     */
    public Tree.Node visitRoot(Tree.Node root) {
        var result = visit(root);
        if (!(result instanceof Tree.Node node) || node.kind() != root.kind()) {
            throw new IllegalStateException(getClass().getSimpleName() + " replaced root " + root.kind() + " with "
                                            + (result == null ? "nothing" : result.kind()));
        }
        return node;
    }

    /**
     * Pipeline running this visitor first and {@code next} on its output.
     */
    public Pipeline andThen(RefactorVisitor next) {
        return Pipeline.of(this, next);
    }

    /**
     * Name used in logs.
     */
    public String name() {
        return getClass().getSimpleName();
    }
}
