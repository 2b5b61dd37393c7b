package org.pragmatica.rewrite.visitor;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.traversal.TreeWalker;
import org.pragmatica.rewrite.tree.Tree;

import java.util.List;
import java.util.stream.Stream;

/**
 * Search visitor collecting every tree that satisfies {@link #isMatch}, in pre-order.
 *
 * <p>{@link #visit(Tree)} collects eagerly; {@link #stream(Tree)} yields the same matches
 * lazily, so a caller can stop a long search by no longer consuming it.
 */
public abstract class FindVisitor extends SearchVisitor<List<Match>> {

    protected abstract boolean isMatch(Tree tree, Cursor cursor);

    public Stream<Match> stream(Tree root) {
        return TreeWalker.preOrder(root, cursored())
                         .filter(visit -> isMatch(visit.tree(), visit.cursor()))
                         .map(visit -> new Match(visit.tree(), visit.cursor()));
    }

    @Override
    public List<Match> defaultValue() {
        return List.of();
    }

    @Override
    public List<Match> reduce(List<Match> accumulated, List<Match> next) {
        if (next.isEmpty()) {
            return accumulated;
        }
        if (accumulated.isEmpty()) {
            return next;
        }
        return ImmutableList.<Match>builderWithExpectedSize(accumulated.size() + next.size())
                            .addAll(accumulated)
                            .addAll(next)
                            .build();
    }

    @Override
    protected List<Match> visitChildren(Tree.Node node, Cursor cursor) {
        var self = isMatch(node, cursor) ? List.of(new Match(node, cursor)) : List.<Match>of();
        return reduce(self, super.visitChildren(node, cursor));
    }

    @Override
    protected List<Match> visitToken(Tree.Token token, Cursor cursor) {
        return isMatch(token, cursor) ? List.of(new Match(token, cursor)) : List.of();
    }
}
