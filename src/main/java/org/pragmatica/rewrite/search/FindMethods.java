package org.pragmatica.rewrite.search;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.visitor.FindVisitor;

/**
 * Finds method invocations and constructor calls matching a method pattern. Declarations
 * are included on request.
 */
public final class FindMethods extends FindVisitor {
    private final MethodMatcher matcher;
    private final boolean includeDeclarations;

    public FindMethods(String pattern) {
        this(MethodMatcher.compile(pattern), false);
    }

    public FindMethods(MethodMatcher matcher, boolean includeDeclarations) {
        this.matcher = matcher;
        this.includeDeclarations = includeDeclarations;
    }

    @Override
    protected boolean isMatch(Tree tree, Cursor cursor) {
        if (tree.kind() == Kind.METHOD_DECLARATION && !includeDeclarations) {
            return false;
        }
        return matcher.matches(tree);
    }
}
