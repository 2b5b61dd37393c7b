package org.pragmatica.rewrite.search;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.visitor.FindVisitor;

/**
 * Finds references to a type: declared types of variables, methods and supertypes, type
 * arguments, constructor calls, static receivers and imports. The name of a class
 * declaration is not a reference.
 */
public final class FindTypes extends FindVisitor {
    private final TypeMatcher matcher;

    public FindTypes(String pattern) {
        this(TypeMatcher.compile(pattern));
    }

    public FindTypes(TypeMatcher matcher) {
        this.matcher = matcher;
    }

    @Override
    protected boolean cursored() {
        return true;
    }

    @Override
    protected boolean isMatch(Tree tree, Cursor cursor) {
        if (!matcher.matches(tree)) {
            return false;
        }
        return cursor.parentTree()
                     .filter(parent -> parent.kind() == Kind.CLASS_DECLARATION)
                     .map(parent -> Syntax.className((Tree.Node) parent) != tree)
                     .orElse(true);
    }
}
