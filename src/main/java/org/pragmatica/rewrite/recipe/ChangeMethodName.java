package org.pragmatica.rewrite.recipe;

import org.pragmatica.rewrite.search.MethodMatcher;
import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.visitor.RefactorVisitor;

/**
 * Renames matching method invocations and declarations. Only the name token changes; its
 * formatting and the rest of the call are kept.
 */
public final class ChangeMethodName extends RefactorVisitor {
    private final MethodMatcher matcher;
    private final String newName;

    public ChangeMethodName(String pattern, String newName) {
        this(MethodMatcher.compile(pattern), newName);
    }

    public ChangeMethodName(MethodMatcher matcher, String newName) {
        if (!newName.matches("[A-Za-z_$][\\w$]*")) {
            throw new IllegalArgumentException("Not a method name: " + newName);
        }
        this.matcher = matcher;
        this.newName = newName;
    }

    @Override
    protected Tree visitMethodInvocation(Tree.Node invocation, Cursor cursor) {
        var visited = (Tree.Node) super.visitMethodInvocation(invocation, cursor);
        return matcher.matches(invocation) ? rename(visited) : visited;
    }

    @Override
    protected Tree visitMethodDeclaration(Tree.Node method, Cursor cursor) {
        var visited = (Tree.Node) super.visitMethodDeclaration(method, cursor);
        if (Syntax.isConstructor(method) || !matcher.matches(method)) {
            return visited;
        }
        return rename(visited);
    }

    private Tree.Node rename(Tree.Node node) {
        var name = Syntax.methodName(node);
        var token = (Tree.Token) name.child(0);
        var renamed = node.replace(name, name.withChild(0, token.withText(newName)));
        return renamed.withType(renamed.type()
                                       .filter(JavaType.Method.class::isInstance)
                                       .map(type -> (JavaType) ((JavaType.Method) type).withName(newName)));
    }

    @Override
    public String name() {
        return "ChangeMethodName(" + matcher + " -> " + newName + ")";
    }
}
