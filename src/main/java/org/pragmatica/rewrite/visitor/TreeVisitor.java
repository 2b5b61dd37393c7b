package org.pragmatica.rewrite.visitor;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.traversal.TreeWalker;
import org.pragmatica.rewrite.tree.Tree;

/**
 * Dispatch shared by search and refactor visitors.
 *
 * <p>{@link #visit(Tree, Cursor)} selects the handler from the node's {@link org.pragmatica.rewrite.tree.Kind}
 * with an exhaustive switch, so a new kind cannot be added without a handler here. Every handler
 * defaults to {@link #visitChildren}, whose meaning is defined by the flavour: rebuild for
 * refactoring, reduce for searching.
 *
 * <p>Visitors hold no traversal state; the cursor is passed along with each call. A visitor
 * instance can therefore be reused, and shared between threads as long as its own fields are
 * immutable.
 *
 * @param <R> result of visiting one tree
 */
public abstract class TreeVisitor<R> {

    /**
     * Opt in to ancestor tracking. Cursorless visitors receive a detached cursor.
     */
    protected boolean cursored() {
        return false;
    }

    public R visit(Tree tree) {
        return visit(tree, TreeWalker.start(cursored()));
    }

    /**
     * Visit a tree whose parent is described by {@code parent}.
     */
    public R visit(Tree tree, Cursor parent) {
        var cursor = TreeWalker.descend(parent, tree);
        if (tree instanceof Tree.Token token) {
            return visitToken(token, cursor);
        }
        var node = (Tree.Node) tree;
        return switch (node.kind()) {
            case COMPILATION_UNIT -> visitCompilationUnit(node, cursor);
            case PACKAGE_DECLARATION -> visitPackageDeclaration(node, cursor);
            case IMPORT -> visitImport(node, cursor);
            case CLASS_DECLARATION -> visitClassDeclaration(node, cursor);
            case MODIFIER -> visitModifier(node, cursor);
            case ANNOTATION -> visitAnnotation(node, cursor);
            case BLOCK -> visitBlock(node, cursor);
            case METHOD_DECLARATION -> visitMethodDeclaration(node, cursor);
            case VARIABLE_DECLARATIONS -> visitVariableDeclarations(node, cursor);
            case NAMED_VARIABLE -> visitNamedVariable(node, cursor);
            case RETURN -> visitReturn(node, cursor);
            case IF -> visitIf(node, cursor);
            case EXPRESSION_STATEMENT -> visitExpressionStatement(node, cursor);
            case METHOD_INVOCATION -> visitMethodInvocation(node, cursor);
            case NEW_CLASS -> visitNewClass(node, cursor);
            case FIELD_ACCESS -> visitFieldAccess(node, cursor);
            case IDENTIFIER -> visitIdentifier(node, cursor);
            case LITERAL -> visitLiteral(node, cursor);
            case UNARY -> visitUnary(node, cursor);
            case BINARY -> visitBinary(node, cursor);
            case ASSIGNMENT -> visitAssignment(node, cursor);
            case PARENTHESES -> visitParentheses(node, cursor);
            case PRIMITIVE_TYPE -> visitPrimitiveType(node, cursor);
            case PARAMETERIZED_TYPE -> visitParameterizedType(node, cursor);
            case ARRAY_TYPE -> visitArrayType(node, cursor);
            case TOKEN -> throw new IllegalStateException("Node tagged as TOKEN: " + node.id());
        };
    }

    /**
     * Default handling of a node: visit each child with {@code cursor} as the parent.
     */
    protected abstract R visitChildren(Tree.Node node, Cursor cursor);

    protected abstract R visitToken(Tree.Token token, Cursor cursor);

    protected R visitCompilationUnit(Tree.Node compilationUnit, Cursor cursor) {
        return visitChildren(compilationUnit, cursor);
    }

    protected R visitPackageDeclaration(Tree.Node packageDeclaration, Cursor cursor) {
        return visitChildren(packageDeclaration, cursor);
    }

    protected R visitImport(Tree.Node importNode, Cursor cursor) {
        return visitChildren(importNode, cursor);
    }

    protected R visitClassDeclaration(Tree.Node classDeclaration, Cursor cursor) {
        return visitChildren(classDeclaration, cursor);
    }

    protected R visitModifier(Tree.Node modifier, Cursor cursor) {
        return visitChildren(modifier, cursor);
    }

    protected R visitAnnotation(Tree.Node annotation, Cursor cursor) {
        return visitChildren(annotation, cursor);
    }

    protected R visitBlock(Tree.Node block, Cursor cursor) {
        return visitChildren(block, cursor);
    }

    protected R visitMethodDeclaration(Tree.Node method, Cursor cursor) {
        return visitChildren(method, cursor);
    }

    protected R visitVariableDeclarations(Tree.Node declarations, Cursor cursor) {
        return visitChildren(declarations, cursor);
    }

    protected R visitNamedVariable(Tree.Node variable, Cursor cursor) {
        return visitChildren(variable, cursor);
    }

    protected R visitReturn(Tree.Node returnNode, Cursor cursor) {
        return visitChildren(returnNode, cursor);
    }

    protected R visitIf(Tree.Node ifNode, Cursor cursor) {
        return visitChildren(ifNode, cursor);
    }

    protected R visitExpressionStatement(Tree.Node statement, Cursor cursor) {
        return visitChildren(statement, cursor);
    }

    protected R visitMethodInvocation(Tree.Node invocation, Cursor cursor) {
        return visitChildren(invocation, cursor);
    }

    protected R visitNewClass(Tree.Node newClass, Cursor cursor) {
        return visitChildren(newClass, cursor);
    }

    protected R visitFieldAccess(Tree.Node fieldAccess, Cursor cursor) {
        return visitChildren(fieldAccess, cursor);
    }

    protected R visitIdentifier(Tree.Node identifier, Cursor cursor) {
        return visitChildren(identifier, cursor);
    }

    protected R visitLiteral(Tree.Node literal, Cursor cursor) {
        return visitChildren(literal, cursor);
    }

    protected R visitUnary(Tree.Node unary, Cursor cursor) {
        return visitChildren(unary, cursor);
    }

    protected R visitBinary(Tree.Node binary, Cursor cursor) {
        return visitChildren(binary, cursor);
    }

    protected R visitAssignment(Tree.Node assignment, Cursor cursor) {
        return visitChildren(assignment, cursor);
    }

    protected R visitParentheses(Tree.Node parentheses, Cursor cursor) {
        return visitChildren(parentheses, cursor);
    }

    protected R visitPrimitiveType(Tree.Node primitive, Cursor cursor) {
        return visitChildren(primitive, cursor);
    }

    protected R visitParameterizedType(Tree.Node parameterized, Cursor cursor) {
        return visitChildren(parameterized, cursor);
    }

    protected R visitArrayType(Tree.Node array, Cursor cursor) {
        return visitChildren(array, cursor);
    }
}
