package org.pragmatica.rewrite.recipe;

import org.pragmatica.rewrite.search.TypeMatcher;
import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeUtils;
import org.pragmatica.rewrite.visitor.RefactorVisitor;

/**
 * Changes the declared type of fields of one class to another. Local variables and
 * parameters are left alone. Type arguments of a parameterized field type are kept.
 */
public final class ChangeFieldType extends RefactorVisitor {
    private final String oldFullyQualifiedName;
    private final String newFullyQualifiedName;

    public ChangeFieldType(String oldFullyQualifiedName, String newFullyQualifiedName) {
        this.oldFullyQualifiedName = oldFullyQualifiedName;
        this.newFullyQualifiedName = newFullyQualifiedName;
    }

    @Override
    protected boolean cursored() {
        return true;
    }

    @Override
    protected Tree visitCompilationUnit(Tree.Node compilationUnit, Cursor cursor) {
        var visited = (Tree.Node) super.visitCompilationUnit(compilationUnit, cursor);
        if (visited == compilationUnit || !AddImport.needsImport(visited, newFullyQualifiedName)) {
            return visited;
        }
        return new AddImport(newFullyQualifiedName).visitRoot(visited);
    }

    @Override
    protected Tree visitVariableDeclarations(Tree.Node declarations, Cursor cursor) {
        if (!isField(cursor)) {
            return super.visitVariableDeclarations(declarations, cursor);
        }
        var typeNode = Syntax.variableType(declarations);
        if (typeNode.kind() == Kind.PARAMETERIZED_TYPE) {
            var base = (Tree.Node) typeNode.child(0);
            if (!matchesOldType(base)) {
                return declarations;
            }
            var retyped = typeNode.withChild(0, ChangeType.reference(base, newFullyQualifiedName))
                                  .withType(typeNode.type().map(this::retarget));
            return declarations.replace(typeNode, retyped);
        }
        if (!matchesOldType(typeNode)) {
            return declarations;
        }
        return declarations.replace(typeNode, ChangeType.reference(typeNode, newFullyQualifiedName));
    }

    private JavaType retarget(JavaType type) {
        return type instanceof JavaType.Class c
               ? JavaType.Class.of(newFullyQualifiedName).withTypeParameters(c.typeParameters())
               : type;
    }

    private boolean matchesOldType(Tree.Node typeNode) {
        return TypeMatcher.isClassReference(typeNode)
               && typeNode.type().map(t -> TypeUtils.isOfClassType(t, oldFullyQualifiedName)).orElse(false);
    }

    private static boolean isField(Cursor cursor) {
        return cursor.parent()
                     .filter(parent -> parent.tree().kind() == Kind.BLOCK)
                     .flatMap(parent -> parent.parentTree())
                     .map(owner -> owner.kind() == Kind.CLASS_DECLARATION)
                     .orElse(false);
    }

    @Override
    public String name() {
        return "ChangeFieldType(" + oldFullyQualifiedName + " -> " + newFullyQualifiedName + ")";
    }
}
