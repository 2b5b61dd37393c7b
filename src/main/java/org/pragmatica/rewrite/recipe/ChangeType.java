package org.pragmatica.rewrite.recipe;

import org.pragmatica.rewrite.search.TypeMatcher;
import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeUtils;
import org.pragmatica.rewrite.visitor.RefactorVisitor;

import java.util.Optional;

/**
 * Replaces every reference to one class with another, including imports and static
 * receivers. References keep their spelling style: a fully-qualified reference stays
 * fully qualified, a simple one becomes the new simple name and the new type is imported
 * when needed.
 */
public final class ChangeType extends RefactorVisitor {
    private final String oldFullyQualifiedName;
    private final String newFullyQualifiedName;

    public ChangeType(String oldFullyQualifiedName, String newFullyQualifiedName) {
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
        if (visited == compilationUnit || !newFullyQualifiedName.contains(".")
            || !AddImport.needsImport(visited, newFullyQualifiedName)) {
            return visited;
        }
        return new AddImport(newFullyQualifiedName).visitRoot(visited);
    }

    @Override
    protected Tree visitIdentifier(Tree.Node identifier, Cursor cursor) {
        boolean declaredName = cursor.parentTree()
                                     .filter(parent -> parent.kind() == Kind.CLASS_DECLARATION)
                                     .map(parent -> Syntax.className((Tree.Node) parent) == identifier)
                                     .orElse(false);
        if (declaredName || !isReferenceToOldType(identifier)) {
            return identifier;
        }
        return reference(identifier, newFullyQualifiedName);
    }

    @Override
    protected Tree visitFieldAccess(Tree.Node fieldAccess, Cursor cursor) {
        if (isReferenceToOldType(fieldAccess)) {
            return reference(fieldAccess, newFullyQualifiedName);
        }
        return super.visitFieldAccess(fieldAccess, cursor);
    }

    @Override
    protected Tree visitParameterizedType(Tree.Node parameterized, Cursor cursor) {
        var visited = (Tree.Node) super.visitParameterizedType(parameterized, cursor);
        return visited.withType(visited.type().map(this::retarget));
    }

    private boolean isReferenceToOldType(Tree.Node node) {
        return TypeMatcher.isClassReference(node)
               && node.type().map(t -> TypeUtils.isOfClassType(t, oldFullyQualifiedName)).orElse(false);
    }

    private JavaType retarget(JavaType type) {
        if (type instanceof JavaType.Class c && c.fullyQualifiedName().equals(oldFullyQualifiedName)) {
            return JavaType.Class.of(newFullyQualifiedName).withTypeParameters(c.typeParameters());
        }
        return type;
    }

    /**
     * A reference to {@code fullyQualifiedName} replacing {@code original}, spelled the same way
     * (qualified or simple) and keeping its formatting and identity.
     */
    static Tree.Node reference(Tree.Node original, String fullyQualifiedName) {
        var type = JavaType.Class.of(fullyQualifiedName);
        boolean qualified = original.kind() == Kind.FIELD_ACCESS
                            && original.type()
                                       .flatMap(TypeUtils::fullyQualifiedName)
                                       .map(name -> name.equals(Syntax.qualifiedName(original)))
                                       .orElse(false);
        var spelled = qualified ? fullyQualifiedName : type.simpleName();
        if (Syntax.qualifiedName(original).equals(spelled)) {
            return original.withType(type);
        }
        var replacement = Syntax.qualifiedName(original.prefix(), spelled);
        return new Tree.Node(original.id(), replacement.kind(), replacement.children(), Optional.of(type));
    }

    @Override
    public String name() {
        return "ChangeType(" + oldFullyQualifiedName + " -> " + newFullyQualifiedName + ")";
    }
}
