package org.pragmatica.rewrite.recipe;

import org.pragmatica.rewrite.traversal.Cursor;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Space;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.visitor.RefactorVisitor;

import java.util.ArrayList;

/**
 * Adds a single-type import unless the type is already visible through an import, the
 * current package or {@code java.lang}. The import is placed in alphabetical position
 * among the existing ones.
 */
public final class AddImport extends RefactorVisitor {
    private final String fullyQualifiedName;

    public AddImport(String fullyQualifiedName) {
        if (!fullyQualifiedName.contains(".")) {
            throw new IllegalArgumentException("Type in the default package cannot be imported: "
                                               + fullyQualifiedName);
        }
        this.fullyQualifiedName = fullyQualifiedName;
    }

    @Override
    protected Tree visitCompilationUnit(Tree.Node compilationUnit, Cursor cursor) {
        if (!needsImport(compilationUnit, fullyQualifiedName)) {
            return compilationUnit;
        }
        var children = new ArrayList<>(compilationUnit.children());
        var imports = Syntax.imports(compilationUnit);
        for (var existing : imports) {
            if (!Syntax.isStaticImport(existing) && Syntax.importName(existing).compareTo(fullyQualifiedName) > 0) {
                int index = compilationUnit.indexOf(existing);
                children.set(index, existing.withPrefix(Space.format("\n")));
                children.add(index, importNode(existing.prefix()));
                return compilationUnit.withChildren(children);
            }
        }
        if (!imports.isEmpty()) {
            var last = imports.get(imports.size() - 1);
            children.add(compilationUnit.indexOf(last) + 1, importNode(Space.format("\n")));
            return compilationUnit.withChildren(children);
        }
        var packageDeclaration = compilationUnit.firstChild(Kind.PACKAGE_DECLARATION);
        if (packageDeclaration.isPresent()) {
            children.add(compilationUnit.indexOf(packageDeclaration.get()) + 1, importNode(Space.format("\n\n")));
            return compilationUnit.withChildren(children);
        }
        var first = children.get(0);
        children.set(0, first.withPrefix(Space.format("\n\n")));
        children.add(0, importNode(first.prefix()));
        return compilationUnit.withChildren(children);
    }

    private Tree.Node importNode(Space prefix) {
        return Tree.node(Kind.IMPORT,
                         Tree.token(prefix, "import"),
                         Syntax.qualifiedName(Space.SINGLE_SPACE, fullyQualifiedName),
                         Tree.token(";"));
    }

    /**
     * Whether a reference to the type by simple name needs a new import in this unit.
     */
    static boolean needsImport(Tree.Node compilationUnit, String fullyQualifiedName) {
        int dot = fullyQualifiedName.lastIndexOf('.');
        var packageName = dot < 0 ? "" : fullyQualifiedName.substring(0, dot);
        if (packageName.equals("java.lang") || packageName.equals(Syntax.packageName(compilationUnit).orElse(""))) {
            return false;
        }
        for (var existing : Syntax.imports(compilationUnit)) {
            if (Syntax.isStaticImport(existing)) {
                continue;
            }
            var name = Syntax.importName(existing);
            if (name.equals(fullyQualifiedName) || name.equals(packageName + ".*")) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String name() {
        return "AddImport(" + fullyQualifiedName + ")";
    }
}
