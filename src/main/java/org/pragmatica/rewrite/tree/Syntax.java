package org.pragmatica.rewrite.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Role-based accessors and builders over kind-tagged nodes.
 *
 * <p>Nodes keep their parts in source order; these helpers locate a part by its position
 * relative to the punctuation around it.
 */
public final class Syntax {
    private Syntax() {}

    // === Builders ===

    public static Tree.Node identifier(Space prefix, String name) {
        return Tree.node(Kind.IDENTIFIER, Tree.token(prefix, name));
    }

    /**
     * Identifier for a simple name, field access chain for a dotted one.
     */
    public static Tree.Node qualifiedName(Space prefix, String dotted) {
        var parts = dotted.split("\\.");
        Tree.Node result = identifier(prefix, parts[0]);
        for (int i = 1; i < parts.length; i++) {
            result = Tree.node(Kind.FIELD_ACCESS, result, Tree.token("."), identifier(Space.EMPTY, parts[i]));
        }
        return result;
    }

    // === Names ===

    /**
     * Dotted name spelled by an identifier or field access chain, without formatting.
     */
    public static String qualifiedName(Tree.Node node) {
        var sb = new StringBuilder();
        appendTokens(node, sb);
        return sb.toString();
    }

    private static void appendTokens(Tree tree, StringBuilder sb) {
        if (tree instanceof Tree.Token token) {
            sb.append(token.text());
        } else if (tree instanceof Tree.Node node) {
            node.children().forEach(child -> appendTokens(child, sb));
        }
    }

    /**
     * Name of a method invocation or declaration - the identifier right before {@code (}.
     */
    public static Tree.Node methodName(Tree.Node node) {
        checkArgument(node.kind() == Kind.METHOD_INVOCATION || node.kind() == Kind.METHOD_DECLARATION,
                      "%s has no method name", node.kind());
        int paren = openParen(node);
        return (Tree.Node) node.child(paren - 1);
    }

    /**
     * Receiver of a method invocation, if it is qualified.
     */
    public static Optional<Tree.Node> select(Tree.Node invocation) {
        checkArgument(invocation.kind() == Kind.METHOD_INVOCATION, "%s is not an invocation", invocation.kind());
        var name = methodName(invocation);
        var first = invocation.child(0);
        return first == name ? Optional.empty() : Optional.of((Tree.Node) first);
    }

    /**
     * Arguments of an invocation, constructor call or annotation.
     */
    public static List<Tree.Node> arguments(Tree.Node node) {
        int paren = node.indexOf(node.token("(").orElse(null));
        if (paren < 0) {
            return List.of();
        }
        return node.children()
                   .subList(paren + 1, node.children().size())
                   .stream()
                   .filter(Tree.Node.class::isInstance)
                   .map(Tree.Node.class::cast)
                   .toList();
    }

    private static int openParen(Tree.Node node) {
        var paren = node.token("(")
                        .orElseThrow(() -> new IllegalArgumentException(node.kind() + " has no argument list"));
        return node.indexOf(paren);
    }

    // === Declarations ===

    public static List<Tree.Node> parameters(Tree.Node method) {
        checkArgument(method.kind() == Kind.METHOD_DECLARATION, "%s is not a method", method.kind());
        return method.childrenOfKind(Kind.VARIABLE_DECLARATIONS);
    }

    /**
     * Declared return type; empty for constructors.
     */
    public static Optional<Tree.Node> returnType(Tree.Node method) {
        var name = methodName(method);
        Tree.Node candidate = null;
        for (var child : method.nodes()) {
            if (child == name) {
                break;
            }
            if (child.kind().isType()) {
                candidate = child;
            }
        }
        return Optional.ofNullable(candidate);
    }

    public static boolean isConstructor(Tree.Node method) {
        return method.kind() == Kind.METHOD_DECLARATION && returnType(method).isEmpty();
    }

    public static Tree.Node variableType(Tree.Node declarations) {
        checkArgument(declarations.kind() == Kind.VARIABLE_DECLARATIONS, "%s is not a variable declaration",
                      declarations.kind());
        return declarations.nodes()
                           .stream()
                           .filter(n -> n.kind().isType())
                           .findFirst()
                           .orElseThrow(() -> new IllegalStateException("Variable declaration without type"));
    }

    public static List<Tree.Node> variables(Tree.Node declarations) {
        return declarations.childrenOfKind(Kind.NAMED_VARIABLE);
    }

    public static boolean isVarargs(Tree.Node declarations) {
        return declarations.token("...").isPresent();
    }

    public static Tree.Node variableName(Tree.Node namedVariable) {
        return namedVariable.firstChild(Kind.IDENTIFIER)
                            .orElseThrow(() -> new IllegalStateException("Named variable without name"));
    }

    public static Optional<Tree.Node> initializer(Tree.Node namedVariable) {
        var nodes = namedVariable.nodes();
        return nodes.size() > 1 ? Optional.of(nodes.get(1)) : Optional.empty();
    }

    public static Tree.Node className(Tree.Node classDeclaration) {
        checkArgument(classDeclaration.kind() == Kind.CLASS_DECLARATION, "%s is not a class",
                      classDeclaration.kind());
        var keyword = classDeclaration.token("class")
                                      .or(() -> classDeclaration.token("interface"))
                                      .orElseThrow(() -> new IllegalStateException("Class without keyword"));
        return (Tree.Node) classDeclaration.child(classDeclaration.indexOf(keyword) + 1);
    }

    public static boolean isInterface(Tree.Node classDeclaration) {
        return classDeclaration.token("interface").isPresent();
    }

    public static List<Tree.Node> extendsClause(Tree.Node classDeclaration) {
        return typesAfter(classDeclaration, "extends");
    }

    public static List<Tree.Node> implementsClause(Tree.Node classDeclaration) {
        return typesAfter(classDeclaration, "implements");
    }

    private static List<Tree.Node> typesAfter(Tree.Node declaration, String keyword) {
        var result = new ArrayList<Tree.Node>();
        var start = declaration.token(keyword);
        if (start.isEmpty()) {
            return result;
        }
        var children = declaration.children();
        for (int i = declaration.indexOf(start.get()) + 1; i < children.size(); i++) {
            var child = children.get(i);
            if (child instanceof Tree.Token token) {
                if (!token.text().equals(",")) {
                    break;
                }
            } else if (child.kind().isType()) {
                result.add((Tree.Node) child);
            } else {
                break;
            }
        }
        return result;
    }

    public static Optional<Tree.Node> body(Tree.Node declaration) {
        return declaration.firstChild(Kind.BLOCK);
    }

    public static List<String> modifiers(Tree.Node declaration) {
        return declaration.childrenOfKind(Kind.MODIFIER)
                          .stream()
                          .map(Tree.Node::text)
                          .toList();
    }

    // === Expressions ===

    public static Tree.Node fieldName(Tree.Node fieldAccess) {
        checkArgument(fieldAccess.kind() == Kind.FIELD_ACCESS, "%s is not a field access", fieldAccess.kind());
        var nodes = fieldAccess.nodes();
        return nodes.get(nodes.size() - 1);
    }

    public static Tree.Node target(Tree.Node fieldAccess) {
        checkArgument(fieldAccess.kind() == Kind.FIELD_ACCESS, "%s is not a field access", fieldAccess.kind());
        return fieldAccess.nodes().get(0);
    }

    // === Compilation unit ===

    public static Optional<String> packageName(Tree.Node compilationUnit) {
        return compilationUnit.firstChild(Kind.PACKAGE_DECLARATION)
                              .flatMap(p -> p.nodes().stream().findFirst())
                              .map(Syntax::qualifiedName);
    }

    public static List<Tree.Node> imports(Tree.Node compilationUnit) {
        return compilationUnit.childrenOfKind(Kind.IMPORT);
    }

    /**
     * Imported name, e.g. {@code java.util.List} or {@code java.util.*}.
     */
    public static String importName(Tree.Node importNode) {
        return importNode.nodes()
                         .stream()
                         .findFirst()
                         .map(Syntax::qualifiedName)
                         .orElseThrow(() -> new IllegalStateException("Import without name"));
    }

    public static boolean isStaticImport(Tree.Node importNode) {
        return importNode.token("static").isPresent();
    }

    public static List<Tree.Node> classes(Tree.Node compilationUnit) {
        return compilationUnit.childrenOfKind(Kind.CLASS_DECLARATION);
    }
}
