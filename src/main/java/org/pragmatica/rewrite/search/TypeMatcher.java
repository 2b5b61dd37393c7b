package org.pragmatica.rewrite.search;

import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;
import org.pragmatica.rewrite.tree.Tree;

/**
 * Matches type references by their attributed type.
 */
public final class TypeMatcher {
    private final TypePattern pattern;
    private final boolean includeSubtypes;

    private TypeMatcher(TypePattern pattern, boolean includeSubtypes) {
        this.pattern = pattern;
        this.includeSubtypes = includeSubtypes;
    }

    public static TypeMatcher compile(String pattern) {
        return compile(pattern, false);
    }

    public static TypeMatcher compile(String pattern, boolean includeSubtypes) {
        return new TypeMatcher(TypePattern.compile(pattern), includeSubtypes);
    }

    public boolean matches(JavaType type) {
        if (type instanceof JavaType.Method) {
            return false;
        }
        return includeSubtypes ? pattern.matchesSubtype(type) : pattern.matches(type);
    }

    /**
     * Whether the tree is a reference to a matching class. Unattributed trees never match.
     */
    public boolean matches(Tree tree) {
        return tree instanceof Tree.Node node
               && isClassReference(node)
               && node.type().map(this::matches).orElse(false);
    }

    /**
     * Whether a node spells the name of the class it is attributed with, as opposed to a
     * variable or expression that merely has that type.
     */
    public static boolean isClassReference(Tree.Node node) {
        if (node.kind() != Kind.IDENTIFIER && node.kind() != Kind.FIELD_ACCESS) {
            return false;
        }
        if (!(node.type().orElse(null) instanceof JavaType.Class type)) {
            return false;
        }
        var spelled = Syntax.qualifiedName(node);
        return spelled.equals(type.fullyQualifiedName())
               || spelled.equals(type.simpleName())
               || type.fullyQualifiedName().endsWith("." + spelled);
    }

    @Override
    public String toString() {
        return "TypeMatcher(" + pattern + (includeSubtypes ? ", subtypes" : "") + ")";
    }
}
