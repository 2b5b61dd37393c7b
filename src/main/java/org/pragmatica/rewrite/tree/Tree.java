package org.pragmatica.rewrite.tree;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lossless syntax tree. Every character of the source lives either in a token's text or
 * in the formatting ({@link Space}) preceding a token, so printing an untouched tree
 * reproduces the source exactly.
 *
 * <p>Trees are immutable. "Changing" a tree yields a new value; the rebuilt node keeps the
 * {@link #id()} of the node it replaces so before and after versions can be correlated,
 * and unchanged subtrees are shared by reference.
 */
public sealed interface Tree {
    /**
     * Identity token, stable across transformations of the same logical node.
     */
    UUID id();

    Kind kind();

    /**
     * Formatting before the first token of this tree.
     */
    Space prefix();

    Tree withPrefix(Space prefix);

    default String print() {
        return TreePrinter.print(this);
    }

    /**
     * Printed text with the common leading margin removed.
     */
    default String printTrimmed() {
        return TreePrinter.trimIndent(print());
    }

    static Token token(String text) {
        return new Token(UUID.randomUUID(), Space.EMPTY, text);
    }

    static Token token(Space prefix, String text) {
        return new Token(UUID.randomUUID(), prefix, text);
    }

    static Node node(Kind kind, List<? extends Tree> children) {
        return new Node(UUID.randomUUID(), kind, List.copyOf(children), Optional.empty());
    }

    static Node node(Kind kind, Tree... children) {
        return node(kind, List.of(children));
    }

    /**
     * Leaf - exact source text plus the formatting in front of it.
     */
    record Token(UUID id, Space prefix, String text) implements Tree {
        public Token {
            checkNotNull(id, "id");
            checkNotNull(prefix, "prefix");
            checkNotNull(text, "text");
        }

        @Override
        public Kind kind() {
            return Kind.TOKEN;
        }

        @Override
        public Token withPrefix(Space newPrefix) {
            return newPrefix.equals(prefix) ? this : new Token(id, newPrefix, text);
        }

        public Token withText(String newText) {
            return newText.equals(text) ? this : new Token(id, prefix, newText);
        }
    }

    /**
     * Interior node of a given kind. Construction fails fast when a child kind is not
     * accepted by {@link Kind#accepts(Kind)}.
     */
    record Node(UUID id, Kind kind, List<Tree> children, Optional<JavaType> type) implements Tree {
        public Node {
            checkNotNull(id, "id");
            checkNotNull(type, "type");
            checkArgument(kind != Kind.TOKEN, "TOKEN is a leaf kind and cannot be used for a node");
            children = ImmutableList.copyOf(children);
            for (var child : children) {
                checkArgument(kind.accepts(child.kind()), "%s cannot contain %s", kind, child.kind());
            }
            checkArgument(!kind.isSingleToken() || children.size() == 1,
                          "%s must wrap exactly one token, got %s children", kind, children.size());
        }

        @Override
        public Space prefix() {
            return children.isEmpty() ? Space.EMPTY : children.get(0).prefix();
        }

        @Override
        public Node withPrefix(Space newPrefix) {
            if (children.isEmpty()) {
                return this;
            }
            return withChild(0, children.get(0).withPrefix(newPrefix));
        }

        public Node withType(JavaType newType) {
            return withType(Optional.of(newType));
        }

        public Node withType(Optional<JavaType> newType) {
            return newType.equals(type) ? this : new Node(id, kind, children, newType);
        }

        /**
         * Path-copy with new children. Returns this node when every child is the same instance.
         */
        public Node withChildren(List<? extends Tree> newChildren) {
            if (newChildren.size() == children.size()) {
                boolean same = true;
                for (int i = 0; i < children.size() && same; i++) {
                    same = children.get(i) == newChildren.get(i);
                }
                if (same) {
                    return this;
                }
            }
            return new Node(id, kind, List.copyOf(newChildren), type);
        }

        public Node withChild(int index, Tree child) {
            if (children.get(index) == child) {
                return this;
            }
            var copy = new ArrayList<Tree>(children);
            copy.set(index, child);
            return withChildren(copy);
        }

        /**
         * Replace a direct child, found by identity.
         */
        public Node replace(Tree oldChild, Tree newChild) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == oldChild) {
                    return withChild(i, newChild);
                }
            }
            throw new IllegalArgumentException("Not a child of this " + kind + ": " + oldChild.kind());
        }

        public Tree child(int index) {
            return children.get(index);
        }

        public Optional<Node> firstChild(Kind childKind) {
            return children.stream()
                           .filter(c -> c.kind() == childKind)
                           .map(Node.class::cast)
                           .findFirst();
        }

        public List<Node> childrenOfKind(Kind childKind) {
            return children.stream()
                           .filter(c -> c.kind() == childKind)
                           .map(Node.class::cast)
                           .toList();
        }

        /**
         * Child nodes, skipping tokens.
         */
        public List<Node> nodes() {
            return children.stream()
                           .filter(Node.class::isInstance)
                           .map(Node.class::cast)
                           .toList();
        }

        public Optional<Token> token(String text) {
            return children.stream()
                           .filter(Token.class::isInstance)
                           .map(Token.class::cast)
                           .filter(t -> t.text().equals(text))
                           .findFirst();
        }

        public int indexOf(Tree child) {
            for (int i = 0; i < children.size(); i++) {
                if (children.get(i) == child) {
                    return i;
                }
            }
            return -1;
        }

        /**
         * Text of the single token wrapped by identifier, literal, modifier and primitive nodes.
         */
        public String text() {
            checkArgument(kind.isSingleToken(), "%s does not wrap a single token", kind);
            return ((Token) children.get(0)).text();
        }
    }
}
