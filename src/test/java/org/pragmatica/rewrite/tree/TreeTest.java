package org.pragmatica.rewrite.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.parser.JavaParser;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TreeTest {

    // === Construction ===

    @Test
    void node_withIncompatibleChildKind_isRejected() {
        var literal = Tree.node(Kind.LITERAL, Tree.token("1"));

        var error = assertThrows(IllegalArgumentException.class,
                                 () -> Tree.node(Kind.IMPORT, Tree.token("import"), literal, Tree.token(";")));
        assertThat(error.getMessage()).contains("IMPORT cannot contain LITERAL");
    }

    @Test
    void singleTokenKind_withTwoTokens_isRejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> Tree.node(Kind.IDENTIFIER, Tree.token("a"), Tree.token("b")));
    }

    @Test
    void tokenKind_cannotTagNode() {
        assertThrows(IllegalArgumentException.class, () -> Tree.node(Kind.TOKEN, List.of()));
    }

    // === Path copying ===

    @Test
    void withChildren_sameInstances_returnsSameNode() {
        var node = Syntax.qualifiedName(Space.EMPTY, "java.io.File");

        assertSame(node, node.withChildren(node.children()));
    }

    @Test
    void withChild_keepsIdAndSharesUntouchedChildren() {
        var node = Syntax.qualifiedName(Space.EMPTY, "java.io.File");
        var renamed = node.withChild(2, Syntax.identifier(Space.EMPTY, "Path"));

        assertNotSame(node, renamed);
        assertEquals(node.id(), renamed.id());
        assertSame(node.child(0), renamed.child(0));
        assertEquals("java.io.Path", renamed.print());
        assertEquals("java.io.File", node.print());
    }

    @Test
    void replace_unknownChild_fails() {
        var node = Syntax.qualifiedName(Space.EMPTY, "a.b");

        assertThrows(IllegalArgumentException.class,
                     () -> node.replace(Tree.token("x"), Tree.token("y")));
    }

    @Test
    void withPrefix_changesFirstToken() {
        var node = Syntax.qualifiedName(Space.EMPTY, "a.b");

        assertEquals("  a.b", node.withPrefix(Space.format("  ")).print());
    }

    @Test
    void withType_sameType_returnsSameNode() {
        var node = Syntax.identifier(Space.EMPTY, "File").withType(JavaType.Class.of("java.io.File"));

        assertSame(node, node.withType(JavaType.Class.of("java.io.File")));
    }

    // === Printing ===

    @Test
    void printTrimmed_removesCommonMargin() {
        var source = """
            class A {
                void run() {
                    go();
                }
            }
            """;
        var unit = JavaParser.create().parse(source).unwrap();
        var body = Syntax.body(Syntax.classes(unit).get(0)).orElseThrow();
        var method = body.childrenOfKind(Kind.METHOD_DECLARATION).get(0);

        assertEquals("void run() {\n    go();\n}", method.printTrimmed());
        assertEquals("\n    void run() {\n        go();\n    }", method.print());
    }

    @Test
    void trimIndent_dropsBlankEdgesAndTrailingWhitespace() {
        assertEquals("a\n\n  b", TreePrinter.trimIndent("\n\n  a  \n\n    b\n  \n"));
    }

    // === Formatting ===

    @Test
    void spaceFormat_splitsCommentsAndWhitespace() {
        var space = Space.format(" /* c */\n// line\n  ");

        assertThat(space.trivia()).hasSize(5);
        assertThat(space.trivia().get(1)).isInstanceOf(Trivia.BlockComment.class);
        assertThat(space.trivia().get(3)).isInstanceOf(Trivia.LineComment.class);
        assertThat(space.comments()).hasSize(2);
        assertEquals("  ", space.indent());
        assertEquals(" /* c */\n// line\n  ", space.print());
    }

    @Test
    void spaceFormat_rejectsCode() {
        assertThrows(IllegalArgumentException.class, () -> Space.format(" int "));
    }
}
