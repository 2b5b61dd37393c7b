package org.pragmatica.rewrite.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.pragmatica.rewrite.error.ParseError;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Syntax;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class JavaParserTest {

    private static final String SERVICE = """
        /*
         * Header comment.
         */
        package com.example.service;

        import java.util.List;
        import java.util.*;
        import static java.util.Objects.requireNonNull;

        /**
         * Javadoc stays attached to the class.
         */
        @Deprecated
        public final class Service extends Base implements Runnable, Comparable<Service> {
            private static final int LIMIT = 10;   // trailing comment
            private final List<String> names, aliases;
            protected int[] counts;

            public Service(List<String> names) {
                super();
                this.names = names;
            }

            @Override
            public void run() {
                final String first = names.get(0);
                if (first == null || first.length() > LIMIT) {
                    return;
                } else if (!first.isEmpty()) {
                    log("x" + first, -1);
                } else {
                    counts = null;
                }
                Map<String, List<? extends Number>> grouped = new HashMap<>();
                ;
            }

            static String join(String separator, Object... parts) throws Exception {
                return (separator + parts.length) + 'c' + 1.5e3 + 10L;
            }

            interface Listener {
                void changed(String name);
            }
        }
        """;

    static Stream<String> sources() {
        return Stream.of(
            SERVICE,
            "",
            "// only a comment\n",
            "class A {}",
            "class A {}\n\n\n   ",
            "class A {\r\n    int x = 1;\r\n}\r\n",
            "class A {\n\tString s = \"\"\"\n\t    text \\\"\"\" block\n\t    \"\"\";\n}\n",
            "interface Shape extends Comparable<Shape> { double area(); }",
            "class A { void f() { { int a; } a = b = c; x.y.z(1, 2).w(); new A(); } }"
        );
    }

    @ParameterizedTest
    @MethodSource("sources")
    void parse_printsBackExactly(String source) {
        var result = JavaParser.create().parse(source);

        assertTrue(result.isSuccess(), () -> "Failed: " + result);
        assertEquals(source, result.unwrap().print());
    }

    @Test
    void parse_withoutAttribution_stillRoundTrips() {
        var parser = JavaParser.builder().attribution(false).build();

        assertEquals(SERVICE, parser.parse(SERVICE).unwrap().print());
        assertFalse(parser.config().attributeTypes());
    }

    @Test
    void parse_buildsExpectedStructure() {
        var unit = JavaParser.create().parse(SERVICE).unwrap();

        assertEquals(Kind.COMPILATION_UNIT, unit.kind());
        assertEquals("com.example.service", Syntax.packageName(unit).orElseThrow());
        assertThat(Syntax.imports(unit)).extracting(Syntax::importName)
                                       .containsExactly("java.util.List", "java.util.*", "java.util.Objects.requireNonNull");
        assertTrue(Syntax.isStaticImport(Syntax.imports(unit).get(2)));

        var service = Syntax.classes(unit).get(0);
        assertEquals("Service", Syntax.className(service).text());
        assertThat(Syntax.modifiers(service)).containsExactly("public", "final");
        assertThat(Syntax.extendsClause(service)).extracting(Syntax::qualifiedName).containsExactly("Base");
        assertThat(Syntax.implementsClause(service)).hasSize(2);

        var members = Syntax.body(service).orElseThrow();
        var methods = members.childrenOfKind(Kind.METHOD_DECLARATION);
        assertThat(methods).hasSize(3);
        assertTrue(Syntax.isConstructor(methods.get(0)));
        assertEquals("join", Syntax.methodName(methods.get(2)).text());
        assertTrue(Syntax.isVarargs(Syntax.parameters(methods.get(2)).get(1)));

        var fields = members.childrenOfKind(Kind.VARIABLE_DECLARATIONS);
        assertThat(fields).hasSize(3);
        assertThat(Syntax.variables(fields.get(1))).hasSize(2);
        assertEquals(Kind.PARAMETERIZED_TYPE, Syntax.variableType(fields.get(1)).kind());
        assertEquals(Kind.ARRAY_TYPE, Syntax.variableType(fields.get(2)).kind());
        assertThat(members.childrenOfKind(Kind.CLASS_DECLARATION)).hasSize(1);
    }

    @Test
    void parse_commentsLiveInPrefixes() {
        var unit = JavaParser.create().parse(SERVICE).unwrap();
        var service = Syntax.classes(unit).get(0);

        assertThat(service.prefix().comments()).hasSize(1);
        assertThat(service.prefix().print()).contains("Javadoc stays attached");
    }

    // === Failures ===

    @Test
    void parse_missingBrace_reportsEndOfInput() {
        var result = JavaParser.create().parse("class A {");

        assertTrue(result.isFailure());
        var error = ((ParseResult.Failure) result).error();
        assertThat(error).isInstanceOf(ParseError.UnexpectedEof.class);
        assertThat(error.message()).contains("'}'");
    }

    @Test
    void parse_unexpectedToken_reportsLocation() {
        var result = JavaParser.create().parse("class A {\n    int }");

        var error = ((ParseResult.Failure) result).error();
        assertThat(error).isInstanceOf(ParseError.UnexpectedInput.class);
        assertEquals(2, error.location().line());
        assertEquals(9, error.location().column());
    }

    @Test
    void parse_lexicalError_isFailure() {
        var result = JavaParser.create().parse("class A { String s = \"open; }");

        assertThat(((ParseResult.Failure) result).error()).isInstanceOf(ParseError.LexicalError.class);
    }

    @Test
    void unwrap_onFailure_throws() {
        var result = JavaParser.create().parse("class");

        var error = assertThrows(IllegalStateException.class, result::unwrap);
        assertThat(error.getMessage()).startsWith("Parse failed");
    }
}
