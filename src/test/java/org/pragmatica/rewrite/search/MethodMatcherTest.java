package org.pragmatica.rewrite.search;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.rewrite.parser.JavaParser;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeTable;
import org.pragmatica.rewrite.visitor.Match;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MethodMatcherTest {

    private static final TypeTable GUAVA = TypeTable.builder()
                                                    .addClass("java.io.File")
                                                    .addClass("com.google.common.io.Files")
                                                    .addMethod("com.google.common.io.Files", "java.io.File",
                                                               "createTempDir")
                                                    .addMethod("com.google.common.io.Files", "java.io.File",
                                                               "createTempFile")
                                                    .build();

    private static final String TEMP_DIR = """
        import com.google.common.io.Files;
        import java.io.File;

        class Workspace {
            File dir = Files.createTempDir();
        }
        """;

    private static final String TEMP_FILE = """
        import com.google.common.io.Files;
        import java.io.File;

        class Workspace {
            File file = Files.createTempFile();
        }
        """;

    private static Tree.Node parse(String source, TypeTable types) {
        return JavaParser.builder().types(types).build().parse(source).unwrap();
    }

    private static List<Match> find(String pattern, Tree.Node unit) {
        return new FindMethods(pattern).visit(unit);
    }

    // === Resolved signatures ===

    @Test
    void exactSignature_matchesOnlyThatMethod() {
        var pattern = "java.io.File com.google.common.io.Files.createTempDir()";

        assertThat(find(pattern, parse(TEMP_DIR, GUAVA))).extracting(Match::printTrimmed)
                                                         .containsExactly("Files.createTempDir()");
        assertThat(find(pattern, parse(TEMP_FILE, GUAVA))).isEmpty();
    }

    @Test
    void wildcardDeclaringType_matchesAcrossClasses() {
        var types = TypeTable.builder()
                             .addClass("demo.Alpha")
                             .addClass("demo.Beta")
                             .addMethod("demo.Alpha", "void", "foo", "int")
                             .addMethod("demo.Beta", "void", "foo", "java.lang.String", "java.lang.String")
                             .addMethod("demo.Beta", "void", "bar")
                             .build();
        var unit = parse("""
            package demo;

            class Caller {
                void call(Alpha alpha, Beta beta) {
                    alpha.foo(1);
                    beta.foo("a", "b");
                    beta.bar();
                }
            }
            """, types);

        assertThat(find("* foo(..)", unit)).extracting(Match::printTrimmed)
                                           .containsExactly("alpha.foo(1)", "beta.foo(\"a\", \"b\")");
        assertThat(find("demo.Beta foo(java.lang.String, *)", unit)).hasSize(1);
        assertThat(find("demo.* foo(int)", unit)).hasSize(1);
        assertThat(find("demo..* *o*()", unit)).isEmpty();
        assertThat(find("demo..* *a*()", unit)).hasSize(1);
    }

    @Test
    void parameterPattern_acceptsSubtypes() {
        var types = TypeTable.builder()
                             .addClass("demo.Printer")
                             .addMethod("demo.Printer", "void", "print", "java.lang.String")
                             .build();
        var method = types.declaredMethods("demo.Printer").get(0);

        assertTrue(MethodMatcher.compile("demo.Printer print(java.lang.CharSequence)").matches(method));
        assertTrue(MethodMatcher.compile("demo.Printer print(java.lang.Object)").matches(method));
        assertFalse(MethodMatcher.compile("demo.Printer print(int)").matches(method));
        assertFalse(MethodMatcher.compile("demo.Printer print()").matches(method));
    }

    @Test
    void varargsPattern_requiresVarargsMethod() {
        var types = TypeTable.builder()
                             .addClass("demo.Log")
                             .addMethod("demo.Log", "void", "info", "java.lang.String", "java.lang.Object...")
                             .addMethod("demo.Log", "void", "warn", "java.lang.String", "java.lang.Object[]")
                             .build();
        var info = types.declaredMethods("demo.Log").get(0);
        var warn = types.declaredMethods("demo.Log").get(1);

        assertTrue(MethodMatcher.compile("demo.Log info(java.lang.String, java.lang.Object...)").matches(info));
        assertTrue(MethodMatcher.compile("demo.Log info(..)").matches(info));
        assertTrue(MethodMatcher.compile("demo.Log info(*, ..)").matches(info));
        assertFalse(MethodMatcher.compile("demo.Log info(java.lang.String)").matches(info));
        assertFalse(MethodMatcher.compile("demo.Log warn(java.lang.String, java.lang.Object...)").matches(warn));
        assertTrue(MethodMatcher.compile("demo.Log warn(java.lang.String, java.lang.Object[])").matches(warn));
    }

    @Test
    void matchOverrides_acceptsSubclassDeclarations() {
        var types = TypeTable.builder()
                             .addClass("demo.Base")
                             .addClass("demo.Child", "demo.Base")
                             .addMethod("demo.Child", "void", "run")
                             .build();
        var run = types.declaredMethods("demo.Child").get(0);

        assertFalse(MethodMatcher.compile("demo.Base run()").matches(run));
        assertTrue(MethodMatcher.compile("demo.Base run()", true).matches(run));
        assertTrue(MethodMatcher.compile("demo.Base run()", true).matchOverrides());
    }

    @Test
    void returnType_mustMatch() {
        var method = GUAVA.declaredMethods("com.google.common.io.Files").get(0);

        assertTrue(MethodMatcher.compile("java.io.* com.google..Files.createTemp*()").matches(method));
        assertFalse(MethodMatcher.compile("void com.google.common.io.Files.createTempDir()").matches(method));
        assertTrue(MethodMatcher.compile("* com.google.common.io.Files createTempDir()").matches(method));
    }

    @Test
    void constructorPattern_matchesNewClass() {
        var types = TypeTable.builder().addClass("demo.Printer").build();
        var unit = parse("package demo;\nclass A { Printer p = new Printer(); }", types);

        assertThat(find("demo.Printer <constructor>()", unit)).extracting(Match::printTrimmed)
                                                              .containsExactly("new Printer()");
        assertThat(find("demo.Printer <constructor>(int)", unit)).isEmpty();
    }

    @Test
    void declarations_matchWhenRequested() {
        var unit = parse("class A { void foo(int x) { foo(1); } }", TypeTable.empty());
        var matcher = MethodMatcher.compile("A foo(int)");

        assertThat(new FindMethods(matcher, false).visit(unit)).hasSize(1);
        assertThat(new FindMethods(matcher, true).visit(unit)).extracting(m -> m.tree().kind().name())
                                                             .containsExactly("METHOD_DECLARATION", "METHOD_INVOCATION");
    }

    @Test
    void boxedArguments_matchReferenceParameters() {
        var types = TypeTable.builder()
                             .addClass("demo.Box")
                             .addMethod("demo.Box", "void", "put", "java.lang.Object")
                             .addClass("demo.Log")
                             .addMethod("demo.Log", "void", "info", "java.lang.String", "java.lang.Object...")
                             .build();
        var unit = parse("""
            package demo;

            class A {
                void f(Box b, Log log) {
                    b.put("s");
                    b.put(1);
                    log.info("a", 1, "b");
                }
            }
            """, types);

        assertThat(find("demo.Box put(java.lang.Object)", unit)).extracting(Match::printTrimmed)
                                                                .containsExactly("b.put(\"s\")", "b.put(1)");
        assertThat(find("demo.Log info(java.lang.String, java.lang.Object...)", unit))
            .extracting(Match::printTrimmed)
            .containsExactly("log.info(\"a\", 1, \"b\")");
    }

    // === Unresolved trees ===

    @Test
    void unresolvedInvocation_neverMatchesTypedPattern() {
        var unit = parse(TEMP_DIR, TypeTable.empty());

        assertThat(find("java.io.File com.google.common.io.Files.createTempDir()", unit)).isEmpty();
        assertThat(find("* com.google.common.io.Files.createTempDir()", unit)).isEmpty();
        assertThat(find("com.google.common.io.Files createTempDir(..)", unit)).isEmpty();
    }

    @Test
    void unresolvedInvocation_matchesFullyWildcardPatternByName() {
        var unit = parse(TEMP_DIR, TypeTable.empty());

        assertThat(find("* createTempDir(..)", unit)).hasSize(1);
        assertThat(find("* createTempFile(..)", unit)).isEmpty();
    }

    @Test
    void nonMethodTree_neverMatches() {
        var matcher = MethodMatcher.compile("* *(..)");
        var literal = Tree.node(org.pragmatica.rewrite.tree.Kind.LITERAL, Tree.token("1"))
                          .withType(JavaType.Primitive.INT);

        assertFalse(matcher.matches(literal));
        assertFalse(matcher.matches(Tree.token("foo")));
    }

    // === Pattern syntax ===

    @ParameterizedTest
    @ValueSource(strings = {
        "foo",
        "foo(",
        "a b c d()",
        "java.io.File.()",
        "* fo-o()",
        "* foo(java.lang.String..., int)",
        "* foo(java.util.List<)",
        "* foo(a b)"
    })
    void malformedPattern_isRejected(String pattern) {
        assertThrows(IllegalArgumentException.class, () -> MethodMatcher.compile(pattern));
    }

    @Test
    void toString_showsPattern() {
        assertEquals("MethodMatcher(* foo(..))", MethodMatcher.compile("  * foo(..) ").toString());
    }
}
