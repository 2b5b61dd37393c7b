package org.pragmatica.rewrite.recipe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.rewrite.parser.JavaParser;
import org.pragmatica.rewrite.tree.Tree;

import static org.junit.jupiter.api.Assertions.*;

class AddImportTest {

    private static final String WITH_IMPORTS = """
        package demo;

        import java.util.List;
        import java.util.Map;

        class A {}
        """;

    private static Tree.Node parse(String source) {
        return JavaParser.builder().attribution(false).build().parse(source).unwrap();
    }

    private static String addImport(String fullyQualifiedName, String source) {
        return new AddImport(fullyQualifiedName).visitRoot(parse(source)).print();
    }

    // === Placement ===

    @Test
    void import_sortedBeforeLaterName() {
        assertEquals("""
            package demo;

            import java.util.HashMap;
            import java.util.List;
            import java.util.Map;

            class A {}
            """, addImport("java.util.HashMap", WITH_IMPORTS));
    }

    @Test
    void import_afterLastWhenGreatest() {
        assertEquals("""
            package demo;

            import java.util.List;
            import java.util.Map;
            import java.util.Set;

            class A {}
            """, addImport("java.util.Set", WITH_IMPORTS));
    }

    @Test
    void import_afterPackageWhenNoImports() {
        assertEquals("package demo;\n\nimport java.util.List;\n\nclass A {}\n",
                     addImport("java.util.List", "package demo;\n\nclass A {}\n"));
    }

    @Test
    void import_atTopOfDefaultPackageUnit() {
        assertEquals("import java.util.List;\n\nclass A {}", addImport("java.util.List", "class A {}"));
        assertEquals("// header\nimport java.util.List;\n\nclass A {}",
                     addImport("java.util.List", "// header\nclass A {}"));
    }

    @Test
    void import_staticImportsIgnoredForOrdering() {
        var source = "import static java.util.Objects.requireNonNull;\nimport java.util.List;\n\nclass A {}";

        assertEquals("import static java.util.Objects.requireNonNull;\nimport java.util.ArrayList;\n"
                     + "import java.util.List;\n\nclass A {}",
                     addImport("java.util.ArrayList", source));
    }

    // === No-op cases ===

    @ParameterizedTest
    @ValueSource(strings = {"java.lang.String", "demo.B", "java.util.List", "java.util.concurrent.Future"})
    void visibleType_leavesUnitUntouched(String fullyQualifiedName) {
        var unit = parse("package demo;\n\nimport java.util.List;\nimport java.util.concurrent.*;\n\nclass A {}");

        assertSame(unit, new AddImport(fullyQualifiedName).visitRoot(unit));
    }

    @Test
    void defaultPackageType_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AddImport("Widget"));
    }

    @Test
    void name_mentionsImportedType() {
        assertEquals("AddImport(java.util.List)", new AddImport("java.util.List").name());
    }
}
