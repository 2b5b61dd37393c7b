package org.pragmatica.rewrite.type;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.tree.JavaType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TypeTableTest {

    private static final TypeTable TYPES = TypeTable.builder()
                                                    .addClass("demo.Base")
                                                    .addClass("demo.Child", "demo.Base", "java.lang.Runnable")
                                                    .addInterface("java.lang.Runnable")
                                                    .addMethod("demo.Base", "void", "run")
                                                    .addMethod("demo.Base", "void", "go", "int")
                                                    .addMethod("demo.Child", "void", "run")
                                                    .addMethod("demo.Child", "void", "log", "java.lang.String",
                                                               "java.lang.Object...")
                                                    .build();

    @Test
    void builder_preloadsStringHierarchy() {
        var string = TypeTable.empty().lookup(TypeTable.STRING).orElseThrow();

        assertEquals(TypeTable.OBJECT, string.supertype().orElseThrow().fullyQualifiedName());
        assertThat(string.interfaces()).extracting(JavaType.Class::fullyQualifiedName)
                                       .containsExactly("java.lang.CharSequence");
    }

    @Test
    void lookup_recordsSupertypesAndInterfaces() {
        var child = TYPES.lookup("demo.Child").orElseThrow();

        assertEquals("demo.Base", child.supertype().orElseThrow().fullyQualifiedName());
        assertThat(child.interfaces()).extracting(JavaType.Class::fullyQualifiedName)
                                      .containsExactly("java.lang.Runnable");
        assertTrue(TYPES.lookup("demo.Missing").isEmpty());
    }

    @Test
    void methods_overridingDeclarationHidesInherited() {
        var child = TYPES.lookup("demo.Child").orElseThrow();
        var run = TYPES.methods(child, "run");

        assertThat(run).hasSize(1);
        assertEquals("demo.Child", run.get(0).declaringType().fullyQualifiedName());
    }

    @Test
    void methods_inheritedMethodKeepsDeclaringType() {
        var go = TYPES.methods(TYPES.lookup("demo.Child").orElseThrow(), "go");

        assertThat(go).hasSize(1);
        assertEquals("demo.Base", go.get(0).declaringType().fullyQualifiedName());
        assertEquals(List.of(JavaType.Primitive.INT), go.get(0).parameterTypes());
    }

    @Test
    void addMethod_trailingEllipsis_makesVarargs() {
        var log = TYPES.declaredMethods("demo.Child")
                       .stream()
                       .filter(m -> m.name().equals("log"))
                       .findFirst()
                       .orElseThrow();

        assertTrue(log.varargs());
        assertEquals("void demo.Child.log(java.lang.String,java.lang.Object[])", log.describe());
    }

    @Test
    void build_cyclicHierarchy_isRejected() {
        var builder = TypeTable.builder()
                               .addClass("demo.A", "demo.B")
                               .addClass("demo.B", "demo.A");

        var error = assertThrows(IllegalArgumentException.class, builder::build);
        assertThat(error.getMessage()).contains("Cyclic type hierarchy");
    }

    @Test
    void resolve_handlesPrimitivesArraysAndClasses() {
        assertEquals(new JavaType.Array(JavaType.Primitive.INT), TYPES.resolve("int[]").orElseThrow());
        assertEquals("demo.Base[][]", TYPES.resolve("demo.Base[][]").orElseThrow().describe());
        assertTrue(TYPES.resolve("demo.Missing").isEmpty());
    }

    @Test
    void with_addsAndReplacesEntries() {
        var replacement = JavaType.Class.of("demo.Base");
        var extra = new JavaType.Method(replacement, "stop", JavaType.Primitive.VOID, List.of(), false);

        var extended = TYPES.with(List.of(replacement, JavaType.Class.of("demo.Extra")), List.of(extra));

        assertTrue(extended.contains("demo.Extra"));
        assertThat(extended.declaredMethods("demo.Base")).extracting(JavaType.Method::name).containsExactly("stop");
        assertThat(TYPES.declaredMethods("demo.Base")).extracting(JavaType.Method::name).containsExactly("run", "go");
        assertSame(TYPES, TYPES.with(List.of(), List.of()));
    }

    // === Assignability ===

    @Test
    void isAssignableTo_followsInterfaces() {
        var string = TYPES.lookup(TypeTable.STRING).orElseThrow();

        assertTrue(TypeUtils.isAssignableTo("java.lang.CharSequence", string));
        assertTrue(TypeUtils.isAssignableTo(TypeTable.OBJECT, string));
        assertFalse(TypeUtils.isAssignableTo("demo.Base", string));
    }

    @Test
    void isAssignableTo_nullAndPrimitives() {
        assertTrue(TypeUtils.isAssignableTo("demo.Base", JavaType.Primitive.NULL));
        assertFalse(TypeUtils.isAssignableTo("int", JavaType.Primitive.NULL));
        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.LONG, JavaType.Primitive.INT));
        assertFalse(TypeUtils.isAssignableTo(JavaType.Primitive.INT, JavaType.Primitive.LONG));
        assertFalse(TypeUtils.isAssignableTo(JavaType.Primitive.INT, JavaType.Primitive.BOOLEAN));
    }

    @Test
    void isAssignableTo_charWidening() {
        var byteType = new JavaType.Primitive("byte");
        var shortType = new JavaType.Primitive("short");

        assertFalse(TypeUtils.isAssignableTo(JavaType.Primitive.CHAR, byteType));
        assertFalse(TypeUtils.isAssignableTo(JavaType.Primitive.CHAR, shortType));
        assertFalse(TypeUtils.isAssignableTo(shortType, JavaType.Primitive.CHAR));
        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.INT, JavaType.Primitive.CHAR));
        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.INT, byteType));
        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.CHAR, JavaType.Primitive.CHAR));
    }

    @Test
    void isAssignableTo_boxingAndUnboxing() {
        assertTrue(TypeUtils.isAssignableTo(TypeTable.OBJECT, JavaType.Primitive.INT));
        assertTrue(TypeUtils.isAssignableTo("java.lang.Integer", JavaType.Primitive.INT));
        assertTrue(TypeUtils.isAssignableTo("java.lang.Number", JavaType.Primitive.DOUBLE));
        assertTrue(TypeUtils.isAssignableTo("java.lang.Character", JavaType.Primitive.CHAR));
        assertFalse(TypeUtils.isAssignableTo("java.lang.Number", JavaType.Primitive.BOOLEAN));
        assertFalse(TypeUtils.isAssignableTo("java.lang.Long", JavaType.Primitive.INT));
        assertFalse(TypeUtils.isAssignableTo(TypeTable.STRING, JavaType.Primitive.INT));

        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.INT, JavaType.Class.of("java.lang.Integer")));
        assertTrue(TypeUtils.isAssignableTo(JavaType.Primitive.LONG, JavaType.Class.of("java.lang.Integer")));
        assertFalse(TypeUtils.isAssignableTo(JavaType.Primitive.INT, JavaType.Class.of("java.lang.Long")));
        assertEquals("java.lang.Short", TypeUtils.wrapperOf("short").orElseThrow());
    }

    @Test
    void isAssignableTo_arraysByElement() {
        var strings = new JavaType.Array(TYPES.lookup(TypeTable.STRING).orElseThrow());
        var sequences = new JavaType.Array(TYPES.lookup("java.lang.CharSequence").orElseThrow());

        assertTrue(TypeUtils.isAssignableTo(sequences, strings));
        assertFalse(TypeUtils.isAssignableTo(strings, sequences));
        assertTrue(TypeUtils.isAssignableTo(TypeTable.OBJECT, strings));
    }
}
