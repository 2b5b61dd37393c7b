package org.pragmatica.rewrite.search;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.tree.JavaType;
import org.pragmatica.rewrite.type.TypeTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypePatternTest {

    private static final JavaType LIST = JavaType.Class.of("java.util.List");
    private static final JavaType FUTURE = JavaType.Class.of("java.util.concurrent.Future");

    @Test
    void star_matchesAnything() {
        var any = TypePattern.compile("*");

        assertTrue(any.isAny());
        assertSame(TypePattern.any(), any);
        assertTrue(any.matches(JavaType.Primitive.INT));
        assertTrue(any.matches(LIST));
    }

    @Test
    void starInName_staysWithinOneSegment() {
        var pattern = TypePattern.compile("java.util.*");

        assertTrue(pattern.matches(LIST));
        assertFalse(pattern.matches(FUTURE));
        assertFalse(pattern.isExact());
    }

    @Test
    void doubleDot_spansPackages() {
        var pattern = TypePattern.compile("java..Future");

        assertTrue(pattern.matches(FUTURE));
        assertTrue(pattern.matches(JavaType.Class.of("java.Future")));
        assertFalse(pattern.matches(LIST));
    }

    @Test
    void typeArguments_areErased() {
        var pattern = TypePattern.compile("java.util.List<java.lang.String>");
        var parameterized = JavaType.Class.of("java.util.List").withTypeParameters(List.of(JavaType.Class.of("x.Y")));

        assertTrue(pattern.isExact());
        assertTrue(pattern.matches(parameterized));
        assertEquals("java.util.List", pattern.toString());
    }

    @Test
    void arrays_matchByElement() {
        var strings = new JavaType.Array(TypeTable.empty().lookup(TypeTable.STRING).orElseThrow());

        assertTrue(TypePattern.compile("int[]").matches(new JavaType.Array(JavaType.Primitive.INT)));
        assertFalse(TypePattern.compile("int").matches(new JavaType.Array(JavaType.Primitive.INT)));
        assertFalse(TypePattern.compile("java.lang.CharSequence[]").matches(strings));
        assertTrue(TypePattern.compile("java.lang.CharSequence[]").matchesSubtype(strings));
    }

    @Test
    void matchesSubtype_walksSupertypes() {
        var types = TypeTable.builder()
                             .addInterface("demo.Shape")
                             .addClass("demo.Square", TypeTable.OBJECT, "demo.Shape")
                             .build();
        var square = types.lookup("demo.Square").orElseThrow();

        assertFalse(TypePattern.compile("demo.Shape").matches(square));
        assertTrue(TypePattern.compile("demo.Shape").matchesSubtype(square));
        assertTrue(TypePattern.compile("java.lang.Object").matchesSubtype(square));
        assertFalse(TypePattern.compile("demo.Circle").matchesSubtype(square));
    }

    @Test
    void methodTypes_haveNoErasure() {
        var method = new JavaType.Method(JavaType.Class.of("a.B"), "f", JavaType.Primitive.VOID, List.of(), false);

        assertFalse(TypePattern.compile("a.B").matches(method));
        assertTrue(TypePattern.erasure(method).isEmpty());
    }

    @Test
    void malformedPatterns_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> TypePattern.compile(" "));
        assertThrows(IllegalArgumentException.class, () -> TypePattern.compile("java.util.List>"));
        assertThrows(IllegalArgumentException.class, () -> TypePattern.compile("java.util.List<String"));
        assertThrows(IllegalArgumentException.class, () -> TypePattern.compile("a-b"));
    }
}
