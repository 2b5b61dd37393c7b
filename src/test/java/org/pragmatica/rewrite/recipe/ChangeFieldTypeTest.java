package org.pragmatica.rewrite.recipe;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.parser.JavaParser;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeTable;

import static org.junit.jupiter.api.Assertions.*;

class ChangeFieldTypeTest {

    private static final TypeTable TYPES = TypeTable.builder()
                                                    .addClass("java.util.List")
                                                    .addClass("java.util.ArrayList", TypeTable.OBJECT, "java.util.List")
                                                    .build();

    private static Tree.Node parse(String source) {
        return JavaParser.builder().types(TYPES).build().parse(source).unwrap();
    }

    @Test
    void fields_changeLocalsAndParametersStay() {
        var unit = parse("""
            class Holder {
                private String name;
                String label = "x";

                void rename(String next) {
                    String previous = name;
                    name = next;
                }
            }
            """);

        var result = new ChangeFieldType("java.lang.String", "java.lang.CharSequence").visitRoot(unit);

        assertEquals("""
            class Holder {
                private CharSequence name;
                CharSequence label = "x";

                void rename(String next) {
                    String previous = name;
                    name = next;
                }
            }
            """, result.print());
    }

    @Test
    void parameterizedField_keepsTypeArguments() {
        var unit = parse("""
            package demo;

            import java.util.ArrayList;

            class Holder {
                ArrayList<String> items;
            }
            """);

        var result = new ChangeFieldType("java.util.ArrayList", "java.util.List").visitRoot(unit);

        assertEquals("""
            package demo;

            import java.util.ArrayList;
            import java.util.List;

            class Holder {
                List<String> items;
            }
            """, result.print());
    }

    @Test
    void nestedClassFields_areIncluded() {
        var unit = parse("class Outer { class Inner { String value; } }");

        var result = new ChangeFieldType("java.lang.String", "java.lang.CharSequence").visitRoot(unit);

        assertEquals("class Outer { class Inner { CharSequence value; } }", result.print());
    }

    @Test
    void otherFieldTypes_leaveUnitUntouched() {
        var unit = parse("class Holder { int count; Object value; }");

        assertSame(unit, new ChangeFieldType("java.lang.String", "java.lang.CharSequence").visitRoot(unit));
    }
}
