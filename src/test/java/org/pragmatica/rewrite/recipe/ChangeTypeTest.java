package org.pragmatica.rewrite.recipe;

import org.junit.jupiter.api.Test;
import org.pragmatica.rewrite.parser.JavaParser;
import org.pragmatica.rewrite.search.FindTypes;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeTable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ChangeTypeTest {

    private static final TypeTable TYPES = TypeTable.builder()
                                                    .addClass("java.util.List")
                                                    .addClass("old.Widget")
                                                    .addClass("demo.Part")
                                                    .build();

    private static Tree.Node parse(String source) {
        return JavaParser.builder().types(TYPES).build().parse(source).unwrap();
    }

    @Test
    void everyReference_isReplacedKeepingSpelling() {
        var unit = parse("""
            package demo;

            import java.util.List;
            import old.Widget;

            class Shop {
                Widget widget;
                List<Widget> widgets;

                Widget make(old.Widget template) {
                    return new Widget();
                }
            }
            """);

        var result = new ChangeType("old.Widget", "org.fresh.Gadget").visitRoot(unit);

        assertEquals("""
            package demo;

            import java.util.List;
            import org.fresh.Gadget;

            class Shop {
                Gadget widget;
                List<Gadget> widgets;

                Gadget make(org.fresh.Gadget template) {
                    return new Gadget();
                }
            }
            """, result.print());
        assertThat(new FindTypes("org.fresh.Gadget").visit(result)).hasSize(6);
        assertThat(new FindTypes("old.Widget").visit(result)).isEmpty();
    }

    @Test
    void samePackageType_getsNewImport() {
        var unit = parse("""
            package demo;

            class Shop {
                Part part;
            }
            """);

        var result = new ChangeType("demo.Part", "org.fresh.Gadget").visitRoot(unit);

        assertEquals("""
            package demo;

            import org.fresh.Gadget;

            class Shop {
                Gadget part;
            }
            """, result.print());
    }

    @Test
    void variablesNamedLikeType_areNotTouched() {
        var unit = parse("package demo;\nclass Shop { Part Part; }");

        var result = new ChangeType("demo.Part", "demo.Piece").visitRoot(unit);

        assertEquals("package demo;\nclass Shop { Piece Part; }", result.print());
    }

    @Test
    void changedReference_keepsIdentity() {
        var unit = parse("package demo;\nclass Shop { Part part; }");
        var result = new ChangeType("demo.Part", "demo.Piece").visitRoot(unit);

        var before = new FindTypes("demo.Part").visit(unit).get(0).tree();
        var after = new FindTypes("demo.Piece").visit(result).get(0).tree();
        assertEquals(before.id(), after.id());
    }

    @Test
    void unrelatedUnit_isReturnedAsIs() {
        var unit = parse("package demo;\nclass Shop { String name; }");

        assertSame(unit, new ChangeType("old.Widget", "org.fresh.Gadget").visitRoot(unit));
    }
}
