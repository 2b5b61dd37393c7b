package org.pragmatica.rewrite.parser;

import org.pragmatica.rewrite.type.TypeTable;

/**
 * Parser configuration options.
 *
 * @param types          classes visible to type attribution
 * @param attributeTypes whether to attach resolved types after parsing
 */
public record ParserConfig(
    TypeTable types,
    boolean attributeTypes
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        TypeTable.empty(),
        true
    );

    public ParserConfig withTypes(TypeTable newTypes) {
        return new ParserConfig(newTypes, attributeTypes);
    }
}
