package org.pragmatica.rewrite.parser;

import org.pragmatica.rewrite.tree.SourceLocation;
import org.pragmatica.rewrite.tree.Space;

/**
 * Token types for the Java lexer. Every token carries the formatting that precedes it.
 */
public sealed interface JavaToken {
    SourceLocation location();

    Space prefix();

    String text();

    record Identifier(SourceLocation location, Space prefix, String text) implements JavaToken {}

    record Keyword(SourceLocation location, Space prefix, String text) implements JavaToken {}

    // string, char, number, boolean and null literals
    record Literal(SourceLocation location, Space prefix, String text, LiteralKind literalKind) implements JavaToken {}

    record Symbol(SourceLocation location, Space prefix, String text) implements JavaToken {}

    // trailing formatting of the file lives in the prefix
    record Eof(SourceLocation location, Space prefix) implements JavaToken {
        @Override
        public String text() {
            return "";
        }
    }

    record Error(SourceLocation location, Space prefix, String text, String message) implements JavaToken {}

    enum LiteralKind {
        STRING,
        CHAR,
        NUMBER,
        BOOLEAN,
        NULL
    }
}
