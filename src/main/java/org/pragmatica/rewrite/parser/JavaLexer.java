package org.pragmatica.rewrite.parser;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rewrite.tree.SourceLocation;
import org.pragmatica.rewrite.tree.Space;
import org.pragmatica.rewrite.tree.Trivia;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the supported Java subset. Whitespace and comments are not dropped:
 * they are attached as {@link Space} to the token that follows them, and whatever
 * trails the last token ends up on the end-of-file token.
 */
public final class JavaLexer {
    private static final int MAX_INPUT_SIZE = 4_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private static final Set<String> KEYWORDS = Set.of(
        "package", "import", "class", "interface", "extends", "implements", "throws",
        "public", "protected", "private", "static", "final", "abstract", "synchronized",
        "native", "transient", "volatile", "default", "strictfp",
        "return", "if", "else", "new", "this", "super",
        "void", "boolean", "byte", "char", "short", "int", "long", "float", "double");

    // longest first
    private static final List<String> SYMBOLS = List.of(
        "...", "==", "!=", "<=", ">=", "&&", "||",
        "{", "}", "(", ")", "[", "]", ";", ",", ".", "@", "=", "<", ">", "!",
        "+", "-", "*", "/", "%", "?", ":", "&", "|", "^");

    private final String input;
    private int pos;
    private SourceLocation location;

    private JavaLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.location = SourceLocation.START;
    }

    public static List<JavaToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new JavaLexer(input).tokenizeAll();
    }

    private List<JavaToken> tokenizeAll() {
        var tokens = new ArrayList<JavaToken>();
        while (true) {
            var prefix = scanFormatting();
            if (prefix == null) {
                tokens.add(new JavaToken.Error(location, Space.EMPTY, input.substring(pos), "Unterminated comment"));
                return tokens;
            }
            if (isAtEnd()) {
                tokens.add(new JavaToken.Eof(location, prefix));
                return tokens;
            }
            var token = nextToken(prefix);
            tokens.add(token);
            if (token instanceof JavaToken.Error) {
                return tokens;
            }
        }
    }

    /**
     * Collect whitespace and comments. Returns null on an unterminated block comment.
     */
    private Space scanFormatting() {
        var trivia = ImmutableList.<Trivia>builder();
        while (!isAtEnd()) {
            int start = pos;
            char c = peek();
            if (Character.isWhitespace(c)) {
                while (!isAtEnd() && Character.isWhitespace(peek())) {
                    advance();
                }
                trivia.add(new Trivia.Whitespace(input.substring(start, pos)));
            } else if (input.startsWith("//", pos)) {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
                trivia.add(new Trivia.LineComment(input.substring(start, pos)));
            } else if (input.startsWith("/*", pos)) {
                int end = input.indexOf("*/", pos + 2);
                if (end < 0) {
                    return null;
                }
                while (pos < end + 2) {
                    advance();
                }
                trivia.add(new Trivia.BlockComment(input.substring(start, pos)));
            } else {
                break;
            }
        }
        var items = trivia.build();
        return items.isEmpty() ? Space.EMPTY : new Space(items);
    }

    private JavaToken nextToken(Space prefix) {
        var start = location;
        char c = peek();
        if (Character.isJavaIdentifierStart(c)) {
            return scanWord(start, prefix);
        }
        if (input.startsWith("\"\"\"", pos)) {
            return scanTextBlock(start, prefix);
        }
        if (c == '"' || c == '\'') {
            return scanQuoted(start, prefix, c);
        }
        if (isDigit(c) || (c == '.' && pos + 1 < input.length() && isDigit(input.charAt(pos + 1)))) {
            return scanNumber(start, prefix);
        }
        for (var symbol : SYMBOLS) {
            if (input.startsWith(symbol, pos)) {
                advanceBy(symbol.length());
                return new JavaToken.Symbol(start, prefix, symbol);
            }
        }
        advance();
        return new JavaToken.Error(start, prefix, String.valueOf(c), "Unexpected character '" + c + "'");
    }

    private JavaToken scanWord(SourceLocation start, Space prefix) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && Character.isJavaIdentifierPart(peek())) {
            sb.append(advance());
        }
        var word = sb.toString();
        return switch (word) {
            case "true", "false" -> new JavaToken.Literal(start, prefix, word, JavaToken.LiteralKind.BOOLEAN);
            case "null" -> new JavaToken.Literal(start, prefix, word, JavaToken.LiteralKind.NULL);
            default -> KEYWORDS.contains(word)
                       ? new JavaToken.Keyword(start, prefix, word)
                       : new JavaToken.Identifier(start, prefix, word);
        };
    }

    private JavaToken scanQuoted(SourceLocation start, Space prefix, char quote) {
        int begin = pos;
        advance();
        while (!isAtEnd() && peek() != quote && peek() != '\n') {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd() || peek() != quote) {
            return new JavaToken.Error(start, prefix, input.substring(begin, pos),
                                       quote == '"' ? "Unterminated string literal" : "Unterminated char literal");
        }
        advance();
        var kind = quote == '"' ? JavaToken.LiteralKind.STRING : JavaToken.LiteralKind.CHAR;
        return new JavaToken.Literal(start, prefix, input.substring(begin, pos), kind);
    }

    private JavaToken scanTextBlock(SourceLocation start, Space prefix) {
        int begin = pos;
        advanceBy(3);
        while (!isAtEnd() && !input.startsWith("\"\"\"", pos)) {
            if (peek() == '\\' && pos + 1 < input.length()) {
                advance();
            }
            advance();
        }
        if (isAtEnd()) {
            return new JavaToken.Error(start, prefix, input.substring(begin), "Unterminated text block");
        }
        advanceBy(3);
        return new JavaToken.Literal(start, prefix, input.substring(begin, pos), JavaToken.LiteralKind.STRING);
    }

    private JavaToken scanNumber(SourceLocation start, Space prefix) {
        int begin = pos;
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                if (c == '.' && (pos + 1 >= input.length() || !isDigit(input.charAt(pos + 1)))) {
                    break;
                }
                advance();
                // exponent sign
                if ((c == 'e' || c == 'E') && !isAtEnd() && (peek() == '+' || peek() == '-')
                    && !input.substring(begin, pos).startsWith("0x")) {
                    advance();
                }
            } else {
                break;
            }
        }
        return new JavaToken.Literal(start, prefix, input.substring(begin, pos), JavaToken.LiteralKind.NUMBER);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char advance() {
        char c = input.charAt(pos++);
        location = location.advance(c);
        return c;
    }

    private void advanceBy(int count) {
        for (int i = 0; i < count; i++) {
            advance();
        }
    }
}
