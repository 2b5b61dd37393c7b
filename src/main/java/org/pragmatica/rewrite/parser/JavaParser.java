package org.pragmatica.rewrite.parser;

import org.pragmatica.rewrite.error.ParseError;
import org.pragmatica.rewrite.tree.Kind;
import org.pragmatica.rewrite.tree.Tree;
import org.pragmatica.rewrite.type.TypeAttributor;
import org.pragmatica.rewrite.type.TypeTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for a Java subset producing lossless trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = JavaParser.builder()
 *                        .types(typeTable)
 *                        .build();
 *
 * var unit = parser.parse(source).unwrap();
 * }</pre>
 */
public final class JavaParser {
    private static final Logger log = LoggerFactory.getLogger(JavaParser.class);

    private static final Set<String> MODIFIERS = Set.of(
        "public", "protected", "private", "static", "final", "abstract", "synchronized",
        "native", "transient", "volatile", "default", "strictfp");

    private static final Set<String> PRIMITIVES = Set.of(
        "void", "boolean", "byte", "char", "short", "int", "long", "float", "double");

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
        Map.entry("||", 1),
        Map.entry("&&", 2),
        Map.entry("|", 3),
        Map.entry("^", 4),
        Map.entry("&", 5),
        Map.entry("==", 6),
        Map.entry("!=", 6),
        Map.entry("<", 7),
        Map.entry(">", 7),
        Map.entry("<=", 7),
        Map.entry(">=", 7),
        Map.entry("+", 8),
        Map.entry("-", 8),
        Map.entry("*", 9),
        Map.entry("/", 9),
        Map.entry("%", 9));

    private final ParserConfig config;

    private JavaParser(ParserConfig config) {
        this.config = config;
    }

    public static JavaParser create() {
        return new JavaParser(ParserConfig.DEFAULT);
    }

    public static JavaParser create(ParserConfig config) {
        return new JavaParser(config);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parse a compilation unit. The resulting tree prints back to exactly {@code source}.
     */
    public ParseResult parse(String source) {
        var tokens = JavaLexer.tokenize(source);
        for (var token : tokens) {
            if (token instanceof JavaToken.Error error) {
                return new ParseResult.Failure(new ParseError.LexicalError(error.location(), error.message()));
            }
        }
        Tree.Node unit;
        try {
            unit = new Session(tokens).compilationUnit();
        } catch (SyntaxFailure failure) {
            log.debug("Parse failed: {}", failure.error.message());
            return new ParseResult.Failure(failure.error);
        }
        log.debug("Parsed compilation unit of {} tokens", tokens.size());
        if (config.attributeTypes()) {
            unit = TypeAttributor.attribute(unit, config.types());
        }
        return new ParseResult.Success(unit);
    }

    public static final class Builder {
        private TypeTable types = TypeTable.empty();
        private boolean attributeTypes = true;

        private Builder() {}

        public Builder types(TypeTable types) {
            this.types = types;
            return this;
        }

        public Builder attribution(boolean enabled) {
            this.attributeTypes = enabled;
            return this;
        }

        public JavaParser build() {
            return new JavaParser(new ParserConfig(types, attributeTypes));
        }
    }

    private static final class SyntaxFailure extends RuntimeException {
        private final ParseError error;

        SyntaxFailure(ParseError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }

    /**
     * Mutable state of one parse.
     */
    private static final class Session {
        private final List<JavaToken> tokens;
        private int pos;

        Session(List<JavaToken> tokens) {
            this.tokens = tokens;
            this.pos = 0;
        }

        // === Declarations ===

        Tree.Node compilationUnit() {
            var children = new ArrayList<Tree>();
            if (isKeyword("package")) {
                children.add(node(Kind.PACKAGE_DECLARATION, take(), qualifiedName(), expectSymbol(";")));
            }
            while (isKeyword("import")) {
                children.add(importDeclaration());
            }
            while (!isEof()) {
                if (isSymbol(";")) {
                    children.add(take());
                } else {
                    children.add(classDeclaration(modifiers()));
                }
            }
            children.add(take());
            return Tree.node(Kind.COMPILATION_UNIT, children);
        }

        private Tree.Node importDeclaration() {
            var children = new ArrayList<Tree>();
            children.add(take());
            if (isKeyword("static")) {
                children.add(take());
            }
            var name = qualifiedName();
            if (isSymbol(".") && peek(1).text().equals("*")) {
                var dot = take();
                name = node(Kind.FIELD_ACCESS, name, dot, node(Kind.IDENTIFIER, take()));
            }
            children.add(name);
            children.add(expectSymbol(";"));
            return Tree.node(Kind.IMPORT, children);
        }

        private List<Tree> modifiers() {
            var result = new ArrayList<Tree>();
            while (true) {
                if (isSymbol("@") && !peek(1).text().equals("interface")) {
                    result.add(annotation());
                } else if (peek() instanceof JavaToken.Keyword keyword && MODIFIERS.contains(keyword.text())) {
                    result.add(node(Kind.MODIFIER, take()));
                } else {
                    return result;
                }
            }
        }

        private Tree.Node annotation() {
            var children = new ArrayList<Tree>();
            children.add(take());
            children.add(qualifiedName());
            if (isSymbol("(")) {
                arguments(children);
            }
            return Tree.node(Kind.ANNOTATION, children);
        }

        private Tree.Node classDeclaration(List<Tree> modifiers) {
            var children = new ArrayList<Tree>(modifiers);
            if (!isKeyword("class") && !isKeyword("interface")) {
                throw fail("'class' or 'interface'");
            }
            children.add(take());
            children.add(identifier());
            if (isKeyword("extends")) {
                children.add(take());
                typeList(children);
            }
            if (isKeyword("implements")) {
                children.add(take());
                typeList(children);
            }
            children.add(classBody());
            return Tree.node(Kind.CLASS_DECLARATION, children);
        }

        private void typeList(List<Tree> into) {
            into.add(type());
            while (isSymbol(",")) {
                into.add(take());
                into.add(type());
            }
        }

        private Tree.Node classBody() {
            var children = new ArrayList<Tree>();
            children.add(expectSymbol("{"));
            while (!isSymbol("}")) {
                if (isEof()) {
                    throw fail("'}'");
                }
                children.add(member());
            }
            children.add(take());
            return Tree.node(Kind.BLOCK, children);
        }

        private Tree member() {
            if (isSymbol(";")) {
                return take();
            }
            var modifiers = modifiers();
            if (isKeyword("class") || isKeyword("interface")) {
                return classDeclaration(modifiers);
            }
            if (peek() instanceof JavaToken.Identifier && peek(1).text().equals("(")) {
                return methodDeclaration(modifiers);
            }
            var type = type();
            if (peek() instanceof JavaToken.Identifier && peek(1).text().equals("(")) {
                var children = new ArrayList<Tree>(modifiers);
                children.add(type);
                return methodDeclaration(children);
            }
            return variableDeclarations(modifiers, type, true);
        }

        private Tree.Node methodDeclaration(List<Tree> head) {
            var children = new ArrayList<Tree>(head);
            children.add(identifier());
            children.add(expectSymbol("("));
            if (!isSymbol(")")) {
                children.add(parameter());
                while (isSymbol(",")) {
                    children.add(take());
                    children.add(parameter());
                }
            }
            children.add(expectSymbol(")"));
            if (isKeyword("throws")) {
                children.add(take());
                typeList(children);
            }
            children.add(isSymbol(";") ? take() : block());
            return Tree.node(Kind.METHOD_DECLARATION, children);
        }

        private Tree.Node parameter() {
            var children = new ArrayList<Tree>(modifiers());
            children.add(type());
            if (isSymbol("...")) {
                children.add(take());
            }
            children.add(node(Kind.NAMED_VARIABLE, identifier()));
            return Tree.node(Kind.VARIABLE_DECLARATIONS, children);
        }

        private Tree.Node variableDeclarations(List<Tree> modifiers, Tree.Node type, boolean terminated) {
            var children = new ArrayList<Tree>(modifiers);
            children.add(type);
            children.add(namedVariable());
            while (isSymbol(",")) {
                children.add(take());
                children.add(namedVariable());
            }
            if (terminated) {
                children.add(expectSymbol(";"));
            }
            return Tree.node(Kind.VARIABLE_DECLARATIONS, children);
        }

        private Tree.Node namedVariable() {
            var children = new ArrayList<Tree>();
            children.add(identifier());
            if (isSymbol("=")) {
                children.add(take());
                children.add(expression());
            }
            return Tree.node(Kind.NAMED_VARIABLE, children);
        }

        // === Statements ===

        private Tree.Node block() {
            var children = new ArrayList<Tree>();
            children.add(expectSymbol("{"));
            while (!isSymbol("}")) {
                if (isEof()) {
                    throw fail("'}'");
                }
                children.add(statement());
            }
            children.add(take());
            return Tree.node(Kind.BLOCK, children);
        }

        private Tree statement() {
            if (isSymbol("{")) {
                return block();
            }
            if (isSymbol(";")) {
                return take();
            }
            if (isKeyword("return")) {
                var children = new ArrayList<Tree>();
                children.add(take());
                if (!isSymbol(";")) {
                    children.add(expression());
                }
                children.add(expectSymbol(";"));
                return Tree.node(Kind.RETURN, children);
            }
            if (isKeyword("if")) {
                var children = new ArrayList<Tree>();
                children.add(take());
                children.add(expectSymbol("("));
                children.add(expression());
                children.add(expectSymbol(")"));
                children.add(statement());
                if (isKeyword("else")) {
                    children.add(take());
                    children.add(statement());
                }
                return Tree.node(Kind.IF, children);
            }
            if (isKeyword("final") || isSymbol("@") || isKeyword("abstract") || isKeyword("class")) {
                var modifiers = modifiers();
                if (isKeyword("class") || isKeyword("interface")) {
                    return classDeclaration(modifiers);
                }
                return variableDeclarations(modifiers, type(), true);
            }
            if (looksLikeVariableDeclaration()) {
                return variableDeclarations(List.of(), type(), true);
            }
            return node(Kind.EXPRESSION_STATEMENT, expression(), expectSymbol(";"));
        }

        private boolean looksLikeVariableDeclaration() {
            int end = scanType(pos);
            return end >= 0 && tokens.get(end) instanceof JavaToken.Identifier;
        }

        /**
         * Index just past a syntactically plausible type starting at {@code index}, or -1.
         */
        private int scanType(int index) {
            var first = tokens.get(index);
            if (first instanceof JavaToken.Keyword && PRIMITIVES.contains(first.text())) {
                index++;
            } else if (first instanceof JavaToken.Identifier) {
                index++;
                while (symbolAt(index, ".") && tokens.get(index + 1) instanceof JavaToken.Identifier) {
                    index += 2;
                }
                if (symbolAt(index, "<")) {
                    int depth = 0;
                    do {
                        var token = tokens.get(index);
                        if (symbolAt(index, "<")) {
                            depth++;
                        } else if (symbolAt(index, ">")) {
                            depth--;
                        } else if (!(token instanceof JavaToken.Identifier)
                                   && !symbolAt(index, ",") && !symbolAt(index, ".")
                                   && !symbolAt(index, "?") && !symbolAt(index, "[") && !symbolAt(index, "]")
                                   && !(token instanceof JavaToken.Keyword)) {
                            return -1;
                        }
                        index++;
                    } while (depth > 0 && index < tokens.size() - 1);
                    if (depth != 0) {
                        return -1;
                    }
                }
            } else {
                return -1;
            }
            while (symbolAt(index, "[") && symbolAt(index + 1, "]")) {
                index += 2;
            }
            return index;
        }

        private boolean symbolAt(int index, String text) {
            return index < tokens.size()
                   && tokens.get(index) instanceof JavaToken.Symbol symbol
                   && symbol.text().equals(text);
        }

        // === Types ===

        private Tree.Node type() {
            Tree.Node result;
            if (peek() instanceof JavaToken.Keyword keyword && PRIMITIVES.contains(keyword.text())) {
                result = node(Kind.PRIMITIVE_TYPE, take());
            } else {
                result = qualifiedName();
                if (isSymbol("<")) {
                    var children = new ArrayList<Tree>();
                    children.add(result);
                    children.add(take());
                    if (!isSymbol(">")) {
                        typeArgument(children);
                        while (isSymbol(",")) {
                            children.add(take());
                            typeArgument(children);
                        }
                    }
                    children.add(expectSymbol(">"));
                    result = Tree.node(Kind.PARAMETERIZED_TYPE, children);
                }
            }
            while (isSymbol("[") && peek(1).text().equals("]")) {
                result = node(Kind.ARRAY_TYPE, result, take(), take());
            }
            return result;
        }

        /**
         * A type argument; a wildcard becomes a {@code ?} identifier followed by its bound, if any.
         */
        private void typeArgument(List<Tree> into) {
            if (!isSymbol("?")) {
                into.add(type());
                return;
            }
            into.add(node(Kind.IDENTIFIER, take()));
            if (isKeyword("extends") || isKeyword("super")) {
                into.add(take());
                into.add(type());
            }
        }

        private Tree.Node qualifiedName() {
            Tree.Node result = identifier();
            while (isSymbol(".") && peek(1) instanceof JavaToken.Identifier) {
                result = node(Kind.FIELD_ACCESS, result, take(), identifier());
            }
            return result;
        }

        private Tree.Node identifier() {
            if (!(peek() instanceof JavaToken.Identifier)) {
                throw fail("identifier");
            }
            return node(Kind.IDENTIFIER, take());
        }

        // === Expressions ===

        private Tree.Node expression() {
            var left = binary(1);
            if (isSymbol("=")) {
                return node(Kind.ASSIGNMENT, left, take(), expression());
            }
            return left;
        }

        private Tree.Node binary(int minPrecedence) {
            var left = unary();
            while (peek() instanceof JavaToken.Symbol symbol
                   && PRECEDENCE.getOrDefault(symbol.text(), 0) >= minPrecedence) {
                int precedence = PRECEDENCE.get(symbol.text());
                var operator = take();
                var right = binary(precedence + 1);
                left = node(Kind.BINARY, left, operator, right);
            }
            return left;
        }

        private Tree.Node unary() {
            if (isSymbol("!") || isSymbol("-") || isSymbol("+")) {
                return node(Kind.UNARY, take(), unary());
            }
            return postfix();
        }

        private Tree.Node postfix() {
            var result = primary();
            while (isSymbol(".")) {
                var dot = take();
                var name = identifier();
                if (isSymbol("(")) {
                    var children = new ArrayList<Tree>(List.of(result, dot, name));
                    arguments(children);
                    result = Tree.node(Kind.METHOD_INVOCATION, children);
                } else {
                    result = node(Kind.FIELD_ACCESS, result, dot, name);
                }
            }
            return result;
        }

        private Tree.Node primary() {
            var current = peek();
            if (current instanceof JavaToken.Literal) {
                return node(Kind.LITERAL, take());
            }
            if (isKeyword("new")) {
                var children = new ArrayList<Tree>();
                children.add(take());
                children.add(type());
                arguments(children);
                return Tree.node(Kind.NEW_CLASS, children);
            }
            if (isSymbol("(")) {
                return node(Kind.PARENTHESES, take(), expression(), expectSymbol(")"));
            }
            if (current instanceof JavaToken.Identifier || isKeyword("this") || isKeyword("super")) {
                var name = node(Kind.IDENTIFIER, take());
                if (isSymbol("(")) {
                    var children = new ArrayList<Tree>();
                    children.add(name);
                    arguments(children);
                    return Tree.node(Kind.METHOD_INVOCATION, children);
                }
                return name;
            }
            throw fail("expression");
        }

        private void arguments(List<Tree> into) {
            into.add(expectSymbol("("));
            if (!isSymbol(")")) {
                into.add(expression());
                while (isSymbol(",")) {
                    into.add(take());
                    into.add(expression());
                }
            }
            into.add(expectSymbol(")"));
        }

        // === Token access ===

        private JavaToken peek() {
            return tokens.get(pos);
        }

        private JavaToken peek(int offset) {
            return tokens.get(Math.min(pos + offset, tokens.size() - 1));
        }

        private boolean isEof() {
            return peek() instanceof JavaToken.Eof;
        }

        private boolean isKeyword(String text) {
            return peek() instanceof JavaToken.Keyword keyword && keyword.text().equals(text);
        }

        private boolean isSymbol(String text) {
            return peek() instanceof JavaToken.Symbol symbol && symbol.text().equals(text);
        }

        private Tree.Token take() {
            var token = peek();
            if (!(token instanceof JavaToken.Eof)) {
                pos++;
            }
            return Tree.token(token.prefix(), token.text());
        }

        private Tree.Token expectSymbol(String text) {
            if (!isSymbol(text)) {
                throw fail("'" + text + "'");
            }
            return take();
        }

        private SyntaxFailure fail(String expected) {
            var token = peek();
            if (token instanceof JavaToken.Eof) {
                return new SyntaxFailure(new ParseError.UnexpectedEof(token.location(), expected));
            }
            return new SyntaxFailure(new ParseError.UnexpectedInput(token.location(), token.text(), expected));
        }

        private static Tree.Node node(Kind kind, Tree... children) {
            return Tree.node(kind, children);
        }
    }
}
